package gov.llnl.ams.jobmanager;

import static java.util.Objects.requireNonNull;
import static org.slf4j.LoggerFactory.getLogger;

import java.io.IOException;

import org.slf4j.Logger;

import gov.llnl.ams.job.JobDescription;
import gov.llnl.ams.job.SubmissionSpec;
import gov.llnl.ams.rmq.BrokerConfiguration;
import gov.llnl.ams.store.DataStore;
import gov.llnl.ams.store.DataStoreException;

/**
 * Prepares jobs against a store and hands them to the scheduler.
 */
public class JobDeployer {
	private final Logger logger = getLogger(getClass());

	private final DataStore store;
	private final BrokerConfiguration broker;
	private final Scheduler scheduler;

	/**
	 * @param store
	 *            The store the jobs work on
	 * @param broker
	 *            The broker the domain jobs stream to, or <tt>null</tt> if
	 *            they write to files
	 * @param scheduler
	 *            Where jobs are submitted
	 */
	public JobDeployer(DataStore store, BrokerConfiguration broker,
			Scheduler scheduler) {
		this.store = requireNonNull(store, "a deployer needs a store");
		this.broker = broker;
		this.scheduler = requireNonNull(scheduler,
				"a deployer needs a scheduler");
	}

	/**
	 * Deploys a job: runs its preparation once, then submits it.
	 *
	 * @param job
	 *            The job to deploy
	 * @return The handle of the submitted job
	 * @throws DataStoreException
	 *             If the store cannot be searched while preparing the job
	 * @throws IOException
	 *             If the job cannot be prepared or submitted
	 */
	public SubmissionHandle deploy(JobDescription job)
			throws DataStoreException, IOException {
		logger.info("Deploying " + job.getName());
		try {
			job.precedeDeploy(store, broker);
		} catch (DataStoreException | IOException e) {
			logger.error("Error preparing job " + job.getName(), e);
			throw e;
		}

		SubmissionSpec spec = job.toSubmissionSpec();
		logger.debug("Submitting " + spec);
		try {
			SubmissionHandle handle = scheduler.submit(spec);
			logger.info("Job " + job.getName() + " submitted as " + handle);
			return handle;
		} catch (IOException e) {
			logger.error("Error submitting job " + job.getName(), e);
			throw e;
		}
	}

	/**
	 * Submits a request that needs no preparation.
	 */
	public SubmissionHandle submit(SubmissionSpec spec) throws IOException {
		logger.debug("Submitting " + spec);
		return scheduler.submit(spec);
	}
}
