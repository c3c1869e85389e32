package gov.llnl.ams.jobmanager;

import java.io.IOException;

import gov.llnl.ams.job.SubmissionSpec;

/**
 * The cluster scheduler jobs are handed to.
 */
public interface Scheduler {
	/**
	 * Submits a job to the scheduler.
	 *
	 * @param spec
	 *            What to run and where
	 * @return The handle of the submitted job
	 * @throws IOException
	 *             If the scheduler cannot be reached or refuses the job
	 */
	SubmissionHandle submit(SubmissionSpec spec) throws IOException;
}
