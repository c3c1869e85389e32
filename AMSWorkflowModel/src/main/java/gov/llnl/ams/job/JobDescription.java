package gov.llnl.ams.job;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Map;

import gov.llnl.ams.rmq.BrokerConfiguration;
import gov.llnl.ams.store.DataStore;
import gov.llnl.ams.store.DataStoreException;

/**
 * A job of the workflow, described well enough to be handed to the cluster
 * scheduler. Note that the implementation must be annotated with
 * {@link JobDescriptionTypeName} if it is to be serialized or deserialized.
 */
public interface JobDescription {
	/**
	 * Gets the name of the job
	 *
	 * @return The name
	 */
	String getName();

	/**
	 * Gets the executable that the job runs
	 *
	 * @return The executable
	 */
	String getExecutable();

	/**
	 * Gets the environment the job is submitted with
	 *
	 * @return An unmodifiable view of the environment
	 */
	Map<String, String> getEnvironment();

	/**
	 * Gets the resources the job asks for
	 *
	 * @return The resources, or <tt>null</tt> if none have been given
	 */
	JobResources getResources();

	/**
	 * Builds the command line of the job.
	 *
	 * @return The executable followed by its arguments
	 */
	List<String> generateCommand();

	/**
	 * Lowers the job to a scheduler request that runs in the current working
	 * directory of this process.
	 *
	 * @return The request
	 * @throws JobResourceException
	 *             If the job has no resources
	 */
	SubmissionSpec toSubmissionSpec();

	/**
	 * Lowers the job to a scheduler request.
	 *
	 * @param workingDirectory
	 *            The directory the job runs in
	 * @return The request
	 * @throws JobResourceException
	 *             If the job has no resources
	 */
	SubmissionSpec toSubmissionSpec(File workingDirectory);

	/**
	 * Called immediately before the job is submitted, to let the job adapt its
	 * submission environment to the current state of the store and the
	 * broker. This is not idempotent; call it exactly once per submission.
	 *
	 * @param store
	 *            The data store of the workflow
	 * @param broker
	 *            The broker configuration, or <tt>null</tt> if data moves
	 *            through the file system
	 * @throws DataStoreException
	 *             If the store cannot be queried
	 * @throws IOException
	 *             If a file needed by the job cannot be written
	 */
	void precedeDeploy(DataStore store, BrokerConfiguration broker)
			throws DataStoreException, IOException;
}
