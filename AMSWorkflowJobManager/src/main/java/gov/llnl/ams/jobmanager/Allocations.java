package gov.llnl.ams.jobmanager;

import static java.util.Arrays.asList;

import java.io.File;
import java.util.Map;

import gov.llnl.ams.job.AMSJob;
import gov.llnl.ams.job.SubmissionSpec;

/**
 * Submission requests that are not built from a job description.
 */
public final class Allocations {
	/** How long a nested instance lives unless told otherwise. */
	public static final String DEFAULT_TIME = "inf";

	private Allocations() {
	}

	/**
	 * Requests a nested scheduler instance holding whole nodes, into which
	 * the jobs of the workflow are later submitted. The instance is kept
	 * alive by a <tt>sleep</tt> for the given time.
	 *
	 * @param numNodes
	 *            The nodes of the instance
	 * @param coresPerNode
	 *            The cores of each node
	 * @param gpusPerNode
	 *            The GPUs of each node
	 * @param time
	 *            How long the instance lives, or <tt>null</tt> for
	 *            {@value #DEFAULT_TIME}
	 * @param stdout
	 *            The output file, or <tt>null</tt> to leave it to the
	 *            scheduler
	 * @param stderr
	 *            The error file, or <tt>null</tt> to leave it to the
	 *            scheduler
	 * @param environment
	 *            The environment of the instance, or <tt>null</tt>
	 * @param cwd
	 *            The working directory, or <tt>null</tt>
	 * @return The request
	 * @throws gov.llnl.ams.job.JobConfigurationException
	 *             If the environment holds something other than strings
	 */
	public static SubmissionSpec nestedInstance(int numNodes,
			int coresPerNode, int gpusPerNode, String time, String stdout,
			String stderr, Map<String, ?> environment, File cwd) {
		SubmissionSpec spec = new SubmissionSpec(asList("sleep",
				(time == null ? DEFAULT_TIME : time)), numNodes, numNodes,
				coresPerNode, gpusPerNode, true, true);
		if (stdout != null)
			spec.setStdout(stdout);
		if (stderr != null)
			spec.setStderr(stderr);
		spec.setEnvironment(AMSJob.validateEnvironment(environment));
		if (cwd != null)
			spec.setCwd(cwd.getAbsolutePath());
		return spec;
	}

	public static SubmissionSpec nestedInstance(int numNodes,
			int coresPerNode, int gpusPerNode) {
		return nestedInstance(numNodes, coresPerNode, gpusPerNode, null, null,
				null, null, null);
	}

	/**
	 * Requests a one task job printing a message, to check that jobs reach
	 * the scheduler.
	 */
	public static SubmissionSpec echo(String message) {
		return new SubmissionSpec(asList("echo", message), 1, 1, 1, 0, true);
	}
}
