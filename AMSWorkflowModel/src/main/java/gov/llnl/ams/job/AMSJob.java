package gov.llnl.ams.job;

import static gov.llnl.ams.job.SubmissionSpec.GPU_AFFINITY_OPTION;
import static gov.llnl.ams.job.SubmissionSpec.MPI_OPTION;
import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;
import static org.slf4j.LoggerFactory.getLogger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.slf4j.Logger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import gov.llnl.ams.rmq.BrokerConfiguration;
import gov.llnl.ams.store.DataStore;
import gov.llnl.ams.store.DataStoreException;

/**
 * The description shared by every job of the workflow. Used directly for
 * plain jobs; the specialised jobs in <tt>gov.llnl.ams.job.impl</tt> extend it
 * with their own arguments and, where needed, their own
 * {@link #precedeDeploy(DataStore, BrokerConfiguration) precedeDeploy}.
 */
@JobDescriptionTypeName("AMSJob")
@JsonPropertyOrder({ "name", "executable", "environment", "resources",
		"stdout", "stderr", "cli_args", "cli_kwargs", "is_mpi", "ams_log" })
public class AMSJob implements JobDescription {
	/** Where standard output goes when the job does not say. */
	public static final String DEFAULT_STDOUT = "ams_test.out";

	/** Where standard error goes when the job does not say. */
	public static final String DEFAULT_STDERR = "ams_test.err";

	/** The MPI flavour requested for MPI jobs. */
	public static final String MPI_FLAVOUR = "spectrum";

	private final Logger logger = getLogger(getClass());

	private final String name;
	private final String executable;
	private final Map<String, String> environment;
	private final JobResources resources;
	private final String stdout;
	private final String stderr;
	private final boolean amsLog;
	private final boolean mpi;
	private final List<String> cliArgs;
	private final Map<String, Object> cliKwargs;

	/**
	 * Creates a job description.
	 *
	 * @param name
	 *            An arbitrary name for the job
	 * @param executable
	 *            The executable to run
	 * @param environment
	 *            The environment to submit the job with; <tt>null</tt> for an
	 *            empty one
	 * @param resources
	 *            The resources dedicated to the job; may be <tt>null</tt>
	 *            until the job is submitted
	 * @param stdout
	 *            The file to redirect standard output to, or <tt>null</tt>
	 * @param stderr
	 *            The file to redirect standard error to, or <tt>null</tt>
	 * @param amsLog
	 *            Whether to enable the logging of the AMS library
	 * @param mpi
	 *            Whether the job is an MPI job
	 * @param cliArgs
	 *            The positional arguments of the command
	 * @param cliKwargs
	 *            The flags of the command and their values
	 * @throws JobConfigurationException
	 *             If the environment is not a mapping of strings to strings
	 */
	@JsonCreator
	public AMSJob(@JsonProperty(value = "name", required = true) String name,
			@JsonProperty(value = "executable", required = true) String executable,
			@JsonProperty("environment") Map<String, ?> environment,
			@JsonProperty("resources") JobResources resources,
			@JsonProperty("stdout") String stdout,
			@JsonProperty("stderr") String stderr,
			@JsonProperty("ams_log") boolean amsLog,
			@JsonProperty("is_mpi") boolean mpi,
			@JsonProperty("cli_args") List<String> cliArgs,
			@JsonProperty("cli_kwargs") Map<String, ?> cliKwargs) {
		this.name = requireNonNull(name, "a job needs a name");
		this.executable = requireNonNull(executable,
				"a job needs an executable");
		this.environment = validateEnvironment(environment);
		this.resources = resources;
		this.stdout = stdout;
		this.stderr = stderr;
		this.amsLog = amsLog;
		this.mpi = mpi;
		this.cliArgs = (cliArgs == null ? new ArrayList<String>()
				: new ArrayList<>(cliArgs));
		this.cliKwargs = new LinkedHashMap<>();
		if (cliKwargs != null)
			this.cliKwargs.putAll(cliKwargs);
	}

	/**
	 * Checks that an environment maps strings to strings and copies it.
	 *
	 * @param environment
	 *            The candidate environment; <tt>null</tt> is an empty one
	 * @return A modifiable copy
	 * @throws JobConfigurationException
	 *             If the value has any other shape
	 */
	public static Map<String, String> validateEnvironment(Object environment) {
		Map<String, String> copy = new LinkedHashMap<>();
		if (environment == null)
			return copy;
		if (!(environment instanceof Map))
			throw new JobConfigurationException("Unknown type "
					+ environment.getClass().getName()
					+ " to set job environment");
		for (Entry<?, ?> entry : ((Map<?, ?>) environment).entrySet()) {
			if (!(entry.getKey() instanceof String)
					|| !(entry.getValue() instanceof String))
				throw new JobConfigurationException(
						"Job environment must map strings to strings but found "
								+ entry.getKey() + "=" + entry.getValue());
			copy.put((String) entry.getKey(), (String) entry.getValue());
		}
		return copy;
	}

	@Override
	@JsonProperty("name")
	public String getName() {
		return name;
	}

	@Override
	@JsonProperty("executable")
	public String getExecutable() {
		return executable;
	}

	@Override
	@JsonProperty("environment")
	public Map<String, String> getEnvironment() {
		return unmodifiableMap(environment);
	}

	/**
	 * Adds or replaces a variable of the submission environment. Only for use
	 * while preparing the job for submission.
	 */
	protected void setEnvironmentVariable(String variable, String value) {
		environment.put(variable, value);
	}

	@Override
	@JsonProperty("resources")
	public JobResources getResources() {
		return resources;
	}

	@JsonProperty("stdout")
	public String getStdout() {
		return stdout;
	}

	@JsonProperty("stderr")
	public String getStderr() {
		return stderr;
	}

	@JsonProperty("ams_log")
	public boolean isAmsLog() {
		return amsLog;
	}

	@JsonProperty("is_mpi")
	public boolean isMpi() {
		return mpi;
	}

	@JsonProperty("cli_args")
	public List<String> getCliArgs() {
		return unmodifiableList(cliArgs);
	}

	@JsonProperty("cli_kwargs")
	public Map<String, Object> getCliKwargs() {
		return unmodifiableMap(cliKwargs);
	}

	@Override
	public List<String> generateCommand() {
		return CommandBuilder.build(executable, cliArgs, cliKwargs);
	}

	@Override
	public SubmissionSpec toSubmissionSpec() {
		return toSubmissionSpec(new File(System.getProperty("user.dir")));
	}

	@Override
	public SubmissionSpec toSubmissionSpec(File workingDirectory) {
		if (resources == null)
			throw new JobResourceException("Job " + name
					+ " has no resources and cannot be submitted");

		SubmissionSpec spec = new SubmissionSpec(generateCommand(),
				resources.getTotalTasks(), resources.getNodes(),
				resources.getCoresPerTask(), resources.getGpusPerTask(),
				resources.isExclusive());
		if (mpi) {
			logger.debug("Setting MPI to " + MPI_FLAVOUR + " for " + name);
			spec.setShellOption(MPI_OPTION, MPI_FLAVOUR);
		}
		if (resources.getGpusPerTask() > 0)
			spec.setShellOption(GPU_AFFINITY_OPTION, "per-task");
		spec.setStdout(stdout != null ? stdout : DEFAULT_STDOUT);
		spec.setStderr(stderr != null ? stderr : DEFAULT_STDERR);
		spec.setEnvironment(environment);
		spec.setCwd(workingDirectory.getAbsolutePath());
		return spec;
	}

	/**
	 * Does nothing; jobs that depend on the state of the store override this.
	 */
	@Override
	public void precedeDeploy(DataStore store, BrokerConfiguration broker)
			throws DataStoreException, IOException {
		// Does Nothing
	}

	@Override
	public String toString() {
		StringBuilder cli = new StringBuilder();
		for (String part : generateCommand()) {
			if (cli.length() != 0)
				cli.append(' ');
			cli.append(part);
		}
		return getClass().getSimpleName() + "\nCLI:" + cli + "\nJOB-Descr:{name="
				+ name + ", executable=" + executable + ", stdout=" + stdout
				+ ", stderr=" + stderr + ", cli_args=" + cliArgs
				+ ", cli_kwargs=" + cliKwargs + ", resources=" + resources
				+ "}";
	}
}
