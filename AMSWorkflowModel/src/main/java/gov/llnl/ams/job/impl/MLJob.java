package gov.llnl.ams.job.impl;

import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import gov.llnl.ams.job.AMSJob;
import gov.llnl.ams.job.ArgumentFormatter;
import gov.llnl.ams.job.JobDescriptionTypeName;
import gov.llnl.ams.job.JobResources;

/**
 * A job provided by the machine learning side of the workflow, training a
 * surrogate model of a domain or selecting the data to train it on.
 */
@JobDescriptionTypeName("AMSMLJob")
public class MLJob extends AMSJob {
	/**
	 * What a machine learning job does.
	 */
	public static enum Role {
		/** Trains a new surrogate model. */
		TRAIN,
		/** Selects the samples worth training on. */
		SUB_SELECT
	}

	private final Role role;
	private final String domain;

	/**
	 * Creates a job whose arguments are used as given.
	 *
	 * @param role
	 *            What the job does
	 * @param domain
	 *            The domain the job trains or selects for
	 */
	@JsonCreator
	public MLJob(@JsonProperty(value = "role", required = true) Role role,
			@JsonProperty(value = "domain", required = true) String domain,
			@JsonProperty(value = "name", required = true) String name,
			@JsonProperty(value = "executable", required = true) String executable,
			@JsonProperty("environment") Map<String, ?> environment,
			@JsonProperty("resources") JobResources resources,
			@JsonProperty("stdout") String stdout,
			@JsonProperty("stderr") String stderr,
			@JsonProperty("ams_log") boolean amsLog,
			@JsonProperty("is_mpi") boolean mpi,
			@JsonProperty("cli_args") List<String> cliArgs,
			@JsonProperty("cli_kwargs") Map<String, ?> cliKwargs) {
		super(name, executable, environment, resources, stdout, stderr, amsLog,
				mpi, cliArgs, cliKwargs);
		this.role = requireNonNull(role, "an ML job needs a role");
		this.domain = requireNonNull(domain, "an ML job needs a domain");
	}

	/**
	 * Creates a job whose arguments are templates over the locations of the
	 * store. Every positional argument and every string flag value is
	 * formatted now, so that a template naming an unknown location fails
	 * here rather than on submission.
	 *
	 * @param formatter
	 *            The locations to substitute
	 * @throws gov.llnl.ams.job.JobConfigurationException
	 *             If a template cannot be formatted
	 */
	public MLJob(ArgumentFormatter formatter, Role role, String domain,
			String name, String executable, Map<String, ?> environment,
			JobResources resources, String stdout, String stderr,
			boolean amsLog, boolean mpi, List<?> cliArgs,
			Map<String, ?> cliKwargs) {
		this(role, domain, name, executable, environment, resources, stdout,
				stderr, amsLog, mpi, formatter.formatArgs(cliArgs), formatter
						.formatKwargs(cliKwargs));
	}

	@JsonProperty("role")
	public Role getRole() {
		return role;
	}

	@JsonProperty("domain")
	public String getDomain() {
		return domain;
	}
}
