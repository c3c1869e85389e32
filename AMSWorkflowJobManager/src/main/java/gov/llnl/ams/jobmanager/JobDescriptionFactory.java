package gov.llnl.ams.jobmanager;

import static org.slf4j.LoggerFactory.getLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;

import gov.llnl.ams.job.ArgumentFormatter;
import gov.llnl.ams.job.JobConfigurationException;
import gov.llnl.ams.job.JobResources;
import gov.llnl.ams.job.impl.DomainJob;
import gov.llnl.ams.job.impl.MLJob;
import gov.llnl.ams.job.impl.MLJob.Role;
import gov.llnl.ams.job.impl.StageJob;
import gov.llnl.ams.store.DataStore;

/**
 * Builds job descriptions from the entries of a workflow manifest. An entry
 * names the job, gives its <tt>resources</tt>, and puts the command in a
 * <tt>cli</tt> section:
 *
 * <pre>
 * {"name": "physics", "domain_names": ["hydro"], "ams_log": true,
 *  "resources": {"nodes": 2, "tasks_per_node": 4},
 *  "cli": {"executable": "app", "cli_args": ["-v"], "cli_kwargs": {"-n": 10}}}
 * </pre>
 */
public class JobDescriptionFactory {
	private final Logger logger = getLogger(getClass());

	private final JobDescriptionMapper mapper;

	public JobDescriptionFactory() {
		this(new JobDescriptionMapper());
	}

	public JobDescriptionFactory(JobDescriptionMapper mapper) {
		this.mapper = mapper;
	}

	/**
	 * Builds the job running the domain application.
	 *
	 * @param descr
	 *            The manifest entry
	 * @param stageDir
	 *            The directory the application writes its data to, or
	 *            <tt>null</tt>
	 * @param baseEnvironment
	 *            The environment to submit the job with, typically that of
	 *            the workflow driver
	 * @return The job
	 * @throws JobConfigurationException
	 *             If the entry is incomplete or inconsistent
	 */
	public DomainJob domainJob(Map<String, ?> descr, String stageDir,
			Map<String, String> baseEnvironment) {
		Map<String, ?> cli = section(descr, "cli");
		logger.debug("Building domain job " + descr.get("name"));
		return new DomainJob(strings(descr, "domain_names", true), stageDir,
				string(descr, "name", true), string(cli, "executable", true),
				baseEnvironment, resources(descr), string(cli, "stdout", false),
				string(cli, "stderr", false), flag(descr, "ams_log", false),
				flag(cli, "is_mpi", false), strings(cli, "cli_args", false),
				kwargs(cli));
	}

	/**
	 * Builds a training or sub-selection job. The arguments of its command
	 * may refer to the locations of the store, e.g.
	 * <tt>{AMS_STORE_PATH}/models</tt>.
	 *
	 * @param store
	 *            The store the job works on
	 * @param descr
	 *            The manifest entry
	 * @param role
	 *            What the job does
	 * @return The job
	 * @throws JobConfigurationException
	 *             If the entry is incomplete or an argument refers to an
	 *             unknown location
	 */
	public MLJob mlJob(DataStore store, Map<String, ?> descr, Role role) {
		Map<String, ?> cli = section(descr, "cli");
		logger.debug("Building " + role + " job " + descr.get("name"));
		return new MLJob(ArgumentFormatter.forStore(store), role,
				string(descr, "domain_name", true), string(descr, "name", true),
				string(cli, "executable", true), null, resources(descr),
				string(cli, "stdout", false), string(cli, "stderr", false),
				flag(descr, "ams_log", false), flag(cli, "is_mpi", false),
				list(cli, "cli_args"), kwargs(cli));
	}

	/**
	 * Builds a job consuming the data streamed through the broker. The entry
	 * holds the optional settings of the stager, e.g. <tt>update_models</tt>
	 * or <tt>prune_module_path</tt>.
	 *
	 * @throws JobConfigurationException
	 *             If the entry is inconsistent
	 */
	public StageJob networkStageJob(Map<String, ?> descr, String dest,
			String persistentDbPath, String creds, JobResources resources) {
		return StageJob.fromNetwork(resources, dest, persistentDbPath, creds,
				flag(descr, "store", true), string(descr, "db_type", false),
				flag(descr, "update_models", false),
				string(descr, "prune_module_path", false),
				string(descr, "prune_class", false),
				environment(descr), string(descr, "stdout", false),
				string(descr, "stderr", false),
				strings(descr, "cli_args", false), kwargs(descr));
	}

	private JobResources resources(Map<String, ?> descr) {
		Object resources = descr.get("resources");
		if (resources == null)
			throw new JobConfigurationException("Job "
					+ descr.get("name") + " does not define its resources");
		try {
			return mapper.getObjectMapper().convertValue(resources,
					JobResources.class);
		} catch (IllegalArgumentException e) {
			for (Throwable cause = e; cause != null; cause = cause.getCause())
				if (cause instanceof JobConfigurationException)
					throw (JobConfigurationException) cause;
			throw new JobConfigurationException("Invalid resources of job "
					+ descr.get("name") + ": " + e.getMessage(), e);
		}
	}

	@SuppressWarnings("unchecked")
	private static Map<String, ?> section(Map<String, ?> descr, String key) {
		Object value = descr.get(key);
		if (!(value instanceof Map))
			throw new JobConfigurationException("Job " + descr.get("name")
					+ " needs a '" + key + "' section");
		return (Map<String, ?>) value;
	}

	private static String string(Map<String, ?> descr, String key,
			boolean required) {
		Object value = descr.get(key);
		if (value == null) {
			if (required)
				throw new JobConfigurationException("'" + key
						+ "' is required but missing from " + descr);
			return null;
		}
		if (!(value instanceof String))
			throw new JobConfigurationException("'" + key
					+ "' must be a string but was " + value);
		return (String) value;
	}

	private static boolean flag(Map<String, ?> descr, String key,
			boolean defaultValue) {
		Object value = descr.get(key);
		if (value == null)
			return defaultValue;
		if (!(value instanceof Boolean))
			throw new JobConfigurationException("'" + key
					+ "' must be true or false but was " + value);
		return (Boolean) value;
	}

	private static List<?> list(Map<String, ?> descr, String key) {
		Object value = descr.get(key);
		if (value == null)
			return null;
		if (!(value instanceof List))
			throw new JobConfigurationException("'" + key
					+ "' must be a list but was " + value);
		return (List<?>) value;
	}

	private static List<String> strings(Map<String, ?> descr, String key,
			boolean required) {
		List<?> values = list(descr, key);
		if (values == null) {
			if (required)
				throw new JobConfigurationException("'" + key
						+ "' is required but missing from " + descr);
			return null;
		}
		List<String> strings = new ArrayList<>();
		for (Object value : values) {
			if (!(value instanceof String))
				throw new JobConfigurationException("'" + key
						+ "' must only hold strings but holds " + value);
			strings.add((String) value);
		}
		return strings;
	}

	@SuppressWarnings("unchecked")
	private static Map<String, ?> kwargs(Map<String, ?> descr) {
		Object value = descr.get("cli_kwargs");
		if (value == null)
			return null;
		if (!(value instanceof Map))
			throw new JobConfigurationException(
					"'cli_kwargs' must be a mapping but was " + value);
		return (Map<String, ?>) value;
	}

	@SuppressWarnings("unchecked")
	private static Map<String, ?> environment(Map<String, ?> descr) {
		Object value = descr.get("environment");
		if (value != null && !(value instanceof Map))
			throw new JobConfigurationException("Unknown type "
					+ value.getClass().getName() + " to set job environment");
		return (Map<String, ?>) value;
	}
}
