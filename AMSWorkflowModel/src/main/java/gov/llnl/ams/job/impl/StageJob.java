package gov.llnl.ams.job.impl;

import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

import java.io.File;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import gov.llnl.ams.job.AMSJob;
import gov.llnl.ams.job.JobConfigurationException;
import gov.llnl.ams.job.JobDescription;
import gov.llnl.ams.job.JobDescriptionTypeName;
import gov.llnl.ams.job.JobResourceException;
import gov.llnl.ams.job.JobResources;

/**
 * A job moving the data produced by the application into the persistent
 * store, optionally pruning it on the way with a user supplied class. The
 * {@link StageSource} decides where the data is read from; everything else is
 * common to all staging jobs.
 */
@JobDescriptionTypeName("AMSStageJob")
@JsonIgnoreProperties(ignoreUnknown = true)
public class StageJob extends AMSJob {
	/** The stager executable. */
	public static final String EXECUTABLE = "AMSDBStage";

	/** The name of staging jobs built by the factory methods. */
	public static final String DEFAULT_NAME = "AMSStageJob";

	/** The name of jobs built by {@link #toPersistentStore}. */
	public static final String PERSISTENT_STAGE_NAME = "AMSStage";

	public static final String DEFAULT_DB_TYPE = "dhdf5";

	public static final String DEFAULT_POLICY = "process";

	private final String dest;
	private final String persistentDbPath;
	private final StageSource source;
	private final boolean store;
	private final String dbType;
	private final String policy;
	private final String pruneModulePath;
	private final String pruneClass;
	private final List<String> userArgs;
	private final Map<String, Object> userKwargs;

	private StageJob(String name, JobResources resources, String dest,
			String persistentDbPath, StageSource source, boolean store,
			String dbType, String policy, String pruneModulePath,
			String pruneClass, Map<String, ?> environment, String stdout,
			String stderr, List<String> userArgs, Map<String, Object> userKwargs,
			List<String> args, Map<String, ?> kwargs) {
		super(name, EXECUTABLE, environment, resources, stdout, stderr, false,
				false, args, kwargs);
		this.dest = dest;
		this.persistentDbPath = persistentDbPath;
		this.source = source;
		this.store = store;
		this.dbType = dbType;
		this.policy = policy;
		this.pruneModulePath = pruneModulePath;
		this.pruneClass = pruneClass;
		this.userArgs = userArgs;
		this.userKwargs = userKwargs;
	}

	/**
	 * Reads a staging job back from its description. The command is built
	 * again from the fields, so it always agrees with them.
	 */
	@JsonCreator
	static StageJob fromProperties(
			@JsonProperty(value = "name", required = true) String name,
			@JsonProperty("resources") JobResources resources,
			@JsonProperty(value = "dest", required = true) String dest,
			@JsonProperty(value = "persistent_db_path", required = true) String persistentDbPath,
			@JsonProperty("source") StageSource source,
			@JsonProperty("store") Boolean store,
			@JsonProperty("db_type") String dbType,
			@JsonProperty("policy") String policy,
			@JsonProperty("prune_module_path") String pruneModulePath,
			@JsonProperty("prune_class") String pruneClass,
			@JsonProperty("environment") Map<String, ?> environment,
			@JsonProperty("stdout") String stdout,
			@JsonProperty("stderr") String stderr,
			@JsonProperty("cli_args") List<String> cliArgs,
			@JsonProperty("cli_kwargs") Map<String, ?> cliKwargs) {
		if (source == null)
			throw new JobConfigurationException("Staging job " + name
					+ " does not say where its data comes from");
		return create(name, resources, dest, persistentDbPath, source,
				(store == null ? true : store), dbType, policy,
				pruneModulePath, pruneClass, environment, stdout, stderr,
				cliArgs, cliKwargs);
	}

	/**
	 * Checks that a pruning module, if given, exists and comes with the class
	 * to load from it.
	 *
	 * @throws JobConfigurationException
	 *             If it does not
	 */
	static void checkPruning(String pruneModulePath, String pruneClass) {
		if (pruneModulePath == null)
			return;
		if (!new File(pruneModulePath).exists())
			throw new JobConfigurationException(
					"Module path to user pruner does not exist: "
							+ pruneModulePath);
		if (pruneClass == null)
			throw new JobConfigurationException(
					"When defining a pruning module please define the class");
	}

	private static StageJob create(String name, JobResources resources,
			String dest, String persistentDbPath, StageSource source,
			boolean store, String dbType, String policy,
			String pruneModulePath, String pruneClass,
			Map<String, ?> environment, String stdout, String stderr,
			List<String> cliArgs, Map<String, ?> cliKwargs) {
		checkPruning(pruneModulePath, pruneClass);
		if (dbType == null)
			dbType = DEFAULT_DB_TYPE;
		if (policy == null)
			policy = DEFAULT_POLICY;

		List<String> userArgs = new ArrayList<>();
		if (cliArgs != null)
			userArgs.addAll(cliArgs);
		Map<String, Object> userKwargs = new LinkedHashMap<>();
		if (cliKwargs != null)
			userKwargs.putAll(cliKwargs);

		List<String> args = new ArrayList<>(userArgs);
		Map<String, Object> kwargs = new LinkedHashMap<>(userKwargs);
		source.addArguments(args, kwargs);
		args.add(store ? "--store" : "--no-store");
		kwargs.put("--dest",
				requireNonNull(dest, "a staging job needs a destination"));
		kwargs.put("--persistent-db-path", requireNonNull(persistentDbPath,
				"a staging job needs a persistent store"));
		kwargs.put("--db-type", dbType);
		kwargs.put("--policy", policy);
		if (pruneModulePath != null) {
			kwargs.put("--load", pruneModulePath);
			kwargs.put("--class", pruneClass);
		}

		return new StageJob(name, resources, dest, persistentDbPath, source,
				store, dbType, policy, pruneModulePath, pruneClass,
				environment, stdout, stderr, userArgs, userKwargs, args,
				kwargs);
	}

	/**
	 * Creates a job staging files written by the application to a directory.
	 *
	 * @param resources
	 *            The resources of the stager
	 * @param dest
	 *            The directory the staged data is moved to
	 * @param persistentDbPath
	 *            The persistent store
	 * @param src
	 *            The directory the application writes to
	 * @param store
	 *            Whether to register the staged data in the store
	 * @param dbType
	 *            The type of the staged files, or <tt>null</tt> for
	 *            {@value #DEFAULT_DB_TYPE}
	 * @param pattern
	 *            The files to pick up, or <tt>null</tt> for
	 *            {@value FileSystemStageSource#DEFAULT_PATTERN}
	 * @param srcType
	 *            The type of the source files, or <tt>null</tt> for
	 *            {@value FileSystemStageSource#DEFAULT_SRC_TYPE}
	 * @param pruneModulePath
	 *            The module holding the pruning class, or <tt>null</tt>
	 * @param pruneClass
	 *            The pruning class; required with a module
	 * @throws JobConfigurationException
	 *             If the pruning module is missing or has no class
	 */
	public static StageJob fromFileSystem(JobResources resources, String dest,
			String persistentDbPath, String src, boolean store, String dbType,
			String pattern, String srcType, String pruneModulePath,
			String pruneClass, Map<String, ?> environment, String stdout,
			String stderr, List<String> cliArgs, Map<String, ?> cliKwargs) {
		StageSource source = new FileSystemStageSource(src,
				(srcType == null ? FileSystemStageSource.DEFAULT_SRC_TYPE
						: srcType), pattern);
		return create(DEFAULT_NAME, resources, dest, persistentDbPath, source,
				store, dbType, DEFAULT_POLICY, pruneModulePath, pruneClass,
				environment, stdout, stderr, cliArgs, cliKwargs);
	}

	public static StageJob fromFileSystem(JobResources resources, String dest,
			String persistentDbPath, String src) {
		return fromFileSystem(resources, dest, persistentDbPath, src, true,
				null, null, null, null, null, null, null, null, null, null);
	}

	/**
	 * Creates a job consuming the data the application streams through the
	 * broker.
	 *
	 * @param creds
	 *            The broker credentials file
	 * @param updateModels
	 *            Whether to push newly trained models back to the application
	 * @throws JobConfigurationException
	 *             If the pruning module is missing or has no class
	 */
	public static StageJob fromNetwork(JobResources resources, String dest,
			String persistentDbPath, String creds, boolean store,
			String dbType, boolean updateModels, String pruneModulePath,
			String pruneClass, Map<String, ?> environment, String stdout,
			String stderr, List<String> cliArgs, Map<String, ?> cliKwargs) {
		return create(DEFAULT_NAME, resources, dest, persistentDbPath,
				new NetworkStageSource(creds, updateModels), store, dbType,
				DEFAULT_POLICY, pruneModulePath, pruneClass, environment,
				stdout, stderr, cliArgs, cliKwargs);
	}

	public static StageJob fromNetwork(JobResources resources, String dest,
			String persistentDbPath, String creds) {
		return fromNetwork(resources, dest, persistentDbPath, creds, true,
				null, false, null, null, null, null, null, null, null);
	}

	/**
	 * Creates a job moving the HDF5 files left by the application in a
	 * temporary directory into the persistent store, always registering them.
	 *
	 * @param storeDir
	 *            The persistent store
	 * @param srcDir
	 *            The directory the application writes to
	 * @param destDir
	 *            The directory the files are moved to
	 * @throws JobConfigurationException
	 *             If the pruning module is missing or has no class
	 */
	public static StageJob toPersistentStore(String storeDir, String srcDir,
			String destDir, JobResources resources,
			Map<String, ?> environment, String stdout, String stderr,
			String pruneModulePath, String pruneClass, List<String> cliArgs,
			Map<String, ?> cliKwargs) {
		return create(PERSISTENT_STAGE_NAME, resources, destDir, storeDir,
				new FileSystemStageSource(srcDir, null,
						FileSystemStageSource.DEFAULT_PATTERN), true,
				DEFAULT_DB_TYPE, DEFAULT_POLICY, pruneModulePath, pruneClass,
				environment, stdout, stderr, cliArgs, cliKwargs);
	}

	/**
	 * Sizes a staging job to run alongside a domain job: one task on each of
	 * its nodes, sharing the nodes with it.
	 *
	 * @param domainJob
	 *            The job whose data is staged
	 * @return The resources of the staging job
	 * @throws JobResourceException
	 *             If the domain job has no resources
	 */
	public static JobResources resourcesFromDomainJob(JobDescription domainJob) {
		JobResources resources = domainJob.getResources();
		if (resources == null)
			throw new JobResourceException("Job " + domainJob.getName()
					+ " has no resources to size a staging job from");
		return new JobResources(resources.getNodes(), 1, 5, false,
				resources.getGpusPerTask());
	}

	/**
	 * Gets the positional arguments given by the user; the command adds the
	 * staging flags to them
	 *
	 * @return The user's arguments
	 */
	@Override
	@JsonProperty("cli_args")
	public List<String> getCliArgs() {
		return unmodifiableList(userArgs);
	}

	/**
	 * Gets the flags given by the user; the command adds the staging flags to
	 * them
	 *
	 * @return The user's flags
	 */
	@Override
	@JsonProperty("cli_kwargs")
	public Map<String, Object> getCliKwargs() {
		return unmodifiableMap(userKwargs);
	}

	@JsonProperty("dest")
	public String getDest() {
		return dest;
	}

	@JsonProperty("persistent_db_path")
	public String getPersistentDbPath() {
		return persistentDbPath;
	}

	@JsonProperty("source")
	public StageSource getSource() {
		return source;
	}

	@JsonProperty("store")
	public boolean isStore() {
		return store;
	}

	@JsonProperty("db_type")
	public String getDbType() {
		return dbType;
	}

	@JsonProperty("policy")
	public String getPolicy() {
		return policy;
	}

	@JsonProperty("prune_module_path")
	public String getPruneModulePath() {
		return pruneModulePath;
	}

	@JsonProperty("prune_class")
	public String getPruneClass() {
		return pruneClass;
	}
}
