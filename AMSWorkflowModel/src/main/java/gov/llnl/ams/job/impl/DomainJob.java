package gov.llnl.ams.job.impl;

import static gov.llnl.ams.store.DataStore.LATEST_VERSION;
import static gov.llnl.ams.store.DataStore.MODELS_ENTRY;
import static java.util.Collections.unmodifiableSet;
import static org.slf4j.LoggerFactory.getLogger;

import java.io.File;
import java.io.IOException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import gov.llnl.ams.job.AMSJob;
import gov.llnl.ams.job.JobDescriptionTypeName;
import gov.llnl.ams.job.JobResources;
import gov.llnl.ams.rmq.BrokerConfiguration;
import gov.llnl.ams.store.DataStore;
import gov.llnl.ams.store.DataStoreException;
import gov.llnl.ams.store.ModelRecord;

/**
 * A job running the physics code linked with the AMS library. Before it is
 * submitted, it writes the {@link AMSObjects} describing the latest model of
 * each of its domains and points the application at them through the
 * submission environment.
 */
@JobDescriptionTypeName("AMSDomainJob")
public class DomainJob extends AMSJob {
	/** The variable naming the file of the AMS objects. */
	public static final String AMS_OBJECTS_VARIABLE = "AMS_OBJECTS";

	/** The variable setting the verbosity of the AMS library. */
	public static final String AMS_LOG_LEVEL_VARIABLE = "AMS_LOG_LEVEL";

	/** The directory of the store in which the AMS objects are written. */
	public static final String TMP_DIRECTORY = "tmp";

	private static final ObjectMapper mapper = new ObjectMapper();

	private final Logger logger = getLogger(getClass());

	private final Set<String> domainNames;
	private final String stageDir;
	private File amsObjectsFile;

	/**
	 * Creates a domain job.
	 *
	 * @param domainNames
	 *            The physical domains the application evaluates; models are
	 *            numbered in this order
	 * @param stageDir
	 *            The directory the application writes its data to, or
	 *            <tt>null</tt> to use the candidate directory of the store
	 */
	@JsonCreator
	public DomainJob(
			@JsonProperty(value = "domain_names", required = true) Collection<String> domainNames,
			@JsonProperty("stage_dir") String stageDir,
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
		this.domainNames = new LinkedHashSet<>(domainNames);
		this.stageDir = stageDir;
	}

	@JsonProperty("domain_names")
	public Set<String> getDomainNames() {
		return unmodifiableSet(domainNames);
	}

	@JsonProperty("stage_dir")
	public String getStageDir() {
		return stageDir;
	}

	/**
	 * Gets the AMS objects file written by the last call to
	 * {@link #precedeDeploy(DataStore, BrokerConfiguration) precedeDeploy}
	 *
	 * @return The file, or <tt>null</tt> if none has been written
	 */
	@JsonIgnore
	public File getAmsObjectsFile() {
		return amsObjectsFile;
	}

	/**
	 * Describes where the application stores the data it gathers.
	 */
	private Map<String, Object> describeDatabase(DataStore store,
			BrokerConfiguration broker) {
		Map<String, Object> db = new LinkedHashMap<>();
		if (broker == null) {
			if (stageDir == null)
				db.put("fs_path", store.getCandidatePath().getPath());
			else
				db.put("fs_path", stageDir);
			db.put("dbType", "hdf5");
		} else {
			db.put("rmq_config", broker.toConnectionDescriptor(true));
			db.put("dbType", "rmq");
			db.put("update_surrogate", false);
		}
		return db;
	}

	/**
	 * Builds the AMS objects for the current state of the store. A domain
	 * without a model gets an entry that gathers data on every evaluation.
	 *
	 * @param store
	 *            The store holding the models
	 * @param broker
	 *            The broker configuration, or <tt>null</tt>
	 * @return The objects
	 * @throws DataStoreException
	 *             If the store cannot be searched
	 */
	public AMSObjects generateAMSObjects(DataStore store,
			BrokerConfiguration broker) throws DataStoreException {
		AMSObjects objects = new AMSObjects(describeDatabase(store, broker));
		int i = 0;
		for (String domainName : domainNames) {
			List<ModelRecord> models = store.search(domainName, MODELS_ENTRY,
					LATEST_VERSION);
			logger.debug("Models of " + domainName + ": " + models);
			MLModelEntry entry;
			if (models.isEmpty())
				entry = MLModelEntry.dataGathering(domainName);
			else
				entry = MLModelEntry.fromModel(models.get(0), domainName);
			objects.addModel("model_" + i, domainName, entry);
			i++;
		}
		return objects;
	}

	/**
	 * Writes a new AMS objects file under the temporary directory of the store
	 * and points {@value #AMS_OBJECTS_VARIABLE} at it. Every call writes a
	 * new file.
	 */
	@Override
	public void precedeDeploy(DataStore store, BrokerConfiguration broker)
			throws DataStoreException, IOException {
		AMSObjects objects = generateAMSObjects(store, broker);

		// The job must be able to read the store's directory
		File tmpPath = store.mkdir(TMP_DIRECTORY);
		File objectsFile = new File(tmpPath, store.uniqueFilename() + ".json");
		mapper.writeValue(objectsFile, objects);
		amsObjectsFile = objectsFile;
		logger.debug("Wrote AMS objects of " + getName() + " to "
				+ objectsFile);

		setEnvironmentVariable(AMS_OBJECTS_VARIABLE, objectsFile.getPath());
		if (isAmsLog()) {
			logger.debug("Setting AMS log level of " + getName());
			setEnvironmentVariable(AMS_LOG_LEVEL_VARIABLE, "debug");
		}
	}
}
