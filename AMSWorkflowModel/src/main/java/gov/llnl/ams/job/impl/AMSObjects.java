package gov.llnl.ams.job.impl;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * The objects the AMS library of a domain application loads at start-up:
 * where to store the data it gathers, the surrogate models, and which model
 * serves which domain. Read by the application from the file named by the
 * <tt>AMS_OBJECTS</tt> environment variable.
 */
@JsonPropertyOrder({ "db", "ml_models", "domain_models" })
public class AMSObjects {
	private final Map<String, Object> db;
	private final Map<String, MLModelEntry> mlModels = new LinkedHashMap<>();
	private final Map<String, String> domainModels = new LinkedHashMap<>();

	public AMSObjects(Map<String, Object> db) {
		this.db = db;
	}

	/**
	 * Registers the model serving a domain.
	 *
	 * @param modelName
	 *            The key of the model
	 * @param domainName
	 *            The domain
	 * @param entry
	 *            The model
	 */
	public void addModel(String modelName, String domainName,
			MLModelEntry entry) {
		mlModels.put(modelName, entry);
		domainModels.put(domainName, modelName);
	}

	@JsonProperty("db")
	public Map<String, Object> getDb() {
		return db;
	}

	@JsonProperty("ml_models")
	public Map<String, MLModelEntry> getMlModels() {
		return mlModels;
	}

	@JsonProperty("domain_models")
	public Map<String, String> getDomainModels() {
		return domainModels;
	}
}
