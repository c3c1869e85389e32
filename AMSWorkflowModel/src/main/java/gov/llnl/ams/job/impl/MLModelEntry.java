package gov.llnl.ams.job.impl;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import gov.llnl.ams.store.ModelRecord;

/**
 * How the AMS library treats the surrogate model of one domain.
 */
@JsonPropertyOrder({ "uq_type", "model_path", "uq_aggregate", "threshold",
		"db_label" })
public class MLModelEntry {
	/** The aggregation applied to the uncertainty of every model. */
	public static final String MEAN_AGGREGATE = "mean";

	/** The uncertainty method that marks every evaluation as uncertain. */
	public static final String RANDOM_UQ = "random";

	private final String uqType;
	private final String modelPath;
	private final String uqAggregate;
	private final double threshold;
	private final String dbLabel;

	public MLModelEntry(String uqType, String modelPath, String uqAggregate,
			double threshold, String dbLabel) {
		this.uqType = uqType;
		this.modelPath = modelPath;
		this.uqAggregate = uqAggregate;
		this.threshold = threshold;
		this.dbLabel = dbLabel;
	}

	/**
	 * An entry for a domain without a trained model: the library always
	 * falls back to the physics code and gathers the data.
	 */
	public static MLModelEntry dataGathering(String domainName) {
		return new MLModelEntry(RANDOM_UQ, "", MEAN_AGGREGATE, 1, domainName);
	}

	public static MLModelEntry fromModel(ModelRecord model, String domainName) {
		return new MLModelEntry(model.getUqType(), model.getFile(),
				MEAN_AGGREGATE, model.getThreshold(), domainName);
	}

	@JsonProperty("uq_type")
	public String getUqType() {
		return uqType;
	}

	@JsonProperty("model_path")
	public String getModelPath() {
		return modelPath;
	}

	@JsonProperty("uq_aggregate")
	public String getUqAggregate() {
		return uqAggregate;
	}

	@JsonProperty("threshold")
	public double getThreshold() {
		return threshold;
	}

	@JsonProperty("db_label")
	public String getDbLabel() {
		return dbLabel;
	}
}
