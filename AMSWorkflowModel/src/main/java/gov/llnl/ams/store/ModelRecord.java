package gov.llnl.ams.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A trained surrogate model as registered in the data store.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelRecord {
	private String domainName;
	private int version;
	private String uqType;
	private String file;
	private double threshold;

	public ModelRecord() {
		// Does Nothing
	}

	public ModelRecord(String domainName, int version, String uqType,
			String file, double threshold) {
		this.domainName = domainName;
		this.version = version;
		this.uqType = uqType;
		this.file = file;
		this.threshold = threshold;
	}

	@JsonProperty("domain_name")
	public String getDomainName() {
		return domainName;
	}

	public void setDomainName(String domainName) {
		this.domainName = domainName;
	}

	public int getVersion() {
		return version;
	}

	public void setVersion(int version) {
		this.version = version;
	}

	/** @return The uncertainty quantification method of the model */
	@JsonProperty("uq_type")
	public String getUqType() {
		return uqType;
	}

	public void setUqType(String uqType) {
		this.uqType = uqType;
	}

	/** @return The location of the serialized model */
	public String getFile() {
		return file;
	}

	public void setFile(String file) {
		this.file = file;
	}

	/** @return The uncertainty above which the model is not trusted */
	public double getThreshold() {
		return threshold;
	}

	public void setThreshold(double threshold) {
		this.threshold = threshold;
	}

	@Override
	public String toString() {
		return "{domain_name=" + domainName + ", version=" + version
				+ ", uq_type=" + uqType + ", file=" + file + ", threshold="
				+ threshold + "}";
	}
}
