package gov.llnl.ams.job.impl;

import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Data streamed by the application through the message broker. The staging
 * job is the consumer side of the exchange.
 */
public class NetworkStageSource implements StageSource {
	public static final String MECHANISM = "network";

	private final String creds;
	private final boolean updateModels;

	/**
	 * @param creds
	 *            The broker credentials file
	 * @param updateModels
	 *            Whether the stager pushes newly trained models back to the
	 *            application through the broker
	 */
	@JsonCreator
	public NetworkStageSource(
			@JsonProperty(value = "creds", required = true) String creds,
			@JsonProperty("update_models") boolean updateModels) {
		this.creds = requireNonNull(creds, "a network source needs credentials");
		this.updateModels = updateModels;
	}

	@Override
	public String getMechanism() {
		return MECHANISM;
	}

	@JsonProperty("creds")
	public String getCreds() {
		return creds;
	}

	@JsonProperty("update_models")
	public boolean isUpdateModels() {
		return updateModels;
	}

	@Override
	public void addArguments(List<String> args, Map<String, Object> kwargs) {
		if (updateModels)
			args.add("--update-rmq-models");
		kwargs.put("--creds", creds);
		kwargs.put("--mechanism", MECHANISM);
	}
}
