package gov.llnl.ams.job.impl;

import static java.util.Objects.requireNonNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import gov.llnl.ams.job.AMSJob;
import gov.llnl.ams.job.JobDescriptionTypeName;
import gov.llnl.ams.job.JobResources;

/**
 * A job that itself schedules the other jobs of the workflow. So far it has
 * only been used to schedule jobs inside the allocation it runs in.
 */
@JobDescriptionTypeName("AMSOrchestratorJob")
@JsonIgnoreProperties(ignoreUnknown = true)
public class OrchestratorJob extends AMSJob {
	public static final String NAME = "AMSOrchestrator";

	public static final String EXECUTABLE = "AMSOrchestrator";

	private static final JobResources RESOURCES = new JobResources(1, 1, 1,
			false, 0);

	private final String schedulerUri;
	private final String brokerConfig;

	/**
	 * @param schedulerUri
	 *            The endpoint of the scheduler the orchestrator submits to
	 * @param brokerConfig
	 *            The broker configuration file the orchestrator listens with
	 * @param environment
	 *            The environment to submit the orchestrator with
	 */
	@JsonCreator
	public OrchestratorJob(
			@JsonProperty(value = "scheduler_uri", required = true) String schedulerUri,
			@JsonProperty(value = "rmq_config", required = true) String brokerConfig,
			@JsonProperty("environment") Map<String, ?> environment) {
		super(NAME, EXECUTABLE, environment, RESOURCES, NAME + "-log.out",
				NAME + "-log.err", false, false, Collections.<String> emptyList(),
				kwargs(schedulerUri, brokerConfig));
		this.schedulerUri = schedulerUri;
		this.brokerConfig = brokerConfig;
	}

	private static Map<String, Object> kwargs(String schedulerUri,
			String brokerConfig) {
		Map<String, Object> kwargs = new LinkedHashMap<>();
		kwargs.put("--ml-uri", requireNonNull(schedulerUri,
				"the orchestrator needs a scheduler to submit to"));
		kwargs.put("--ams-rmq-config", requireNonNull(brokerConfig,
				"the orchestrator needs a broker configuration"));
		return kwargs;
	}

	@JsonProperty("scheduler_uri")
	public String getSchedulerUri() {
		return schedulerUri;
	}

	@JsonProperty("rmq_config")
	public String getBrokerConfig() {
		return brokerConfig;
	}
}
