package gov.llnl.ams.jobmanager;

import static com.fasterxml.jackson.databind.DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES;
import static com.fasterxml.jackson.databind.PropertyNamingStrategies.SNAKE_CASE;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.type.MapType;

import gov.llnl.ams.job.AMSJob;
import gov.llnl.ams.job.JobConfigurationException;
import gov.llnl.ams.job.JobDescription;
import gov.llnl.ams.job.impl.DomainJob;
import gov.llnl.ams.job.impl.MLJob;
import gov.llnl.ams.job.impl.OrchestratorJob;
import gov.llnl.ams.job.impl.StageJob;

/**
 * Converts job descriptions to and from JSON-compatible dictionaries, for
 * storing them in and reading them from workflow manifests. Every dictionary
 * names the kind of job in {@value #TYPE_FIELD}.
 */
public class JobDescriptionMapper {
	/** The field naming the kind of job. */
	public static final String TYPE_FIELD = "job_type";

	/** The kinds of job that can be read back. */
	public static final List<Class<? extends JobDescription>> JOB_TYPES =
			Arrays.<Class<? extends JobDescription>> asList(AMSJob.class,
					DomainJob.class, MLJob.class, StageJob.class,
					OrchestratorJob.class);

	private final ObjectMapper mapper;

	private final MapType dictType;

	public JobDescriptionMapper() {
		this(JOB_TYPES);
	}

	public JobDescriptionMapper(
			Collection<Class<? extends JobDescription>> types) {
		mapper = configure(new ObjectMapper());
		SimpleModule module = new SimpleModule();
		module.addSerializer(JobDescription.class,
				new JobDescriptionSerializer(TYPE_FIELD,
						configure(new ObjectMapper())));
		module.addDeserializer(JobDescription.class,
				new JobDescriptionDeserializer(TYPE_FIELD,
						new ArrayList<>(types)));
		mapper.registerModule(module);
		dictType = mapper.getTypeFactory().constructMapType(
				LinkedHashMap.class, String.class, Object.class);
	}

	private static ObjectMapper configure(ObjectMapper mapper) {
		mapper.setPropertyNamingStrategy(SNAKE_CASE);
		mapper.configure(FAIL_ON_UNKNOWN_PROPERTIES, false);
		return mapper;
	}

	/**
	 * Gets the mapper used for job descriptions, e.g. to read manifests
	 *
	 * @return The mapper
	 */
	public ObjectMapper getObjectMapper() {
		return mapper;
	}

	/**
	 * Converts a job description into a dictionary.
	 *
	 * @param job
	 *            The job description
	 * @return The dictionary, including the nested resources
	 */
	public Map<String, Object> toDict(JobDescription job) {
		return mapper.convertValue(job, dictType);
	}

	/**
	 * Builds a job description from a dictionary.
	 *
	 * @param dict
	 *            The dictionary, as produced by {@link #toDict(JobDescription)}
	 * @return The job description
	 * @throws JobConfigurationException
	 *             If the dictionary does not describe a valid job
	 */
	public JobDescription fromDict(Map<String, ?> dict) {
		AMSJob.validateEnvironment(dict.get("environment"));
		try {
			return mapper.convertValue(dict, JobDescription.class);
		} catch (IllegalArgumentException e) {
			throw configurationError(e);
		}
	}

	public String toJson(JobDescription job) throws IOException {
		return mapper.writeValueAsString(job);
	}

	/**
	 * Reads a job description from JSON.
	 *
	 * @throws JobConfigurationException
	 *             If the JSON does not describe a valid job
	 * @throws IOException
	 *             If the JSON cannot be parsed
	 */
	public JobDescription fromJson(String json) throws IOException {
		try {
			return mapper.readValue(json, JobDescription.class);
		} catch (JsonMappingException e) {
			throw configurationError(e);
		}
	}

	public void write(File file, JobDescription job) throws IOException {
		mapper.writeValue(file, job);
	}

	public JobDescription read(File file) throws IOException {
		try {
			return mapper.readValue(file, JobDescription.class);
		} catch (JsonMappingException e) {
			throw configurationError(e);
		}
	}

	/**
	 * Reports the configuration error a job description raised while being
	 * built, or wraps the mapping failure in one.
	 */
	private static JobConfigurationException configurationError(Exception e) {
		for (Throwable cause = e; cause != null; cause = cause.getCause())
			if (cause instanceof JobConfigurationException)
				return (JobConfigurationException) cause;
		return new JobConfigurationException("Invalid job description: "
				+ e.getMessage(), e);
	}
}
