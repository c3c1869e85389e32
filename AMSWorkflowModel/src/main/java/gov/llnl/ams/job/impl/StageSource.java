package gov.llnl.ams.job.impl;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonSubTypes.Type;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeInfo.As;
import com.fasterxml.jackson.annotation.JsonTypeInfo.Id;

/**
 * Where a {@link StageJob} reads the data produced by the application.
 */
@JsonTypeInfo(use = Id.NAME, include = As.PROPERTY, property = "mechanism")
@JsonSubTypes({
		@Type(value = FileSystemStageSource.class, name = FileSystemStageSource.MECHANISM),
		@Type(value = NetworkStageSource.class, name = NetworkStageSource.MECHANISM) })
public interface StageSource {
	/**
	 * Gets the value of the <tt>--mechanism</tt> flag for this source
	 *
	 * @return The mechanism
	 */
	@JsonIgnore
	String getMechanism();

	/**
	 * Adds the arguments selecting this source, including
	 * <tt>--mechanism</tt>.
	 *
	 * @param args
	 *            The positional arguments to append to
	 * @param kwargs
	 *            The flags to add to
	 */
	void addArguments(List<String> args, Map<String, Object> kwargs);
}
