package gov.llnl.ams.job.impl;

import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Data written by the application to files in a directory.
 */
public class FileSystemStageSource implements StageSource {
	public static final String MECHANISM = "fs";

	/** The file type written by the application unless told otherwise. */
	public static final String DEFAULT_SRC_TYPE = "shdf5";

	/** The files picked up unless told otherwise. */
	public static final String DEFAULT_PATTERN = "*.h5";

	private final String src;
	private final String srcType;
	private final String pattern;

	/**
	 * @param src
	 *            The directory the application writes to
	 * @param srcType
	 *            The type of the files, or <tt>null</tt> to leave it to the
	 *            stager
	 * @param pattern
	 *            The pattern of the files to pick up
	 */
	@JsonCreator
	public FileSystemStageSource(
			@JsonProperty(value = "src", required = true) String src,
			@JsonProperty("src_type") String srcType,
			@JsonProperty("pattern") String pattern) {
		this.src = requireNonNull(src, "a file system source needs a directory");
		this.srcType = srcType;
		this.pattern = (pattern == null ? DEFAULT_PATTERN : pattern);
	}

	@Override
	public String getMechanism() {
		return MECHANISM;
	}

	@JsonProperty("src")
	public String getSrc() {
		return src;
	}

	@JsonProperty("src_type")
	@JsonInclude(Include.NON_NULL)
	public String getSrcType() {
		return srcType;
	}

	@JsonProperty("pattern")
	public String getPattern() {
		return pattern;
	}

	@Override
	public void addArguments(List<String> args, Map<String, Object> kwargs) {
		kwargs.put("--src", src);
		if (srcType != null)
			kwargs.put("--src-type", srcType);
		kwargs.put("--pattern", pattern);
		kwargs.put("--mechanism", MECHANISM);
	}
}
