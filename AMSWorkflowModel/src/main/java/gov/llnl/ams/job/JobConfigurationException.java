package gov.llnl.ams.job;

/**
 * Indicates that a job description could not be constructed because the
 * values supplied to it are not consistent.
 */
public class JobConfigurationException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public JobConfigurationException(String message) {
		super(message);
	}

	public JobConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
