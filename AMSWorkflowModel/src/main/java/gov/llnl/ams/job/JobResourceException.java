package gov.llnl.ams.job;

/**
 * Indicates that a job cannot be lowered to a submission because it has no
 * resources to ask for.
 */
public class JobResourceException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public JobResourceException(String message) {
		super(message);
	}
}
