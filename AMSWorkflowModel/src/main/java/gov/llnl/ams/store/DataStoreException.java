package gov.llnl.ams.store;

/**
 * Indicates that the data store could not answer a query.
 */
public class DataStoreException extends Exception {
	private static final long serialVersionUID = 1L;

	public DataStoreException(String message) {
		super(message);
	}

	public DataStoreException(String message, Throwable cause) {
		super(message, cause);
	}
}
