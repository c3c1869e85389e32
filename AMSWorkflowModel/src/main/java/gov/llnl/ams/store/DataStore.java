package gov.llnl.ams.store;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * The persistent store holding trained models and staged data. Jobs only
 * borrow a store for the duration of a single call; they never own one.
 */
public interface DataStore {
	/** The entry under which trained models are registered. */
	String MODELS_ENTRY = "models";

	/** The version selector for the most recent registration. */
	String LATEST_VERSION = "latest";

	/**
	 * Gets the root directory of the store
	 * 
	 * @return The root directory
	 */
	File getRootPath();

	/**
	 * Gets the directory into which applications write candidate data that
	 * has not yet been staged.
	 * 
	 * @return The candidate directory
	 */
	File getCandidatePath();

	/**
	 * Looks up the records registered for a domain.
	 * 
	 * @param domainName
	 *            The physical domain
	 * @param entry
	 *            The kind of record, e.g. {@link #MODELS_ENTRY}
	 * @param version
	 *            The version selector, e.g. {@link #LATEST_VERSION}
	 * @return The matching records, most relevant first; empty if there are
	 *         none
	 * @throws DataStoreException
	 *             If the store cannot be queried
	 */
	List<ModelRecord> search(String domainName, String entry, String version)
			throws DataStoreException;

	/**
	 * Creates a directory below the root of the store if it does not exist.
	 * 
	 * @param subpath
	 *            The path relative to the root
	 * @return The directory
	 * @throws IOException
	 *             If the directory cannot be created
	 */
	File mkdir(String subpath) throws IOException;

	/**
	 * Generates a file name that no other call returns.
	 * 
	 * @return A file name without extension
	 */
	String uniqueFilename();
}
