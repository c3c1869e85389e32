package gov.llnl.ams.store;

import static gov.llnl.ams.utils.DirectoryUtils.uniqueName;
import static java.util.Objects.requireNonNull;

import java.io.File;
import java.io.IOException;

import gov.llnl.ams.utils.DirectoryUtils;

/**
 * A store rooted in a directory of the shared file system. Subclasses supply
 * the lookup of registered records.
 */
public abstract class AbstractDataStore implements DataStore {
	/** The directory, relative to the root, holding candidate data. */
	public static final String CANDIDATES_DIRECTORY = "candidates";

	private final File rootPath;

	protected AbstractDataStore(File rootPath) {
		this.rootPath = requireNonNull(rootPath, "the store needs a root path");
	}

	@Override
	public final File getRootPath() {
		return rootPath;
	}

	@Override
	public File getCandidatePath() {
		return new File(rootPath, CANDIDATES_DIRECTORY);
	}

	@Override
	public final File mkdir(String subpath) throws IOException {
		return DirectoryUtils.mkdir(rootPath, subpath);
	}

	@Override
	public String uniqueFilename() {
		return uniqueName();
	}
}
