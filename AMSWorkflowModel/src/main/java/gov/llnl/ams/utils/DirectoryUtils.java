package gov.llnl.ams.utils;

import static org.apache.commons.io.FileUtils.forceMkdir;

import java.io.File;
import java.io.IOException;
import java.util.UUID;

public class DirectoryUtils {
	private DirectoryUtils() {
	}

	/**
	 * Creates a directory below a parent, along with any missing ancestors.
	 * Does nothing if the directory already exists.
	 */
	public static File mkdir(File parent, String name) throws IOException {
		File dir = new File(parent, name);
		forceMkdir(dir);
		return dir;
	}

	public static String uniqueName() {
		return UUID.randomUUID().toString().replace("-", "");
	}
}
