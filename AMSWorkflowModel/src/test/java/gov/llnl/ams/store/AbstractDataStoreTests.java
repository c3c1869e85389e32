package gov.llnl.ams.store;

import static org.junit.Assert.*;

import java.io.File;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class AbstractDataStoreTests {
	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	@Test
	public void testCandidatePath() {
		DataStore store = new MockDataStore(tmp.getRoot());
		assertEquals(new File(tmp.getRoot(), "candidates"),
				store.getCandidatePath());
	}

	@Test
	public void testMkdir() throws Exception {
		DataStore store = new MockDataStore(tmp.getRoot());
		File dir = store.mkdir("tmp/objects");
		assertTrue(dir.isDirectory());
		assertEquals(new File(new File(tmp.getRoot(), "tmp"), "objects"), dir);

		// Existing directories are fine
		assertEquals(dir, store.mkdir("tmp/objects"));
	}

	@Test
	public void testUniqueFilename() {
		DataStore store = new MockDataStore(tmp.getRoot());
		String first = store.uniqueFilename();
		String second = store.uniqueFilename();
		assertNotEquals(first, second);
		assertFalse(first.contains("-"));
	}

	@Test
	public void testSearchLatest() throws Exception {
		MockDataStore store = new MockDataStore(tmp.getRoot());
		store.register(new ModelRecord("hydro", 1, "faiss", "old.pt", 0.1));
		store.register(new ModelRecord("hydro", 2, "faiss", "new.pt", 0.2));

		assertEquals("new.pt", store.search("hydro", DataStore.MODELS_ENTRY,
				DataStore.LATEST_VERSION).get(0).getFile());
		assertEquals("old.pt", store.search("hydro", DataStore.MODELS_ENTRY,
				"1").get(0).getFile());
		assertTrue(store.search("eos", DataStore.MODELS_ENTRY,
				DataStore.LATEST_VERSION).isEmpty());
	}
}
