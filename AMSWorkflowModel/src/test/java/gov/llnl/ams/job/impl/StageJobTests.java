package gov.llnl.ams.job.impl;

import static java.util.Arrays.asList;
import static java.util.Collections.frequency;
import static org.junit.Assert.*;

import java.io.File;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import gov.llnl.ams.job.AMSJob;
import gov.llnl.ams.job.JobConfigurationException;
import gov.llnl.ams.job.JobResourceException;
import gov.llnl.ams.job.JobResources;

public class StageJobTests {
	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	private static final JobResources RESOURCES = new JobResources(1, 1);

	@Test
	public void testFileSystemCommand() {
		StageJob job = StageJob.fromFileSystem(RESOURCES, "/p/dest",
				"/p/db", "/p/src");
		assertEquals(asList("AMSDBStage", "--src", "/p/src", "--src-type",
				"shdf5", "--pattern", "*.h5", "--mechanism", "fs", "--dest",
				"/p/dest", "--persistent-db-path", "/p/db", "--db-type",
				"dhdf5", "--policy", "process", "--store"),
				job.generateCommand());
		assertEquals(StageJob.DEFAULT_NAME, job.getName());
		assertEquals(StageJob.EXECUTABLE, job.getExecutable());
		assertTrue(job.getSource() instanceof FileSystemStageSource);
	}

	@Test
	public void testNetworkCommand() {
		StageJob job = StageJob.fromNetwork(RESOURCES, "/p/dest", "/p/db",
				"/p/creds.json", false, "hdf5", true, null, null, null, null,
				null, null, null);
		assertEquals(asList("AMSDBStage", "--creds", "/p/creds.json",
				"--mechanism", "network", "--dest", "/p/dest",
				"--persistent-db-path", "/p/db", "--db-type", "hdf5",
				"--policy", "process", "--update-rmq-models", "--no-store"),
				job.generateCommand());
		assertFalse(job.isStore());
		assertTrue(((NetworkStageSource) job.getSource()).isUpdateModels());
	}

	@Test
	public void testMechanismAppearsOnce() {
		List<String> fs = StageJob.fromFileSystem(RESOURCES, "d", "p", "s")
				.generateCommand();
		List<String> network = StageJob.fromNetwork(RESOURCES, "d", "p", "c")
				.generateCommand();
		assertEquals(1, frequency(fs, "--mechanism"));
		assertEquals("fs", fs.get(fs.indexOf("--mechanism") + 1));
		assertEquals(1, frequency(network, "--mechanism"));
		assertEquals("network",
				network.get(network.indexOf("--mechanism") + 1));
		assertFalse(network.contains("--update-rmq-models"));
	}

	@Test
	public void testUserArgumentsFirst() {
		Map<String, Object> kwargs = new LinkedHashMap<>();
		kwargs.put("--threads", 4);
		StageJob job = StageJob.fromFileSystem(RESOURCES, "d", "p", "s", true,
				null, "*.hdf5", "dhdf5", null, null, null, null, null,
				asList("-v"), kwargs);
		List<String> command = job.generateCommand();
		assertEquals(asList("AMSDBStage", "--threads", "4", "--src", "s",
				"--src-type", "dhdf5", "--pattern", "*.hdf5"),
				command.subList(0, 9));
		assertEquals(asList("-v", "--store"),
				command.subList(command.size() - 2, command.size()));
		assertEquals(asList("-v"), job.getCliArgs());
		assertEquals(kwargs, job.getCliKwargs());
	}

	@Test
	public void testPruning() throws Exception {
		File module = tmp.newFile("pruner.py");
		StageJob job = StageJob.fromNetwork(RESOURCES, "d", "p", "c", true,
				null, false, module.getPath(), "RandomPruner", null, null,
				null, null, null);
		List<String> command = job.generateCommand();
		assertEquals(module.getPath(),
				command.get(command.indexOf("--load") + 1));
		assertEquals("RandomPruner",
				command.get(command.indexOf("--class") + 1));
		assertEquals("RandomPruner", job.getPruneClass());
	}

	@Test(expected = JobConfigurationException.class)
	public void testMissingPruningModule() {
		StageJob.fromFileSystem(RESOURCES, "d", "p", "s", true, null, null,
				null, new File(tmp.getRoot(), "missing.py").getPath(), "P",
				null, null, null, null, null);
	}

	@Test(expected = JobConfigurationException.class)
	public void testPruningModuleWithoutClass() throws Exception {
		StageJob.fromNetwork(RESOURCES, "d", "p", "c", true, null, false, tmp
				.newFile("pruner.py").getPath(), null, null, null, null, null,
				null);
	}

	@Test(expected = JobConfigurationException.class)
	public void testPersistentStoreChecksPruning() {
		StageJob.toPersistentStore("/p/db", "/p/src", "/p/dest", RESOURCES,
				null, null, null, "/nonexistent/pruner.py", "P", null, null);
	}

	@Test
	public void testToPersistentStore() {
		Map<String, String> environment = new LinkedHashMap<>();
		environment.put("PYTHONPATH", "/p/lib");
		StageJob job = StageJob.toPersistentStore("/p/db", "/p/src",
				"/p/dest", RESOURCES, environment, "stage.out", "stage.err",
				null, null, null, null);
		assertEquals(StageJob.PERSISTENT_STAGE_NAME, job.getName());
		assertEquals(asList("AMSDBStage", "--src", "/p/src", "--pattern",
				"*.h5", "--mechanism", "fs", "--dest", "/p/dest",
				"--persistent-db-path", "/p/db", "--db-type", "dhdf5",
				"--policy", "process", "--store"), job.generateCommand());
		assertEquals("/p/lib", job.getEnvironment().get("PYTHONPATH"));
		assertEquals("stage.out", job.getStdout());
	}

	@Test
	public void testResourcesFromDomainJob() {
		DomainJob domain = new DomainJob(asList("hydro"), null, "physics",
				"miniapp", null, new JobResources(4, 8, 2, true, 1), null,
				null, false, true, null, null);
		assertEquals(new JobResources(4, 1, 5, false, 1),
				StageJob.resourcesFromDomainJob(domain));
	}

	@Test(expected = JobResourceException.class)
	public void testResourcesFromDomainJobWithout() {
		StageJob.resourcesFromDomainJob(new AMSJob("physics", "miniapp", null,
				null, null, null, false, false, null, null));
	}
}
