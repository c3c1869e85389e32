package gov.llnl.ams.jobmanager;

import static java.util.Arrays.asList;
import static org.junit.Assert.*;

import java.io.File;
import java.util.Collections;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import gov.llnl.ams.job.JobConfigurationException;
import gov.llnl.ams.job.JobResources;
import gov.llnl.ams.job.impl.DomainJob;
import gov.llnl.ams.job.impl.MLJob;
import gov.llnl.ams.job.impl.MLJob.Role;
import gov.llnl.ams.job.impl.StageJob;

public class JobDescriptionFactoryTests {
	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	JobDescriptionFactory factory = new JobDescriptionFactory();

	private static Map<String, Object> entry(String json) throws Exception {
		return new ObjectMapper().readValue(json.replace('\'', '"'),
				new TypeReference<Map<String, Object>>() {
				});
	}

	@Test
	public void testDomainJob() throws Exception {
		Map<String, Object> descr = entry("{'name': 'physics',"
				+ " 'domain_names': ['hydro', 'eos'], 'ams_log': true,"
				+ " 'resources': {'nodes': 2, 'tasks_per_node': 4,"
				+ " 'gpus_per_task': 1},"
				+ " 'cli': {'executable': 'miniapp', 'is_mpi': true,"
				+ " 'cli_args': ['-S', '8'], 'cli_kwargs': {'-n': 10},"
				+ " 'stdout': 'physics.out'}}");
		DomainJob job = factory.domainJob(descr, "/p/stage",
				Collections.singletonMap("PATH", "/usr/bin"));

		assertEquals("physics", job.getName());
		assertEquals(asList("hydro", "eos"),
				asList(job.getDomainNames().toArray()));
		assertEquals("/p/stage", job.getStageDir());
		assertEquals(new JobResources(2, 4, 1, true, 1), job.getResources());
		assertEquals(asList("miniapp", "-n", "10", "-S", "8"),
				job.generateCommand());
		assertTrue(job.isAmsLog());
		assertTrue(job.isMpi());
		assertEquals("physics.out", job.getStdout());
		assertNull(job.getStderr());
		assertEquals("/usr/bin", job.getEnvironment().get("PATH"));
	}

	@Test
	public void testMLJob() throws Exception {
		Map<String, Object> descr = entry("{'name': 'train-hydro',"
				+ " 'domain_name': 'hydro',"
				+ " 'resources': {'nodes': 1, 'tasks_per_node': 1},"
				+ " 'cli': {'executable': 'python3',"
				+ " 'cli_args': ['train.py'],"
				+ " 'cli_kwargs': {'--out': '{AMS_STORE_PATH}/models'}}}");
		MLJob job = factory.mlJob(new FixedDataStore(tmp.getRoot()), descr,
				Role.TRAIN);

		assertEquals(Role.TRAIN, job.getRole());
		assertEquals("hydro", job.getDomain());
		assertEquals(asList("python3", "--out", tmp.getRoot().getPath()
				+ "/models", "train.py"), job.generateCommand());
		assertTrue(job.getEnvironment().isEmpty());
		assertFalse(job.isAmsLog());
	}

	@Test
	public void testNetworkStageJob() throws Exception {
		Map<String, Object> descr = entry("{'update_models': true,"
				+ " 'store': false, 'environment': {'PYTHONPATH': '/p/lib'}}");
		StageJob job = factory.networkStageJob(descr, "/p/dest", "/p/db",
				"/p/creds.json", new JobResources(1, 1));

		assertTrue(job.generateCommand().contains("--update-rmq-models"));
		assertTrue(job.generateCommand().contains("--no-store"));
		assertEquals(StageJob.DEFAULT_DB_TYPE, job.getDbType());
		assertEquals("/p/lib", job.getEnvironment().get("PYTHONPATH"));
	}

	@Test(expected = JobConfigurationException.class)
	public void testMissingPruningModule() throws Exception {
		Map<String, Object> descr = entry("{'prune_module_path': '"
				+ new File(tmp.getRoot(), "pruner.py").getPath()
				+ "', 'prune_class': 'P'}");
		factory.networkStageJob(descr, "/p/dest", "/p/db", "/p/creds.json",
				new JobResources(1, 1));
	}

	@Test(expected = JobConfigurationException.class)
	public void testMissingResources() throws Exception {
		factory.domainJob(entry("{'name': 'physics', 'domain_names': ['x'],"
				+ " 'cli': {'executable': 'miniapp'}}"), null, null);
	}

	@Test(expected = JobConfigurationException.class)
	public void testMissingExecutable() throws Exception {
		factory.domainJob(entry("{'name': 'physics', 'domain_names': ['x'],"
				+ " 'resources': {'nodes': 1, 'tasks_per_node': 1},"
				+ " 'cli': {}}"), null, null);
	}

	@Test(expected = JobConfigurationException.class)
	public void testMissingCli() throws Exception {
		factory.mlJob(new FixedDataStore(tmp.getRoot()),
				entry("{'name': 'train', 'domain_name': 'x',"
						+ " 'resources': {'nodes': 1, 'tasks_per_node': 1}}"),
				Role.TRAIN);
	}

	@Test
	public void testInvalidResources() throws Exception {
		try {
			factory.domainJob(entry("{'name': 'physics',"
					+ " 'domain_names': ['x'],"
					+ " 'resources': {'nodes': 1, 'tasks_per_node': -2},"
					+ " 'cli': {'executable': 'miniapp'}}"), null, null);
			fail("accepted negative tasks");
		} catch (JobConfigurationException e) {
			assertTrue(e.getMessage(), e.getMessage().contains(
					"tasks_per_node"));
		}
	}

	@Test(expected = JobConfigurationException.class)
	public void testWrongFlagType() throws Exception {
		factory.domainJob(entry("{'name': 'physics', 'domain_names': ['x'],"
				+ " 'ams_log': 'yes',"
				+ " 'resources': {'nodes': 1, 'tasks_per_node': 1},"
				+ " 'cli': {'executable': 'miniapp'}}"), null, null);
	}
}
