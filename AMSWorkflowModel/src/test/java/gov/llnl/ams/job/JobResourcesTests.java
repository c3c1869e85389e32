package gov.llnl.ams.job;

import static org.junit.Assert.*;

import org.junit.Test;

public class JobResourcesTests {
	@Test
	public void testDefaults() {
		JobResources resources = new JobResources(2, 3);
		assertEquals(2, resources.getNodes());
		assertEquals(3, resources.getTasksPerNode());
		assertEquals(1, resources.getCoresPerTask());
		assertTrue(resources.isExclusive());
		assertEquals(0, resources.getGpusPerTask());
		assertEquals(6, resources.getTotalTasks());
	}

	@Test
	public void testEquality() {
		assertEquals(new JobResources(2, 3), new JobResources(2, 3, 1, true, 0));
		assertEquals(new JobResources(2, 3).hashCode(),
				new JobResources(2, 3, 1, true, 0).hashCode());
		assertNotEquals(new JobResources(2, 3),
				new JobResources(2, 3, 1, false, 0));
	}

	@Test(expected = JobConfigurationException.class)
	public void testNoNodes() {
		new JobResources(0, 1);
	}

	@Test(expected = JobConfigurationException.class)
	public void testNoTasks() {
		new JobResources(1, 0);
	}

	@Test(expected = JobConfigurationException.class)
	public void testNoCores() {
		new JobResources(1, 1, 0, true, 0);
	}

	@Test(expected = JobConfigurationException.class)
	public void testNegativeGpus() {
		new JobResources(1, 1, 1, true, -1);
	}

	@Test(expected = JobConfigurationException.class)
	public void testTotalTasksOverflow() {
		new JobResources(65536, 65536);
	}

	@Test
	public void testLargestTotalTasks() {
		assertEquals(Integer.MAX_VALUE,
				new JobResources(Integer.MAX_VALUE, 1).getTotalTasks());
	}

	@Test
	public void testFromPropertiesDefaults() {
		assertEquals(new JobResources(4, 2),
				JobResources.fromProperties(4, 2, null, null, null));
		assertEquals(new JobResources(4, 2, 8, false, 1),
				JobResources.fromProperties(4, 2, 8, false, 1));
	}
}
