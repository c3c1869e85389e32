package gov.llnl.ams.job;

import static java.util.Arrays.asList;
import static org.junit.Assert.*;

import java.io.File;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Test;

import gov.llnl.ams.job.ArgumentFormatter.Key;
import gov.llnl.ams.store.MockDataStore;

public class ArgumentFormatterTests {
	private ArgumentFormatter formatter() {
		Map<Key, String> values = new EnumMap<>(Key.class);
		values.put(Key.AMS_STORE_PATH, "/p/store");
		return new ArgumentFormatter(values);
	}

	@Test
	public void testSubstitution() {
		assertEquals("/p/store/models",
				formatter().format("{AMS_STORE_PATH}/models"));
		assertEquals("plain", formatter().format("plain"));
	}

	@Test
	public void testEscapedBraces() {
		assertEquals("{x}=/p/store",
				formatter().format("{{x}}={AMS_STORE_PATH}"));
	}

	@Test(expected = JobConfigurationException.class)
	public void testUnknownKey() {
		formatter().format("{HOME}/models");
	}

	@Test(expected = JobConfigurationException.class)
	public void testUnterminated() {
		formatter().format("{AMS_STORE_PATH");
	}

	@Test(expected = JobConfigurationException.class)
	public void testSingleClosingBrace() {
		formatter().format("a}b");
	}

	@Test(expected = JobConfigurationException.class)
	public void testMissingValue() {
		new ArgumentFormatter(new EnumMap<Key, String>(Key.class))
				.format("{AMS_STORE_PATH}");
	}

	@Test
	public void testForStore() {
		ArgumentFormatter formatter = ArgumentFormatter
				.forStore(new MockDataStore(new File("/p/ams")));
		assertEquals(new File("/p/ams").getPath() + "/db",
				formatter.format("{AMS_STORE_PATH}/db"));
	}

	@Test
	public void testArgs() {
		assertEquals(asList("/p/store", "-v"),
				formatter().formatArgs(asList("{AMS_STORE_PATH}", "-v")));
		assertTrue(formatter().formatArgs(null).isEmpty());
	}

	@Test(expected = JobConfigurationException.class)
	public void testNonStringArg() {
		formatter().formatArgs(asList("-n", 3));
	}

	@Test
	public void testKwargs() {
		Map<String, Object> kwargs = new LinkedHashMap<>();
		kwargs.put("--out", "{AMS_STORE_PATH}/out");
		kwargs.put("--epochs", 10);
		Map<String, Object> formatted = formatter().formatKwargs(kwargs);
		assertEquals(asList("--out", "--epochs"),
				asList(formatted.keySet().toArray()));
		assertEquals("/p/store/out", formatted.get("--out"));
		assertEquals(10, formatted.get("--epochs"));
	}
}
