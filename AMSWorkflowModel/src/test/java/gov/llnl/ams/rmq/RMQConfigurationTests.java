package gov.llnl.ams.rmq;

import static org.junit.Assert.*;

import java.io.File;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class RMQConfigurationTests {
	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	@Test
	public void testLoad() throws Exception {
		File credentials = tmp.newFile("rmq.json");
		FileUtils.writeStringToFile(credentials, "{\"service-host\":"
				+ "\"rmq.example.org\",\"service-port\":5671,"
				+ "\"rabbitmq-user\":\"ams\",\"rabbitmq-password\":\"secret\","
				+ "\"rabbitmq-vhost\":\"/ams\",\"rabbitmq-cert\":\"/p/c.crt\","
				+ "\"rabbitmq-outbound-queue\":\"ams-out\","
				+ "\"rabbitmq-comment\":\"ignored\"}", "UTF-8");

		RMQConfiguration config = RMQConfiguration.load(credentials);
		assertEquals("rmq.example.org", config.getServiceHost());
		assertEquals(5671, config.getServicePort());
		assertEquals("ams", config.getUser());
		assertEquals("secret", config.getPassword());
		assertEquals("/ams", config.getVhost());
		assertEquals("/p/c.crt", config.getCert());
		assertEquals("ams-out", config.getOutboundQueue());
		assertNull(config.getExchange());
	}

	@Test
	public void testLibraryDescriptor() {
		RMQConfiguration config = new RMQConfiguration("rmq.example.org",
				5671, "ams", "secret", "/ams", "/p/c.crt");
		Map<String, Object> descriptor = config.toConnectionDescriptor(true);
		assertEquals("rmq.example.org", descriptor.get("service-host"));
		assertEquals(5671, descriptor.get("service-port"));
		assertEquals("secret", descriptor.get("rabbitmq-password"));
		assertFalse(descriptor.containsKey("rabbitmq-exchange"));
		assertEquals(6, descriptor.size());
	}

	@Test
	public void testToolDescriptor() {
		RMQConfiguration config = new RMQConfiguration("rmq.example.org",
				5671, "ams", "secret", "/ams", "/p/c.crt");
		config.setRoutingKey("training");
		Map<String, Object> descriptor = config.toConnectionDescriptor(false);
		assertEquals("rmq.example.org", descriptor.get("service_host"));
		assertEquals("training", descriptor.get("rabbitmq_routing_key"));
		assertFalse(descriptor.containsKey("service-host"));
	}
}
