package gov.llnl.ams.rmq;

import java.io.File;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * A RabbitMQ server as described by an AMS credentials file. The file uses
 * the dashed key names that the AMS library expects, e.g.
 * <tt>service-host</tt> and <tt>rabbitmq-user</tt>.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RMQConfiguration implements BrokerConfiguration {
	private String serviceHost;
	private int servicePort;
	private String user;
	private String password;
	private String vhost;
	private String cert;
	private String outboundQueue;
	private String exchange;
	private String routingKey;

	public RMQConfiguration() {
		// Does Nothing
	}

	public RMQConfiguration(String serviceHost, int servicePort, String user,
			String password, String vhost, String cert) {
		this.serviceHost = serviceHost;
		this.servicePort = servicePort;
		this.user = user;
		this.password = password;
		this.vhost = vhost;
		this.cert = cert;
	}

	/**
	 * Reads a credentials file.
	 *
	 * @param credentials
	 *            The JSON file
	 * @return The configuration
	 * @throws IOException
	 *             If the file cannot be read or parsed
	 */
	public static RMQConfiguration load(File credentials) throws IOException {
		return new ObjectMapper().readValue(credentials,
				RMQConfiguration.class);
	}

	@Override
	public Map<String, Object> toConnectionDescriptor(boolean forLibrary) {
		Map<String, Object> descriptor = new LinkedHashMap<>();
		put(descriptor, "service-host", serviceHost, forLibrary);
		put(descriptor, "service-port", servicePort, forLibrary);
		put(descriptor, "rabbitmq-user", user, forLibrary);
		put(descriptor, "rabbitmq-password", password, forLibrary);
		put(descriptor, "rabbitmq-vhost", vhost, forLibrary);
		put(descriptor, "rabbitmq-cert", cert, forLibrary);
		put(descriptor, "rabbitmq-outbound-queue", outboundQueue, forLibrary);
		put(descriptor, "rabbitmq-exchange", exchange, forLibrary);
		put(descriptor, "rabbitmq-routing-key", routingKey, forLibrary);
		return descriptor;
	}

	private static void put(Map<String, Object> descriptor, String key,
			Object value, boolean forLibrary) {
		if (value == null)
			return;
		descriptor.put(forLibrary ? key : key.replace('-', '_'), value);
	}

	@JsonProperty("service-host")
	public String getServiceHost() {
		return serviceHost;
	}

	public void setServiceHost(String serviceHost) {
		this.serviceHost = serviceHost;
	}

	@JsonProperty("service-port")
	public int getServicePort() {
		return servicePort;
	}

	public void setServicePort(int servicePort) {
		this.servicePort = servicePort;
	}

	@JsonProperty("rabbitmq-user")
	public String getUser() {
		return user;
	}

	public void setUser(String user) {
		this.user = user;
	}

	@JsonProperty("rabbitmq-password")
	public String getPassword() {
		return password;
	}

	public void setPassword(String password) {
		this.password = password;
	}

	@JsonProperty("rabbitmq-vhost")
	public String getVhost() {
		return vhost;
	}

	public void setVhost(String vhost) {
		this.vhost = vhost;
	}

	@JsonProperty("rabbitmq-cert")
	public String getCert() {
		return cert;
	}

	public void setCert(String cert) {
		this.cert = cert;
	}

	@JsonProperty("rabbitmq-outbound-queue")
	public String getOutboundQueue() {
		return outboundQueue;
	}

	public void setOutboundQueue(String outboundQueue) {
		this.outboundQueue = outboundQueue;
	}

	@JsonProperty("rabbitmq-exchange")
	public String getExchange() {
		return exchange;
	}

	public void setExchange(String exchange) {
		this.exchange = exchange;
	}

	@JsonProperty("rabbitmq-routing-key")
	public String getRoutingKey() {
		return routingKey;
	}

	public void setRoutingKey(String routingKey) {
		this.routingKey = routingKey;
	}
}
