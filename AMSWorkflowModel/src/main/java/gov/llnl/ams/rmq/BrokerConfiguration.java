package gov.llnl.ams.rmq;

import java.util.Map;

/**
 * The connection details of the message broker through which applications
 * stream data to the staging jobs.
 */
public interface BrokerConfiguration {
	/**
	 * Describes how to connect to the broker.
	 * 
	 * @param forLibrary
	 *            True for the form read by the AMS library linked into the
	 *            domain application, false for the form read by the workflow
	 *            tools
	 * @return A JSON-serializable description of the connection
	 */
	Map<String, Object> toConnectionDescriptor(boolean forLibrary);
}
