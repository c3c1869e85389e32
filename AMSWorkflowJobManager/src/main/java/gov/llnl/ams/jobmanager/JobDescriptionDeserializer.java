package gov.llnl.ams.jobmanager;

import static org.slf4j.LoggerFactory.getLogger;

import java.io.IOException;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.node.ObjectNode;

import gov.llnl.ams.job.JobDescription;
import gov.llnl.ams.job.JobDescriptionTypeName;

/**
 * Reads a job description written by {@link JobDescriptionSerializer}, using
 * the type field to pick the class to build.
 */
public class JobDescriptionDeserializer extends StdDeserializer<JobDescription> {
	private static final long serialVersionUID = 1L;

	private final Logger logger = getLogger(getClass());

	private final Map<String, Class<? extends JobDescription>> typeMap =
			new HashMap<>();

	private final String typeField;

	public JobDescriptionDeserializer(String typeField,
			Collection<Class<? extends JobDescription>> types) {
		super(JobDescription.class);

		this.typeField = typeField;

		for (Class<? extends JobDescription> type : types) {
			JobDescriptionTypeName typeNameAnnotation =
					type.getAnnotation(JobDescriptionTypeName.class);
			if (typeNameAnnotation == null) {
				throw new IllegalArgumentException("Type " + type
					+ " is not annotated with JobDescriptionTypeName and so"
					+ " cannot be deserialized");
			}
			String typeName = typeNameAnnotation.value();
			if (typeMap.containsKey(typeName)) {
				throw new IllegalArgumentException("A type with type name "
					+ typeName + " has already been mapped (existing = "
					+ typeMap.get(typeName) + ") when adding type " + type);
			}

			typeMap.put(typeName, type);
		}
	}

	@Override
	public JobDescription deserialize(JsonParser parser,
			DeserializationContext context) throws IOException {
		ObjectMapper mapper = (ObjectMapper) parser.getCodec();
		JsonNode tree = mapper.readTree(parser);
		if (!tree.isObject())
			throw JsonMappingException.from(parser,
					"A job description must be an object");
		ObjectNode root = (ObjectNode) tree;

		JsonNode typeNode = root.remove(typeField);
		if (typeNode == null) {
			throw JsonMappingException.from(parser,
				"Type field " + typeField + " not found in received object."
				+ " Ensure that the serialiser is configured to add this"
				+ " field to the serialised object.");
		}
		String typeName = typeNode.asText();
		Class<? extends JobDescription> type = typeMap.get(typeName);
		if (type == null) {
			throw JsonMappingException.from(parser, "No type with name "
				+ typeName + " was found.  Ensure that the deserialiser has"
				+ " been configured with all required types");
		}
		logger.debug("Deserialising " + type);

		return mapper.treeToValue(root, type);
	}
}
