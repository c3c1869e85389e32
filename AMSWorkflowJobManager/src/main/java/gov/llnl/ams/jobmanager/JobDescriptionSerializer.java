package gov.llnl.ams.jobmanager;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonGenerationException;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fasterxml.jackson.databind.type.MapType;

import gov.llnl.ams.job.JobDescription;
import gov.llnl.ams.job.JobDescriptionTypeName;

/**
 * Writes a job description as its properties preceded by a field holding the
 * {@link JobDescriptionTypeName} of its class.
 */
public class JobDescriptionSerializer extends StdSerializer<JobDescription> {
	private static final long serialVersionUID = 1L;

	private final String typeField;

	/** Converts the description to a map without recursing into this. */
	private final ObjectMapper plainMapper;

	public JobDescriptionSerializer(String typeField, ObjectMapper plainMapper) {
		super(JobDescription.class);

		this.typeField = typeField;
		this.plainMapper = plainMapper;
	}

	@Override
	public void serialize(JobDescription value, JsonGenerator jgen,
			SerializerProvider provider) throws IOException {
		JobDescriptionTypeName typeNameAnnotation =
				value.getClass().getAnnotation(JobDescriptionTypeName.class);
		if (typeNameAnnotation == null) {
			throw new JsonGenerationException("Type " + value.getClass()
				+ " is not annotated with JobDescriptionTypeName and so"
				+ " cannot be serialized", jgen);
		}
		MapType mapType = plainMapper.getTypeFactory().constructMapType(
				LinkedHashMap.class, String.class, Object.class);
		Map<String, Object> map = plainMapper.convertValue(value, mapType);

		jgen.writeStartObject();
		jgen.writeStringField(typeField, typeNameAnnotation.value());
		for (Map.Entry<String, Object> entry : map.entrySet())
			jgen.writeObjectField(entry.getKey(), entry.getValue());
		jgen.writeEndObject();
	}
}
