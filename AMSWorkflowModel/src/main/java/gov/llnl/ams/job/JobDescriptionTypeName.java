package gov.llnl.ams.job;

import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

/**
 * Identifies the unique type name of a {@link JobDescription} implementation.
 * Required if the description is to be serialized or deserialized.
 */
@Retention(RUNTIME)
@Target(TYPE)
public @interface JobDescriptionTypeName {
	/**
	 * The type name
	 * 
	 * @return The type name
	 */
	String value();
}
