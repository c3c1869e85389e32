package gov.llnl.ams.job;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import gov.llnl.ams.store.DataStore;

/**
 * Substitutes data store locations into command line arguments. Templates
 * name a {@link Key} between braces, e.g. <tt>{AMS_STORE_PATH}/models</tt>;
 * <tt>{{</tt> and <tt>}}</tt> stand for literal braces. A template that names
 * anything else is rejected.
 */
public class ArgumentFormatter {
	/**
	 * The keys that may appear in a template.
	 */
	public static enum Key {
		/** The root directory of the data store. */
		AMS_STORE_PATH
	}

	private final Map<Key, String> values;

	public ArgumentFormatter(Map<Key, String> values) {
		this.values = new EnumMap<>(Key.class);
		this.values.putAll(values);
	}

	/**
	 * Creates a formatter for the locations of a data store.
	 *
	 * @param store
	 *            The store
	 * @return The formatter
	 */
	public static ArgumentFormatter forStore(DataStore store) {
		Map<Key, String> values = new EnumMap<>(Key.class);
		values.put(Key.AMS_STORE_PATH, store.getRootPath().getPath());
		return new ArgumentFormatter(values);
	}

	/**
	 * Formats a single template.
	 *
	 * @param template
	 *            The template
	 * @return The template with every placeholder replaced
	 * @throws JobConfigurationException
	 *             If the template names an unknown key or has an unbalanced
	 *             brace
	 */
	public String format(String template) {
		StringBuilder result = new StringBuilder();
		int i = 0;
		while (i < template.length()) {
			char c = template.charAt(i);
			if (c == '{') {
				if (i + 1 < template.length() && template.charAt(i + 1) == '{') {
					result.append('{');
					i += 2;
					continue;
				}
				int end = template.indexOf('}', i);
				if (end < 0)
					throw new JobConfigurationException("Unterminated '{' in \""
							+ template + "\"");
				result.append(lookup(template.substring(i + 1, end), template));
				i = end + 1;
			} else if (c == '}') {
				if (i + 1 < template.length() && template.charAt(i + 1) == '}') {
					result.append('}');
					i += 2;
					continue;
				}
				throw new JobConfigurationException("Single '}' in \""
						+ template + "\"");
			} else {
				result.append(c);
				i++;
			}
		}
		return result.toString();
	}

	private String lookup(String name, String template) {
		Key key;
		try {
			key = Key.valueOf(name);
		} catch (IllegalArgumentException e) {
			throw new JobConfigurationException("Unknown key {" + name
					+ "} in \"" + template + "\"", e);
		}
		String value = values.get(key);
		if (value == null)
			throw new JobConfigurationException("No value for key {" + name
					+ "} in \"" + template + "\"");
		return value;
	}

	/**
	 * Formats positional arguments. Every argument must be a template.
	 *
	 * @param args
	 *            The arguments; may be <tt>null</tt>
	 * @return The formatted arguments, never <tt>null</tt>
	 */
	public List<String> formatArgs(List<?> args) {
		List<String> formatted = new ArrayList<>();
		if (args == null)
			return formatted;
		for (Object arg : args) {
			if (!(arg instanceof String))
				throw new JobConfigurationException(
						"Positional arguments must be strings but found " + arg);
			formatted.add(format((String) arg));
		}
		return formatted;
	}

	/**
	 * Formats keyed arguments. Only string values are treated as templates;
	 * other values pass through untouched.
	 *
	 * @param kwargs
	 *            The arguments; may be <tt>null</tt>
	 * @return The formatted arguments in the same order, never <tt>null</tt>
	 */
	public Map<String, Object> formatKwargs(Map<String, ?> kwargs) {
		Map<String, Object> formatted = new LinkedHashMap<>();
		if (kwargs == null)
			return formatted;
		for (Entry<String, ?> kwarg : kwargs.entrySet()) {
			Object value = kwarg.getValue();
			if (value instanceof String)
				value = format((String) value);
			formatted.put(kwarg.getKey(), value);
		}
		return formatted;
	}
}
