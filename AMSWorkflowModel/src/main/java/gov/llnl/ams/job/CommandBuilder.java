package gov.llnl.ams.job;

import java.io.File;
import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

/**
 * Turns an executable, its keyed arguments and its positional arguments into
 * the command vector handed to the scheduler. The keyed arguments come first,
 * each flag followed by its value, then the positional arguments.
 */
public final class CommandBuilder {
	private CommandBuilder() {
	}

	/**
	 * Builds a command vector.
	 *
	 * @param executable
	 *            The executable to run
	 * @param args
	 *            The positional arguments, in order; may be <tt>null</tt>
	 * @param kwargs
	 *            The flags and their values, in iteration order; may be
	 *            <tt>null</tt>
	 * @return <tt>[executable, flag1, value1, ..., arg1, arg2, ...]</tt>
	 * @throws IllegalArgumentException
	 *             If a value cannot be rendered on a command line
	 */
	public static List<String> build(String executable, List<?> args,
			Map<String, ?> kwargs) {
		List<String> command = new ArrayList<>();
		command.add(stringify(executable));
		if (kwargs != null)
			for (Entry<String, ?> kwarg : kwargs.entrySet()) {
				command.add(stringify(kwarg.getKey()));
				command.add(stringify(kwarg.getValue()));
			}
		if (args != null)
			for (Object arg : args)
				command.add(stringify(arg));
		return command;
	}

	/**
	 * Renders a single command line value.
	 *
	 * @param value
	 *            The value
	 * @return The string form of the value
	 * @throws IllegalArgumentException
	 *             If the value is <tt>null</tt> or not a scalar
	 */
	public static String stringify(Object value) {
		if (value == null)
			throw new IllegalArgumentException(
					"cannot place a null value on a command line");
		if (value instanceof CharSequence || value instanceof Number
				|| value instanceof Boolean || value instanceof Character
				|| value instanceof Enum || value instanceof URI)
			return value.toString();
		if (value instanceof File)
			return ((File) value).getPath();
		if (value instanceof Path)
			return value.toString();
		throw new IllegalArgumentException("cannot place a value of type "
				+ value.getClass().getName() + " on a command line");
	}
}
