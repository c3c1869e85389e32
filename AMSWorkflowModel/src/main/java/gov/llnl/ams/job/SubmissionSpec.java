package gov.llnl.ams.job;

import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * The request handed to the cluster scheduler: what to run, on how much of
 * the machine, and with which environment and output files.
 */
@JsonPropertyOrder({ "command", "total_tasks", "nodes", "cores_per_task",
		"gpus_per_task", "exclusive", "nested", "stdout", "stderr",
		"environment", "cwd", "shell_options" })
public class SubmissionSpec {
	/** Shell option selecting the MPI flavour of the job. */
	public static final String MPI_OPTION = "mpi";

	/** Shell option binding GPUs to tasks. */
	public static final String GPU_AFFINITY_OPTION = "gpu-affinity";

	private final List<String> command;
	private final int totalTasks;
	private final int nodes;
	private final int coresPerTask;
	private final int gpusPerTask;
	private final boolean exclusive;
	private final boolean nested;
	private String stdout;
	private String stderr;
	private Map<String, String> environment = new LinkedHashMap<>();
	private String cwd;
	private final Map<String, String> shellOptions = new LinkedHashMap<>();

	/**
	 * Creates a request for a plain command.
	 *
	 * @param command
	 *            The command vector
	 * @param totalTasks
	 *            The total number of tasks
	 * @param nodes
	 *            The number of nodes
	 * @param coresPerTask
	 *            The cores of each task
	 * @param gpusPerTask
	 *            The GPUs of each task
	 * @param exclusive
	 *            Whether the nodes are reserved for this job alone
	 */
	public SubmissionSpec(List<String> command, int totalTasks, int nodes,
			int coresPerTask, int gpusPerTask, boolean exclusive) {
		this(command, totalTasks, nodes, coresPerTask, gpusPerTask, exclusive,
				false);
	}

	/**
	 * Creates a request.
	 *
	 * @param nested
	 *            Whether the command runs inside a nested scheduler instance
	 *            with one slot per task
	 */
	public SubmissionSpec(List<String> command, int totalTasks, int nodes,
			int coresPerTask, int gpusPerTask, boolean exclusive,
			boolean nested) {
		this.command = unmodifiableList(new ArrayList<>(command));
		this.totalTasks = totalTasks;
		this.nodes = nodes;
		this.coresPerTask = coresPerTask;
		this.gpusPerTask = gpusPerTask;
		this.exclusive = exclusive;
		this.nested = nested;
	}

	public List<String> getCommand() {
		return command;
	}

	public int getTotalTasks() {
		return totalTasks;
	}

	public int getNodes() {
		return nodes;
	}

	public int getCoresPerTask() {
		return coresPerTask;
	}

	public int getGpusPerTask() {
		return gpusPerTask;
	}

	public boolean isExclusive() {
		return exclusive;
	}

	public boolean isNested() {
		return nested;
	}

	public String getStdout() {
		return stdout;
	}

	public void setStdout(String stdout) {
		this.stdout = stdout;
	}

	public String getStderr() {
		return stderr;
	}

	public void setStderr(String stderr) {
		this.stderr = stderr;
	}

	public Map<String, String> getEnvironment() {
		return unmodifiableMap(environment);
	}

	public void setEnvironment(Map<String, String> environment) {
		this.environment = new LinkedHashMap<>(environment);
	}

	public String getCwd() {
		return cwd;
	}

	public void setCwd(String cwd) {
		this.cwd = cwd;
	}

	public Map<String, String> getShellOptions() {
		return unmodifiableMap(shellOptions);
	}

	public void setShellOption(String option, String value) {
		shellOptions.put(option, value);
	}

	@Override
	public String toString() {
		return "SubmissionSpec" + command + " tasks=" + totalTasks + " nodes="
				+ nodes + " cores_per_task=" + coresPerTask
				+ " gpus_per_task=" + gpusPerTask + " exclusive=" + exclusive
				+ (nested ? " nested" : "") + " options=" + shellOptions;
	}
}
