package gov.llnl.ams.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * The allocation requested by a single job. Instances are immutable and are
 * owned by the job description that carries them.
 */
@JsonPropertyOrder({ "nodes", "tasks_per_node", "cores_per_task", "exclusive",
		"gpus_per_task" })
public final class JobResources {
	/**
	 * The number of nodes
	 */
	private final int nodes;

	/**
	 * The number of tasks launched on each node
	 */
	private final int tasksPerNode;

	/**
	 * The number of cores given to each task
	 */
	private final int coresPerTask;

	/**
	 * Whether the nodes are reserved for this job alone
	 */
	private final boolean exclusive;

	/**
	 * The number of GPUs given to each task
	 */
	private final int gpusPerTask;

	/**
	 * Creates an exclusive, GPU-less allocation with one core per task.
	 *
	 * @param nodes
	 *            The number of nodes
	 * @param tasksPerNode
	 *            The number of tasks on each node
	 */
	public JobResources(int nodes, int tasksPerNode) {
		this(nodes, tasksPerNode, 1, true, 0);
	}

	/**
	 * Creates an allocation.
	 *
	 * @param nodes
	 *            The number of nodes; must be positive
	 * @param tasksPerNode
	 *            The number of tasks on each node; must be positive
	 * @param coresPerTask
	 *            The number of cores of each task; at least one
	 * @param exclusive
	 *            Whether the nodes are reserved for this job alone
	 * @param gpusPerTask
	 *            The number of GPUs of each task; never negative
	 * @throws JobConfigurationException
	 *             If any count is out of range, or the total number of
	 *             tasks does not fit in an <tt>int</tt>
	 */
	public JobResources(int nodes, int tasksPerNode, int coresPerTask,
			boolean exclusive, int gpusPerTask) {
		if (nodes <= 0)
			throw new JobConfigurationException(
					"nodes must be positive but was " + nodes);
		if (tasksPerNode <= 0)
			throw new JobConfigurationException(
					"tasks_per_node must be positive but was " + tasksPerNode);
		if (coresPerTask < 1)
			throw new JobConfigurationException(
					"cores_per_task must be at least 1 but was " + coresPerTask);
		if (gpusPerTask < 0)
			throw new JobConfigurationException(
					"gpus_per_task must not be negative but was " + gpusPerTask);
		try {
			Math.multiplyExact(nodes, tasksPerNode);
		} catch (ArithmeticException e) {
			throw new JobConfigurationException("Too many tasks: " + nodes
					+ " nodes of " + tasksPerNode + " tasks each", e);
		}
		this.nodes = nodes;
		this.tasksPerNode = tasksPerNode;
		this.coresPerTask = coresPerTask;
		this.exclusive = exclusive;
		this.gpusPerTask = gpusPerTask;
	}

	@JsonCreator
	static JobResources fromProperties(
			@JsonProperty(value = "nodes", required = true) int nodes,
			@JsonProperty(value = "tasks_per_node", required = true) int tasksPerNode,
			@JsonProperty("cores_per_task") Integer coresPerTask,
			@JsonProperty("exclusive") Boolean exclusive,
			@JsonProperty("gpus_per_task") Integer gpusPerTask) {
		return new JobResources(nodes, tasksPerNode,
				(coresPerTask == null ? 1 : coresPerTask),
				(exclusive == null ? true : exclusive),
				(gpusPerTask == null ? 0 : gpusPerTask));
	}

	@JsonProperty("nodes")
	public int getNodes() {
		return nodes;
	}

	@JsonProperty("tasks_per_node")
	public int getTasksPerNode() {
		return tasksPerNode;
	}

	@JsonProperty("cores_per_task")
	public int getCoresPerTask() {
		return coresPerTask;
	}

	@JsonProperty("exclusive")
	public boolean isExclusive() {
		return exclusive;
	}

	@JsonProperty("gpus_per_task")
	public int getGpusPerTask() {
		return gpusPerTask;
	}

	/** @return nodes &times; tasks per node */
	@JsonIgnore
	public int getTotalTasks() {
		return nodes * tasksPerNode;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof JobResources))
			return false;
		JobResources r = (JobResources) o;
		return nodes == r.nodes && tasksPerNode == r.tasksPerNode
				&& coresPerTask == r.coresPerTask && exclusive == r.exclusive
				&& gpusPerTask == r.gpusPerTask;
	}

	@Override
	public int hashCode() {
		int hc = nodes;
		hc = 31 * hc + tasksPerNode;
		hc = 31 * hc + coresPerTask;
		hc = 31 * hc + (exclusive ? 1 : 0);
		hc = 31 * hc + gpusPerTask;
		return hc;
	}

	@Override
	public String toString() {
		return "{nodes=" + nodes + ", tasks_per_node=" + tasksPerNode
				+ ", cores_per_task=" + coresPerTask + ", exclusive="
				+ exclusive + ", gpus_per_task=" + gpusPerTask + "}";
	}
}
