package gov.llnl.ams.jobmanager;

import static java.util.Objects.requireNonNull;

/**
 * The scheduler's reference to a submitted job.
 */
public final class SubmissionHandle {
	private final String id;

	public SubmissionHandle(String id) {
		this.id = requireNonNull(id, "a submission needs an id");
	}

	public String getId() {
		return id;
	}

	@Override
	public boolean equals(Object other) {
		if (this == other)
			return true;
		if (!(other instanceof SubmissionHandle))
			return false;
		return id.equals(((SubmissionHandle) other).id);
	}

	@Override
	public int hashCode() {
		return id.hashCode();
	}

	@Override
	public String toString() {
		return id;
	}
}
