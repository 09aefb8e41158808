package dev.mediadl.model;

import java.util.EnumSet;
import java.util.Set;

/** Lifecycle states of a {@link Job} */
public enum JobStatus {
	/** Awaiting a free concurrency slot */
	PENDING,
	/** Bound to exactly one transfer supervisor */
	RUNNING,
	/** Final artifact exists and the partial marker is gone */
	DONE,
	/** Agent exited abnormally or no progress was seen within the inactivity window */
	FAILED,
	/** Abandoned because of a rate limit or batch limit, can be picked up by a later run */
	PAUSED,
	/** Excluded before admission, usually because the file already exists */
	SKIPPED;

	public boolean isTerminal() {
		return this != PENDING && this != RUNNING;
	}

	public Set<JobStatus> successors() {
		return switch (this) {
			case PENDING -> EnumSet.of(RUNNING, PAUSED, SKIPPED);
			case RUNNING -> EnumSet.of(DONE, FAILED, PAUSED);
			default -> EnumSet.noneOf(JobStatus.class);
		};
	}

	public boolean canTransitionTo(JobStatus next) {
		return successors().contains(next);
	}
}
