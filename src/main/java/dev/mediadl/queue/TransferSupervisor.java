package dev.mediadl.queue;

import dev.mediadl.model.Job;
import dev.mediadl.model.JobStatus;
import java.io.IOException;

/**
 * Owns the lifecycle of one active transfer. The admission queue polls supervisors on every
 * scheduling tick; a supervisor updates its bound job and reports the job's status.
 */
public interface TransferSupervisor {

	/** The job this supervisor is bound to */
	Job job();

	/**
	 * Inspect the transfer once. Must not block for longer than a filesystem check.
	 *
	 * @return {@link JobStatus#RUNNING} while the transfer is in flight, otherwise the terminal status
	 *     the job was moved to
	 */
	JobStatus poll();

	/** Stop the underlying transfer. Called before the slot of a failed job is handed to the next job. */
	void cancel();

	/** Creates a supervisor for a freshly admitted job */
	@FunctionalInterface
	interface Factory {
		/**
		 * Start the transfer for a job that has just been moved to {@link JobStatus#RUNNING}.
		 *
		 * @throws IOException If the transfer could not be started; only this job fails
		 */
		TransferSupervisor start(Job job) throws IOException;
	}
}
