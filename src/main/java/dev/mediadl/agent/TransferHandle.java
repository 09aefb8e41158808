package dev.mediadl.agent;

/**
 * Handle on one transfer started by a {@link TransferAgent}. The handle only reports what the agent
 * itself knows; completion of the download is judged from the files on disk.
 */
public interface TransferHandle {

	enum State {
		/** The agent is still working (or, for agents that never exit, has not reported anything) */
		RUNNING,
		/** The agent finished without error */
		SUCCEEDED,
		/** The agent exited abnormally */
		FAILED,
		/** The site redirected the transfer to a restricted-access page */
		RESTRICTED
	}

	/** Current state, never blocks */
	State state();

	/**
	 * Diagnostic for {@link State#FAILED}, or the restricted location for {@link State#RESTRICTED}.
	 *
	 * @return A human-readable message, or null while the transfer is running or after success
	 */
	String diagnostic();

	/**
	 * Stop a transfer that is still running and remove its partial marker, so an abandoned transfer
	 * can neither hold on to agent resources nor produce the final file later. Has no effect once the
	 * agent has reported an outcome.
	 */
	void cancel();

	/** Immutable terminal outcome, shared by agent implementations */
	record Outcome(State state, String diagnostic) {
		public static Outcome succeeded() {
			return new Outcome(State.SUCCEEDED, null);
		}

		public static Outcome failed(String diagnostic) {
			return new Outcome(State.FAILED, diagnostic);
		}

		public static Outcome restricted(String location) {
			return new Outcome(State.RESTRICTED, location);
		}
	}
}
