package dev.mediadl.agent;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Performs the actual byte transfer for a job. Agents write into the partial marker file and move it
 * onto the target name once the transfer is complete.
 */
public interface TransferAgent extends AutoCloseable {

	/**
	 * Start transferring a file. Must return quickly, the transfer itself runs elsewhere.
	 *
	 * @param source The location to retrieve from
	 * @param target The final path of the downloaded file
	 * @param marker The partial-artifact path to write to while the transfer is in progress
	 * @return A handle to query the agent's view of the transfer
	 * @throws IOException If the transfer could not be started
	 */
	TransferHandle start(String source, Path target, Path marker) throws IOException;

	/** Release resources held by the agent. In-flight transfers may be abandoned. */
	@Override
	default void close() {}
}
