package dev.mediadl.agent;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/** Helpers for agents turning a partial artifact into the final file */
final class Artifacts {
	private Artifacts() {}

	/**
	 * Move the partial marker onto the target name. Does nothing when the marker is gone already.
	 *
	 * @throws IOException If the move fails
	 */
	static void promote(Path marker, Path target) throws IOException {
		if (!Files.exists(marker)) {
			return;
		}
		try {
			Files.move(marker, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		} catch (AtomicMoveNotSupportedException e) {
			Files.move(marker, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}
}
