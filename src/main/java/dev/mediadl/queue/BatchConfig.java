package dev.mediadl.queue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration record for a download batch. Encapsulates the target directory, the concurrency
 * ceiling, the completion polling cadence and the inactivity bound for stalled transfers.
 *
 * @param targetDir Directory the files are downloaded into
 * @param maxConcurrent Maximum number of simultaneously running transfers
 * @param pollInterval Delay between scheduling ticks that made no progress
 * @param maxIdlePolls Number of consecutive polls without growth before a transfer is failed
 * @param markerSuffix Suffix of the partial-artifact file written while a transfer is in progress
 * @param limit Maximum number of new files to download in this batch, or -1 for no limit
 */
public record BatchConfig(
		Path targetDir, int maxConcurrent, Duration pollInterval, int maxIdlePolls, String markerSuffix, int limit) {

	public static final int DEFAULT_MAX_CONCURRENT = 2;
	public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(5);
	// 5 minutes at the default interval
	public static final int DEFAULT_MAX_IDLE_POLLS = 60;
	public static final String DEFAULT_MARKER_SUFFIX = ".crdownload";

	public static BatchConfig defaults(Path targetDir) {
		return new BatchConfig(
				targetDir,
				DEFAULT_MAX_CONCURRENT,
				DEFAULT_POLL_INTERVAL,
				DEFAULT_MAX_IDLE_POLLS,
				DEFAULT_MARKER_SUFFIX,
				-1);
	}

	/**
	 * Check all values and make sure the target directory exists.
	 *
	 * @return This config with the target directory made absolute
	 * @throws ConfigInvalidException If a value is out of range or the directory cannot be used
	 */
	public BatchConfig validate() {
		if (targetDir == null) {
			throw new ConfigInvalidException("A target directory is required");
		}
		if (maxConcurrent <= 0) {
			throw new ConfigInvalidException("Concurrency limit must be a positive integer, got " + maxConcurrent);
		}
		if (pollInterval == null || pollInterval.isNegative()) {
			throw new ConfigInvalidException("Poll interval must not be negative, got " + pollInterval);
		}
		if (maxIdlePolls <= 0) {
			throw new ConfigInvalidException("Inactivity bound must be a positive number of polls, got " + maxIdlePolls);
		}
		if (markerSuffix == null || markerSuffix.isBlank() || markerSuffix.contains("/")) {
			throw new ConfigInvalidException("Invalid partial marker suffix: '" + markerSuffix + "'");
		}
		if (limit == 0 || limit < -1) {
			throw new ConfigInvalidException("Batch limit must be positive or -1, got " + limit);
		}

		Path dir = targetDir.toAbsolutePath().normalize();
		if (Files.exists(dir) && !Files.isDirectory(dir)) {
			throw new ConfigInvalidException("Target is not a directory: " + dir);
		}
		try {
			Files.createDirectories(dir);
		} catch (IOException e) {
			throw new ConfigInvalidException("Cannot create target directory " + dir + ": " + e.getMessage(), e);
		}
		return new BatchConfig(dir, maxConcurrent, pollInterval, maxIdlePolls, markerSuffix, limit);
	}

	/** Path of the partial-artifact marker for a target file */
	public Path markerFor(Path target) {
		return target.resolveSibling(target.getFileName() + markerSuffix);
	}
}
