package dev.mediadl.queue;

import dev.mediadl.model.Job;
import dev.mediadl.model.JobStatus;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes candidates whose file is already in the target directory. The directory is listed once
 * when the snapshot is taken; names are compared case-insensitively. Jobs that are filtered out are
 * marked {@link JobStatus#SKIPPED} rather than dropped so the summary accounts for them. A partial
 * marker left by an interrupted run does not exclude a job, its transfer continues the marker.
 */
public class DedupFilter {
	private static final Logger logger = LoggerFactory.getLogger(DedupFilter.class);

	public static final String REASON_EXISTS = "already exists";
	public static final String REASON_DUPLICATE = "duplicate in batch";

	private final Set<String> existing;
	private final Set<String> partial;

	private DedupFilter(Set<String> existing, Set<String> partial) {
		this.existing = Collections.unmodifiableSet(existing);
		this.partial = Collections.unmodifiableSet(partial);
	}

	/**
	 * List the target directory once. A missing directory yields an empty snapshot.
	 *
	 * @param targetDir The download directory
	 * @param markerSuffix Suffix identifying partial-artifact files
	 * @return The snapshot
	 * @throws IOException If the directory cannot be listed
	 */
	public static DedupFilter snapshot(Path targetDir, String markerSuffix) throws IOException {
		Set<String> existing = new HashSet<>();
		Set<String> partial = new HashSet<>();
		if (Files.isDirectory(targetDir)) {
			String suffix = markerSuffix.toLowerCase(Locale.ROOT);
			try (Stream<Path> entries = Files.list(targetDir)) {
				entries.map(p -> p.getFileName().toString().toLowerCase(Locale.ROOT))
						.forEach(name -> {
							if (name.endsWith(suffix) && name.length() > suffix.length()) {
								partial.add(name.substring(0, name.length() - suffix.length()));
							} else {
								existing.add(name);
							}
						});
			}
		}
		logger.debug(
				"Snapshot of {}: {} existing files, {} partial downloads", targetDir, existing.size(), partial.size());
		return new DedupFilter(existing, partial);
	}

	/**
	 * Why a filename would be skipped, judged against the snapshot only.
	 *
	 * @param filename The target filename
	 * @return The skip reason, or empty if the file should be downloaded
	 */
	public Optional<String> skipReason(String filename) {
		String key = filename.toLowerCase(Locale.ROOT);
		if (existing.contains(key)) {
			return Optional.of(REASON_EXISTS);
		}
		return Optional.empty();
	}

	/** Whether an interrupted transfer left a partial marker for this filename */
	public boolean hasPartial(String filename) {
		return partial.contains(filename.toLowerCase(Locale.ROOT));
	}

	/**
	 * Mark pending jobs whose file exists, or that repeat an earlier job's filename, as skipped.
	 * Jobs that are not pending are left alone.
	 *
	 * @param jobs Jobs in discovery order
	 * @return The jobs that remain pending, in the same order
	 */
	public List<Job> apply(List<Job> jobs) {
		Set<String> claimed = new HashSet<>();
		List<Job> admissible = new ArrayList<>();
		for (Job job : jobs) {
			if (job.status() != JobStatus.PENDING) {
				continue;
			}
			Optional<String> reason = skipReason(job.filename());
			if (reason.isEmpty() && !claimed.add(job.filename().toLowerCase(Locale.ROOT))) {
				reason = Optional.of(REASON_DUPLICATE);
			}
			if (reason.isPresent()) {
				logger.debug("Skipping {} ({})", job.filename(), reason.get());
				job.skip(reason.get());
			} else {
				if (hasPartial(job.filename())) {
					logger.debug("Partial download of {} found, it will be resumed", job.filename());
				}
				admissible.add(job);
			}
		}
		return admissible;
	}
}
