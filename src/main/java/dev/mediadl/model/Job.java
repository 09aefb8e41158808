package dev.mediadl.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import dev.mediadl.util.FilenameInference;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Represents one file to retrieve. Jobs are created in bulk before admission and kept until the
 * batch ends so the summary can account for every candidate.
 */
@JsonPropertyOrder({"id", "status", "source", "target_path", "extension", "bytes_observed", "error"})
public class Job {
	@JsonProperty("id")
	private final String id;

	@JsonProperty("source")
	private final String source;

	@JsonIgnore
	private final Path targetPath;

	@JsonProperty("extension")
	private final MediaType extension;

	@JsonProperty("status")
	private JobStatus status;

	@JsonProperty("bytes_observed")
	private long bytesObserved;

	@JsonProperty("error")
	private String error;

	public Job(String source, Path targetPath, MediaType extension) {
		this.source = Objects.requireNonNull(source, "source");
		this.targetPath = Objects.requireNonNull(targetPath, "targetPath").toAbsolutePath().normalize();
		this.extension = extension;
		this.id = this.targetPath.getFileName().toString();
		this.status = JobStatus.PENDING;
	}

	/**
	 * Create a job for a candidate, resolving its filename inside the target directory.
	 *
	 * @param candidate The discovered candidate
	 * @param targetDir The directory files are downloaded into
	 * @return A new job in {@link JobStatus#PENDING} state
	 */
	public static Job fromCandidate(Candidate candidate, Path targetDir) {
		String filename = FilenameInference.sanitize(candidate.filename());
		MediaType type = candidate.extension() != null
				? candidate.extension()
				: MediaType.fromFilename(filename).orElse(null);
		return new Job(candidate.source(), targetDir.resolve(filename), type);
	}

	public String id() {
		return id;
	}

	public String source() {
		return source;
	}

	public Path targetPath() {
		return targetPath;
	}

	@JsonProperty("target_path")
	private String targetPathText() {
		return targetPath.toString();
	}

	/** Filename component of the target path */
	public String filename() {
		return targetPath.getFileName().toString();
	}

	public MediaType extension() {
		return extension;
	}

	public JobStatus status() {
		return status;
	}

	public long bytesObserved() {
		return bytesObserved;
	}

	public Job bytesObserved(long bytesObserved) {
		this.bytesObserved = bytesObserved;
		return this;
	}

	public String error() {
		return error;
	}

	// State transitions

	/** Move to {@link JobStatus#RUNNING} once a slot has been granted */
	public Job start() {
		return transitionTo(JobStatus.RUNNING, null);
	}

	public Job complete(long bytes) {
		this.bytesObserved = bytes;
		return transitionTo(JobStatus.DONE, null);
	}

	public Job fail(String diagnostic) {
		if (diagnostic == null || diagnostic.isBlank()) {
			diagnostic = "transfer failed";
		}
		return transitionTo(JobStatus.FAILED, diagnostic);
	}

	public Job pause(String reason) {
		return transitionTo(JobStatus.PAUSED, reason);
	}

	public Job skip(String reason) {
		return transitionTo(JobStatus.SKIPPED, reason);
	}

	private Job transitionTo(JobStatus next, String message) {
		if (!status.canTransitionTo(next)) {
			throw new IllegalStateException("Illegal transition " + status + " -> " + next + " for " + id);
		}
		this.status = next;
		this.error = message;
		return this;
	}

	@Override
	public String toString() {
		return error == null ? "%s [%s]".formatted(id, status) : "%s [%s] %s".formatted(id, status, error);
	}
}
