package dev.mediadl.reporting;

import java.time.Instant;

/** Represents a progress event emitted while a batch runs */
public record ProgressEvent(String jobId, EventType eventType, String message, Instant timestamp) {
	public enum EventType {
		SKIPPED,
		ADMITTED,
		PROGRESS,
		DONE,
		FAILED,
		PAUSED,
		RATE_LIMITED
	}

	public static ProgressEvent of(String jobId, EventType eventType, String message) {
		return new ProgressEvent(jobId, eventType, message, Instant.now());
	}

	public static ProgressEvent skipped(String jobId, String reason) {
		return of(jobId, EventType.SKIPPED, reason);
	}

	public static ProgressEvent admitted(String jobId, int active, int maxConcurrent) {
		return of(jobId, EventType.ADMITTED, "Started (" + active + "/" + maxConcurrent + " active)");
	}

	public static ProgressEvent progress(String jobId, long bytes) {
		return of(jobId, EventType.PROGRESS, "%,d bytes".formatted(bytes));
	}

	public static ProgressEvent rateLimited(String message) {
		return of(null, EventType.RATE_LIMITED, message);
	}

	@Override
	public String toString() {
		return "[%s] %s: %s - %s".formatted(timestamp, jobId != null ? jobId : "batch", eventType, message);
	}
}
