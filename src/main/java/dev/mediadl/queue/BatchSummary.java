package dev.mediadl.queue;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import dev.mediadl.model.Job;
import dev.mediadl.model.JobStatus;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Terminal report of a batch: totals, counts per status, and every job that did not end up
 * {@link JobStatus#DONE} so a rerun can be targeted.
 */
@JsonPropertyOrder({"total", "counts", "rate_limit", "elapsed_millis", "unfinished"})
public record BatchSummary(
		@JsonProperty("total") int total,
		@JsonProperty("counts") Map<JobStatus, Integer> counts,
		@JsonProperty("rate_limit") RateLimitSignal rateLimit,
		@JsonProperty("elapsed_millis") long elapsedMillis,
		@JsonProperty("unfinished") List<Job> unfinished,
		@JsonIgnore List<Job> jobs) {

	public static BatchSummary of(List<Job> jobs, RateLimitSignal rateLimit, Duration elapsed) {
		Map<JobStatus, Integer> counts = new EnumMap<>(JobStatus.class);
		for (JobStatus status : JobStatus.values()) {
			counts.put(status, 0);
		}
		for (Job job : jobs) {
			counts.merge(job.status(), 1, Integer::sum);
		}
		List<Job> unfinished =
				jobs.stream().filter(j -> j.status() != JobStatus.DONE).toList();
		return new BatchSummary(
				jobs.size(),
				Collections.unmodifiableMap(counts),
				rateLimit,
				elapsed.toMillis(),
				unfinished,
				List.copyOf(jobs));
	}

	public int count(JobStatus status) {
		return counts.getOrDefault(status, 0);
	}

	public List<Job> withStatus(JobStatus status) {
		return jobs.stream().filter(j -> j.status() == status).toList();
	}

	public boolean rateLimited() {
		return rateLimit != null;
	}

	/** Process exit code: 0 when nothing failed, 1 when a transfer failed, 3 when rate limited */
	public int exitCode() {
		if (count(JobStatus.FAILED) > 0) {
			return 1;
		}
		return rateLimited() ? 3 : 0;
	}

	@Override
	public String toString() {
		return "%d jobs: %d done, %d failed, %d paused, %d skipped%s"
				.formatted(
						total,
						count(JobStatus.DONE),
						count(JobStatus.FAILED),
						count(JobStatus.PAUSED),
						count(JobStatus.SKIPPED),
						rateLimited() ? " (rate limited: " + rateLimit + ")" : "");
	}
}
