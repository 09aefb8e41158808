package dev.mediadl.queue;

import dev.mediadl.agent.TransferAgent;
import dev.mediadl.model.Candidate;
import dev.mediadl.model.Job;
import dev.mediadl.model.JobStatus;
import dev.mediadl.reporting.ProgressEvent;
import dev.mediadl.reporting.ProgressListener;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one batch end to end: builds jobs from the candidate list, skips files that already exist,
 * applies the batch limit and hands the rest to the {@link AdmissionQueue}.
 */
public class BatchRunner {
	private static final Logger logger = LoggerFactory.getLogger(BatchRunner.class);

	private final BatchConfig config;
	private final TransferAgent agent;
	private final RateLimitGuard guard;
	private final ProgressListener listener;

	public BatchRunner(BatchConfig config, TransferAgent agent, RateLimitGuard guard, ProgressListener listener) {
		this.config = config.validate();
		this.agent = agent;
		this.guard = guard;
		this.listener = listener;
	}

	public BatchConfig config() {
		return config;
	}

	/**
	 * Download all candidates.
	 *
	 * @param candidates Candidates in discovery order
	 * @return Summary covering every candidate
	 * @throws IOException If the target directory cannot be listed
	 * @throws InterruptedException If interrupted while waiting for transfers
	 */
	public BatchSummary run(List<Candidate> candidates) throws IOException, InterruptedException {
		List<Job> jobs = plan(candidates);
		List<Job> pending = jobs.stream()
				.filter(j -> j.status() == JobStatus.PENDING)
				.toList();

		if (config.limit() > 0 && pending.size() > config.limit()) {
			logger.info("Limit applied: only downloading the first {} of {} new files", config.limit(), pending.size());
			for (Job job : pending.subList(config.limit(), pending.size())) {
				job.pause("over batch limit of " + config.limit());
				listener.onEvent(ProgressEvent.of(job.id(), ProgressEvent.EventType.PAUSED, job.error()));
			}
		}

		var queue = new AdmissionQueue(
				FileSystemTransferSupervisor.factory(agent, config, guard, listener),
				guard,
				config.pollInterval(),
				listener);
		return queue.admit(jobs, config.maxConcurrent());
	}

	/**
	 * Build jobs for the candidates and mark the ones whose file already exists as skipped, without
	 * starting anything.
	 *
	 * @param candidates Candidates in discovery order
	 * @return One job per candidate, in the same order
	 * @throws IOException If the target directory cannot be listed
	 */
	public List<Job> plan(List<Candidate> candidates) throws IOException {
		List<Job> jobs = candidates.stream()
				.map(c -> Job.fromCandidate(c, config.targetDir()))
				.toList();
		DedupFilter filter = DedupFilter.snapshot(config.targetDir(), config.markerSuffix());
		List<Job> admissible = filter.apply(jobs);
		for (Job job : jobs) {
			if (job.status() == JobStatus.SKIPPED) {
				listener.onEvent(ProgressEvent.skipped(job.id(), job.error()));
			}
		}
		logger.info(
				"{} candidates: {} to download, {} skipped",
				jobs.size(),
				admissible.size(),
				jobs.size() - admissible.size());
		return jobs;
	}
}
