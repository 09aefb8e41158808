package dev.mediadl.queue;

import dev.mediadl.model.Job;
import dev.mediadl.model.JobStatus;
import dev.mediadl.reporting.ProgressEvent;
import dev.mediadl.reporting.ProgressListener;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a batch of jobs through a fixed number of transfer slots. Jobs are admitted in discovery
 * order; a single control loop polls the active supervisors, releases finished slots and admits the
 * next pending jobs. Once the {@link RateLimitGuard} trips, nothing new is admitted, running
 * transfers are left to finish on their own, and the remaining pending jobs are paused.
 */
public class AdmissionQueue {
	private static final Logger logger = LoggerFactory.getLogger(AdmissionQueue.class);

	private final TransferSupervisor.Factory supervisorFactory;
	private final RateLimitGuard guard;
	private final Duration pollInterval;
	private final ProgressListener listener;

	public AdmissionQueue(
			TransferSupervisor.Factory supervisorFactory,
			RateLimitGuard guard,
			Duration pollInterval,
			ProgressListener listener) {
		this.supervisorFactory = supervisorFactory;
		this.guard = guard;
		this.pollInterval = pollInterval;
		this.listener = listener;
	}

	/**
	 * Run all pending jobs to a terminal state. Jobs in other states (for example already skipped)
	 * are not touched but are included in the summary.
	 *
	 * @param jobs All jobs of the batch in discovery order
	 * @param maxConcurrent Maximum number of simultaneously running transfers
	 * @return The summary once no job is pending or running any more
	 * @throws InterruptedException If interrupted while waiting between polls
	 */
	public BatchSummary admit(List<Job> jobs, int maxConcurrent) throws InterruptedException {
		if (maxConcurrent <= 0) {
			throw new ConfigInvalidException("Concurrency limit must be a positive integer, got " + maxConcurrent);
		}
		long startTime = System.nanoTime();

		Deque<Job> pending = new ArrayDeque<>();
		for (Job job : jobs) {
			if (job.status() == JobStatus.PENDING) {
				pending.add(job);
			}
		}
		List<TransferSupervisor> active = new ArrayList<>(maxConcurrent);
		logger.info(
				"Starting download queue: {} to download, {} jobs in total, max {} concurrent",
				pending.size(),
				jobs.size(),
				maxConcurrent);

		while (!pending.isEmpty() || !active.isEmpty()) {
			boolean progressed = releaseFinished(active);

			if (guard.isTripped()) {
				if (!pending.isEmpty()) {
					pauseRemaining(pending, active.size());
					progressed = true;
				}
			} else {
				while (active.size() < maxConcurrent && !pending.isEmpty() && !guard.isTripped()) {
					admitNext(pending.poll(), active, maxConcurrent);
					progressed = true;
				}
			}

			if (!progressed) {
				logger.debug(
						"Downloads: {} pending, {}/{} active, waiting {} ms",
						pending.size(),
						active.size(),
						maxConcurrent,
						pollInterval.toMillis());
				Thread.sleep(pollInterval.toMillis());
			}
		}

		BatchSummary summary = BatchSummary.of(
				jobs, guard.signal().orElse(null), Duration.ofNanos(System.nanoTime() - startTime));
		logger.info("Download queue finished: {}", summary);
		return summary;
	}

	private void admitNext(Job job, List<TransferSupervisor> active, int maxConcurrent) {
		job.start();
		try {
			active.add(supervisorFactory.start(job));
			listener.onEvent(ProgressEvent.admitted(job.id(), active.size(), maxConcurrent));
		} catch (IOException | RuntimeException e) {
			// only this job is affected, the slot stays free for the next one
			logger.debug("Failed to start transfer for {}", job.id(), e);
			job.fail("Could not start transfer: " + e.getMessage());
			report(job);
		}
	}

	/** Poll every active supervisor once and drop the ones that reached a terminal state */
	private boolean releaseFinished(List<TransferSupervisor> active) {
		boolean released = false;
		Iterator<TransferSupervisor> it = active.iterator();
		while (it.hasNext()) {
			TransferSupervisor supervisor = it.next();
			Job job = supervisor.job();
			JobStatus status;
			try {
				status = supervisor.poll();
			} catch (RuntimeException e) {
				logger.debug("Supervisor for {} failed", job.id(), e);
				if (job.status() == JobStatus.RUNNING) {
					cancelQuietly(supervisor);
					job.fail("Supervisor error: " + e.getMessage());
				}
				status = job.status();
			}
			if (status.isTerminal()) {
				it.remove();
				report(job);
				released = true;
			}
		}
		return released;
	}

	private void cancelQuietly(TransferSupervisor supervisor) {
		try {
			supervisor.cancel();
		} catch (RuntimeException e) {
			logger.warn("Could not cancel transfer of {}: {}", supervisor.job().id(), e.getMessage());
		}
	}

	private void pauseRemaining(Deque<Job> pending, int stillRunning) {
		String reason = "rate limited: " + guard.signal().map(RateLimitSignal::toString).orElse("unknown");
		listener.onEvent(ProgressEvent.rateLimited("Pausing " + pending.size() + " pending downloads, waiting for "
				+ stillRunning + " running downloads to finish"));
		while (!pending.isEmpty()) {
			Job job = pending.poll();
			job.pause(reason);
			report(job);
		}
	}

	private void report(Job job) {
		switch (job.status()) {
			case DONE -> listener.onEvent(
					ProgressEvent.of(job.id(), ProgressEvent.EventType.DONE, "%,d bytes".formatted(job.bytesObserved())));
			case FAILED -> listener.onEvent(ProgressEvent.of(job.id(), ProgressEvent.EventType.FAILED, job.error()));
			case PAUSED -> listener.onEvent(ProgressEvent.of(job.id(), ProgressEvent.EventType.PAUSED, job.error()));
			default -> logger.debug("Unexpected status {} for released job {}", job.status(), job.id());
		}
	}
}
