package dev.mediadl.queue;

import dev.mediadl.agent.TransferAgent;
import dev.mediadl.agent.TransferHandle;
import dev.mediadl.model.Job;
import dev.mediadl.model.JobStatus;
import dev.mediadl.reporting.ProgressEvent;
import dev.mediadl.reporting.ProgressListener;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Supervises one transfer by watching the target directory. A transfer is complete once the final
 * file exists and the partial marker is gone; byte counts are only used to detect stalls and to
 * report progress.
 */
public class FileSystemTransferSupervisor implements TransferSupervisor {
	private static final Logger logger = LoggerFactory.getLogger(FileSystemTransferSupervisor.class);

	private final Job job;
	private final TransferHandle handle;
	private final Path marker;
	private final int maxIdlePolls;
	private final RateLimitGuard guard;
	private final ProgressListener listener;

	private int idlePolls;
	private long lastSize = -1;
	private boolean markerSeen;

	public FileSystemTransferSupervisor(
			Job job,
			TransferHandle handle,
			Path marker,
			int maxIdlePolls,
			RateLimitGuard guard,
			ProgressListener listener) {
		this.job = job;
		this.handle = handle;
		this.marker = marker;
		this.maxIdlePolls = maxIdlePolls;
		this.guard = guard;
		this.listener = listener;
	}

	/**
	 * Factory that starts each admitted job on the given agent.
	 *
	 * @param agent The agent performing the transfers
	 * @param config Batch configuration (marker suffix, inactivity bound)
	 * @param guard The batch's rate-limit guard, tripped when an agent hits a restricted page
	 * @param listener Receives progress events
	 */
	public static TransferSupervisor.Factory factory(
			TransferAgent agent, BatchConfig config, RateLimitGuard guard, ProgressListener listener) {
		return job -> {
			Path marker = config.markerFor(job.targetPath());
			TransferHandle handle = agent.start(job.source(), job.targetPath(), marker);
			return new FileSystemTransferSupervisor(job, handle, marker, config.maxIdlePolls(), guard, listener);
		};
	}

	@Override
	public Job job() {
		return job;
	}

	@Override
	public JobStatus poll() {
		if (job.status().isTerminal()) {
			return job.status();
		}

		// ask the agent first, a finished agent may still have to move the marker into place
		TransferHandle.State agentState = handle.state();
		if (agentState == TransferHandle.State.RESTRICTED) {
			String location = handle.diagnostic();
			guard.observe(RateLimitSignal.redirect(location));
			job.pause("rate limited: redirected to " + location);
			return job.status();
		}
		if (agentState == TransferHandle.State.FAILED) {
			job.bytesObserved(Math.max(0, sizeOf(marker)));
			return fail(handle.diagnostic());
		}

		long markerSize = sizeOf(marker);
		long finalSize = sizeOf(job.targetPath());
		if (finalSize >= 0 && markerSize < 0) {
			logger.debug("{} complete ({} bytes, marker seen: {})", job.filename(), finalSize, markerSeen);
			job.complete(finalSize);
			return job.status();
		}

		if (agentState == TransferHandle.State.SUCCEEDED && markerSize < 0 && finalSize < 0) {
			return fail("Agent finished without producing " + job.filename());
		}

		if (markerSize >= 0) {
			markerSeen = true;
			if (markerSize > lastSize) {
				lastSize = markerSize;
				idlePolls = 0;
				job.bytesObserved(markerSize);
				listener.onEvent(ProgressEvent.progress(job.id(), markerSize));
				return job.status();
			}
		}

		idlePolls++;
		if (idlePolls >= maxIdlePolls) {
			return fail(markerSeen
					? "No progress observed after " + idlePolls + " polls (stalled at " + lastSize + " bytes)"
					: "Transfer did not start after " + idlePolls + " polls");
		}
		return job.status();
	}

	@Override
	public void cancel() {
		logger.debug("Cancelling transfer of {}", job.filename());
		handle.cancel();
	}

	// the agent may still be working, it must not keep the slot or finish the file later
	private JobStatus fail(String diagnostic) {
		cancel();
		job.fail(diagnostic);
		return job.status();
	}

	/** Size of a file, or -1 if it does not exist */
	private static long sizeOf(Path path) {
		try {
			return Files.size(path);
		} catch (IOException e) {
			return -1;
		}
	}
}
