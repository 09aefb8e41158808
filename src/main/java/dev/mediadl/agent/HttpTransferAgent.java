package dev.mediadl.agent;

import dev.mediadl.util.HttpUtils;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transfers files inside the JVM using {@link HttpUtils}. Each transfer runs on a worker thread and
 * streams the response body into the marker file, continuing an existing marker with a range request
 * when the server supports it. Requests that get redirected to a restricted page are reported as
 * {@link TransferHandle.State#RESTRICTED} without writing anything.
 */
public class HttpTransferAgent implements TransferAgent {
	private static final Logger logger = LoggerFactory.getLogger(HttpTransferAgent.class);

	private static final int HTTP_PARTIAL_CONTENT = 206;

	private final HttpUtils httpUtils;
	private final RestrictedRedirectDetector detector;
	private final ExecutorService executorService;

	public HttpTransferAgent(HttpUtils httpUtils, RestrictedRedirectDetector detector, int threadCount) {
		this.httpUtils = httpUtils;
		this.detector = detector;
		AtomicInteger counter = new AtomicInteger();
		this.executorService = Executors.newFixedThreadPool(threadCount, runnable -> {
			Thread thread = new Thread(runnable, "transfer-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		});
	}

	@Override
	public TransferHandle start(String source, Path target, Path marker) {
		Transfer transfer = new Transfer(source, target, marker);
		transfer.future = executorService.submit(transfer::run);
		return transfer;
	}

	@Override
	public void close() {
		executorService.shutdownNow();
	}

	/** One transfer, run on a worker thread and queried through the handle methods */
	private class Transfer implements TransferHandle {
		private final String source;
		private final Path target;
		private final Path marker;
		private volatile Future<Outcome> future;
		private InputStream body;
		private boolean cancelled;
		private Outcome outcome;

		Transfer(String source, Path target, Path marker) {
			this.source = source;
			this.target = target;
			this.marker = marker;
		}

		private Outcome run() {
			try {
				long resumeFrom = Files.exists(marker) ? Files.size(marker) : 0;
				Map<String, String> range = resumeFrom > 0 ? Map.of("Range", "bytes=" + resumeFrom + "-") : Map.of();
				HttpResponse<InputStream> response = httpUtils.open(source, range);
				try (InputStream in = attach(response.body())) {
					if (detector.isRestricted(source, response.uri())) {
						logger.warn("Redirected to restricted page {} while fetching {}", response.uri(), source);
						return Outcome.restricted(response.uri().toString());
					}
					if (!HttpUtils.isSuccess(response.statusCode())) {
						return Outcome.failed("HTTP status " + response.statusCode() + " for " + response.uri());
					}
					boolean append = resumeFrom > 0 && response.statusCode() == HTTP_PARTIAL_CONTENT;
					if (resumeFrom > 0) {
						logger.debug(
								"{} {} at {} bytes", append ? "Resuming" : "Restarting", target.getFileName(), resumeFrom);
					}
					try (OutputStream out = append
							? Files.newOutputStream(marker, StandardOpenOption.CREATE, StandardOpenOption.APPEND)
							: Files.newOutputStream(marker)) {
						in.transferTo(out);
					}
				}
				return promote();
			} catch (IOException e) {
				if (isCancelled()) {
					discardMarker();
					return Outcome.failed("Transfer cancelled");
				}
				return Outcome.failed("Transfer of " + source + " failed: " + e.getMessage());
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return Outcome.failed("Transfer of " + source + " interrupted");
			}
		}

		private synchronized InputStream attach(InputStream in) throws IOException {
			if (cancelled) {
				in.close();
				throw new IOException("Transfer cancelled");
			}
			body = in;
			return in;
		}

		private synchronized Outcome promote() throws IOException {
			if (cancelled) {
				Files.deleteIfExists(marker);
				return Outcome.failed("Transfer cancelled");
			}
			Artifacts.promote(marker, target);
			return Outcome.succeeded();
		}

		private synchronized boolean isCancelled() {
			return cancelled;
		}

		@Override
		public synchronized State state() {
			if (outcome == null && future != null && future.isDone()) {
				outcome = resolve();
			}
			return outcome != null ? outcome.state() : State.RUNNING;
		}

		@Override
		public synchronized String diagnostic() {
			return outcome != null ? outcome.diagnostic() : null;
		}

		@Override
		public synchronized void cancel() {
			if (outcome != null || cancelled) {
				return;
			}
			cancelled = true;
			outcome = Outcome.failed("Transfer cancelled");
			if (future != null) {
				future.cancel(true);
			}
			if (body != null) {
				try {
					body.close();
				} catch (IOException e) {
					logger.debug("Could not close response body of {}", source, e);
				}
			}
			discardMarker();
		}

		private void discardMarker() {
			try {
				Files.deleteIfExists(marker);
			} catch (IOException e) {
				logger.debug("Could not delete {}", marker, e);
			}
		}

		private Outcome resolve() {
			try {
				return future.get();
			} catch (ExecutionException e) {
				return Outcome.failed("Transfer failed: " + e.getCause().getMessage());
			} catch (CancellationException e) {
				return Outcome.failed("Transfer cancelled");
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return Outcome.failed("Interrupted while collecting transfer result");
			}
		}
	}
}
