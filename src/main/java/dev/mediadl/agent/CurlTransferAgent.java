package dev.mediadl.agent;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transfers files by launching one {@code curl} process per job. curl writes into the marker file
 * (resuming it if present) and the handle moves the marker onto the target name after a clean exit.
 * curl reports the URL it ended up on, so a redirect to a restricted page is recognized instead of
 * being saved as the media file.
 */
public class CurlTransferAgent implements TransferAgent {
	private static final Logger logger = LoggerFactory.getLogger(CurlTransferAgent.class);

	private final String executable;
	private final int retries;
	private final Map<String, String> headers;
	private final RestrictedRedirectDetector detector;

	public CurlTransferAgent() {
		this("curl", 3, Map.of(), new RestrictedRedirectDetector());
	}

	/**
	 * @param executable The curl binary to run
	 * @param retries Value passed to curl's {@code --retry}
	 * @param headers Extra request headers, for example a session cookie
	 * @param detector Decides whether the final URL of a transfer is a restricted-access page
	 */
	public CurlTransferAgent(
			String executable, int retries, Map<String, String> headers, RestrictedRedirectDetector detector) {
		this.executable = executable;
		this.retries = retries;
		this.headers = Map.copyOf(headers);
		this.detector = detector;
	}

	@Override
	public TransferHandle start(String source, Path target, Path marker) throws IOException {
		List<String> command = command(source, marker);
		Path outputLog = Files.createTempFile("mediadl-curl-", ".out");
		Path errorLog = Files.createTempFile("mediadl-curl-", ".log");
		ProcessBuilder builder = new ProcessBuilder(command)
				.redirectOutput(outputLog.toFile())
				.redirectError(errorLog.toFile());
		try {
			Process process = builder.start();
			logger.debug("Started curl (pid {}) for {}", process.pid(), target.getFileName());
			return new CurlHandle(process, source, target, marker, outputLog, errorLog);
		} catch (IOException e) {
			Files.deleteIfExists(outputLog);
			Files.deleteIfExists(errorLog);
			throw new IOException("Failed to launch " + executable + ": " + e.getMessage(), e);
		}
	}

	List<String> command(String source, Path marker) {
		List<String> command = new ArrayList<>();
		command.add(executable);
		command.add("-fsSL");
		command.add("--retry");
		command.add(String.valueOf(retries));
		command.add("-C");
		command.add("-");
		command.add("-o");
		command.add(marker.toString());
		command.add("-w");
		command.add("%{url_effective}");
		headers.forEach((name, value) -> {
			command.add("-H");
			command.add(name + ": " + value);
		});
		command.add(source);
		return command;
	}

	/** Handle for a running curl process */
	private class CurlHandle implements TransferHandle {
		private final Process process;
		private final String source;
		private final Path target;
		private final Path marker;
		private final Path outputLog;
		private final Path errorLog;
		private Outcome outcome;

		CurlHandle(Process process, String source, Path target, Path marker, Path outputLog, Path errorLog) {
			this.process = process;
			this.source = source;
			this.target = target;
			this.marker = marker;
			this.outputLog = outputLog;
			this.errorLog = errorLog;
		}

		@Override
		public synchronized State state() {
			if (outcome == null && !process.isAlive()) {
				outcome = finish(process.exitValue());
			}
			return outcome != null ? outcome.state() : State.RUNNING;
		}

		@Override
		public synchronized String diagnostic() {
			return outcome != null ? outcome.diagnostic() : null;
		}

		@Override
		public synchronized void cancel() {
			if (outcome != null) {
				return;
			}
			process.destroy();
			try {
				if (!process.waitFor(5, TimeUnit.SECONDS)) {
					process.destroyForcibly().waitFor(5, TimeUnit.SECONDS);
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				process.destroyForcibly();
			}
			outcome = Outcome.failed("Transfer cancelled");
			deleteQuietly(marker);
			deleteQuietly(outputLog);
			deleteQuietly(errorLog);
		}

		private Outcome finish(int exitCode) {
			String stderr = lastLine(errorLog);
			String effectiveUrl = lastLine(outputLog);
			if (isRestricted(effectiveUrl)) {
				logger.warn("Redirected to restricted page {} while fetching {}", effectiveUrl, source);
				deleteQuietly(marker);
				return Outcome.restricted(effectiveUrl);
			}
			if (exitCode != 0) {
				return Outcome.failed(
						"curl exited with code " + exitCode + (stderr.isEmpty() ? "" : ": " + stderr));
			}
			try {
				Artifacts.promote(marker, target);
				return Outcome.succeeded();
			} catch (IOException e) {
				return Outcome.failed("Could not move " + marker.getFileName() + " to " + target.getFileName()
						+ ": " + e.getMessage());
			}
		}

		private boolean isRestricted(String effectiveUrl) {
			if (effectiveUrl.isEmpty()) {
				return false;
			}
			try {
				return detector.isRestricted(source, URI.create(effectiveUrl));
			} catch (IllegalArgumentException e) {
				logger.debug("curl reported an unparseable URL {}", effectiveUrl);
				return false;
			}
		}
	}

	/** Last non-blank line of a capture file, which is deleted afterwards */
	private static String lastLine(Path file) {
		try {
			List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
			for (int i = lines.size() - 1; i >= 0; i--) {
				if (!lines.get(i).isBlank()) {
					return lines.get(i).strip();
				}
			}
			return "";
		} catch (IOException e) {
			logger.debug("Could not read curl output {}", file, e);
			return "";
		} finally {
			deleteQuietly(file);
		}
	}

	private static void deleteQuietly(Path file) {
		try {
			Files.deleteIfExists(file);
		} catch (IOException e) {
			logger.debug("Could not delete {}", file, e);
		}
	}
}
