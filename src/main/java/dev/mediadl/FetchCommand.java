package dev.mediadl;

import dev.mediadl.agent.CurlTransferAgent;
import dev.mediadl.agent.HttpTransferAgent;
import dev.mediadl.agent.RestrictedRedirectDetector;
import dev.mediadl.agent.TransferAgent;
import dev.mediadl.model.Candidate;
import dev.mediadl.model.Job;
import dev.mediadl.model.JobStatus;
import dev.mediadl.model.MediaType;
import dev.mediadl.queue.BatchConfig;
import dev.mediadl.queue.BatchRunner;
import dev.mediadl.queue.BatchSummary;
import dev.mediadl.queue.ConfigInvalidException;
import dev.mediadl.queue.RateLimitGuard;
import dev.mediadl.reporting.LoggingProgressListener;
import dev.mediadl.util.CandidateReader;
import dev.mediadl.util.HttpUtils;
import dev.mediadl.util.RemoteFilenameResolver;
import dev.mediadl.util.ReportWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Fetch command that downloads every new candidate with a bounded number of transfers */
@Command(
		name = "fetch",
		description = "Download all candidates that are not in the target directory yet",
		mixinStandardHelpOptions = true)
public class FetchCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	/** Available transfer agents */
	public enum AgentType {
		curl,
		http
	}

	@Option(
			names = {"-i", "--input"},
			description = "Candidate list: a text/CSV file with links, or a JSON array of {source, filename}",
			required = true)
	private Path input;

	@Option(
			names = {"-d", "--target"},
			description = "Directory to save downloads (default: $MEDIADL_TARGET)",
			defaultValue = "${env:MEDIADL_TARGET}")
	private Path targetDir;

	@Option(
			names = {"-e", "--ext"},
			description = "Which extension to download: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
			defaultValue = "mkv")
	private MediaType ext;

	@Option(
			names = {"-j", "--jobs"},
			description = "Maximum number of concurrent downloads (default: $MEDIADL_JOBS or 2)",
			defaultValue = "${env:MEDIADL_JOBS:-2}")
	private int maxConcurrent;

	@Option(
			names = {"--agent"},
			description = "Transfer agent: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
			defaultValue = "curl")
	private AgentType agentType;

	@Option(
			names = {"--poll-interval"},
			description = "Seconds between completion checks (default: ${DEFAULT-VALUE})",
			defaultValue = "5")
	private int pollSeconds;

	@Option(
			names = {"--max-idle-polls"},
			description = "Checks without any progress before a download is failed (default: ${DEFAULT-VALUE})",
			defaultValue = "60")
	private int maxIdlePolls;

	@Option(
			names = {"--marker-suffix"},
			description = "Suffix of partial download files (default: ${DEFAULT-VALUE})",
			defaultValue = BatchConfig.DEFAULT_MARKER_SUFFIX)
	private String markerSuffix;

	@Option(
			names = {"--limit"},
			description = "Only download the first N new files, e.g. for testing (default: unlimited)",
			defaultValue = "-1")
	private int limit;

	@Option(
			names = {"-H", "--header"},
			description = "Extra request header as NAME=VALUE, for example a session cookie (repeatable)")
	private Map<String, String> headers = new LinkedHashMap<>();

	@Option(
			names = {"--restricted-keywords"},
			description = "Redirect targets containing any of these words count as rate limiting (default: ${DEFAULT-VALUE})",
			defaultValue = "register,premium",
			split = ",")
	private List<String> restrictedKeywords;

	@Option(
			names = {"--resolve-names"},
			negatable = true,
			defaultValue = "true",
			fallbackValue = "true",
			description = "Ask the server (HEAD request) for the file name of links without one (default: ${DEFAULT-VALUE})")
	private boolean resolveNames;

	@Option(
			names = {"--report"},
			description = "Write the batch summary as JSON to this file")
	private Path reportFile;

	@Override
	public Integer call() throws Exception {
		if (targetDir == null) {
			logger.error("Error: a target directory is required (--target or MEDIADL_TARGET)");
			return 2;
		}

		BatchConfig config = new BatchConfig(
				targetDir, maxConcurrent, Duration.ofSeconds(pollSeconds), maxIdlePolls, markerSuffix, limit);
		RateLimitGuard guard = new RateLimitGuard();

		BatchSummary summary;
		try (TransferAgent agent = createAgent()) {
			BatchRunner runner = new BatchRunner(config, agent, guard, new LoggingProgressListener());
			config = runner.config();

			logger.info("Media Downloader - Fetch");
			logger.info("========================");
			logger.info("Target directory: {}", config.targetDir());
			logger.info("Max concurrent downloads: {}", config.maxConcurrent());
			logger.info("Transfer agent: {}", agentType);
			logger.info("");

			List<Candidate> candidates;
			if (resolveNames) {
				var resolver = new RemoteFilenameResolver(new HttpUtils(headers, 1, Duration.ZERO));
				candidates = CandidateReader.read(input, ext, resolver::resolve);
			} else {
				candidates = CandidateReader.read(input, ext);
			}
			if (candidates.isEmpty()) {
				logger.info("No {} download links found in {}", ext, input);
				return 0;
			}
			summary = runner.run(candidates);
		} catch (ConfigInvalidException e) {
			logger.error("Error: {}", e.getMessage());
			return 2;
		}

		printSummary(summary);
		if (reportFile != null) {
			ReportWriter.write(reportFile, summary);
			logger.info("Report written to {}", reportFile.toAbsolutePath());
		}
		return summary.exitCode();
	}

	private TransferAgent createAgent() {
		return switch (agentType) {
			case curl -> new CurlTransferAgent(
					"curl", 3, headers, new RestrictedRedirectDetector(restrictedKeywords));
			case http -> new HttpTransferAgent(
					new HttpUtils(headers, 3, Duration.ofSeconds(2)),
					new RestrictedRedirectDetector(restrictedKeywords),
					Math.max(1, maxConcurrent));
		};
	}

	private void printSummary(BatchSummary summary) {
		logger.info("");
		logger.info("Download Summary");
		logger.info("================");
		logger.info("Total candidates: {}", summary.total());
		logger.info("Done: {}", summary.count(JobStatus.DONE));
		logger.info("Failed: {}", summary.count(JobStatus.FAILED));
		logger.info("Paused: {}", summary.count(JobStatus.PAUSED));
		logger.info("Skipped: {}", summary.count(JobStatus.SKIPPED));

		for (JobStatus status : List.of(JobStatus.FAILED, JobStatus.PAUSED, JobStatus.SKIPPED)) {
			List<Job> jobs = summary.withStatus(status);
			if (jobs.isEmpty()) {
				continue;
			}
			logger.info("");
			logger.info("{}:", status);
			for (Job job : jobs) {
				logger.info("  {} - {}", job.filename(), job.error());
			}
		}

		if (summary.rateLimited()) {
			logger.warn("");
			logger.warn("Stopped early because of rate limiting: {}", summary.rateLimit());
			logger.warn("Wait before running again, paused files will be picked up by the next run.");
		}

		logger.info("");
		logger.info("Batch completed in {} seconds", summary.elapsedMillis() / 1000.0);
	}
}
