package dev.mediadl;

import dev.mediadl.model.Candidate;
import dev.mediadl.model.Job;
import dev.mediadl.model.JobStatus;
import dev.mediadl.model.MediaType;
import dev.mediadl.queue.BatchConfig;
import dev.mediadl.queue.DedupFilter;
import dev.mediadl.util.CandidateReader;
import dev.mediadl.util.HttpUtils;
import dev.mediadl.util.RemoteFilenameResolver;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Dry run: shows which candidates would be downloaded and which are already present */
@Command(
		name = "plan",
		description = "Show which files a fetch would download without downloading anything",
		mixinStandardHelpOptions = true)
public class PlanCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Option(
			names = {"-i", "--input"},
			description = "Candidate list: a text/CSV file with links, or a JSON array of {source, filename}",
			required = true)
	private Path input;

	@Option(
			names = {"-d", "--target"},
			description = "Directory the files are downloaded into (default: $MEDIADL_TARGET)",
			defaultValue = "${env:MEDIADL_TARGET}")
	private Path targetDir;

	@Option(
			names = {"-e", "--ext"},
			description = "Which extension to download: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
			defaultValue = "mkv")
	private MediaType ext;

	@Option(
			names = {"--marker-suffix"},
			description = "Suffix of partial download files (default: ${DEFAULT-VALUE})",
			defaultValue = BatchConfig.DEFAULT_MARKER_SUFFIX)
	private String markerSuffix;

	@Option(
			names = {"--resolve-names"},
			negatable = true,
			defaultValue = "true",
			fallbackValue = "true",
			description = "Ask the server (HEAD request) for the file name of links without one (default: ${DEFAULT-VALUE})")
	private boolean resolveNames;

	@Override
	public Integer call() throws Exception {
		if (targetDir == null) {
			logger.error("Error: a target directory is required (--target or MEDIADL_TARGET)");
			return 2;
		}
		List<Candidate> candidates;
		if (resolveNames) {
			var resolver = new RemoteFilenameResolver(new HttpUtils(Map.of(), 1, Duration.ZERO));
			candidates = CandidateReader.read(input, ext, resolver::resolve);
		} else {
			candidates = CandidateReader.read(input, ext);
		}
		List<Job> jobs = candidates.stream()
				.map(c -> Job.fromCandidate(c, targetDir))
				.toList();
		DedupFilter filter = DedupFilter.snapshot(targetDir, markerSuffix);
		List<Job> admissible = filter.apply(jobs);

		logger.info("Plan for {}", targetDir.toAbsolutePath());
		logger.info("=========");
		for (Job job : jobs) {
			if (job.status() == JobStatus.SKIPPED) {
				logger.info("  skip      {} ({})", job.filename(), job.error());
			} else if (filter.hasPartial(job.filename())) {
				logger.info("  resume    {} <- {}", job.filename(), job.source());
			} else {
				logger.info("  download  {} <- {}", job.filename(), job.source());
			}
		}
		logger.info("");
		logger.info("Total candidates: {}", jobs.size());
		logger.info("To download: {}", admissible.size());
		logger.info("Already present: {}", jobs.size() - admissible.size());
		return 0;
	}
}
