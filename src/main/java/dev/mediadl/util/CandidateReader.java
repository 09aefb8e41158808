package dev.mediadl.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mediadl.model.Candidate;
import dev.mediadl.model.MediaType;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads candidate lists produced by other tools. Two formats are understood: free-form text or
 * CSV containing http(s) links, and a JSON array of {@code {"source": ..., "filename": ...}}
 * objects as written by a listing page scraper.
 */
public class CandidateReader {
	private static final Logger logger = LoggerFactory.getLogger(CandidateReader.class);
	private static final Pattern URL_PATTERN = Pattern.compile("https?://[^\\s\",]+", Pattern.CASE_INSENSITIVE);
	private static final Pattern COLUMN_SEPARATOR = Pattern.compile("[,;\\t]");

	private static final ObjectMapper readMapper = new ObjectMapper();

	private CandidateReader() {}

	/**
	 * Read candidates from a file, picking the format from its extension ({@code .json} or text).
	 * Names that the file does not provide are inferred from the link.
	 *
	 * @param file The input file
	 * @param type The media type to keep
	 * @return Candidates in discovery order
	 * @throws IOException If the file cannot be read or parsed
	 */
	public static List<Candidate> read(Path file, MediaType type) throws IOException {
		return read(file, type, FilenameInference::infer);
	}

	/**
	 * Read candidates from a file, naming the ones without an explicit filename with the given
	 * function, for example {@link RemoteFilenameResolver#resolve}.
	 */
	public static List<Candidate> read(Path file, MediaType type, BiFunction<String, MediaType, String> namer)
			throws IOException {
		String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
		return name.endsWith(".json") ? fromJson(file, type, namer) : fromText(file, type, namer);
	}

	/**
	 * Extract http(s) links from a text or CSV file. Duplicate links are dropped keeping the first
	 * occurrence, and only links that point at the requested media type are kept. When a line holds
	 * a single link and one of its columns looks like a filename of the right type, that name is used
	 * instead of one inferred from the link.
	 */
	public static List<Candidate> fromText(Path file, MediaType type, BiFunction<String, MediaType, String> namer)
			throws IOException {
		// decode leniently, exported lists are not always valid UTF-8
		String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
		Set<String> seen = new LinkedHashSet<>();
		List<Candidate> candidates = new ArrayList<>();
		int ignored = 0;

		for (String line : text.split("\\R")) {
			List<String> urls = new ArrayList<>();
			Matcher matcher = URL_PATTERN.matcher(line);
			while (matcher.find()) {
				urls.add(matcher.group());
			}
			for (String url : urls) {
				if (!seen.add(url)) {
					continue;
				}
				if (!FilenameInference.urlMatches(url, type)) {
					ignored++;
					logger.debug("Ignoring {} - not a {} link", url, type);
					continue;
				}
				String filename = urls.size() == 1 ? filenameColumn(line, type) : null;
				if (filename == null) {
					filename = namer.apply(url, type);
				}
				candidates.add(new Candidate(url, filename, type));
			}
		}

		logger.info("Read {} {} candidates from {} ({} other links ignored)", candidates.size(), type, file, ignored);
		return candidates;
	}

	/** Read a JSON array of candidate objects */
	public static List<Candidate> fromJson(Path file, MediaType type, BiFunction<String, MediaType, String> namer)
			throws IOException {
		JsonNode root = readMapper.readTree(file.toFile());
		if (root == null || !root.isArray()) {
			throw new IOException("Expected a JSON array of candidates in " + file);
		}

		Set<String> seen = new LinkedHashSet<>();
		List<Candidate> candidates = new ArrayList<>();
		for (JsonNode node : root) {
			String source = node.path("source").asText(null);
			if (source == null || source.isBlank()) {
				logger.warn("Skipping candidate without source in {}: {}", file, node);
				continue;
			}
			if (!seen.add(source)) {
				continue;
			}
			String filename = node.path("filename").asText(null);
			if (filename == null || filename.isBlank()) {
				if (!FilenameInference.urlMatches(source, type)) {
					continue;
				}
				filename = namer.apply(source, type);
			} else if (!type.matches(filename)) {
				logger.debug("Ignoring {} - not a {} file", filename, type);
				continue;
			}
			candidates.add(new Candidate(source, FilenameInference.sanitize(filename), type));
		}

		logger.info("Read {} {} candidates from {}", candidates.size(), type, file);
		return candidates;
	}

	private static String filenameColumn(String line, MediaType type) {
		for (String column : COLUMN_SEPARATOR.split(line)) {
			String value = unquote(column.strip());
			if (value.isEmpty() || URL_PATTERN.matcher(value).find()) {
				continue;
			}
			if (type.matches(value)) {
				return FilenameInference.sanitize(value);
			}
		}
		return null;
	}

	private static String unquote(String value) {
		if (value.length() >= 2
				&& ((value.startsWith("\"") && value.endsWith("\"")) || (value.startsWith("'") && value.endsWith("'")))) {
			return value.substring(1, value.length() - 1).strip();
		}
		return value;
	}
}
