package dev.mediadl.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import dev.mediadl.queue.BatchSummary;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Writes batch summaries as JSON so a later run (or a person) can see what is left to do */
public class ReportWriter {
	private static final ObjectMapper writeMapper =
			JsonMapper.builder().enable(SerializationFeature.INDENT_OUTPUT).build();

	private ReportWriter() {}

	/**
	 * Save a summary to a file, creating parent directories as needed.
	 *
	 * @param file The report file
	 * @param summary The summary to write
	 * @throws IOException If the file cannot be written
	 */
	public static void write(Path file, BatchSummary summary) throws IOException {
		Path parent = file.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Files.writeString(file, toJson(summary) + "\n");
	}

	public static String toJson(BatchSummary summary) throws JsonProcessingException {
		return writeMapper.writeValueAsString(summary);
	}
}
