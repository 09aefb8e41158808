package dev.mediadl.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * A discovered downloadable item before admission. Produced by whatever collaborator found the
 * links (a listing page scraper, a CSV export, ...).
 */
public record Candidate(
		@JsonProperty("source") String source,
		@JsonProperty("filename") String filename,
		@JsonProperty("extension") MediaType extension) {

	public Candidate {
		Objects.requireNonNull(source, "source");
		Objects.requireNonNull(filename, "filename");
	}
}
