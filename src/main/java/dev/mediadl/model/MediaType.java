package dev.mediadl.model;

import java.util.Locale;
import java.util.Optional;

/** Media file types the downloader knows how to select */
public enum MediaType {
	mkv,
	mp4;

	/** File name suffix including the leading dot */
	public String suffix() {
		return "." + name();
	}

	/** Check whether a filename carries this type's extension (case-insensitive) */
	public boolean matches(String filename) {
		return filename != null && filename.toLowerCase(Locale.ROOT).endsWith(suffix());
	}

	/**
	 * Determine the media type from a filename.
	 *
	 * @param filename The filename to inspect
	 * @return The media type, or empty if the extension is not a known media type
	 */
	public static Optional<MediaType> fromFilename(String filename) {
		if (filename == null) {
			return Optional.empty();
		}
		for (MediaType type : values()) {
			if (type.matches(filename)) {
				return Optional.of(type);
			}
		}
		return Optional.empty();
	}
}
