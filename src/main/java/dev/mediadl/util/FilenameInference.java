package dev.mediadl.util;

import dev.mediadl.model.MediaType;
import java.net.URI;
import java.net.URLDecoder;
import java.net.http.HttpHeaders;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Derives local filenames from download URLs */
public class FilenameInference {
	private static final Pattern ILLEGAL_CHARS = Pattern.compile("[\\\\/:*?\"<>|\\p{Cntrl}]");
	private static final String FALLBACK_NAME = "download";
	private static final Pattern EXTENDED_FILENAME =
			Pattern.compile("filename\\*\\s*=\\s*([\\w-]+)'[^']*'([^;\\s]+)", Pattern.CASE_INSENSITIVE);
	private static final Pattern PLAIN_FILENAME =
			Pattern.compile("filename\\s*=\\s*(?:\"([^\"]*)\"|([^;]+))", Pattern.CASE_INSENSITIVE);

	private FilenameInference() {}

	/**
	 * Infer a filename for a URL, forcing the requested media extension.
	 *
	 * <p>The last path segment is used when it looks like a filename. A bare type segment such as
	 * {@code .../episode-01/mkv} is named after its parent segment instead.
	 *
	 * @param url The download URL
	 * @param type The media type the file must end up with
	 * @return A sanitized filename ending in the type's suffix
	 */
	public static String infer(String url, MediaType type) {
		return infer(url, null, null, type);
	}

	/**
	 * Infer a filename using what the server said about the file. The {@code Content-Disposition}
	 * filename wins, then the last segment of the URL the redirects ended on, then the URL itself.
	 *
	 * @param url The download URL
	 * @param headers Headers of a HEAD request for the URL, or null
	 * @param landed Where the HEAD request's redirect chain ended, or null
	 * @param type The media type the file must end up with
	 * @return A sanitized filename ending in the type's suffix
	 */
	public static String infer(String url, HttpHeaders headers, URI landed, MediaType type) {
		String name = headers != null
				? headers.firstValue("Content-Disposition")
						.flatMap(FilenameInference::dispositionFilename)
						.orElse("")
				: "";
		if (name.isEmpty() && landed != null && !landed.toString().equals(url)) {
			name = lastSegment(decodedPath(landed.toString()));
		}
		if (name.isEmpty()) {
			name = lastSegment(decodedPath(url));
		}

		String lower = name.toLowerCase(Locale.ROOT);
		if (lower.isEmpty() || isBareType(lower)) {
			String[] segments = decodedPath(url).split("/");
			String parent = segments.length >= 2 ? segments[segments.length - 2] : "";
			name = (parent.isEmpty() ? FALLBACK_NAME : parent) + type.suffix();
		}

		return sanitize(withExtension(name, type));
	}

	/**
	 * Extract the filename from a {@code Content-Disposition} header value. The RFC 5987
	 * {@code filename*} form is preferred over the plain {@code filename} parameter.
	 *
	 * @param disposition The header value
	 * @return The bare filename, without any directory part
	 */
	public static Optional<String> dispositionFilename(String disposition) {
		Matcher extended = EXTENDED_FILENAME.matcher(disposition);
		if (extended.find()) {
			Charset charset;
			try {
				charset = Charset.forName(extended.group(1));
			} catch (IllegalArgumentException e) {
				charset = StandardCharsets.UTF_8;
			}
			try {
				return nonEmpty(baseName(URLDecoder.decode(extended.group(2), charset)));
			} catch (IllegalArgumentException e) {
				// malformed escapes, try the plain parameter
			}
		}
		Matcher plain = PLAIN_FILENAME.matcher(disposition);
		if (plain.find()) {
			String value = plain.group(1) != null ? plain.group(1) : plain.group(2);
			return nonEmpty(baseName(value.strip()));
		}
		return Optional.empty();
	}

	private static String lastSegment(String path) {
		String[] segments = path.split("/");
		return segments.length > 0 ? segments[segments.length - 1] : "";
	}

	private static String baseName(String name) {
		int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
		return slash >= 0 ? name.substring(slash + 1) : name;
	}

	private static Optional<String> nonEmpty(String value) {
		return value.isBlank() ? Optional.empty() : Optional.of(value);
	}

	/** Check whether a URL points at the given media type, either by suffix or by a type segment */
	public static boolean urlMatches(String url, MediaType type) {
		String lower = url.toLowerCase(Locale.ROOT);
		String segment = "/" + type.name();
		if (lower.endsWith(segment) || lower.contains(segment + "?") || lower.contains(segment + "#")) {
			return true;
		}
		return type.matches(stripQuery(lower));
	}

	private static boolean isBareType(String segment) {
		for (MediaType candidate : MediaType.values()) {
			if (candidate.name().equals(segment)) {
				return true;
			}
		}
		return false;
	}

	/** Replace or append the extension so that the name ends in the type's suffix */
	static String withExtension(String name, MediaType type) {
		int dot = name.lastIndexOf('.');
		if (dot <= 0) {
			return name + type.suffix();
		}
		var existing = MediaType.fromFilename(name);
		if (existing.isEmpty()) {
			return name + type.suffix();
		}
		if (existing.get() != type) {
			return name.substring(0, dot) + type.suffix();
		}
		return name;
	}

	/**
	 * Make a name safe to use as a single path component.
	 *
	 * @param name The raw name
	 * @return The name with separators and reserved characters replaced by underscores
	 */
	public static String sanitize(String name) {
		if (name == null) {
			return FALLBACK_NAME;
		}
		String cleaned = ILLEGAL_CHARS.matcher(name.strip()).replaceAll("_");
		if (cleaned.isEmpty() || cleaned.equals(".") || cleaned.equals("..")) {
			return FALLBACK_NAME;
		}
		return cleaned;
	}

	private static String decodedPath(String url) {
		String trimmed = stripQuery(url);
		try {
			String path = URI.create(trimmed).getPath();
			if (path != null) {
				return path;
			}
		} catch (IllegalArgumentException e) {
			// fall through to the raw text
		}
		int schemeEnd = trimmed.indexOf("://");
		return schemeEnd >= 0 ? trimmed.substring(schemeEnd + 3) : trimmed;
	}

	private static String stripQuery(String url) {
		int cut = url.length();
		int query = url.indexOf('?');
		int fragment = url.indexOf('#');
		if (query >= 0) {
			cut = Math.min(cut, query);
		}
		if (fragment >= 0) {
			cut = Math.min(cut, fragment);
		}
		return url.substring(0, cut);
	}
}
