package dev.mediadl.agent;

import java.net.URI;
import java.util.List;
import java.util.Locale;

/**
 * Recognizes redirects to the site's restricted-access pages (registration, premium upsell), which
 * is how the site signals that an account has been throttled.
 */
public class RestrictedRedirectDetector {
	public static final List<String> DEFAULT_KEYWORDS = List.of("register", "premium");

	private final List<String> keywords;

	public RestrictedRedirectDetector() {
		this(DEFAULT_KEYWORDS);
	}

	public RestrictedRedirectDetector(List<String> keywords) {
		this.keywords = keywords.stream()
				.map(k -> k.toLowerCase(Locale.ROOT))
				.filter(k -> !k.isBlank())
				.toList();
	}

	/**
	 * Check whether a request ended up on a restricted page. A request that was not redirected at all
	 * is never considered restricted, so links that happen to contain a keyword still work.
	 *
	 * @param requested The URL that was requested
	 * @param landed Where the redirect chain ended
	 * @return true if the landing page is a restricted-access page
	 */
	public boolean isRestricted(String requested, URI landed) {
		if (landed == null || landed.toString().equals(requested)) {
			return false;
		}
		String location = landed.toString().toLowerCase(Locale.ROOT);
		return keywords.stream().anyMatch(location::contains);
	}
}
