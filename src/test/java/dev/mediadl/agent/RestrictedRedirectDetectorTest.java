package dev.mediadl.agent;

import static org.assertj.core.api.Assertions.*;

import java.net.URI;
import java.util.List;
import org.junit.jupiter.api.Test;

class RestrictedRedirectDetectorTest {

	private final RestrictedRedirectDetector detector = new RestrictedRedirectDetector();

	@Test
	void testRedirectToRegisterPage() {
		assertThat(detector.isRestricted("https://example.com/file/1/mkv", URI.create("https://example.com/Register")))
				.isTrue();
		assertThat(detector.isRestricted(
						"https://example.com/file/1/mkv", URI.create("https://example.com/premium?from=download")))
				.isTrue();
	}

	@Test
	void testRedirectToCdnIsFine() {
		assertThat(detector.isRestricted("https://example.com/file/1/mkv", URI.create("https://cdn.example.net/1.mkv")))
				.isFalse();
	}

	@Test
	void testNoRedirectIsNeverRestricted() {
		String url = "https://example.com/premium-collection/ep1.mkv";

		assertThat(detector.isRestricted(url, URI.create(url))).isFalse();
		assertThat(detector.isRestricted(url, null)).isFalse();
	}

	@Test
	void testCustomKeywords() {
		RestrictedRedirectDetector custom = new RestrictedRedirectDetector(List.of("Upgrade", " "));

		assertThat(custom.isRestricted("https://example.com/a", URI.create("https://example.com/upgrade"))).isTrue();
		assertThat(custom.isRestricted("https://example.com/a", URI.create("https://example.com/register")))
				.isFalse();
	}
}
