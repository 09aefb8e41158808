package dev.mediadl.util;

import static org.assertj.core.api.Assertions.*;

import dev.mediadl.model.MediaType;
import java.net.URI;
import java.net.http.HttpHeaders;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FilenameInferenceTest {

	@Test
	void testLastSegmentIsUsed() {
		assertThat(FilenameInference.infer("https://cdn.example.com/shows/Episode%2001.mkv?token=abc", MediaType.mkv))
				.isEqualTo("Episode 01.mkv");
	}

	@Test
	void testBareTypeSegmentUsesParent() {
		assertThat(FilenameInference.infer("https://example.com/file/episode-07/mkv", MediaType.mkv))
				.isEqualTo("episode-07.mkv");
		assertThat(FilenameInference.infer("https://example.com/mp4", MediaType.mp4)).isEqualTo("download.mp4");
	}

	@Test
	void testTrailingSlash() {
		assertThat(FilenameInference.infer("https://example.com/movies/trailer/", MediaType.mp4))
				.isEqualTo("trailer.mp4");
	}

	@Test
	void testExtensionIsForced() {
		assertThat(FilenameInference.infer("https://example.com/get/12345", MediaType.mkv)).isEqualTo("12345.mkv");
		assertThat(FilenameInference.infer("https://example.com/get/video.mp4", MediaType.mkv))
				.isEqualTo("video.mkv");
		assertThat(FilenameInference.infer("https://example.com/get/archive.v2", MediaType.mp4))
				.isEqualTo("archive.v2.mp4");
	}

	@Test
	void testUrlMatches() {
		assertThat(FilenameInference.urlMatches("https://example.com/a/B.MKV", MediaType.mkv)).isTrue();
		assertThat(FilenameInference.urlMatches("https://example.com/a/b.mkv?dl=1", MediaType.mkv)).isTrue();
		assertThat(FilenameInference.urlMatches("https://example.com/file/123/mkv", MediaType.mkv)).isTrue();
		assertThat(FilenameInference.urlMatches("https://example.com/file/123/mkv?x=1", MediaType.mkv)).isTrue();
		assertThat(FilenameInference.urlMatches("https://example.com/a/b.mp4", MediaType.mkv)).isFalse();
		assertThat(FilenameInference.urlMatches("https://example.com/mkvtools/index.html", MediaType.mkv))
				.isFalse();
	}

	@Test
	void testSanitize() {
		assertThat(FilenameInference.sanitize("a/b\\c:d*e?f\"g<h>i|j.mkv")).isEqualTo("a_b_c_d_e_f_g_h_i_j.mkv");
		assertThat(FilenameInference.sanitize("  spaced.mkv ")).isEqualTo("spaced.mkv");
		assertThat(FilenameInference.sanitize("")).isEqualTo("download");
		assertThat(FilenameInference.sanitize(".")).isEqualTo("download");
		assertThat(FilenameInference.sanitize(null)).isEqualTo("download");
	}

	@Test
	void testContentDispositionWins() {
		// Given
		HttpHeaders headers = headers("attachment; filename=\"Show.S01E02.mkv\"");

		// When
		String name = FilenameInference.infer(
				"https://example.com/watch/123/mkv", headers, URI.create("https://cdn.example.com/x/abc.mkv"), MediaType.mkv);

		// Then
		assertThat(name).isEqualTo("Show.S01E02.mkv");
	}

	@Test
	void testExtendedDispositionIsDecoded() {
		assertThat(FilenameInference.dispositionFilename("attachment; filename*=UTF-8''%C3%89pisode%2001.mkv"))
				.contains("\u00c9pisode 01.mkv");
		assertThat(FilenameInference.dispositionFilename(
						"attachment; filename=\"fallback.mkv\"; filename*=UTF-8''real.mkv"))
				.contains("real.mkv");
		assertThat(FilenameInference.dispositionFilename("attachment; filename=plain.mp4")).contains("plain.mp4");
		assertThat(FilenameInference.dispositionFilename("inline")).isEmpty();
	}

	@Test
	void testDirectoryInDispositionIsDropped() {
		assertThat(FilenameInference.dispositionFilename("attachment; filename=\"../../etc/evil.mkv\""))
				.contains("evil.mkv");
		assertThat(FilenameInference.dispositionFilename("attachment; filename=\"C:\\temp\\ep.mkv\""))
				.contains("ep.mkv");
	}

	@Test
	void testRedirectTargetNamesTheFile() {
		// Given
		HttpHeaders noDisposition = HttpHeaders.of(Map.of(), (name, value) -> true);

		// When
		String name = FilenameInference.infer(
				"https://example.com/watch/123/mkv",
				noDisposition,
				URI.create("https://cdn.example.com/media/Show.S01E03.mkv?sig=1"),
				MediaType.mkv);

		// Then
		assertThat(name).isEqualTo("Show.S01E03.mkv");
	}

	@Test
	void testWithoutServerInformationTheLinkIsUsed() {
		assertThat(FilenameInference.infer("https://example.com/watch/123/mkv", null, null, MediaType.mkv))
				.isEqualTo("123.mkv");
		assertThat(FilenameInference.infer(
						"https://example.com/get/video.mkv",
						null,
						URI.create("https://example.com/get/video.mkv"),
						MediaType.mkv))
				.isEqualTo("video.mkv");
	}

	private static HttpHeaders headers(String disposition) {
		return HttpHeaders.of(Map.of("Content-Disposition", List.of(disposition)), (name, value) -> true);
	}
}
