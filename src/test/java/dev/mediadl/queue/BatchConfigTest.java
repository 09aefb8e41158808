package dev.mediadl.queue;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BatchConfigTest {

	@TempDir
	Path tempDir;

	@Test
	void testDefaults() {
		BatchConfig config = BatchConfig.defaults(tempDir);

		assertThat(config.maxConcurrent()).isEqualTo(2);
		assertThat(config.pollInterval()).isEqualTo(Duration.ofSeconds(5));
		assertThat(config.maxIdlePolls()).isEqualTo(60);
		assertThat(config.markerSuffix()).isEqualTo(".crdownload");
		assertThat(config.limit()).isEqualTo(-1);
	}

	@Test
	void testValidateCreatesTargetDirectory() {
		// Given
		Path target = tempDir.resolve("downloads/show");

		// When
		BatchConfig config = BatchConfig.defaults(target).validate();

		// Then
		assertThat(target).isDirectory();
		assertThat(config.targetDir()).isAbsolute();
	}

	@Test
	void testTargetThatIsAFile() throws Exception {
		// Given
		Path file = Files.writeString(tempDir.resolve("file.txt"), "x");

		// When/Then
		assertThatThrownBy(() -> BatchConfig.defaults(file).validate())
				.isInstanceOf(ConfigInvalidException.class)
				.hasMessageContaining("not a directory");
	}

	@Test
	void testInvalidValues() {
		assertThatThrownBy(() -> new BatchConfig(tempDir, 0, Duration.ofSeconds(1), 5, ".part", -1).validate())
				.isInstanceOf(ConfigInvalidException.class)
				.hasMessageContaining("Concurrency limit");
		assertThatThrownBy(() -> new BatchConfig(tempDir, 2, Duration.ofSeconds(-1), 5, ".part", -1).validate())
				.isInstanceOf(ConfigInvalidException.class);
		assertThatThrownBy(() -> new BatchConfig(tempDir, 2, Duration.ofSeconds(1), 0, ".part", -1).validate())
				.isInstanceOf(ConfigInvalidException.class);
		assertThatThrownBy(() -> new BatchConfig(tempDir, 2, Duration.ofSeconds(1), 5, " ", -1).validate())
				.isInstanceOf(ConfigInvalidException.class);
		assertThatThrownBy(() -> new BatchConfig(tempDir, 2, Duration.ofSeconds(1), 5, ".part", 0).validate())
				.isInstanceOf(ConfigInvalidException.class);
		assertThatThrownBy(() -> new BatchConfig(null, 2, Duration.ofSeconds(1), 5, ".part", -1).validate())
				.isInstanceOf(ConfigInvalidException.class);
	}

	@Test
	void testMarkerFor() {
		BatchConfig config = BatchConfig.defaults(tempDir);

		assertThat(config.markerFor(tempDir.resolve("a.mkv"))).isEqualTo(tempDir.resolve("a.mkv.crdownload"));
	}
}
