package dev.mediadl.queue;

import static org.assertj.core.api.Assertions.*;

import dev.mediadl.model.Job;
import dev.mediadl.model.JobStatus;
import dev.mediadl.model.MediaType;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DedupFilterTest {

	@TempDir
	Path tempDir;

	@Test
	void testExistingFileIsSkipped() throws Exception {
		// Given
		Files.writeString(tempDir.resolve("ep3.mkv"), "already here");
		List<Job> jobs = createJobs("ep1.mkv", "ep2.mkv", "ep3.mkv", "ep4.mkv", "ep5.mkv");

		// When
		List<Job> admissible = DedupFilter.snapshot(tempDir, ".crdownload").apply(jobs);

		// Then
		assertThat(admissible).extracting(Job::id).containsExactly("ep1.mkv", "ep2.mkv", "ep4.mkv", "ep5.mkv");
		assertThat(jobs.get(2).status()).isEqualTo(JobStatus.SKIPPED);
		assertThat(jobs.get(2).error()).isEqualTo(DedupFilter.REASON_EXISTS);
		assertThat(jobs).hasSize(5);
	}

	@Test
	void testComparisonIsCaseInsensitive() throws Exception {
		// Given
		Files.writeString(tempDir.resolve("Episode 01.MKV"), "x");
		List<Job> jobs = createJobs("episode 01.mkv");

		// When
		List<Job> admissible = DedupFilter.snapshot(tempDir, ".crdownload").apply(jobs);

		// Then
		assertThat(admissible).isEmpty();
		assertThat(jobs.get(0).status()).isEqualTo(JobStatus.SKIPPED);
	}

	@Test
	void testPartialDownloadIsAdmittedForResume() throws Exception {
		// Given
		Files.writeString(tempDir.resolve("ep1.mkv.crdownload"), "partial");
		List<Job> jobs = createJobs("ep1.mkv", "ep2.mkv");

		// When
		DedupFilter filter = DedupFilter.snapshot(tempDir, ".crdownload");
		List<Job> admissible = filter.apply(jobs);

		// Then
		assertThat(admissible).extracting(Job::id).containsExactly("ep1.mkv", "ep2.mkv");
		assertThat(filter.hasPartial("EP1.mkv")).isTrue();
		assertThat(filter.hasPartial("ep2.mkv")).isFalse();
		assertThat(filter.skipReason("ep1.mkv")).isEmpty();
	}

	@Test
	void testDuplicateWithinBatchIsSkipped() throws Exception {
		// Given
		List<Job> jobs = createJobs("ep1.mkv", "EP1.mkv", "ep2.mkv");

		// When
		List<Job> admissible = DedupFilter.snapshot(tempDir, ".crdownload").apply(jobs);

		// Then
		assertThat(admissible).extracting(Job::id).containsExactly("ep1.mkv", "ep2.mkv");
		assertThat(jobs.get(1).status()).isEqualTo(JobStatus.SKIPPED);
		assertThat(jobs.get(1).error()).isEqualTo(DedupFilter.REASON_DUPLICATE);
	}

	@Test
	void testSnapshotIsTakenOnce() throws Exception {
		// Given
		DedupFilter filter = DedupFilter.snapshot(tempDir, ".crdownload");
		Files.writeString(tempDir.resolve("ep1.mkv"), "written after the snapshot");

		// When
		List<Job> admissible = filter.apply(createJobs("ep1.mkv"));

		// Then
		assertThat(admissible).hasSize(1);
	}

	@Test
	void testFilterIsIdempotent() throws Exception {
		// Given
		Files.writeString(tempDir.resolve("ep2.mkv"), "x");
		Files.writeString(tempDir.resolve("EP4.MKV"), "x");
		String[] names = {"ep1.mkv", "ep2.mkv", "ep3.mkv", "ep4.mkv"};

		// When
		List<String> first = skipped(DedupFilter.snapshot(tempDir, ".crdownload").apply(createJobs(names)), names);
		List<String> second = skipped(DedupFilter.snapshot(tempDir, ".crdownload").apply(createJobs(names)), names);

		// Then
		assertThat(first).containsExactly("ep2.mkv", "ep4.mkv");
		assertThat(second).isEqualTo(first);
	}

	@Test
	void testApplyingTwiceKeepsTheSameResult() throws Exception {
		// Given
		Files.writeString(tempDir.resolve("ep2.mkv"), "x");
		DedupFilter filter = DedupFilter.snapshot(tempDir, ".crdownload");
		List<Job> jobs = createJobs("ep1.mkv", "ep2.mkv", "ep3.mkv");

		// When
		List<Job> first = filter.apply(jobs);
		List<Job> second = filter.apply(jobs);

		// Then
		assertThat(second).isEqualTo(first);
		assertThat(jobs.get(1).status()).isEqualTo(JobStatus.SKIPPED);
	}

	@Test
	void testMissingDirectoryMeansNothingExists() throws Exception {
		// Given
		Path missing = tempDir.resolve("not-created-yet");

		// When
		DedupFilter filter = DedupFilter.snapshot(missing, ".crdownload");

		// Then
		assertThat(filter.skipReason("ep1.mkv")).isEmpty();
	}

	private List<String> skipped(List<Job> admissible, String[] names) {
		List<String> result = new ArrayList<>(List.of(names));
		admissible.forEach(j -> result.remove(j.id()));
		return result;
	}

	private List<Job> createJobs(String... names) {
		List<Job> jobs = new ArrayList<>();
		for (String name : names) {
			jobs.add(new Job("https://example.com/" + name, tempDir.resolve(name), MediaType.mkv));
		}
		return jobs;
	}
}
