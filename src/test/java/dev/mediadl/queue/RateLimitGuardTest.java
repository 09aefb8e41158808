package dev.mediadl.queue;

import static org.assertj.core.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class RateLimitGuardTest {

	@Test
	void testStartsClosed() {
		RateLimitGuard guard = new RateLimitGuard();

		assertThat(guard.isTripped()).isFalse();
		assertThat(guard.signal()).isEmpty();
	}

	@Test
	void testFirstSignalWins() {
		// Given
		RateLimitGuard guard = new RateLimitGuard();

		// When
		guard.observe(RateLimitSignal.redirect("https://example.com/register"));
		guard.observe(RateLimitSignal.redirect("https://example.com/premium"));

		// Then
		assertThat(guard.isTripped()).isTrue();
		assertThat(guard.signal().orElseThrow().location()).isEqualTo("https://example.com/register");
	}

	@Test
	void testConcurrentSignalsTripOnce() throws Exception {
		// Given
		RateLimitGuard guard = new RateLimitGuard();
		List<Thread> threads = new ArrayList<>();
		for (int i = 0; i < 8; i++) {
			String location = "https://example.com/register?n=" + i;
			threads.add(new Thread(() -> guard.observe(RateLimitSignal.redirect(location))));
		}

		// When
		threads.forEach(Thread::start);
		for (Thread thread : threads) {
			thread.join();
		}

		// Then
		assertThat(guard.isTripped()).isTrue();
		assertThat(guard.signal().orElseThrow().location()).startsWith("https://example.com/register?n=");
	}

	@Test
	void testSignalToString() {
		assertThat(RateLimitSignal.redirect("https://example.com/premium"))
				.hasToString("redirected to restricted page (https://example.com/premium)");
		assertThat(new RateLimitSignal("HTTP 429", null)).hasToString("HTTP 429");
	}
}
