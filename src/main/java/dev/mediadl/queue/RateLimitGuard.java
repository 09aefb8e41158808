package dev.mediadl.queue;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-way circuit breaker shared between the admission queue and whoever talks to the site. Once a
 * rate-limit signal has been observed the guard stays tripped for the rest of the batch.
 */
public class RateLimitGuard {
	private static final Logger logger = LoggerFactory.getLogger(RateLimitGuard.class);

	private final AtomicReference<RateLimitSignal> trippedBy = new AtomicReference<>();

	/**
	 * Report a rate-limit signal. Safe to call from any thread. Only the first signal is kept, later
	 * ones are logged and otherwise ignored.
	 *
	 * @param signal The observed signal
	 */
	public void observe(RateLimitSignal signal) {
		if (trippedBy.compareAndSet(null, signal)) {
			logger.warn("Rate limit detected: {}. No further downloads will be started.", signal);
		} else {
			logger.debug("Additional rate limit signal ignored: {}", signal);
		}
	}

	public boolean isTripped() {
		return trippedBy.get() != null;
	}

	/** The signal that tripped the guard, if any */
	public Optional<RateLimitSignal> signal() {
		return Optional.ofNullable(trippedBy.get());
	}
}
