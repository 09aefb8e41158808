package dev.mediadl.reporting;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes progress events to the log */
public class LoggingProgressListener implements ProgressListener {
	private static final Logger logger = LoggerFactory.getLogger("progress");

	@Override
	public void onEvent(ProgressEvent event) {
		String id = event.jobId() != null ? event.jobId() : "batch";
		switch (event.eventType()) {
			case SKIPPED -> logger.info("SKIPPED: {} - {}", id, event.message());
			case ADMITTED -> logger.info("STARTED: {} | {}", id, event.message());
			case PROGRESS -> logger.debug("PROGRESS: {} - {}", id, event.message());
			case DONE -> logger.info("DONE: {} - {}", id, event.message());
			case FAILED -> logger.error("FAILED: {} - {}", id, event.message());
			case PAUSED -> logger.warn("PAUSED: {} - {}", id, event.message());
			case RATE_LIMITED -> logger.warn("RATE LIMITED: {}", event.message());
		}
	}
}
