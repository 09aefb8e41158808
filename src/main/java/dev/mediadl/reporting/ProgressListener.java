package dev.mediadl.reporting;

/** Receives human-readable progress events from a running batch */
@FunctionalInterface
public interface ProgressListener {
	void onEvent(ProgressEvent event);
}
