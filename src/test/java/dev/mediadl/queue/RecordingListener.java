package dev.mediadl.queue;

import dev.mediadl.reporting.ProgressEvent;
import dev.mediadl.reporting.ProgressListener;
import java.util.ArrayList;
import java.util.List;

/** Progress listener for tests that keeps every event */
public class RecordingListener implements ProgressListener {
	private final List<ProgressEvent> events = new ArrayList<>();

	@Override
	public synchronized void onEvent(ProgressEvent event) {
		events.add(event);
	}

	public synchronized List<ProgressEvent> events() {
		return new ArrayList<>(events);
	}

	public List<ProgressEvent.EventType> types() {
		return events().stream().map(ProgressEvent::eventType).toList();
	}

	public List<String> jobIds(ProgressEvent.EventType type) {
		return events().stream()
				.filter(e -> e.eventType() == type)
				.map(ProgressEvent::jobId)
				.toList();
	}
}
