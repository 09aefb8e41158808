package dev.mediadl.queue;

/** Thrown when a batch cannot start because its configuration is unusable */
public class ConfigInvalidException extends RuntimeException {
	public ConfigInvalidException(String message) {
		super(message);
	}

	public ConfigInvalidException(String message, Throwable cause) {
		super(message, cause);
	}
}
