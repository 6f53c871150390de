package dev.jbang.pypimirror.reporting;

import java.time.Instant;

/** Represents a progress event for one package scan */
public record ProgressEvent(String packageName, EventType eventType, String message, Instant timestamp, Throwable error) {
	public enum EventType {
		STARTED,
		COMPLETED,
		FAILED
	}

	public static ProgressEvent started(String packageName) {
		return new ProgressEvent(packageName, EventType.STARTED, "Scan started", Instant.now(), null);
	}

	public static ProgressEvent completed(String packageName, int entries) {
		return new ProgressEvent(
				packageName, EventType.COMPLETED, "Found %d artifacts".formatted(entries), Instant.now(), null);
	}

	public static ProgressEvent failed(String packageName, String message, Throwable error) {
		return new ProgressEvent(packageName, EventType.FAILED, message, Instant.now(), error);
	}

	@Override
	public String toString() {
		return "[%s] %s: %s - %s".formatted(timestamp, packageName, eventType, message);
	}
}
