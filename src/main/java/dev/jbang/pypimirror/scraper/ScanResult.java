package dev.jbang.pypimirror.scraper;

import dev.jbang.pypimirror.model.ListingEntry;
import java.util.List;

/** Result of scanning one package listing */
public record ScanResult(String packageName, boolean success, List<ListingEntry> entries, Exception error) {

	public static ScanResult success(String packageName, List<ListingEntry> entries) {
		return new ScanResult(packageName, true, List.copyOf(entries), null);
	}

	/** A failed package contributes no entries to the snapshot */
	public static ScanResult failure(String packageName, Exception error) {
		return new ScanResult(packageName, false, List.of(), error);
	}

	@Override
	public String toString() {
		return success
				? "%s: SUCCESS (%d artifacts)".formatted(packageName, entries.size())
				: "%s: FAILED - %s".formatted(packageName, error != null ? error.getMessage() : "Unknown error");
	}
}
