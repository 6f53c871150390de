package dev.jbang.pypimirror.scraper;

import dev.jbang.pypimirror.model.ListingEntry;
import dev.jbang.pypimirror.model.SnapshotPath;
import dev.jbang.pypimirror.util.UrlUtils;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;

/** Flattens per-package scan results into snapshot paths relative to the package base */
public class SnapshotAssembler {
	private final String packageBase;
	private final Logger logger;

	public SnapshotAssembler(String packageBase, Logger logger) {
		this.packageBase = UrlUtils.withTrailingSlash(packageBase);
		this.logger = logger;
	}

	/**
	 * Build the snapshot. Artifacts stored outside the package base are dropped with a warning.
	 * Duplicates are kept.
	 */
	public List<SnapshotPath> assemble(List<ScanResult> results) {
		List<SnapshotPath> snapshot = new ArrayList<>();
		for (ScanResult result : results) {
			for (ListingEntry entry : result.entries()) {
				String url = entry.url();
				if (url.startsWith(packageBase)) {
					snapshot.add(new SnapshotPath(url.substring(packageBase.length())));
				} else {
					logger.warn("Package {} has an artifact outside of {}: {}", result.packageName(), packageBase, url);
				}
			}
		}
		return snapshot;
	}

	public String packageBase() {
		return packageBase;
	}
}
