package dev.jbang.pypimirror.scraper;

import dev.jbang.pypimirror.discovery.DiscoveryMode;
import dev.jbang.pypimirror.model.RetentionBudget;
import java.util.Optional;

/**
 * Configuration record for a snapshot run.
 *
 * @param simpleBase base URL of the simple index, without trailing slash
 * @param packageBase base URL under which all artifacts are stored
 * @param discoveryMode how packages are discovered
 * @param retention optional per-package version budget, {@code null} to keep everything
 * @param debug truncate the full index to speed up test runs
 * @param concurrency maximum number of package listings fetched at the same time
 */
public record SnapshotConfig(
		String simpleBase,
		String packageBase,
		DiscoveryMode discoveryMode,
		RetentionBudget retention,
		boolean debug,
		int concurrency) {

	public static final String DEFAULT_SIMPLE_BASE = "https://mirrors.tuna.tsinghua.edu.cn/pypi/web/simple";
	public static final String DEFAULT_PACKAGE_BASE = "https://mirrors.tuna.tsinghua.edu.cn/pypi/web/packages";
	public static final int DEFAULT_CONCURRENCY = 64;

	public SnapshotConfig {
		if (simpleBase == null || simpleBase.isBlank()) {
			throw new IllegalArgumentException("simpleBase must not be empty");
		}
		if (packageBase == null || packageBase.isBlank()) {
			throw new IllegalArgumentException("packageBase must not be empty");
		}
		if (concurrency <= 0) {
			throw new IllegalArgumentException("concurrency must be positive, got " + concurrency);
		}
		while (simpleBase.endsWith("/")) {
			simpleBase = simpleBase.substring(0, simpleBase.length() - 1);
		}
		if (discoveryMode == null) {
			discoveryMode = DiscoveryMode.FULL_INDEX;
		}
	}

	public Optional<RetentionBudget> retentionBudget() {
		return Optional.ofNullable(retention);
	}

	/** URL of the listing page of one package */
	public String packageUrl(String packageName) {
		return simpleBase + "/" + packageName + "/";
	}

	/** URL of the root listing of the simple index */
	public String indexUrl() {
		return simpleBase + "/";
	}
}
