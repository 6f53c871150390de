package dev.jbang.pypimirror.scraper;

import dev.jbang.pypimirror.model.ListingEntry;
import dev.jbang.pypimirror.util.HtmlUtils;
import dev.jbang.pypimirror.util.HttpFetcher;
import dev.jbang.pypimirror.util.UrlUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;

/**
 * Scans the listing page of a single package. Failures never escape {@link #call()}: they are
 * logged and turned into an empty {@link ScanResult}, so one broken package cannot abort a crawl.
 */
public class PackageScraper implements Callable<ScanResult> {
	protected final String packageName;
	protected final String pageUrl;
	protected final Logger logger;
	protected final HttpFetcher fetcher;
	protected final RetentionFilter retentionFilter;

	public PackageScraper(ScanContext context, SnapshotConfig config, String packageName) {
		this.packageName = packageName;
		this.pageUrl = config.packageUrl(packageName);
		this.logger = context.logger();
		this.fetcher = context.fetcher();
		this.retentionFilter = config.retentionBudget()
				.map(budget -> new RetentionFilter(budget, context.logger()))
				.orElse(null);
	}

	@Override
	public ScanResult call() {
		try {
			return ScanResult.success(packageName, scrape());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			warn("Interrupted while fetching index of " + packageName);
			return ScanResult.failure(packageName, e);
		} catch (Exception e) {
			warn("Failed to fetch index of " + packageName + ": " + e);
			return ScanResult.failure(packageName, e);
		}
	}

	/** Fetch and parse the listing page, then apply the retention budget if one is configured */
	protected List<ListingEntry> scrape() throws Exception {
		String html = fetcher.fetch(pageUrl);
		List<ListingEntry> entries = parseListing(html);
		if (retentionFilter != null) {
			entries = retentionFilter.apply(packageName, entries);
		}
		return entries;
	}

	/** Turn every anchor of the page into an entry with a cleaned, absolute URL */
	protected List<ListingEntry> parseListing(String html) {
		List<ListingEntry> entries = new ArrayList<>();
		for (HtmlUtils.Anchor anchor : HtmlUtils.extractAnchors(html)) {
			String url = UrlUtils.resolveAndClean(pageUrl, anchor.href());
			entries.add(new ListingEntry(url, anchor.text()));
		}
		return entries;
	}

	/** Log a warning message */
	protected void warn(String message) {
		logger.warn(message);
	}
}
