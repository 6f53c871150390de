package dev.jbang.pypimirror.scraper;

import dev.jbang.pypimirror.reporting.ProgressReporter;
import dev.jbang.pypimirror.util.HttpFetcher;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.LoggerFactory;

/**
 * In-memory implementation of HttpFetcher for testing. Serves registered pages, fails for
 * registered failing URLs and for everything unknown, and records every request.
 */
public class DummyFetcher implements HttpFetcher {
	private final Map<String, String> pages = new ConcurrentHashMap<>();
	private final Set<String> failing = ConcurrentHashMap.newKeySet();
	private final List<String> requests = Collections.synchronizedList(new ArrayList<>());

	public DummyFetcher page(String url, String html) {
		pages.put(url, html);
		return this;
	}

	public DummyFetcher failing(String url) {
		failing.add(url);
		return this;
	}

	@Override
	public String fetch(String url) throws IOException {
		requests.add(url);
		if (failing.contains(url)) {
			throw new IOException("Failed to download content: " + url + " - HTTP status: 500");
		}
		String html = pages.get(url);
		if (html == null) {
			throw new IOException("Failed to download content: " + url + " - HTTP status: 404");
		}
		return html;
	}

	public List<String> getRequests() {
		return new ArrayList<>(requests);
	}

	/** A scan context around this fetcher with a fresh, unstarted reporter */
	public ScanContext context() {
		return new ScanContext(LoggerFactory.getLogger("test"), new ProgressReporter(), this);
	}

	/** Build a simple index page with one anchor per href/text pair */
	public static String listing(String... hrefsAndTexts) {
		StringBuilder html = new StringBuilder("<!DOCTYPE html>\n<html>\n  <body>\n");
		for (int i = 0; i + 1 < hrefsAndTexts.length; i += 2) {
			html.append("    <a href=\"")
					.append(hrefsAndTexts[i])
					.append("\">")
					.append(hrefsAndTexts[i + 1])
					.append("</a><br/>\n");
		}
		return html.append("  </body>\n</html>\n").toString();
	}
}
