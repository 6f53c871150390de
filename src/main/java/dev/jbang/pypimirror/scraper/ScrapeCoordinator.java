package dev.jbang.pypimirror.scraper;

import dev.jbang.pypimirror.reporting.ProgressEvent;
import dev.jbang.pypimirror.reporting.ProgressReporter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one package scan per name on a fixed pool of worker threads. Results come back in
 * submission order no matter in which order the scans finish.
 */
public class ScrapeCoordinator {
	private static final Logger logger = LoggerFactory.getLogger(ScrapeCoordinator.class);

	private final int concurrency;
	private final ProgressReporter reporter;

	public ScrapeCoordinator(int concurrency, ProgressReporter reporter) {
		if (concurrency <= 0) {
			throw new IllegalArgumentException("concurrency must be positive, got " + concurrency);
		}
		this.concurrency = concurrency;
		this.reporter = reporter;
	}

	/**
	 * Scan all packages with at most {@code concurrency} scans in flight.
	 *
	 * @param packageNames the packages to scan, in discovery order
	 * @param scanner scans one package; expected to report its own failures as a failed result
	 * @return one result per package, in the order of {@code packageNames}
	 * @throws InterruptedException if the calling thread is interrupted while waiting
	 */
	public List<ScanResult> scrapeAll(List<String> packageNames, Function<String, ScanResult> scanner)
			throws InterruptedException {
		reporter.setTotal(packageNames.size());
		if (packageNames.isEmpty()) {
			return List.of();
		}

		int threadCount = Math.min(concurrency, packageNames.size());
		logger.info("Scanning {} packages with {} parallel threads", packageNames.size(), threadCount);
		ExecutorService executor = Executors.newFixedThreadPool(threadCount);
		try {
			// Submit all scans and wrap them to report start/complete/failed events
			List<Future<ScanResult>> futures = new ArrayList<>(packageNames.size());
			for (String packageName : packageNames) {
				futures.add(executor.submit(() -> scanOne(packageName, scanner)));
			}

			// Wait for all scans to complete and collect results in submission order
			List<ScanResult> results = new ArrayList<>(futures.size());
			for (int i = 0; i < futures.size(); i++) {
				try {
					results.add(futures.get(i).get());
				} catch (ExecutionException e) {
					// scanOne already isolates failures, this only guards against Errors
					Exception cause = e.getCause() instanceof Exception ex ? ex : e;
					results.add(ScanResult.failure(packageNames.get(i), cause));
				}
			}
			return results;
		} finally {
			executor.shutdownNow();
		}
	}

	private ScanResult scanOne(String packageName, Function<String, ScanResult> scanner) {
		reporter.report(ProgressEvent.started(packageName));
		ScanResult result;
		try {
			result = scanner.apply(packageName);
		} catch (Exception e) {
			result = ScanResult.failure(packageName, e);
		}
		if (result.success()) {
			reporter.report(ProgressEvent.completed(packageName, result.entries().size()));
		} else {
			reporter.report(ProgressEvent.failed(
					packageName,
					result.error() != null ? result.error().getMessage() : "Unknown error",
					result.error()));
		}
		return result;
	}
}
