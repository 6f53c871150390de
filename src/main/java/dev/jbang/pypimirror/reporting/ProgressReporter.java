package dev.jbang.pypimirror.reporting;

import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects progress events from all package scans. Counters and the set of packages currently
 * being scanned are updated on the calling thread, so they are always current; log output is
 * written by a single background thread so scan threads never wait on the appender.
 */
public class ProgressReporter implements Runnable, AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(ProgressReporter.class);
	// Queued by close(), compared by identity
	private static final ProgressEvent END_OF_EVENTS = new ProgressEvent("<end>", null, "", Instant.EPOCH, null);
	private static final long SHUTDOWN_TIMEOUT_MILLIS = 5000;

	private final LinkedBlockingQueue<ProgressEvent> pending = new LinkedBlockingQueue<>();
	private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
	private final AtomicInteger total = new AtomicInteger();
	private final AtomicInteger finished = new AtomicInteger();
	private final AtomicInteger failed = new AtomicInteger();
	private volatile int logInterval = 1;
	private volatile Thread worker;

	/** Start logging events in the background; calling it twice has no effect */
	public synchronized void start() {
		if (worker != null) {
			return;
		}
		worker = new Thread(this, "scan-progress");
		worker.setDaemon(true);
		worker.start();
		logger.debug("Progress reporter started");
	}

	/** Set the number of packages the current run will scan */
	public void setTotal(int packages) {
		total.set(packages);
		finished.set(0);
		failed.set(0);
		logInterval = Math.max(1, packages / 20);
	}

	/** Record an event; logging of the event happens later on the reporter thread */
	public void report(ProgressEvent event) {
		switch (event.eventType()) {
			case STARTED -> inFlight.add(event.packageName());
			case COMPLETED -> finish(event.packageName());
			case FAILED -> {
				failed.incrementAndGet();
				finish(event.packageName());
			}
		}
		// Unbounded queue, offer never fails
		pending.offer(event);
	}

	private void finish(String packageName) {
		inFlight.remove(packageName);
		finished.incrementAndGet();
	}

	@Override
	public void run() {
		try {
			for (ProgressEvent event = pending.take(); event != END_OF_EVENTS; event = pending.take()) {
				try {
					log(event);
				} catch (RuntimeException e) {
					logger.error("Could not log progress event {}", event, e);
				}
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.warn("Progress reporter interrupted, {} events not logged", pending.size());
		}
	}

	private void log(ProgressEvent event) {
		switch (event.eventType()) {
			case STARTED -> logger.trace("Scanning {}", event.packageName());
			case COMPLETED -> {
				logger.debug("Scanned {}: {}", event.packageName(), event.message());
				logSummary();
			}
			case FAILED -> {
				if (event.error() != null) {
					logger.warn("Scan of {} failed: {}", event.packageName(), event.message(), event.error());
				} else {
					logger.warn("Scan of {} failed: {}", event.packageName(), event.message());
				}
				logSummary();
			}
		}
	}

	private void logSummary() {
		int done = finished.get();
		if (done % logInterval == 0 || done == total.get()) {
			logger.info(
					"Scanned {}/{} packages ({} failed) | In progress: {}",
					done,
					total.get(),
					failed.get(),
					String.join(", ", inFlight));
		}
	}

	/** Number of packages finished, successfully or not */
	public int getCompletedCount() {
		return finished.get();
	}

	/** Number of packages whose scan failed */
	public int getFailedCount() {
		return failed.get();
	}

	public int getTotal() {
		return total.get();
	}

	/** Get a snapshot of the packages currently being scanned */
	public Set<String> getRunningPackages() {
		return Set.copyOf(inFlight);
	}

	/** Stop the reporter thread after it has logged all events reported so far */
	@Override
	public synchronized void close() {
		Thread thread = worker;
		if (thread == null) {
			return;
		}
		worker = null;
		pending.offer(END_OF_EVENTS);
		try {
			thread.join(SHUTDOWN_TIMEOUT_MILLIS);
			if (thread.isAlive()) {
				logger.warn("Progress reporter did not stop within {} ms", SHUTDOWN_TIMEOUT_MILLIS);
			}
			logger.debug("Progress reporter stopped");
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.error("Interrupted while stopping progress reporter", e);
		}
	}
}
