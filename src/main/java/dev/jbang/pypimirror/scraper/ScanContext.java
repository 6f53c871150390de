package dev.jbang.pypimirror.scraper;

import dev.jbang.pypimirror.reporting.ProgressReporter;
import dev.jbang.pypimirror.util.HttpFetcher;
import org.slf4j.Logger;

/**
 * Shared state handed to every component of a snapshot run. All members are safe to use from
 * concurrent package scans.
 */
public record ScanContext(Logger logger, ProgressReporter reporter, HttpFetcher fetcher) {}
