package dev.jbang.pypimirror.discovery;

import dev.jbang.pypimirror.scraper.ScanContext;
import dev.jbang.pypimirror.scraper.SnapshotConfig;
import dev.jbang.pypimirror.util.HtmlUtils;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;

/** Produces the ordered list of package names a snapshot run scans */
public class PackageDiscovery {
	/** Characters of the raw index kept in debug mode */
	public static final int DEBUG_INDEX_LENGTH = 1000;

	/** The 1000 packages pip downloaded most since yesterday, most downloaded first */
	public static final String POPULARITY_QUERY =
			"""
			SELECT file.project, COUNT(*) AS num_downloads
			FROM `bigquery-public-data.pypi.file_downloads`
			WHERE
			  details.installer.name = 'pip'
			  AND
			  DATE(timestamp)
			    BETWEEN DATE_SUB(CURRENT_DATE(), INTERVAL 1 DAY)
			    AND CURRENT_DATE()
			GROUP BY file.project
			ORDER BY num_downloads DESC
			LIMIT 1000
			""";

	private final ScanContext context;
	private final SnapshotConfig config;
	private final QueryExecutor.Provider queryExecutorProvider;
	private final Logger logger;

	public PackageDiscovery(ScanContext context, SnapshotConfig config, QueryExecutor.Provider queryExecutorProvider) {
		this.context = context;
		this.config = config;
		this.queryExecutorProvider = queryExecutorProvider;
		this.logger = context.logger();
	}

	/**
	 * Discover the packages to scan using the configured {@link DiscoveryMode}.
	 *
	 * @throws DiscoveryException if the index cannot be fetched or the query fails
	 */
	public List<String> discover() throws DiscoveryException, InterruptedException {
		return switch (config.discoveryMode()) {
			case FULL_INDEX -> fullIndex();
			case POPULARITY -> {
				if (config.debug()) {
					logger.warn("Debug mode is ignored when discovering packages through BigQuery");
				}
				yield popularity();
			}
		};
	}

	List<String> fullIndex() throws DiscoveryException, InterruptedException {
		logger.info("Downloading PyPI index from {}", config.indexUrl());
		String index;
		try {
			index = context.fetcher().fetch(config.indexUrl());
		} catch (IOException e) {
			throw new DiscoveryException("Failed to download index " + config.indexUrl() + ": " + e.getMessage(), e);
		}

		logger.info("Parsing index...");
		if (config.debug() && index.length() > DEBUG_INDEX_LENGTH) {
			// Cuts the raw document, the last anchor may be lost
			index = index.substring(0, DEBUG_INDEX_LENGTH);
		}
		List<String> packages = HtmlUtils.extractLinkTexts(index);
		logger.info("Found {} packages in index", packages.size());
		return packages;
	}

	List<String> popularity() throws DiscoveryException, InterruptedException {
		logger.info("Executing BigQuery query...");
		QueryExecutor executor = queryExecutorProvider.acquire();
		List<String> packages = executor.queryFirstColumn(POPULARITY_QUERY);
		logger.info("BigQuery returned {} packages", packages.size());
		return packages;
	}
}
