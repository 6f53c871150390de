package dev.jbang.pypimirror.discovery;

import java.util.List;

/** Runs analytic queries against the download statistics warehouse */
public interface QueryExecutor {

	/**
	 * Run a standard SQL query.
	 *
	 * @return the first column of every row, as strings, in row order
	 * @throws DiscoveryException if the query fails or a value is missing
	 */
	List<String> queryFirstColumn(String sql) throws DiscoveryException, InterruptedException;

	/** Acquires a ready to use executor; credentials are resolved at this point */
	@FunctionalInterface
	interface Provider {
		QueryExecutor acquire() throws DiscoveryException;
	}
}
