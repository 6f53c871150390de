package dev.jbang.pypimirror.util;

import java.io.IOException;

/** Shared, read-only capability to fetch a listing page as text. */
@FunctionalInterface
public interface HttpFetcher {

	/**
	 * Fetch the body of the given URL.
	 *
	 * @throws IOException on transport errors and non-2xx responses
	 * @throws InterruptedException if the calling thread is interrupted while waiting
	 */
	String fetch(String url) throws IOException, InterruptedException;
}
