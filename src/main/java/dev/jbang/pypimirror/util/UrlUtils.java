package dev.jbang.pypimirror.util;

import java.net.URI;

/** Utility class for artifact URL handling */
public class UrlUtils {

	private UrlUtils() {}

	/**
	 * Strip query string and fragment from an absolute URL. PyPI listings carry checksums as
	 * {@code #sha256=...} fragments, and a snapshot must not change when only the checksum does.
	 *
	 * @param url absolute URL
	 * @return scheme, authority and path of the URL
	 * @throws IllegalArgumentException if the URL cannot be parsed or is not absolute
	 */
	public static String clean(String url) {
		URI uri = URI.create(url);
		if (!uri.isAbsolute() || uri.getRawAuthority() == null) {
			throw new IllegalArgumentException("Not an absolute URL: " + url);
		}
		String path = uri.getRawPath();
		if (path == null || path.isEmpty()) {
			path = "/";
		}
		return uri.getScheme() + "://" + uri.getRawAuthority() + path;
	}

	/** Resolve a possibly relative href against the page it was found on, then clean it */
	public static String resolveAndClean(String pageUrl, String href) {
		return clean(URI.create(pageUrl).resolve(href.trim()).toString());
	}

	/** Append a trailing slash unless the base already ends with one */
	public static String withTrailingSlash(String base) {
		return base.endsWith("/") ? base : base + "/";
	}
}
