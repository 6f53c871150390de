package dev.jbang.pypimirror.util;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.ProxySelector;
import java.net.SocketAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Proxy policy read from the environment. Scheme specific variables win over the catch-all ones,
 * and lower case names win over upper case ones:
 *
 * <ul>
 *   <li>HTTP targets: {@code http_proxy}, {@code HTTP_PROXY}, then {@code all_proxy}, {@code ALL_PROXY}
 *   <li>HTTPS targets: {@code https_proxy}, {@code HTTPS_PROXY}, then {@code all_proxy}, {@code ALL_PROXY}
 * </ul>
 *
 * Every variable that is set must be valid, even if a higher priority one shadows it.
 */
public record ProxySettings(Proxy httpProxy, Proxy httpsProxy, Proxy allProxy) {
	private static final Logger logger = LoggerFactory.getLogger(ProxySettings.class);

	static final List<String> HTTP_VARIABLES = List.of("http_proxy", "HTTP_PROXY");
	static final List<String> HTTPS_VARIABLES = List.of("https_proxy", "HTTPS_PROXY");
	static final List<String> ALL_VARIABLES = List.of("all_proxy", "ALL_PROXY");

	public static ProxySettings none() {
		return new ProxySettings(null, null, null);
	}

	/**
	 * Build the proxy policy from the given environment.
	 *
	 * @throws InvalidProxyException if any proxy variable is set to a malformed value
	 */
	public static ProxySettings fromEnvironment(Map<String, String> env) {
		return new ProxySettings(
				firstConfigured(env, HTTP_VARIABLES), firstConfigured(env, HTTPS_VARIABLES), firstConfigured(env, ALL_VARIABLES));
	}

	private static Proxy firstConfigured(Map<String, String> env, List<String> variables) {
		Proxy selected = null;
		for (String variable : variables) {
			String value = env.get(variable);
			if (value == null || value.isBlank()) {
				continue;
			}
			Proxy proxy = parseProxy(variable, value.trim());
			if (selected == null) {
				selected = proxy;
			}
		}
		return selected;
	}

	static Proxy parseProxy(String variable, String value) {
		String proxyUrl = value.contains("://") ? value : "http://" + value;
		URI uri;
		try {
			uri = new URI(proxyUrl);
		} catch (URISyntaxException e) {
			throw new InvalidProxyException(variable, value, e.getMessage());
		}
		String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
		if (uri.getHost() == null) {
			throw new InvalidProxyException(variable, value, "missing host");
		}
		Proxy.Type type;
		int defaultPort;
		switch (scheme) {
			case "http" -> {
				type = Proxy.Type.HTTP;
				defaultPort = 80;
			}
			case "https" -> {
				type = Proxy.Type.HTTP;
				defaultPort = 443;
			}
			case "socks", "socks5", "socks5h" -> {
				type = Proxy.Type.SOCKS;
				defaultPort = 1080;
			}
			default -> throw new InvalidProxyException(variable, value, "unsupported scheme '" + scheme + "'");
		}
		int port = uri.getPort() == -1 ? defaultPort : uri.getPort();
		return new Proxy(type, InetSocketAddress.createUnresolved(uri.getHost(), port));
	}

	public boolean isEmpty() {
		return httpProxy == null && httpsProxy == null && allProxy == null;
	}

	/** Proxy to use for the given target, if any */
	public Optional<Proxy> proxyFor(URI target) {
		String scheme = target.getScheme() == null ? "" : target.getScheme().toLowerCase(Locale.ROOT);
		Proxy specific =
				switch (scheme) {
					case "http" -> httpProxy;
					case "https" -> httpsProxy;
					default -> null;
				};
		return Optional.ofNullable(specific != null ? specific : allProxy);
	}

	/** A {@link ProxySelector} applying this policy, for {@link java.net.http.HttpClient} */
	public ProxySelector selector() {
		return new ProxySelector() {
			@Override
			public List<Proxy> select(URI uri) {
				return proxyFor(uri).map(List::of).orElse(List.of(Proxy.NO_PROXY));
			}

			@Override
			public void connectFailed(URI uri, SocketAddress sa, IOException ioe) {
				logger.warn("Proxy connection to {} for {} failed: {}", sa, uri, ioe.getMessage());
			}
		};
	}
}
