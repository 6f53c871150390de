package dev.jbang.pypimirror.util;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/** Utility class for HTTP operations */
public class HttpUtils implements HttpFetcher {

	private static final String USER_AGENT = "pypi-mirror-snapshot";

	private final HttpClient httpClient;

	public HttpUtils() {
		this(ProxySettings.none());
	}

	public HttpUtils(ProxySettings proxySettings) {
		HttpClient.Builder builder = HttpClient.newBuilder()
				.followRedirects(HttpClient.Redirect.NORMAL)
				.connectTimeout(Duration.ofSeconds(30));
		if (!proxySettings.isEmpty()) {
			builder.proxy(proxySettings.selector());
		}
		this.httpClient = builder.build();
	}

	/** Download content from a URL as a string; any status outside 2xx is an error */
	@Override
	public String fetch(String url) throws IOException, InterruptedException {
		HttpRequest request = request(url).build();
		HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
		if (response.statusCode() < 200 || response.statusCode() >= 300) {
			throw new IOException("Failed to download content: " + url + " - HTTP status: " + response.statusCode());
		}
		return response.body();
	}

	private HttpRequest.Builder request(String url) {
		return HttpRequest.newBuilder().uri(URI.create(url)).header("User-Agent", USER_AGENT).GET();
	}
}
