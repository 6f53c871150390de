package dev.jbang.pypimirror;

import static org.assertj.core.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class SnapshotCommandTest {
	private HttpServer server;
	private String base;
	private StringWriter out;

	@BeforeEach
	void setUp() throws IOException {
		server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
		serve("/simple/", "<a href=\"foo/\">foo</a>\n<a href=\"bar/\">bar</a>\n<a href=\"baz/\">baz</a>\n");
		serve(
				"/simple/foo/",
				"<a href=\"../../packages/aa/foo-1.0.tar.gz#sha256=1\">foo-1.0.tar.gz</a>\n"
						+ "<a href=\"../../packages/bb/foo-2.0rc1.tar.gz#sha256=2\">foo-2.0rc1.tar.gz</a>\n"
						+ "<a href=\"../../packages/cc/foo-1.1.tar.gz#sha256=3\">foo-1.1.tar.gz</a>\n");
		serve("/simple/baz/", "<a href=\"/packages/dd/baz-0.1.zip\">baz-0.1.zip</a>\n");
		server.createContext("/simple/bar/", exchange -> {
			exchange.sendResponseHeaders(500, -1);
			exchange.close();
		});
		server.start();
		base = "http://127.0.0.1:" + server.getAddress().getPort();
		out = new StringWriter();
	}

	@AfterEach
	void tearDown() {
		server.stop(0);
	}

	private void serve(String path, String html) {
		server.createContext(path, exchange -> {
			if (!exchange.getRequestURI().getPath().equals(path)) {
				exchange.sendResponseHeaders(404, -1);
				exchange.close();
				return;
			}
			byte[] body = html.getBytes(StandardCharsets.UTF_8);
			exchange.sendResponseHeaders(200, body.length);
			try (OutputStream stream = exchange.getResponseBody()) {
				stream.write(body);
			}
		});
	}

	private int run(Map<String, String> environment, String... args) {
		SnapshotCommand command = new SnapshotCommand();
		command.environment = environment;
		return new CommandLine(command).setOut(new PrintWriter(out)).execute(args);
	}

	@Test
	void testTextSnapshot() {
		// When
		int exitCode = run(Map.of(), "--simple-base", base + "/simple", "--package-base", base + "/packages", "-t", "2");

		// Then
		assertThat(exitCode).isZero();
		assertThat(out.toString().lines())
				.containsExactly("aa/foo-1.0.tar.gz", "bb/foo-2.0rc1.tar.gz", "cc/foo-1.1.tar.gz", "dd/baz-0.1.zip");
	}

	@Test
	void testJsonSnapshotWithRetention() throws Exception {
		// When
		int exitCode = run(
				Map.of(),
				"--simple-base", base + "/simple/",
				"--package-base", base + "/packages",
				"--keep-recent", "1",
				"--format", "json");

		// Then
		assertThat(exitCode).isZero();
		JsonNode document = new ObjectMapper().readTree(out.toString());
		assertThat(document.get("packageBase").asText()).isEqualTo(base + "/packages");
		assertThat(document.get("count").asInt()).isEqualTo(2);
		assertThat(document.get("entries").get(0).asText()).isEqualTo("cc/foo-1.1.tar.gz");
		assertThat(document.get("entries").get(1).asText()).isEqualTo("dd/baz-0.1.zip");
	}

	@Test
	void testMalformedProxyIsFatal() {
		// When
		int exitCode = run(Map.of("https_proxy", "http://:8080"), "--simple-base", base + "/simple");

		// Then
		assertThat(exitCode).isEqualTo(1);
		assertThat(out.toString()).isEmpty();
	}

	@Test
	void testInvalidKeepRecent() {
		assertThat(run(Map.of(), "--simple-base", base + "/simple", "--keep-recent", "0")).isEqualTo(1);
	}

	@Test
	void testInvalidThreads() {
		assertThat(run(Map.of(), "--simple-base", base + "/simple", "--threads", "0")).isEqualTo(1);
	}

	@Test
	void testUnreachableIndex() {
		// When
		int exitCode = run(Map.of(), "--simple-base", "http://127.0.0.1:1/simple");

		// Then
		assertThat(exitCode).isEqualTo(1);
		assertThat(out.toString()).isEmpty();
	}

	@Test
	void testPopularityWithoutProject() {
		assertThat(run(Map.of(), "--simple-base", base + "/simple", "--bq-query")).isEqualTo(1);
	}
}
