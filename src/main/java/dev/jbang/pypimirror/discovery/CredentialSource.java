package dev.jbang.pypimirror.discovery;

import com.google.auth.http.HttpTransportFactory;
import com.google.auth.oauth2.ComputeEngineCredentials;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.auth.oauth2.ServiceAccountCredentials;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Where Google credentials come from, decided once from the environment: a service account key
 * file named by {@code GOOGLE_APPLICATION_CREDENTIALS}, or else the instance metadata server.
 */
public record CredentialSource(Kind kind, Path keyFile) {
	public static final String CREDENTIALS_ENV = "GOOGLE_APPLICATION_CREDENTIALS";

	public enum Kind {
		SERVICE_ACCOUNT,
		INSTANCE_METADATA
	}

	public CredentialSource {
		if (kind == Kind.SERVICE_ACCOUNT && keyFile == null) {
			throw new IllegalArgumentException("A service account needs a key file");
		}
	}

	public static CredentialSource fromEnvironment(Map<String, String> env) {
		String keyFile = env.get(CREDENTIALS_ENV);
		if (keyFile != null && !keyFile.isBlank()) {
			return new CredentialSource(Kind.SERVICE_ACCOUNT, Path.of(keyFile.trim()));
		}
		return new CredentialSource(Kind.INSTANCE_METADATA, null);
	}

	/**
	 * Load the credentials.
	 *
	 * @param transportFactory transport used for token requests
	 * @throws DiscoveryException if the key file cannot be read or is not a service account key
	 */
	public GoogleCredentials load(HttpTransportFactory transportFactory) throws DiscoveryException {
		return switch (kind) {
			case SERVICE_ACCOUNT -> {
				try (InputStream in = Files.newInputStream(keyFile)) {
					yield ServiceAccountCredentials.fromStream(in, transportFactory);
				} catch (IOException e) {
					throw new DiscoveryException("Failed to load service account key from " + keyFile, e);
				}
			}
			case INSTANCE_METADATA -> ComputeEngineCredentials.newBuilder()
					.setHttpTransportFactory(transportFactory)
					.build();
		};
	}
}
