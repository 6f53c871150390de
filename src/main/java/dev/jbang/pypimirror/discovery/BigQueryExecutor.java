package dev.jbang.pypimirror.discovery;

import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.auth.http.HttpTransportFactory;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.BigQueryOptions;
import com.google.cloud.bigquery.FieldValue;
import com.google.cloud.bigquery.FieldValueList;
import com.google.cloud.bigquery.JobException;
import com.google.cloud.bigquery.QueryJobConfiguration;
import com.google.cloud.bigquery.TableResult;
import com.google.cloud.http.HttpTransportOptions;
import dev.jbang.pypimirror.util.ProxySettings;
import java.net.Proxy;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link QueryExecutor} backed by the Google BigQuery client */
public class BigQueryExecutor implements QueryExecutor {
	private static final Logger logger = LoggerFactory.getLogger(BigQueryExecutor.class);

	public static final String PROJECT_ID_ENV = "PROJECT_ID";
	private static final String BIGQUERY_SCOPE = "https://www.googleapis.com/auth/bigquery";
	private static final URI BIGQUERY_ENDPOINT = URI.create("https://bigquery.googleapis.com/");

	private final BigQuery bigQuery;

	BigQueryExecutor(BigQuery bigQuery) {
		this.bigQuery = bigQuery;
	}

	/**
	 * Provider reading the project identifier and credential source from the environment.
	 * Nothing is resolved until {@link QueryExecutor.Provider#acquire()} is called.
	 */
	public static QueryExecutor.Provider fromEnvironment(Map<String, String> env, ProxySettings proxySettings) {
		return () -> {
			String projectId = env.get(PROJECT_ID_ENV);
			if (projectId == null || projectId.isBlank()) {
				throw new DiscoveryException("Environment variable " + PROJECT_ID_ENV + " is not set");
			}
			return acquire(projectId.trim(), CredentialSource.fromEnvironment(env), proxySettings);
		};
	}

	/**
	 * Create a BigQuery client for the given project. Token requests and queries both go through
	 * the configured proxy.
	 */
	public static BigQueryExecutor acquire(String projectId, CredentialSource source, ProxySettings proxySettings)
			throws DiscoveryException {
		Proxy proxy = proxySettings.proxyFor(BIGQUERY_ENDPOINT).orElse(null);
		HttpTransportFactory transportFactory =
				() -> new NetHttpTransport.Builder().setProxy(proxy).build();

		logger.info("Using {} credentials for BigQuery project {}", source.kind(), projectId);
		GoogleCredentials credentials = source.load(transportFactory).createScoped(List.of(BIGQUERY_SCOPE));
		try {
			BigQuery bigQuery = BigQueryOptions.newBuilder()
					.setProjectId(projectId)
					.setCredentials(credentials)
					.setTransportOptions(HttpTransportOptions.newBuilder()
							.setHttpTransportFactory(transportFactory)
							.build())
					.build()
					.getService();
			return new BigQueryExecutor(bigQuery);
		} catch (RuntimeException e) {
			throw new DiscoveryException("Failed to create BigQuery client: " + e.getMessage(), e);
		}
	}

	@Override
	public List<String> queryFirstColumn(String sql) throws DiscoveryException, InterruptedException {
		QueryJobConfiguration query =
				QueryJobConfiguration.newBuilder(sql).setUseLegacySql(false).build();
		TableResult result;
		try {
			result = bigQuery.query(query);
		} catch (BigQueryException | JobException e) {
			throw new DiscoveryException("BigQuery query failed: " + e.getMessage(), e);
		}

		List<String> values = new ArrayList<>();
		try {
			for (FieldValueList row : result.iterateAll()) {
				if (row.isEmpty()) {
					throw new DiscoveryException("BigQuery returned a row without columns");
				}
				FieldValue value = row.get(0);
				if (value.isNull() || value.getAttribute() != FieldValue.Attribute.PRIMITIVE) {
					throw new DiscoveryException("BigQuery returned an invalid value in row " + values.size());
				}
				values.add(value.getStringValue());
			}
		} catch (BigQueryException e) {
			throw new DiscoveryException("Failed to read BigQuery result: " + e.getMessage(), e);
		}
		return values;
	}
}
