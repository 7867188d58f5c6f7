package org.springaicommunity.social.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Default {@link Transport} built on the Java 11+ {@link HttpClient}.
 *
 * <p>
 * Requests go to the Graph server, or to the REST server when
 * {@link RequestOptions#restApi()} is set. A secure connection is used whenever an access
 * token is attached or {@link RequestOptions#useSsl()} is requested. Verbs other than GET
 * and POST are tunnelled as a POST carrying a {@code method} parameter, which is how the
 * remote service expects deletes.
 *
 * <p>
 * Only the verb and path are logged. Parameters may carry access tokens and client
 * secrets and never reach the log.
 */
public class JdkHttpTransport implements Transport {

	private static final Logger logger = LoggerFactory.getLogger(JdkHttpTransport.class);

	private static final String ACCESS_TOKEN = "access_token";

	private final HttpClient httpClient;

	private final GraphClientProperties properties;

	public JdkHttpTransport(GraphClientProperties properties) {
		this(HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build(), properties);
	}

	JdkHttpTransport(HttpClient httpClient, GraphClientProperties properties) {
		this.httpClient = httpClient;
		this.properties = properties;
	}

	@Override
	public TransportResponse request(String path, Map<String, String> params, HttpVerb verb, RequestOptions options) {
		Map<String, String> args = new LinkedHashMap<>(params);
		HttpVerb wireVerb = verb;
		if (verb != HttpVerb.GET && verb != HttpVerb.POST) {
			args.put("method", verb.wireName());
			wireVerb = HttpVerb.POST;
		}

		URI baseUri = buildUri(path, args, options);
		HttpRequest.Builder builder = HttpRequest.newBuilder().header("User-Agent", properties.getUserAgent());
		HttpRequest request;
		if (wireVerb == HttpVerb.GET) {
			String query = encodeForm(args);
			URI uri = query.isEmpty() ? baseUri : URI.create(baseUri + "?" + query);
			request = builder.uri(uri).GET().build();
		}
		else {
			request = builder.uri(baseUri)
				.header("Content-Type", "application/x-www-form-urlencoded")
				.POST(HttpRequest.BodyPublishers.ofString(encodeForm(args)))
				.build();
		}

		String description = verb + " " + path;
		logger.debug("{} ({})", description, baseUri.getHost());
		long start = System.currentTimeMillis();
		try {
			TransportResponse response = execute(request);
			logger.debug("{} completed in {}ms with status {} ({} bytes)", description,
					System.currentTimeMillis() - start, response.status(), response.body().length());
			return response;
		}
		catch (GraphTransportException e) {
			logger.debug("{} failed after {}ms: {}", description, System.currentTimeMillis() - start, e.getMessage());
			throw e;
		}
	}

	/**
	 * Build the request URI without query string.
	 */
	URI buildUri(String path, Map<String, String> params, RequestOptions options) {
		boolean secure = options.useSsl() || params.containsKey(ACCESS_TOKEN);
		String server = options.restApi() ? properties.getRestServer() : properties.getGraphServer();
		return URI.create((secure ? "https" : "http") + "://" + server + path);
	}

	static String encodeForm(Map<String, String> params) {
		return params.entrySet()
			.stream()
			.map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
			.collect(Collectors.joining("&"));
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}

	private TransportResponse execute(HttpRequest request) {
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
			return new TransportResponse(response.statusCode(), response.body(), response.headers().map());
		}
		catch (IOException e) {
			logger.error("HTTP request failed: {}", e.getMessage());
			throw new GraphTransportException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GraphTransportException("HTTP request interrupted", e);
		}
	}

}
