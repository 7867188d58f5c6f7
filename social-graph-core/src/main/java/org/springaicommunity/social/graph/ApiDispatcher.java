package org.springaicommunity.social.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds authenticated requests, sends them through a {@link Transport} and maps the
 * response to parsed JSON or to a {@link GraphApiException}.
 *
 * <p>
 * Every endpoint module funnels through {@link #call}. The dispatcher holds no mutable
 * state; the tokens are fixed at construction, so one instance can be shared freely
 * across threads.
 */
public class ApiDispatcher {

	private static final Logger logger = LoggerFactory.getLogger(ApiDispatcher.class);

	static final String ACCESS_TOKEN = "access_token";

	private final Transport transport;

	private final ObjectMapper objectMapper;

	private final @Nullable String accessToken;

	private final @Nullable String appAccessToken;

	public ApiDispatcher(Transport transport, ObjectMapper objectMapper) {
		this(transport, objectMapper, null, null);
	}

	public ApiDispatcher(Transport transport, ObjectMapper objectMapper, @Nullable String accessToken,
			@Nullable String appAccessToken) {
		this.transport = transport;
		this.objectMapper = objectMapper;
		this.accessToken = accessToken;
		this.appAccessToken = appAccessToken;
	}

	public @Nullable String getAccessToken() {
		return accessToken;
	}

	/**
	 * Returns true if either a user or an app access token will be attached to calls.
	 * @return true if requests are authenticated
	 */
	public boolean isAuthenticated() {
		return accessToken != null || appAccessToken != null;
	}

	public JsonNode call(String path) {
		return call(path, Map.of(), HttpVerb.GET, RequestOptions.defaults(), null);
	}

	public JsonNode call(String path, Map<String, String> params) {
		return call(path, params, HttpVerb.GET, RequestOptions.defaults(), null);
	}

	public JsonNode call(String path, Map<String, String> params, HttpVerb verb) {
		return call(path, params, verb, RequestOptions.defaults(), null);
	}

	/**
	 * Fetch the given path.
	 * @param path API path, a leading "/" is added when missing
	 * @param params request parameters, never modified
	 * @param verb HTTP verb
	 * @param options request options
	 * @param inspector optional hook run on the parsed body to detect endpoint-specific
	 * errors
	 * @return the parsed body, or the requested {@link HttpComponent} as a JSON node
	 * ({@code IntNode} status, {@code ObjectNode} headers, {@code TextNode} body)
	 * @throws GraphTransportException if the server answered with a 5xx status
	 * @throws GraphApiException if the body is not valid JSON or the inspector rejects it
	 */
	public JsonNode call(String path, Map<String, String> params, HttpVerb verb, RequestOptions options,
			@Nullable ErrorInspector inspector) {
		Map<String, String> args = new LinkedHashMap<>(params);
		String token = accessToken != null ? accessToken : appAccessToken;
		if (token != null) {
			args.put(ACCESS_TOKEN, token);
		}

		TransportResponse response = request(path, args, verb, options);

		JsonNode body = parseBody(response.body());
		if (inspector != null) {
			inspector.inspect(body);
		}

		HttpComponent component = options.httpComponent();
		if (component == null) {
			return body;
		}
		return switch (component) {
			case STATUS -> IntNode.valueOf(response.status());
			case HEADERS -> objectMapper.valueToTree(response.headers());
			case BODY -> TextNode.valueOf(response.body());
		};
	}

	/**
	 * Send a request without attaching tokens or parsing the body. Used for endpoints
	 * whose responses are not JSON, such as the OAuth token endpoint.
	 * @param path API path, a leading "/" is added when missing
	 * @param params request parameters
	 * @param verb HTTP verb
	 * @param options request options
	 * @return the raw response
	 * @throws GraphTransportException if the server answered with a 5xx status
	 */
	public TransportResponse request(String path, Map<String, String> params, HttpVerb verb,
			RequestOptions options) {
		String normalizedPath = normalizePath(path);
		TransportResponse response = transport.request(normalizedPath, params, verb, options);

		// 5xx bodies are not guaranteed to be JSON, so they are never parsed
		if (response.isServerError()) {
			logger.error("{} {} failed with HTTP {}", verb, normalizedPath, response.status());
			throw new GraphTransportException(response.status(), response.body());
		}
		return response;
	}

	static String normalizePath(String path) {
		return path.startsWith("/") ? path : "/" + path;
	}

	private JsonNode parseBody(String body) {
		if (body.isBlank()) {
			return MissingNode.getInstance();
		}
		try {
			// Jackson accepts bare scalars such as "true" as root values
			return objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			logger.debug("Response body is not valid JSON: {}", e.getOriginalMessage());
			throw new GraphApiException("JsonParseError", "Unable to parse response body: " + e.getOriginalMessage(),
					e);
		}
	}

}
