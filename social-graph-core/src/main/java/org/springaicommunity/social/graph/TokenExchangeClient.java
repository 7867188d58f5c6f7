package org.springaicommunity.social.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds OAuth URLs and exchanges authorization codes, client credentials and legacy
 * session keys for access tokens.
 *
 * <p>
 * All exchanges go to {@code /oauth/<endpoint>} over a secure connection with the
 * application's {@code client_id} and {@code client_secret}. The {@code access_token}
 * endpoint answers in form encoding ({@code access_token=...&expires=...}), not JSON; the
 * {@code exchange_sessions} endpoint answers with a JSON array.
 */
public class TokenExchangeClient {

	private static final Logger logger = LoggerFactory.getLogger(TokenExchangeClient.class);

	private static final String ACCESS_TOKEN_ENDPOINT = "access_token";

	private static final String EXCHANGE_SESSIONS_ENDPOINT = "exchange_sessions";

	private final ApiDispatcher dispatcher;

	private final AppCredentials credentials;

	private final ObjectMapper objectMapper;

	private final String graphServer;

	public TokenExchangeClient(ApiDispatcher dispatcher, AppCredentials credentials, ObjectMapper objectMapper,
			String graphServer) {
		this.dispatcher = dispatcher;
		this.credentials = credentials;
		this.objectMapper = objectMapper;
		this.graphServer = graphServer;
	}

	// ========== URLs ==========

	/**
	 * Build the URL that sends the user to the authorization dialog.
	 * @param options callback override and permissions
	 * @return the authorization URL
	 * @throws IllegalArgumentException if no callback is given and none is configured
	 */
	public String urlForOAuthCode(OAuthUrlOptions options) {
		String callback = requireCallback(options, "urlForOAuthCode");
		String scope = options.permissions().isEmpty() ? "" : "&scope=" + String.join(",", options.permissions());
		return "https://" + graphServer + "/oauth/authorize?client_id=" + credentials.appId() + "&redirect_uri="
				+ callback + scope;
	}

	/**
	 * Build the URL that exchanges an authorization code for an access token.
	 * @param code authorization code returned to the callback
	 * @param options callback override
	 * @return the token URL
	 * @throws IllegalArgumentException if no callback is given and none is configured
	 */
	public String urlForAccessToken(String code, OAuthUrlOptions options) {
		String callback = requireCallback(options, "urlForAccessToken");
		return "https://" + graphServer + "/oauth/access_token?client_id=" + credentials.appId() + "&redirect_uri="
				+ callback + "&client_secret=" + credentials.appSecret() + "&code=" + code;
	}

	private String requireCallback(OAuthUrlOptions options, String operation) {
		String callback = options.callback() != null ? options.callback() : credentials.callbackUrl();
		if (callback == null || callback.isEmpty()) {
			throw new IllegalArgumentException(
					operation + " must get a callback either from the app credentials or in the options");
		}
		return callback;
	}

	// ========== Code and client credential exchange ==========

	/**
	 * Exchange an authorization code for token information.
	 * @param code authorization code
	 * @return parsed response fields, typically {@code access_token} and {@code expires}
	 * @throws GraphApiException if the server reports an error
	 */
	public Map<String, String> getAccessTokenInfo(String code) {
		Map<String, String> args = new LinkedHashMap<>();
		args.put("code", code);
		if (credentials.callbackUrl() != null) {
			args.put("redirect_uri", credentials.callbackUrl());
		}
		return getTokenFromServer(args, false);
	}

	public Optional<String> getAccessToken(String code) {
		return Optional.ofNullable(getAccessTokenInfo(code).get("access_token"));
	}

	/**
	 * Fetch the application's own access token using client credentials.
	 * @return parsed response fields
	 * @throws GraphApiException if the server reports an error
	 */
	public Map<String, String> getAppAccessTokenInfo() {
		return getTokenFromServer(Map.of("type", "client_cred"), true);
	}

	public Optional<String> getAppAccessToken() {
		return Optional.ofNullable(getAppAccessTokenInfo().get("access_token"));
	}

	private Map<String, String> getTokenFromServer(Map<String, String> args, boolean usePost) {
		String result = fetchTokenString(args, usePost, ACCESS_TOKEN_ENDPOINT);

		if (result.contains("error")) {
			throw upstreamError(result);
		}
		return parseAccessToken(result);
	}

	static Map<String, String> parseAccessToken(String responseText) {
		Map<String, String> components = new LinkedHashMap<>();
		for (String bit : responseText.trim().split("&")) {
			if (bit.isEmpty()) {
				continue;
			}
			String[] pair = bit.split("=");
			if (pair.length == 0) {
				continue;
			}
			components.put(pair[0], pair.length > 1 ? pair[1] : "");
		}
		return components;
	}

	// ========== Session key exchange ==========

	/**
	 * Exchange legacy session keys for access tokens.
	 * @param sessions session keys
	 * @return JSON array with one token object (or null) per session key, in input order
	 * @throws EmptyResponseException if the server returns an empty body
	 * @throws GraphApiException if the server reports an error
	 */
	public JsonNode getTokenInfoFromSessionKeys(List<String> sessions) {
		Map<String, String> args = new LinkedHashMap<>();
		args.put("type", "client_cred");
		args.put("sessions", String.join(",", sessions));
		String response = fetchTokenString(args, true, EXCHANGE_SESSIONS_ENDPOINT);

		if (response.isEmpty()) {
			throw new EmptyResponseException("getTokenInfoFromSessionKeys received an empty response body for "
					+ sessions.size() + " session key(s)");
		}

		JsonNode parsed;
		try {
			parsed = objectMapper.readTree(response);
		}
		catch (JsonProcessingException e) {
			throw new GraphApiException("JsonParseError", "Unable to parse session exchange response", e);
		}
		if (parsed.isObject() && parsed.has("error")) {
			throw GraphApiException.fromDetails(parsed.get("error"));
		}
		return parsed;
	}

	/**
	 * Exchange legacy session keys for access token strings.
	 * @param sessions session keys
	 * @return one entry per session key in input order, null where no token was issued
	 */
	public List<@Nullable String> getTokensFromSessionKeys(List<String> sessions) {
		JsonNode results = getTokenInfoFromSessionKeys(sessions);
		List<@Nullable String> tokens = new ArrayList<>();
		for (JsonNode result : results) {
			JsonNode token = result.path("access_token");
			tokens.add(result.isObject() && token.isTextual() ? token.asText() : null);
		}
		return tokens;
	}

	public Optional<String> getTokenFromSessionKey(String session) {
		List<@Nullable String> tokens = getTokensFromSessionKeys(List.of(session));
		return tokens.isEmpty() ? Optional.empty() : Optional.ofNullable(tokens.get(0));
	}

	// ========== Transport ==========

	/**
	 * Send an authenticated request to an OAuth endpoint and return the raw body.
	 * @param args endpoint arguments, merged after the client credentials
	 * @param usePost send as POST instead of GET
	 * @param endpoint endpoint name under {@code /oauth/}
	 * @return the response body
	 */
	public String fetchTokenString(Map<String, String> args, boolean usePost, String endpoint) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("client_id", credentials.appId());
		params.put("client_secret", credentials.appSecret());
		params.putAll(args);

		logger.debug("Requesting token from /oauth/{}", endpoint);
		return dispatcher.request("/oauth/" + endpoint, params, usePost ? HttpVerb.POST : HttpVerb.GET,
				RequestOptions.secure())
			.body();
	}

	private GraphApiException upstreamError(String body) {
		@Nullable
		JsonNode details = null;
		try {
			details = objectMapper.readTree(body).get("error");
		}
		catch (JsonProcessingException e) {
			logger.debug("Token endpoint error body is not JSON");
		}
		return GraphApiException.fromDetails(details);
	}

}
