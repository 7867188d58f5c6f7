package org.springaicommunity.social.graph;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.time.Clock;

/**
 * Builder for creating Graph client components without Spring dependencies.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Graph API calls on behalf of a user
 * GraphApi graph = GraphClientBuilder.create()
 *     .accessToken(userToken)
 *     .buildGraphApi();
 * JsonNode me = graph.getObject("me", Map.of());
 *
 * // Signed request and cookie verification
 * CredentialVerifier verifier = GraphClientBuilder.create()
 *     .appCredentials("123", "secret", "https://example.com/callback")
 *     .buildCredentialVerifier();
 *
 * // Credentials from GRAPH_APP_ID / GRAPH_APP_SECRET
 * TokenExchangeClient tokens = GraphClientBuilder.create()
 *     .appCredentialsFromEnv()
 *     .buildTokenExchangeClient();
 *
 * // For testing with a mock transport
 * Transport mockTransport = mock(Transport.class);
 * GraphApi testGraph = GraphClientBuilder.create()
 *     .transport(mockTransport)
 *     .buildGraphApi();
 * }
 * </pre>
 */
public class GraphClientBuilder {

	private GraphClientProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable Transport transport;

	private @Nullable AppCredentials appCredentials;

	private @Nullable String accessToken;

	private @Nullable String appAccessToken;

	private Clock clock = Clock.systemUTC();

	private GraphClientBuilder() {
		this.properties = new GraphClientProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new GraphClientBuilder
	 */
	public static GraphClientBuilder create() {
		return new GraphClientBuilder();
	}

	/**
	 * Set the application credentials used for signatures and token exchange.
	 * @param appId application id
	 * @param appSecret application secret
	 * @param callbackUrl default OAuth redirect URI (may be null)
	 * @return this builder
	 */
	public GraphClientBuilder appCredentials(String appId, String appSecret, @Nullable String callbackUrl) {
		this.appCredentials = new AppCredentials(appId, appSecret, callbackUrl);
		return this;
	}

	public GraphClientBuilder appCredentials(AppCredentials credentials) {
		this.appCredentials = credentials;
		return this;
	}

	/**
	 * Read the application credentials from {@code GRAPH_APP_ID},
	 * {@code GRAPH_APP_SECRET} and the optional {@code GRAPH_CALLBACK_URL}.
	 * @return this builder
	 * @throws IllegalStateException if the id or secret is not set
	 */
	public GraphClientBuilder appCredentialsFromEnv() {
		this.appCredentials = new AppCredentials(EnvironmentSupport.require(EnvironmentSupport.APP_ID),
				EnvironmentSupport.require(EnvironmentSupport.APP_SECRET),
				EnvironmentSupport.get(EnvironmentSupport.CALLBACK_URL));
		return this;
	}

	/**
	 * Set the user access token attached to every API call.
	 * @param accessToken user access token (null for anonymous calls)
	 * @return this builder
	 */
	public GraphClientBuilder accessToken(@Nullable String accessToken) {
		this.accessToken = accessToken;
		return this;
	}

	/**
	 * Set the application access token, attached only when no user token is set.
	 * @param appAccessToken application access token (may be null)
	 * @return this builder
	 */
	public GraphClientBuilder appAccessToken(@Nullable String appAccessToken) {
		this.appAccessToken = appAccessToken;
		return this;
	}

	/**
	 * Set configuration properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public GraphClientBuilder properties(@Nullable GraphClientProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public GraphClientBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom Transport implementation. Useful for testing with mocks or for
	 * plugging in another HTTP library.
	 * @param transport custom Transport implementation (null to use
	 * {@link JdkHttpTransport})
	 * @return this builder
	 */
	public GraphClientBuilder transport(@Nullable Transport transport) {
		this.transport = transport;
		return this;
	}

	/**
	 * Set the clock used for cookie expiry and signed request age checks.
	 * @param clock the clock
	 * @return this builder
	 */
	public GraphClientBuilder clock(Clock clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Build the request dispatcher directly (for advanced usage).
	 * @return configured ApiDispatcher
	 */
	public ApiDispatcher buildDispatcher() {
		return new ApiDispatcher(resolveTransport(), resolveObjectMapper(), accessToken, appAccessToken);
	}

	/**
	 * Build a GraphApi.
	 * @return configured GraphApi
	 */
	public GraphApi buildGraphApi() {
		return new GraphApiService(buildDispatcher());
	}

	/**
	 * Build a RestApi.
	 * @return configured RestApi
	 */
	public RestApi buildRestApi() {
		return new RestApiService(buildDispatcher());
	}

	/**
	 * Build a CredentialVerifier.
	 * @return configured CredentialVerifier
	 * @throws IllegalStateException if no application credentials were set
	 */
	public CredentialVerifier buildCredentialVerifier() {
		return new CredentialVerifier(requireAppCredentials(), resolveObjectMapper(), clock,
				properties.getSignedRequestMaxAgeSeconds());
	}

	/**
	 * Build a TokenExchangeClient. Token exchange authenticates with the client
	 * credentials, so no access token is attached by its dispatcher.
	 * @return configured TokenExchangeClient
	 * @throws IllegalStateException if no application credentials were set
	 */
	public TokenExchangeClient buildTokenExchangeClient() {
		ObjectMapper mapper = resolveObjectMapper();
		ApiDispatcher dispatcher = new ApiDispatcher(resolveTransport(), mapper);
		return new TokenExchangeClient(dispatcher, requireAppCredentials(), mapper, properties.getGraphServer());
	}

	private AppCredentials requireAppCredentials() {
		if (appCredentials == null) {
			throw new IllegalStateException(
					"Application credentials are required. Call appCredentials() or appCredentialsFromEnv() first.");
		}
		return appCredentials;
	}

	private ObjectMapper resolveObjectMapper() {
		return objectMapper != null ? objectMapper : ObjectMapperFactory.create();
	}

	private Transport resolveTransport() {
		return transport != null ? transport : new JdkHttpTransport(properties);
	}

}
