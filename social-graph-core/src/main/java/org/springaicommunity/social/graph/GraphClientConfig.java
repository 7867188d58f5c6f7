package org.springaicommunity.social.graph;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the Graph client components.
 *
 * <p>
 * Reads {@code GRAPH_APP_ID}, {@code GRAPH_APP_SECRET} and the optional
 * {@code GRAPH_CALLBACK_URL} and {@code GRAPH_ACCESS_TOKEN} from the environment.
 */
@Configuration
public class GraphClientConfig {

	@Value("${GRAPH_APP_ID}")
	private String appId;

	@Value("${GRAPH_APP_SECRET}")
	private String appSecret;

	@Value("${GRAPH_CALLBACK_URL:}")
	private String callbackUrl;

	@Value("${GRAPH_ACCESS_TOKEN:}")
	private String accessToken;

	@Bean
	public GraphClientProperties graphClientProperties() {
		return new GraphClientProperties();
	}

	@Bean
	public ObjectMapper objectMapper() {
		return ObjectMapperFactory.create();
	}

	@Bean
	public AppCredentials appCredentials() {
		return new AppCredentials(appId, appSecret, callbackUrl.isEmpty() ? null : callbackUrl);
	}

	@Bean
	public Transport transport(GraphClientProperties properties) {
		return new JdkHttpTransport(properties);
	}

	@Bean
	public GraphApi graphApi(Transport transport, ObjectMapper objectMapper) {
		return new GraphApiService(
				new ApiDispatcher(transport, objectMapper, accessToken.isEmpty() ? null : accessToken, null));
	}

	@Bean
	public RestApi restApi(Transport transport, ObjectMapper objectMapper) {
		return new RestApiService(
				new ApiDispatcher(transport, objectMapper, accessToken.isEmpty() ? null : accessToken, null));
	}

	@Bean
	public CredentialVerifier credentialVerifier(AppCredentials appCredentials, ObjectMapper objectMapper,
			GraphClientProperties properties) {
		return GraphClientBuilder.create()
			.appCredentials(appCredentials)
			.objectMapper(objectMapper)
			.properties(properties)
			.buildCredentialVerifier();
	}

	@Bean
	public TokenExchangeClient tokenExchangeClient(AppCredentials appCredentials, Transport transport,
			ObjectMapper objectMapper, GraphClientProperties properties) {
		return GraphClientBuilder.create()
			.appCredentials(appCredentials)
			.transport(transport)
			.objectMapper(objectMapper)
			.properties(properties)
			.buildTokenExchangeClient();
	}

}
