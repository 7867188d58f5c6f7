package org.springaicommunity.social.graph;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import static org.assertj.core.api.Assertions.*;

/**
 * Spring context tests for {@link GraphClientConfig}.
 *
 * Only bean wiring is exercised. No request is sent, so the real
 * {@link JdkHttpTransport} bean never opens a connection.
 */
@SpringJUnitConfig(GraphClientConfig.class)
@TestPropertySource(properties = { "GRAPH_APP_ID=123", "GRAPH_APP_SECRET=test-secret",
		"GRAPH_CALLBACK_URL=http://example.com/callback" })
@DisplayName("GraphClientConfig - Spring Context Tests")
class GraphClientConfigTest {

	@Autowired
	private AppCredentials appCredentials;

	@Autowired
	private ObjectMapper objectMapper;

	@Autowired
	private Transport transport;

	@Autowired
	private GraphApi graphApi;

	@Autowired
	private RestApi restApi;

	@Autowired
	private CredentialVerifier credentialVerifier;

	@Autowired
	private TokenExchangeClient tokenExchangeClient;

	@Nested
	@DisplayName("Spring Bean Wiring Validation")
	class SpringBeanWiringTest {

		@Test
		@DisplayName("Should bind application credentials from properties")
		void shouldBindCredentials() {
			assertThat(appCredentials.appId()).isEqualTo("123");
			assertThat(appCredentials.appSecret()).isEqualTo("test-secret");
			assertThat(appCredentials.callbackUrl()).isEqualTo("http://example.com/callback");
		}

		@Test
		@DisplayName("Should wire the default transport and API modules")
		void shouldWireApiModules() {
			assertThat(transport).isInstanceOf(JdkHttpTransport.class);
			assertThat(graphApi).isInstanceOf(GraphApiService.class);
			assertThat(restApi).isInstanceOf(RestApiService.class);
		}

		@Test
		@DisplayName("Should configure the shared ObjectMapper")
		void shouldConfigureObjectMapper() {
			assertThat(objectMapper.isEnabled(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)).isFalse();
		}

	}

	@Nested
	@DisplayName("Configured Component Behaviour")
	class ConfiguredComponentTest {

		@Test
		@DisplayName("Should build OAuth URLs from the configured credentials")
		void shouldBuildOAuthUrls() {
			assertThat(tokenExchangeClient.urlForOAuthCode(OAuthUrlOptions.defaults())).isEqualTo(
					"https://graph.facebook.com/oauth/authorize?client_id=123&redirect_uri=http://example.com/callback");
		}

		@Test
		@DisplayName("Should verify signed requests with the configured secret")
		void shouldVerifyWithConfiguredSecret() {
			String envelope = "{\"algorithm\":\"HMAC-SHA256\",\"user_id\":\"7\"}";
			String request = SignedRequestFixtures.sign(envelope, "test-secret");

			assertThat(credentialVerifier.parseSignedRequest(request).path("user_id").asText()).isEqualTo("7");
		}

	}

}
