package org.springaicommunity.social.graph;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("GraphClientBuilder Tests")
@ExtendWith(MockitoExtension.class)
class GraphClientBuilderTest {

	@Mock
	private Transport mockTransport;

	@SuppressWarnings("unchecked")
	private final ArgumentCaptor<Map<String, String>> paramsCaptor = ArgumentCaptor.forClass(Map.class);

	private void respondWith(String body) {
		when(mockTransport.request(anyString(), anyMap(), any(HttpVerb.class), any(RequestOptions.class)))
			.thenReturn(new TransportResponse(200, body));
	}

	@Nested
	@DisplayName("API Client Tests")
	class ApiClientTest {

		@Test
		@DisplayName("Should build a Graph API that attaches the user token")
		void shouldBuildGraphApiWithToken() {
			respondWith("{\"id\": \"4\"}");
			GraphApi graph = GraphClientBuilder.create().transport(mockTransport).accessToken("user").buildGraphApi();

			JsonNode me = graph.getObject("me", Map.of());

			assertThat(me.path("id").asText()).isEqualTo("4");
			verify(mockTransport).request(eq("/me"), paramsCaptor.capture(), eq(HttpVerb.GET), any());
			assertThat(paramsCaptor.getValue()).containsEntry("access_token", "user");
		}

		@Test
		@DisplayName("Should fall back to the app token")
		void shouldFallBackToAppToken() {
			ApiDispatcher dispatcher = GraphClientBuilder.create()
				.transport(mockTransport)
				.appAccessToken("app")
				.buildDispatcher();

			assertThat(dispatcher.isAuthenticated()).isTrue();
			assertThat(dispatcher.getAccessToken()).isNull();
		}

		@Test
		@DisplayName("Should build an anonymous REST API")
		void shouldBuildAnonymousRestApi() {
			respondWith("[]");
			RestApi rest = GraphClientBuilder.create().transport(mockTransport).buildRestApi();

			rest.fqlQuery("select 1");

			verify(mockTransport).request(eq("/method/fql.query"), paramsCaptor.capture(), eq(HttpVerb.GET),
					eq(RequestOptions.defaults().withRestApi()));
			assertThat(paramsCaptor.getValue()).doesNotContainKey("access_token");
		}

		@Test
		@DisplayName("Should build a default transport when none is given")
		void shouldBuildDefaultTransport() {
			assertThatCode(() -> GraphClientBuilder.create().buildGraphApi()).doesNotThrowAnyException();
		}

	}

	@Nested
	@DisplayName("Credential Tests")
	class CredentialTest {

		@Test
		@DisplayName("Should require app credentials for the verifier")
		void shouldRequireCredentialsForVerifier() {
			assertThatThrownBy(() -> GraphClientBuilder.create().buildCredentialVerifier())
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("Application credentials are required");
		}

		@Test
		@DisplayName("Should require app credentials for token exchange")
		void shouldRequireCredentialsForTokenExchange() {
			assertThatThrownBy(() -> GraphClientBuilder.create().transport(mockTransport).buildTokenExchangeClient())
				.isInstanceOf(IllegalStateException.class);
		}

		@Test
		@DisplayName("Should apply the configured maximum signed request age")
		void shouldApplyMaxAge() {
			Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
			GraphClientProperties properties = new GraphClientProperties();
			properties.setSignedRequestMaxAgeSeconds(60);
			CredentialVerifier verifier = GraphClientBuilder.create()
				.appCredentials(SignedRequestFixtures.APP_ID, SignedRequestFixtures.APP_SECRET, null)
				.properties(properties)
				.clock(clock)
				.buildCredentialVerifier();

			String request = SignedRequestFixtures.encryptedRequest("{\"user_id\":\"1\"}",
					clock.instant().getEpochSecond() - 120, SignedRequestFixtures.APP_SECRET);

			assertThatThrownBy(() -> verifier.parseSignedRequest(request)).isInstanceOf(SignedRequestException.class)
				.satisfies(e -> assertThat(((SignedRequestException) e).getReason())
					.isEqualTo(SignedRequestException.Reason.TOO_OLD));
		}

		@Test
		@DisplayName("Should not attach user tokens to token exchange requests")
		void shouldNotAttachTokensToExchange() {
			respondWith("access_token=app");
			TokenExchangeClient client = GraphClientBuilder.create()
				.transport(mockTransport)
				.accessToken("user")
				.appCredentials("123", "secret", null)
				.buildTokenExchangeClient();

			client.getAppAccessToken();

			verify(mockTransport).request(eq("/oauth/access_token"), paramsCaptor.capture(), eq(HttpVerb.POST),
					eq(RequestOptions.secure()));
			assertThat(paramsCaptor.getValue()).doesNotContainKey("access_token");
		}

		@Test
		@DisplayName("Should use the configured graph server in OAuth URLs")
		void shouldUseConfiguredGraphServer() {
			GraphClientProperties properties = new GraphClientProperties();
			properties.setGraphServer("graph.example.test");
			TokenExchangeClient client = GraphClientBuilder.create()
				.transport(mockTransport)
				.properties(properties)
				.appCredentials("123", "secret", "http://cb")
				.buildTokenExchangeClient();

			assertThat(client.urlForOAuthCode(OAuthUrlOptions.defaults()))
				.startsWith("https://graph.example.test/oauth/authorize?");
		}

	}

}
