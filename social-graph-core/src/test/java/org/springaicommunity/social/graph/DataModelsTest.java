package org.springaicommunity.social.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the value types and exceptions.
 */
@DisplayName("Data Models Tests")
class DataModelsTest {

	private final ObjectMapper objectMapper = ObjectMapperFactory.create();

	private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

	@Nested
	@DisplayName("AccessToken Tests")
	class AccessTokenTest {

		@Test
		@DisplayName("Should anchor relative expiry to the clock")
		void shouldAnchorExpiry() {
			AccessToken token = AccessToken.fromTokenInfo(Map.of("access_token", "abc", "expires", "3600"), clock);

			assertThat(token.value()).isEqualTo("abc");
			assertThat(token.expiresAt()).isEqualTo(Instant.parse("2024-05-01T13:00:00Z"));
			assertThat(token.isExpiredAt(clock.instant())).isFalse();
			assertThat(token.isExpiredAt(Instant.parse("2024-05-01T13:00:00Z"))).isTrue();
		}

		@ParameterizedTest
		@ValueSource(strings = { "0", "-5" })
		@DisplayName("Should treat non-positive expiry as never expiring")
		void shouldTreatZeroAsNonExpiring(String expires) {
			AccessToken token = AccessToken.fromTokenInfo(Map.of("access_token", "abc", "expires", expires), clock);

			assertThat(token.expiresAt()).isNull();
			assertThat(token.isExpiredAt(Instant.MAX)).isFalse();
		}

		@Test
		@DisplayName("Should reject responses without a token")
		void shouldRejectMissingToken() {
			assertThatThrownBy(() -> AccessToken.fromTokenInfo(Map.of("expires", "10"), clock))
				.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("Should reject non-numeric expiry")
		void shouldRejectBadExpiry() {
			assertThatThrownBy(() -> AccessToken.fromTokenInfo(Map.of("access_token", "a", "expires", "soon"), clock))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("soon");
		}

		@Test
		@DisplayName("Should redact the token value in toString")
		void shouldRedactToken() {
			assertThat(new AccessToken("secret-token", null).toString()).doesNotContain("secret-token");
		}

		@Test
		@DisplayName("Should serialize with wire field names")
		void shouldSerializeWithWireNames() {
			JsonNode json = objectMapper.valueToTree(new AccessToken("abc", Instant.parse("2024-05-01T13:00:00Z")));

			assertThat(json.path("access_token").asText()).isEqualTo("abc");
			assertThat(json.path("expires_at").asText()).isEqualTo("2024-05-01T13:00:00Z");
		}

		@Test
		@DisplayName("Should omit a missing expiry when serialized")
		void shouldOmitMissingExpiry() {
			JsonNode json = objectMapper.valueToTree(new AccessToken("abc", null));

			assertThat(json.has("expires_at")).isFalse();
		}

		@Test
		@DisplayName("Should reject content after the first JSON value")
		void shouldRejectTrailingContent() {
			assertThatThrownBy(() -> objectMapper.readTree("true false"))
				.isInstanceOf(JsonProcessingException.class);
		}

	}

	@Nested
	@DisplayName("AppCredentials Tests")
	class AppCredentialsTest {

		@Test
		@DisplayName("Should derive the cookie name from the app id")
		void shouldDeriveCookieName() {
			assertThat(new AppCredentials("123", "s").cookieName()).isEqualTo("fbs_123");
		}

		@ParameterizedTest
		@ValueSource(strings = { "", "  " })
		@DisplayName("Should reject a blank app id")
		void shouldRejectBlankAppId(String appId) {
			assertThatThrownBy(() -> new AppCredentials(appId, "s")).isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("Should reject an empty secret")
		void shouldRejectEmptySecret() {
			assertThatThrownBy(() -> new AppCredentials("123", "")).isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("Should redact the secret in toString")
		void shouldRedactSecret() {
			assertThat(new AppCredentials("123", "top-secret", "http://cb").toString()).contains("123")
				.doesNotContain("top-secret");
		}

	}

	@Nested
	@DisplayName("CookieSession Tests")
	class CookieSessionTest {

		@Test
		@DisplayName("Should expose well-known fields")
		void shouldExposeFields() {
			CookieSession session = new CookieSession(
					Map.of("uid", "1", "access_token", "t", "expires", "0", "sig", "abc", "secret", "x"));

			assertThat(session.uid()).isEqualTo("1");
			assertThat(session.accessToken()).isEqualTo("t");
			assertThat(session.expires()).isEqualTo("0");
			assertThat(session.sig()).isEqualTo("abc");
			assertThat(session.get("secret")).isEqualTo("x");
			assertThat(session.get("missing")).isNull();
		}

		@Test
		@DisplayName("Should copy and freeze the fields")
		void shouldCopyFields() {
			Map<String, String> source = new HashMap<>(Map.of("uid", "1"));
			CookieSession session = new CookieSession(source);
			source.put("uid", "2");

			assertThat(session.uid()).isEqualTo("1");
			assertThatThrownBy(() -> session.fields().put("uid", "3"))
				.isInstanceOf(UnsupportedOperationException.class);
		}

		@Test
		@DisplayName("Should keep the access token out of toString")
		void shouldRedactAccessToken() {
			CookieSession session = new CookieSession(Map.of("uid", "1", "access_token", "very-secret"));

			assertThat(session.toString()).contains("uid=1").doesNotContain("very-secret");
		}

	}

	@Nested
	@DisplayName("Exception Tests")
	class ExceptionTest {

		@Test
		@DisplayName("Should render type and message")
		void shouldRenderTypeAndMessage() {
			GraphApiException e = new GraphApiException("OAuthException", "bad token");

			assertThat(e).hasMessage("OAuthException: bad token");
			assertThat(e.getErrorType()).isEqualTo("OAuthException");
			assertThat(e.getErrorMessage()).isEqualTo("bad token");
		}

		@Test
		@DisplayName("Should build from error details")
		void shouldBuildFromDetails() throws Exception {
			JsonNode details = objectMapper.readTree("{\"type\":\"GraphMethodException\",\"message\":\"Unsupported\"}");

			assertThat(GraphApiException.fromDetails(details)).hasMessage("GraphMethodException: Unsupported");
		}

		@Test
		@DisplayName("Should build empty details from missing or non-object input")
		void shouldBuildEmptyDetails() throws Exception {
			assertThat(GraphApiException.fromDetails(null)).hasMessage(": ");
			assertThat(GraphApiException.fromDetails(objectMapper.readTree("\"oops\""))).hasMessage(": ")
				.satisfies(e -> assertThat(e.getErrorType()).isNull());
		}

		@Test
		@DisplayName("Should describe server errors with status and body")
		void shouldDescribeServerErrors() {
			GraphTransportException e = new GraphTransportException(503, "down");

			assertThat(e).isInstanceOf(GraphApiException.class).hasMessage("HTTP 503: Response body: down");
			assertThat(e.getStatusCode()).isEqualTo(503);
			assertThat(e.getResponseBody()).isEqualTo("down");
		}

		@Test
		@DisplayName("Should describe signed request failures")
		void shouldDescribeSignedRequestFailures() {
			SignedRequestException e = new SignedRequestException(SignedRequestException.Reason.TOO_OLD);

			assertThat(e).hasMessage("Invalid request. (Too old.)");
			assertThat(e.getReason()).isEqualTo(SignedRequestException.Reason.TOO_OLD);
		}

	}

	@Nested
	@DisplayName("Enum And Options Tests")
	class EnumAndOptionsTest {

		@Test
		@DisplayName("Should look up algorithms by exact wire name")
		void shouldLookUpAlgorithms() {
			assertThat(SignatureAlgorithm.fromWireName("HMAC-SHA256")).contains(SignatureAlgorithm.HMAC_SHA256);
			assertThat(SignatureAlgorithm.fromWireName("AES-256-CBC HMAC-SHA256"))
				.contains(SignatureAlgorithm.AES_256_CBC_HMAC_SHA256);
			assertThat(SignatureAlgorithm.fromWireName("hmac-sha256")).isEmpty();
			assertThat(SignatureAlgorithm.AES_256_CBC_HMAC_SHA256.isEncrypted()).isTrue();
			assertThat(SignatureAlgorithm.HMAC_SHA256.isEncrypted()).isFalse();
		}

		@Test
		@DisplayName("Should use lowercase wire names for verbs")
		void shouldUseLowercaseVerbs() {
			assertThat(HttpVerb.DELETE.wireName()).isEqualTo("delete");
		}

		@Test
		@DisplayName("Should compose request options")
		void shouldComposeOptions() {
			RequestOptions options = RequestOptions.defaults()
				.withRestApi()
				.withSsl()
				.withHttpComponent(HttpComponent.HEADERS);

			assertThat(options).isEqualTo(new RequestOptions(true, true, HttpComponent.HEADERS));
			assertThat(RequestOptions.defaults()).isEqualTo(new RequestOptions(false, false, null));
		}

		@Test
		@DisplayName("Should copy OAuth permissions")
		void shouldCopyPermissions() {
			OAuthUrlOptions options = OAuthUrlOptions.defaults().withPermissions(List.of("email"));

			assertThat(options.permissions()).containsExactly("email");
			assertThat(options.callback()).isNull();
		}

		@Test
		@DisplayName("Should flag server error responses")
		void shouldFlagServerErrors() {
			assertThat(new TransportResponse(500, "").isServerError()).isTrue();
			assertThat(new TransportResponse(499, "").isServerError()).isFalse();
			assertThat(new TransportResponse(200, null).body()).isEmpty();
		}

	}

}
