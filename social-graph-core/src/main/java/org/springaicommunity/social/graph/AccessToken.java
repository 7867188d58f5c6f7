package org.springaicommunity.social.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * An access token and its optional expiration. Owned by the caller; the library never
 * persists it.
 *
 * @param value the opaque token string
 * @param expiresAt expiration instant, or null for tokens that do not expire
 */
public record AccessToken(@JsonProperty("access_token") String value,
		@JsonProperty("expires_at") @Nullable Instant expiresAt) {

	/**
	 * Build a token from a parsed token endpoint response. The {@code expires} field
	 * counts seconds from now; it is absent or {@code 0} for tokens that never expire.
	 * @param info parsed {@code access_token=...&expires=...} response
	 * @param clock clock used to anchor the relative expiration
	 * @return the token
	 * @throws IllegalArgumentException if the response has no access token
	 */
	public static AccessToken fromTokenInfo(Map<String, String> info, Clock clock) {
		String value = info.get("access_token");
		if (value == null || value.isEmpty()) {
			throw new IllegalArgumentException("Token response does not contain an access_token");
		}
		Instant expiresAt = null;
		String expires = info.get("expires");
		if (expires != null) {
			try {
				long seconds = Long.parseLong(expires);
				if (seconds > 0) {
					expiresAt = clock.instant().plusSeconds(seconds);
				}
			}
			catch (NumberFormatException e) {
				throw new IllegalArgumentException("Invalid expires value '" + expires + "' in token response", e);
			}
		}
		return new AccessToken(value, expiresAt);
	}

	/**
	 * Returns true if the token has an expiration that is not after {@code now}.
	 * @param now the instant to compare against
	 * @return true if expired
	 */
	public boolean isExpiredAt(Instant now) {
		return expiresAt != null && !now.isBefore(expiresAt);
	}

	@Override
	public String toString() {
		return "AccessToken[value=****, expiresAt=" + expiresAt + "]";
	}

}
