package org.springaicommunity.social.graph;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/**
 * Decoded envelope of a signed request whose signature has already been checked.
 *
 * @param algorithm signing (and optionally encryption) algorithm
 * @param issuedAt issue time in epoch seconds, 0 when absent
 * @param iv initialization vector, present for the encrypted variant
 * @param payload encrypted payload, present for the encrypted variant
 * @param fields the full envelope JSON
 */
public record SignedEnvelope(SignatureAlgorithm algorithm, long issuedAt, byte @Nullable [] iv,
		byte @Nullable [] payload, JsonNode fields) {

	/**
	 * Returns true if the envelope was issued before {@code nowSeconds - maxAgeSeconds}.
	 * @param nowSeconds current time in epoch seconds
	 * @param maxAgeSeconds accepted age
	 * @return true if the envelope is too old
	 */
	public boolean isOlderThan(long nowSeconds, long maxAgeSeconds) {
		return issuedAt < nowSeconds - maxAgeSeconds;
	}

}
