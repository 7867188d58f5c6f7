package org.springaicommunity.social.graph;

import java.util.Arrays;
import java.util.Optional;

/**
 * Algorithms accepted in the {@code algorithm} field of a signed request envelope. Any
 * other value is rejected.
 */
public enum SignatureAlgorithm {

	/**
	 * Signed, cleartext payload carried in the envelope itself.
	 */
	HMAC_SHA256("HMAC-SHA256"),

	/**
	 * Signed envelope carrying an AES-256-CBC encrypted {@code payload} and its
	 * {@code iv}.
	 */
	AES_256_CBC_HMAC_SHA256("AES-256-CBC HMAC-SHA256");

	private final String wireName;

	SignatureAlgorithm(String wireName) {
		this.wireName = wireName;
	}

	public String getWireName() {
		return wireName;
	}

	public boolean isEncrypted() {
		return this == AES_256_CBC_HMAC_SHA256;
	}

	/**
	 * Look up an algorithm by its exact wire name.
	 * @param wireName the value of the envelope's {@code algorithm} field
	 * @return the algorithm, or empty if unsupported
	 */
	public static Optional<SignatureAlgorithm> fromWireName(String wireName) {
		return Arrays.stream(values()).filter(a -> a.wireName.equals(wireName)).findFirst();
	}

}
