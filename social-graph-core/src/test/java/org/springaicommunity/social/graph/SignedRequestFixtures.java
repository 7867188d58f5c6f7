package org.springaicommunity.social.graph;

import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Builds signed requests and session cookies the way the platform does, for use as test
 * input.
 */
final class SignedRequestFixtures {

	/** 32 bytes, usable as an AES-256 key. */
	static final String APP_SECRET = "0123456789abcdef0123456789abcdef";

	static final String APP_ID = "123";

	private SignedRequestFixtures() {
	}

	static String encode(byte[] bytes) {
		return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
	}

	static String encode(String value) {
		return encode(value.getBytes(StandardCharsets.UTF_8));
	}

	static byte[] hmac(String secret, String data) {
		try {
			Mac mac = Mac.getInstance("HmacSHA256");
			mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
			return mac.doFinal(data.getBytes(StandardCharsets.US_ASCII));
		}
		catch (GeneralSecurityException e) {
			throw new IllegalStateException(e);
		}
	}

	/**
	 * Sign an envelope JSON with the given secret.
	 */
	static String sign(String envelopeJson, String secret) {
		String encodedEnvelope = encode(envelopeJson);
		return encode(hmac(secret, encodedEnvelope)) + "." + encodedEnvelope;
	}

	/**
	 * Encrypt a payload with AES-256-CBC and PKCS#5 padding, returning the base64url
	 * ciphertext.
	 */
	static String encrypt(String payloadJson, String secret, byte[] iv) {
		try {
			Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
			cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "AES"),
					new IvParameterSpec(iv));
			return encode(cipher.doFinal(payloadJson.getBytes(StandardCharsets.UTF_8)));
		}
		catch (GeneralSecurityException e) {
			throw new IllegalStateException(e);
		}
	}

	/**
	 * Build a signed, encrypted request.
	 */
	static String encryptedRequest(String payloadJson, long issuedAt, String secret) {
		byte[] iv = "fedcba9876543210".getBytes(StandardCharsets.US_ASCII);
		String envelope = "{\"algorithm\":\"AES-256-CBC HMAC-SHA256\",\"issued_at\":" + issuedAt + ",\"iv\":\""
				+ encode(iv) + "\",\"payload\":\"" + encrypt(payloadJson, secret, iv) + "\"}";
		return sign(envelope, secret);
	}

	static String md5Hex(String value) {
		try {
			return HexFormat.of()
				.formatHex(MessageDigest.getInstance("MD5").digest(value.getBytes(StandardCharsets.UTF_8)));
		}
		catch (GeneralSecurityException e) {
			throw new IllegalStateException(e);
		}
	}

}
