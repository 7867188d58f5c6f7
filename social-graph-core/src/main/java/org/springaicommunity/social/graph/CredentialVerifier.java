package org.springaicommunity.social.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Verifies credentials signed with the application secret: the session cookie set by the
 * JavaScript SDK and signed requests posted to canvas and tab applications.
 *
 * <p>
 * All signature comparisons are constant-time. Instances are immutable and thread-safe.
 */
public class CredentialVerifier {

	private static final Logger logger = LoggerFactory.getLogger(CredentialVerifier.class);

	private static final String HMAC_ALGORITHM = "HmacSHA256";

	private static final String CIPHER_TRANSFORMATION = "AES/CBC/NoPadding";

	private static final int AES_BLOCK_SIZE = 16;

	public static final long DEFAULT_MAX_AGE_SECONDS = 3600;

	private final AppCredentials credentials;

	private final ObjectMapper objectMapper;

	private final Clock clock;

	private final long defaultMaxAgeSeconds;

	public CredentialVerifier(AppCredentials credentials, ObjectMapper objectMapper) {
		this(credentials, objectMapper, Clock.systemUTC(), DEFAULT_MAX_AGE_SECONDS);
	}

	public CredentialVerifier(AppCredentials credentials, ObjectMapper objectMapper, Clock clock,
			long defaultMaxAgeSeconds) {
		this.credentials = credentials;
		this.objectMapper = objectMapper;
		this.clock = clock;
		this.defaultMaxAgeSeconds = defaultMaxAgeSeconds;
	}

	// ========== Cookie sessions ==========

	/**
	 * Parse and verify the session cookie for this application.
	 *
	 * <p>
	 * A missing, tampered or expired cookie means the user is not logged in, so every
	 * failure yields an empty result rather than an exception.
	 * @param cookies cookie name to raw value
	 * @return the verified session, or empty
	 */
	public Optional<CookieSession> parseCookieSession(Map<String, String> cookies) {
		String raw = cookies.get(credentials.cookieName());
		if (raw == null) {
			return Optional.empty();
		}

		Map<String, String> fields = new LinkedHashMap<>();
		for (String param : raw.replace("\"", "").split("&")) {
			if (param.isEmpty()) {
				continue;
			}
			String[] pair = param.split("=");
			if (pair.length == 0) {
				continue;
			}
			fields.put(pair[0], pair.length > 1 ? pair[1] : "");
		}

		String providedSig = fields.get("sig");
		if (providedSig == null) {
			logger.debug("Session cookie {} carries no signature", credentials.cookieName());
			return Optional.empty();
		}
		if (!constantTimeEquals(cookieSignature(fields), providedSig)) {
			logger.debug("Session cookie {} failed signature check", credentials.cookieName());
			return Optional.empty();
		}
		if (!isUnexpired(fields.get("expires"))) {
			logger.debug("Session cookie {} has expired", credentials.cookieName());
			return Optional.empty();
		}
		return Optional.of(new CookieSession(fields));
	}

	/**
	 * Returns the user id from a verified session cookie.
	 * @param cookies cookie name to raw value
	 * @return the {@code uid} field, or empty if not logged in
	 */
	public Optional<String> getUserFromCookie(Map<String, String> cookies) {
		return parseCookieSession(cookies).map(CookieSession::uid);
	}

	String cookieSignature(Map<String, String> fields) {
		StringBuilder payload = new StringBuilder();
		new TreeMap<>(fields).forEach((key, value) -> {
			if (!"sig".equals(key)) {
				payload.append(key).append('=').append(value);
			}
		});
		payload.append(credentials.appSecret());
		return HexFormat.of().formatHex(md5(payload.toString().getBytes(StandardCharsets.UTF_8)));
	}

	private boolean isUnexpired(@Nullable String expires) {
		if ("0".equals(expires)) {
			return true;
		}
		if (expires == null) {
			return false;
		}
		try {
			return clock.instant().getEpochSecond() < Long.parseLong(expires);
		}
		catch (NumberFormatException e) {
			return false;
		}
	}

	// ========== Signed requests ==========

	/**
	 * Verify and decode a signed request using the configured maximum age.
	 * @param input {@code <base64url signature>.<base64url envelope>}
	 * @return the envelope for plain signed requests, the decrypted payload otherwise
	 * @throws SignedRequestException if the request is malformed, unsupported, too old,
	 * badly signed or cannot be decrypted
	 */
	public JsonNode parseSignedRequest(String input) {
		return parseSignedRequest(input, defaultMaxAgeSeconds);
	}

	/**
	 * Verify and decode a signed request.
	 * @param input {@code <base64url signature>.<base64url envelope>}
	 * @param maxAgeSeconds maximum accepted age of an encrypted request
	 * @return the envelope for plain signed requests, the decrypted payload otherwise
	 * @throws SignedRequestException if the request is malformed, unsupported, too old,
	 * badly signed or cannot be decrypted
	 */
	public JsonNode parseSignedRequest(String input, long maxAgeSeconds) {
		int separator = input.indexOf('.');
		if (separator < 0) {
			throw new SignedRequestException(SignedRequestException.Reason.MALFORMED);
		}
		String encodedSig = input.substring(0, separator);
		String encodedEnvelope = input.substring(separator + 1);

		// the signature covers the raw encoded envelope and is checked before decoding it
		verifySignature(encodedSig, encodedEnvelope);

		SignedEnvelope envelope = decodeEnvelope(encodedEnvelope);
		if (envelope.algorithm().isEncrypted()
				&& envelope.isOlderThan(clock.instant().getEpochSecond(), maxAgeSeconds)) {
			throw new SignedRequestException(SignedRequestException.Reason.TOO_OLD);
		}

		if (!envelope.algorithm().isEncrypted()) {
			return envelope.fields();
		}
		return decryptPayload(envelope);
	}

	private void verifySignature(String encodedSig, String encodedEnvelope) {
		byte[] provided;
		try {
			provided = Base64Url.decode(encodedSig);
		}
		catch (IllegalArgumentException e) {
			throw new SignedRequestException(SignedRequestException.Reason.INVALID_SIGNATURE, e);
		}
		byte[] expected = hmacSha256(encodedEnvelope.getBytes(StandardCharsets.US_ASCII));
		if (!MessageDigest.isEqual(expected, provided)) {
			throw new SignedRequestException(SignedRequestException.Reason.INVALID_SIGNATURE);
		}
	}

	SignedEnvelope decodeEnvelope(String encodedEnvelope) {
		JsonNode fields;
		try {
			fields = objectMapper.readTree(Base64Url.decode(encodedEnvelope));
		}
		catch (IllegalArgumentException | IOException e) {
			throw new SignedRequestException(SignedRequestException.Reason.MALFORMED, e);
		}
		if (fields == null || !fields.isObject()) {
			throw new SignedRequestException(SignedRequestException.Reason.MALFORMED);
		}

		SignatureAlgorithm algorithm = SignatureAlgorithm.fromWireName(fields.path("algorithm").asText(""))
			.orElseThrow(() -> new SignedRequestException(SignedRequestException.Reason.UNSUPPORTED_ALGORITHM));
		long issuedAt = fields.path("issued_at").asLong(0);

		if (!algorithm.isEncrypted()) {
			return new SignedEnvelope(algorithm, issuedAt, null, null, fields);
		}
		try {
			byte[] iv = Base64Url.decode(fields.path("iv").asText(""));
			byte[] payload = Base64Url.decode(fields.path("payload").asText(""));
			return new SignedEnvelope(algorithm, issuedAt, iv, payload, fields);
		}
		catch (IllegalArgumentException e) {
			throw new SignedRequestException(SignedRequestException.Reason.MALFORMED, e);
		}
	}

	private JsonNode decryptPayload(SignedEnvelope envelope) {
		byte[] payload = envelope.payload();
		byte[] iv = envelope.iv();
		if (payload == null || iv == null || payload.length == 0 || payload.length % AES_BLOCK_SIZE != 0) {
			throw new SignedRequestException(SignedRequestException.Reason.DECRYPTION_FAILED);
		}

		byte[] decrypted;
		try {
			Cipher cipher = Cipher.getInstance(CIPHER_TRANSFORMATION);
			cipher.init(Cipher.DECRYPT_MODE,
					new SecretKeySpec(credentials.appSecret().getBytes(StandardCharsets.UTF_8), "AES"),
					new IvParameterSpec(iv));
			decrypted = cipher.doFinal(payload);
		}
		catch (GeneralSecurityException e) {
			logger.debug("Unable to decrypt signed request payload: {}", e.getMessage());
			throw new SignedRequestException(SignedRequestException.Reason.DECRYPTION_FAILED, e);
		}

		String cleartext = new String(stripPadding(decrypted), StandardCharsets.UTF_8);
		try {
			return objectMapper.readTree(trim(cleartext));
		}
		catch (JsonProcessingException e) {
			throw new SignedRequestException(SignedRequestException.Reason.DECRYPTION_FAILED, e);
		}
	}

	/**
	 * The cipher runs without padding, so a PKCS#7 tail is removed here when present.
	 */
	static byte[] stripPadding(byte[] data) {
		if (data.length == 0) {
			return data;
		}
		int pad = data[data.length - 1] & 0xff;
		if (pad < 1 || pad > AES_BLOCK_SIZE || pad > data.length) {
			return data;
		}
		for (int i = data.length - pad; i < data.length; i++) {
			if ((data[i] & 0xff) != pad) {
				return data;
			}
		}
		return Arrays.copyOf(data, data.length - pad);
	}

	private static String trim(String value) {
		int start = 0;
		int end = value.length();
		while (start < end && isBlankOrNul(value.charAt(start))) {
			start++;
		}
		while (end > start && isBlankOrNul(value.charAt(end - 1))) {
			end--;
		}
		return value.substring(start, end);
	}

	private static boolean isBlankOrNul(char c) {
		return c == '\0' || Character.isWhitespace(c);
	}

	// ========== Primitives ==========

	private byte[] hmacSha256(byte[] data) {
		try {
			Mac mac = Mac.getInstance(HMAC_ALGORITHM);
			mac.init(new SecretKeySpec(credentials.appSecret().getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
			return mac.doFinal(data);
		}
		catch (GeneralSecurityException e) {
			throw new IllegalStateException("HmacSHA256 is not available", e);
		}
	}

	private static byte[] md5(byte[] data) {
		try {
			return MessageDigest.getInstance("MD5").digest(data);
		}
		catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("MD5 algorithm not available", e);
		}
	}

	private static boolean constantTimeEquals(String expected, String provided) {
		return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
				provided.getBytes(StandardCharsets.UTF_8));
	}

}
