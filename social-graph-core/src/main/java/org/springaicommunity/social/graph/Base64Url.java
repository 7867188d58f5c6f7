package org.springaicommunity.social.graph;

import java.util.Base64;

/**
 * Decoder for the unpadded base64url strings used in signed requests.
 */
final class Base64Url {

	private Base64Url() {
	}

	/**
	 * Decode a base64url string, tolerating missing padding.
	 * @param value encoded value
	 * @return decoded bytes
	 * @throws IllegalArgumentException if the value is not valid base64
	 */
	static byte[] decode(String value) {
		StringBuilder standard = new StringBuilder(value.replace('-', '+').replace('_', '/'));
		while (standard.length() % 4 != 0) {
			standard.append('=');
		}
		return Base64.getDecoder().decode(standard.toString());
	}

}
