package org.springaicommunity.social.graph;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Session fields parsed from the JavaScript SDK cookie ({@code fbs_<appId>}).
 *
 * @param fields every field of the cookie, in cookie order, including {@code sig}
 */
public record CookieSession(Map<String, String> fields) {

	public CookieSession {
		fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
	}

	public @Nullable String uid() {
		return fields.get("uid");
	}

	public @Nullable String accessToken() {
		return fields.get("access_token");
	}

	public @Nullable String expires() {
		return fields.get("expires");
	}

	public @Nullable String sig() {
		return fields.get("sig");
	}

	public @Nullable String get(String key) {
		return fields.get(key);
	}

	@Override
	public String toString() {
		return "CookieSession[uid=" + uid() + ", expires=" + expires() + "]";
	}

}
