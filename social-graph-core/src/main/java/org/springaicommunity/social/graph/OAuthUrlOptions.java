package org.springaicommunity.social.graph;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Options for building OAuth URLs.
 *
 * @param callback redirect URI overriding the configured default, may be null
 * @param permissions extended permissions to request, empty for none
 */
public record OAuthUrlOptions(@Nullable String callback, List<String> permissions) {

	public OAuthUrlOptions {
		permissions = permissions != null ? List.copyOf(permissions) : List.of();
	}

	public static OAuthUrlOptions defaults() {
		return new OAuthUrlOptions(null, List.of());
	}

	public static OAuthUrlOptions withCallback(String callback) {
		return new OAuthUrlOptions(callback, List.of());
	}

	public OAuthUrlOptions withPermissions(List<String> permissions) {
		return new OAuthUrlOptions(callback, permissions);
	}

}
