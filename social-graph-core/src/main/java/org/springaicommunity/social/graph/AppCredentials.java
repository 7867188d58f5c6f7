package org.springaicommunity.social.graph;

import org.jspecify.annotations.Nullable;

/**
 * Application id, secret and default OAuth callback.
 *
 * @param appId application id
 * @param appSecret application secret, used for signatures and token exchange
 * @param callbackUrl default OAuth redirect URI, may be null
 */
public record AppCredentials(String appId, String appSecret, @Nullable String callbackUrl) {

	public AppCredentials {
		if (appId == null || appId.isBlank()) {
			throw new IllegalArgumentException("appId is required");
		}
		if (appSecret == null || appSecret.isEmpty()) {
			throw new IllegalArgumentException("appSecret is required");
		}
	}

	public AppCredentials(String appId, String appSecret) {
		this(appId, appSecret, null);
	}

	/**
	 * Name of the cookie the JavaScript SDK sets for this application.
	 * @return {@code fbs_<appId>}
	 */
	public String cookieName() {
		return "fbs_" + appId;
	}

	@Override
	public String toString() {
		return "AppCredentials[appId=" + appId + ", appSecret=****, callbackUrl=" + callbackUrl + "]";
	}

}
