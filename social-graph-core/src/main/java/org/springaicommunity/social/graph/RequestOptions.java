package org.springaicommunity.social.graph;

import org.jspecify.annotations.Nullable;

/**
 * Per-request options passed through the dispatcher to the {@link Transport}.
 *
 * @param useSsl force a secure connection even when no access token is attached
 * @param restApi route the request to the legacy REST API server instead of the Graph
 * server
 * @param httpComponent when set, the dispatcher returns this part of the response instead
 * of the parsed body
 */
public record RequestOptions(boolean useSsl, boolean restApi, @Nullable HttpComponent httpComponent) {

	private static final RequestOptions DEFAULTS = new RequestOptions(false, false, null);

	public static RequestOptions defaults() {
		return DEFAULTS;
	}

	public static RequestOptions secure() {
		return new RequestOptions(true, false, null);
	}

	public RequestOptions withSsl() {
		return new RequestOptions(true, restApi, httpComponent);
	}

	public RequestOptions withRestApi() {
		return new RequestOptions(useSsl, true, httpComponent);
	}

	public RequestOptions withHttpComponent(@Nullable HttpComponent component) {
		return new RequestOptions(useSsl, restApi, component);
	}

}
