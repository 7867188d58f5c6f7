package org.springaicommunity.social.graph;

import java.util.List;
import java.util.Map;

/**
 * Raw HTTP response returned by a {@link Transport}.
 *
 * @param status HTTP status code
 * @param body response body, never null (empty when the server sent nothing)
 * @param headers response headers, keyed by header name
 */
public record TransportResponse(int status, String body, Map<String, List<String>> headers) {

	public TransportResponse {
		body = body != null ? body : "";
		headers = headers != null ? Map.copyOf(headers) : Map.of();
	}

	public TransportResponse(int status, String body) {
		this(status, body, Map.of());
	}

	/**
	 * Returns true if the server reported an internal failure (5xx).
	 * @return true for status codes of 500 and above
	 */
	public boolean isServerError() {
		return status >= 500;
	}

}
