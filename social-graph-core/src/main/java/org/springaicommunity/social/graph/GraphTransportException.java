package org.springaicommunity.social.graph;

/**
 * Exception thrown when the server fails with a 5xx status, or when the request could not
 * be performed at all.
 *
 * <p>
 * Server error bodies are not guaranteed to be JSON, so the raw body is attached as-is.
 * For I/O failures the status code is {@code -1} and the cause is attached.
 */
public class GraphTransportException extends GraphApiException {

	private final int statusCode;

	private final String responseBody;

	public GraphTransportException(int statusCode, String responseBody) {
		super("HTTP " + statusCode, "Response body: " + responseBody);
		this.statusCode = statusCode;
		this.responseBody = responseBody;
	}

	public GraphTransportException(String message, Throwable cause) {
		super("Transport", message, cause);
		this.statusCode = -1;
		this.responseBody = "";
	}

	public int getStatusCode() {
		return statusCode;
	}

	public String getResponseBody() {
		return responseBody;
	}

}
