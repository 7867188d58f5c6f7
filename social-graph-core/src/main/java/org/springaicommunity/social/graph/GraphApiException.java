package org.springaicommunity.social.graph;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when the remote API reports an error.
 *
 * <p>
 * Carries the error type and message as reported by the server (for example
 * {@code OAuthException}), or as synthesized by the client for transport failures and
 * empty responses. The exception message renders as {@code "<type>: <message>"}.
 */
public class GraphApiException extends RuntimeException {

	private final @Nullable String errorType;

	private final String errorMessage;

	public GraphApiException(@Nullable String errorType, @Nullable String errorMessage) {
		this(errorType, errorMessage, null);
	}

	public GraphApiException(@Nullable String errorType, @Nullable String errorMessage, @Nullable Throwable cause) {
		super(render(errorType, errorMessage), cause);
		this.errorType = errorType;
		this.errorMessage = errorMessage != null ? errorMessage : "";
	}

	/**
	 * Build an exception from a parsed error object of the form
	 * {@code {"type": ..., "message": ...}}. Missing or non-object details produce an
	 * exception with empty details.
	 * @param details parsed {@code error} object, may be null
	 * @return the exception
	 */
	public static GraphApiException fromDetails(@Nullable JsonNode details) {
		if (details == null || !details.isObject()) {
			return new GraphApiException(null, null);
		}
		return new GraphApiException(textOrNull(details, "type"), textOrNull(details, "message"));
	}

	public @Nullable String getErrorType() {
		return errorType;
	}

	public String getErrorMessage() {
		return errorMessage;
	}

	private static @Nullable String textOrNull(JsonNode node, String field) {
		JsonNode value = node.get(field);
		return value == null || value.isNull() ? null : value.asText();
	}

	private static String render(@Nullable String type, @Nullable String message) {
		return (type != null ? type : "") + ": " + (message != null ? message : "");
	}

}
