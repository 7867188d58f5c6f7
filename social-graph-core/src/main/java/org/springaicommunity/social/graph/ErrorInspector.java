package org.springaicommunity.social.graph;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Hook invoked by {@link ApiDispatcher} with the parsed body of a successful (non-5xx)
 * response.
 *
 * <p>
 * Some endpoints answer with structurally valid JSON that still represents an error, for
 * example {@code {"error": {...}}} on the Graph API or {@code {"error_code": ...}} on the
 * REST API. An inspector detects such shapes and throws.
 */
@FunctionalInterface
public interface ErrorInspector {

	/**
	 * Inspect a parsed response body.
	 * @param body parsed body, {@code MissingNode} when the response was empty
	 * @throws GraphApiException if the body represents an error
	 */
	void inspect(JsonNode body);

}
