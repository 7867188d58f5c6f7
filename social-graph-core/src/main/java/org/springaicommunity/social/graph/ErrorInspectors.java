package org.springaicommunity.social.graph;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Standard {@link ErrorInspector} implementations for the two API flavours.
 */
public final class ErrorInspectors {

	private static final ErrorInspector GRAPH = body -> {
		if (body.isObject() && body.has("error")) {
			throw GraphApiException.fromDetails(body.get("error"));
		}
	};

	private static final ErrorInspector REST = body -> {
		if (body.isObject() && body.has("error_code")) {
			JsonNode message = body.path("error_msg");
			throw new GraphApiException(body.get("error_code").asText(),
					message.isMissingNode() || message.isNull() ? null : message.asText());
		}
	};

	private ErrorInspectors() {
	}

	/**
	 * Graph API errors: an object carrying an {@code error} object with {@code type} and
	 * {@code message}.
	 * @return the inspector
	 */
	public static ErrorInspector graph() {
		return GRAPH;
	}

	/**
	 * REST API errors: an object carrying {@code error_code} and {@code error_msg}.
	 * @return the inspector
	 */
	public static ErrorInspector rest() {
		return REST;
	}

}
