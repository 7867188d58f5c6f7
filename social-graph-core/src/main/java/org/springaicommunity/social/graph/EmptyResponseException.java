package org.springaicommunity.social.graph;

/**
 * Exception thrown when an endpoint that must answer with a body returned nothing. The
 * session key exchange does this for some invalid keys.
 */
public class EmptyResponseException extends GraphApiException {

	public EmptyResponseException(String message) {
		super("EmptyResponse", message);
	}

}
