package org.springaicommunity.social.graph;

import java.util.Map;

/**
 * Interface for the HTTP transport used by the dispatcher.
 *
 * <p>
 * Implementations perform exactly one request per call and report the status, body and
 * headers without interpreting them. Classification of the response (server errors, JSON
 * errors) is the job of {@link ApiDispatcher}. Implementations are supplied explicitly at
 * construction time; there is no global default.
 */
public interface Transport {

	/**
	 * Execute a request.
	 * @param path API path, always beginning with "/"
	 * @param params request parameters (query string for GET, form body otherwise)
	 * @param verb HTTP verb
	 * @param options per-request options
	 * @return the raw response
	 * @throws GraphTransportException if the request could not be performed at all
	 */
	TransportResponse request(String path, Map<String, String> params, HttpVerb verb, RequestOptions options);

}
