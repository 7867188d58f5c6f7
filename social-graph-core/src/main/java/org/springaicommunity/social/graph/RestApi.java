package org.springaicommunity.social.graph;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Interface for the legacy REST API.
 */
public interface RestApi {

	/**
	 * Call a REST API method, e.g. {@code fql.query} or {@code users.getInfo}.
	 * @param method REST method name
	 * @param args method arguments
	 * @param verb HTTP verb
	 * @return parsed response
	 * @throws GraphApiException if the response carries an {@code error_code}
	 */
	JsonNode restCall(String method, Map<String, String> args, HttpVerb verb);

	/**
	 * Run an FQL query.
	 * @param query the FQL statement
	 * @return the result rows
	 */
	JsonNode fqlQuery(String query);

}
