package org.springaicommunity.social.graph;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link RestApi} implementation delegating to an {@link ApiDispatcher}. Requests go to
 * the REST server with {@code format=json}.
 */
public class RestApiService implements RestApi {

	private final ApiDispatcher dispatcher;

	public RestApiService(ApiDispatcher dispatcher) {
		this.dispatcher = dispatcher;
	}

	@Override
	public JsonNode restCall(String method, Map<String, String> args, HttpVerb verb) {
		Map<String, String> params = new LinkedHashMap<>(args);
		params.put("format", "json");
		return dispatcher.call("method/" + method, params, verb, RequestOptions.defaults().withRestApi(),
				ErrorInspectors.rest());
	}

	@Override
	public JsonNode fqlQuery(String query) {
		return restCall("fql.query", Map.of("query", query), HttpVerb.GET);
	}

}
