package org.springaicommunity.social.graph;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link GraphApi} implementation delegating to an {@link ApiDispatcher}.
 */
public class GraphApiService implements GraphApi {

	static final String MISSING_ACCESS_TOKEN = "MissingAccessToken";

	private final ApiDispatcher dispatcher;

	public GraphApiService(ApiDispatcher dispatcher) {
		this.dispatcher = dispatcher;
	}

	@Override
	public JsonNode graphCall(String path, Map<String, String> args, HttpVerb verb, RequestOptions options) {
		return dispatcher.call(path, args, verb, options, ErrorInspectors.graph());
	}

	@Override
	public JsonNode getObject(String id, Map<String, String> args) {
		return graphCall(id, args, HttpVerb.GET, RequestOptions.defaults());
	}

	@Override
	public JsonNode getObjects(List<String> ids, Map<String, String> args) {
		Map<String, String> params = new LinkedHashMap<>(args);
		params.put("ids", String.join(",", ids));
		return graphCall("", params, HttpVerb.GET, RequestOptions.defaults());
	}

	@Override
	public JsonNode getConnections(String id, String connectionName, Map<String, String> args) {
		return graphCall(id + "/" + connectionName, args, HttpVerb.GET, RequestOptions.defaults());
	}

	@Override
	public JsonNode putObject(String parentObject, String connectionName, Map<String, String> args) {
		requireAccessToken("write to the social graph");
		return graphCall(parentObject + "/" + connectionName, args, HttpVerb.POST, RequestOptions.defaults());
	}

	@Override
	public JsonNode putWallPost(String message, Map<String, String> attachment, String profileId) {
		Map<String, String> args = new LinkedHashMap<>(attachment);
		args.put("message", message);
		return putObject(profileId, "feed", args);
	}

	@Override
	public JsonNode putComment(String objectId, String message) {
		return putObject(objectId, "comments", Map.of("message", message));
	}

	@Override
	public JsonNode putLike(String objectId) {
		return putObject(objectId, "likes", Map.of());
	}

	@Override
	public JsonNode deleteObject(String id) {
		requireAccessToken("delete objects");
		return graphCall(id, Map.of(), HttpVerb.DELETE, RequestOptions.defaults());
	}

	@Override
	public JsonNode deleteLike(String objectId) {
		requireAccessToken("delete likes");
		return graphCall(objectId + "/likes", Map.of(), HttpVerb.DELETE, RequestOptions.defaults());
	}

	@Override
	public JsonNode search(String term, Map<String, String> args) {
		Map<String, String> params = new LinkedHashMap<>(args);
		params.put("q", term);
		return graphCall("search", params, HttpVerb.GET, RequestOptions.defaults());
	}

	private void requireAccessToken(String action) {
		if (dispatcher.getAccessToken() == null) {
			throw new GraphApiException(MISSING_ACCESS_TOKEN, "An access token is required to " + action);
		}
	}

}
