package org.springaicommunity.social.graph;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Interface for Graph API operations.
 *
 * <p>
 * Every method funnels through {@link #graphCall}, which raises {@link GraphApiException}
 * when the response carries an {@code error} object.
 */
public interface GraphApi {

	/**
	 * Fetch an arbitrary Graph path.
	 * @param path object id or connection path
	 * @param args request parameters
	 * @param verb HTTP verb
	 * @param options request options
	 * @return parsed response
	 * @throws GraphApiException if the API reports an error
	 */
	JsonNode graphCall(String path, Map<String, String> args, HttpVerb verb, RequestOptions options);

	/**
	 * Get a single object.
	 * @param id object id, e.g. "me" or a numeric id
	 * @param args additional parameters such as {@code fields}
	 * @return the object
	 */
	JsonNode getObject(String id, Map<String, String> args);

	/**
	 * Get several objects in one request.
	 * @param ids object ids
	 * @param args additional parameters
	 * @return object keyed by id
	 */
	JsonNode getObjects(List<String> ids, Map<String, String> args);

	/**
	 * Get a connection of an object, e.g. "friends" or "feed".
	 * @param id object id
	 * @param connectionName connection name
	 * @param args additional parameters
	 * @return the connection page
	 */
	JsonNode getConnections(String id, String connectionName, Map<String, String> args);

	/**
	 * Write an object to a connection of a parent object. Requires a user access token;
	 * without one a {@link GraphApiException} of type {@code MissingAccessToken} is thrown
	 * before any request is sent.
	 * @param parentObject parent object id
	 * @param connectionName connection name, e.g. "feed" or "comments"
	 * @param args fields of the new object
	 * @return the API response, typically the new object id
	 */
	JsonNode putObject(String parentObject, String connectionName, Map<String, String> args);

	/**
	 * Post a message to a profile's wall.
	 * @param message message text
	 * @param attachment optional attachment fields (name, link, caption, ...)
	 * @param profileId target profile, "me" for the current user
	 * @return the API response
	 */
	JsonNode putWallPost(String message, Map<String, String> attachment, String profileId);

	/**
	 * Post a message to the current user's wall.
	 * @param message message text
	 * @param attachment optional attachment fields
	 * @return the API response
	 */
	default JsonNode putWallPost(String message, Map<String, String> attachment) {
		return putWallPost(message, attachment, "me");
	}

	JsonNode putComment(String objectId, String message);

	JsonNode putLike(String objectId);

	JsonNode deleteObject(String id);

	JsonNode deleteLike(String objectId);

	/**
	 * Search public objects.
	 * @param term search term
	 * @param args additional parameters such as {@code type}
	 * @return the search results page
	 */
	JsonNode search(String term, Map<String, String> args);

}
