package org.springaicommunity.social.graph;

/**
 * Configuration properties for the social Graph client.
 *
 * <p>
 * Properties can be set directly via setters or passed to {@link GraphClientBuilder}.
 * Default values point at the public production servers and are suitable for most use
 * cases.
 */
public class GraphClientProperties {

	/**
	 * Host serving the Graph API and the OAuth endpoints.
	 */
	private String graphServer = "graph.facebook.com";

	/**
	 * Host serving the legacy REST API.
	 */
	private String restServer = "api.facebook.com";

	/**
	 * Connect timeout in seconds for the default transport.
	 */
	private int connectTimeoutSeconds = 30;

	/**
	 * User-Agent header sent with every request.
	 */
	private String userAgent = "social-graph-client";

	/**
	 * Maximum age in seconds accepted for encrypted signed requests.
	 */
	private long signedRequestMaxAgeSeconds = 3600;

	public String getGraphServer() {
		return graphServer;
	}

	public void setGraphServer(String graphServer) {
		this.graphServer = graphServer;
	}

	public String getRestServer() {
		return restServer;
	}

	public void setRestServer(String restServer) {
		this.restServer = restServer;
	}

	public int getConnectTimeoutSeconds() {
		return connectTimeoutSeconds;
	}

	public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
		this.connectTimeoutSeconds = connectTimeoutSeconds;
	}

	public String getUserAgent() {
		return userAgent;
	}

	public void setUserAgent(String userAgent) {
		this.userAgent = userAgent;
	}

	public long getSignedRequestMaxAgeSeconds() {
		return signedRequestMaxAgeSeconds;
	}

	public void setSignedRequestMaxAgeSeconds(long signedRequestMaxAgeSeconds) {
		this.signedRequestMaxAgeSeconds = signedRequestMaxAgeSeconds;
	}

}
