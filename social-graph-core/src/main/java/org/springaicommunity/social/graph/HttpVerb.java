package org.springaicommunity.social.graph;

import java.util.Locale;

/**
 * HTTP verbs understood by the Graph and REST APIs.
 */
public enum HttpVerb {

	GET, POST, DELETE;

	/**
	 * Lower-case wire name, as used for the {@code method} override parameter.
	 * @return the verb name in lower case
	 */
	public String wireName() {
		return name().toLowerCase(Locale.ROOT);
	}

}
