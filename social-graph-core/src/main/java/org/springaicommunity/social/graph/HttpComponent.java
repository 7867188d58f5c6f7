package org.springaicommunity.social.graph;

/**
 * Part of the raw HTTP response a caller can ask for instead of the parsed JSON body.
 */
public enum HttpComponent {

	STATUS, HEADERS, BODY

}
