package org.springaicommunity.social.graph;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Factory for the {@link ObjectMapper} shared by the dispatcher, the verifier and the
 * token exchange client.
 *
 * <p>
 * Any JSON root value is accepted, including the bare {@code true} and {@code false}
 * some endpoints answer with, but content after the first value is a parse error.
 * {@link java.time.Instant} values such as {@link AccessToken#expiresAt()} are written as
 * ISO-8601 strings and null record components are left out.
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	/**
	 * Create a new {@link ObjectMapper} with standard configuration.
	 * @return configured ObjectMapper
	 */
	public static ObjectMapper create() {
		ObjectMapper mapper = new ObjectMapper();
		mapper.registerModule(new JavaTimeModule());
		mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
		mapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
		mapper.setDefaultPropertyInclusion(JsonInclude.Include.NON_NULL);
		return mapper;
	}

}
