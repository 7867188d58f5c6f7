package org.springaicommunity.social.graph;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

/**
 * Resolves configuration such as {@code GRAPH_APP_ID} and {@code GRAPH_APP_SECRET} by
 * checking a {@code .env} file first, then falling back to the system environment. The
 * {@code .env} files are loaded once and cached for the lifetime of the process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>{@code .env} file in the current working directory (if present)</li>
 * <li>System environment variable ({@link System#getenv})</li>
 * <li>{@code .env} file in the user's home directory (if present)</li>
 * </ol>
 */
public final class EnvironmentSupport {

	public static final String APP_ID = "GRAPH_APP_ID";

	public static final String APP_SECRET = "GRAPH_APP_SECRET";

	public static final String CALLBACK_URL = "GRAPH_CALLBACK_URL";

	public static final String ACCESS_TOKEN = "GRAPH_ACCESS_TOKEN";

	private static final Dotenv CWD_DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private static final Dotenv HOME_DOTENV = loadHomeDotenv();

	private static Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home != null) {
			return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
		}
		return CWD_DOTENV;
	}

	private EnvironmentSupport() {
	}

	/**
	 * Get an environment variable value.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found or blank
	 */
	@Nullable
	public static String get(String name) {
		String value = CWD_DOTENV.get(name);
		if (value == null) {
			value = HOME_DOTENV.get(name);
		}
		return value == null || value.isBlank() ? null : value;
	}

	/**
	 * Get a required environment variable value.
	 * @param name the variable name
	 * @return the value
	 * @throws IllegalStateException if the variable is not set
	 */
	public static String require(String name) {
		String value = get(name);
		if (value == null) {
			throw new IllegalStateException(name + " environment variable is required.");
		}
		return value;
	}

}
