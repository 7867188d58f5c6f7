package org.springaicommunity.social.graph.cli;

import java.util.Arrays;
import java.util.Optional;

/**
 * Commands understood by {@link GraphClientCli}.
 */
public enum CliCommand {

	SIGNED_REQUEST("signed-request", "<input>", 1, true),

	COOKIE("cookie", "<cookie value>", 1, true),

	OAUTH_URL("oauth-url", "", 0, true),

	ACCESS_TOKEN_URL("access-token-url", "<code>", 1, true),

	ACCESS_TOKEN("access-token", "<code>", 1, true),

	APP_TOKEN("app-token", "", 0, true),

	EXCHANGE_SESSIONS("exchange-sessions", "<key1,key2,...>", 1, true),

	GET("get", "<path>", 1, false);

	private final String commandName;

	private final String usage;

	private final int arity;

	private final boolean requiresAppCredentials;

	CliCommand(String commandName, String usage, int arity, boolean requiresAppCredentials) {
		this.commandName = commandName;
		this.usage = usage;
		this.arity = arity;
		this.requiresAppCredentials = requiresAppCredentials;
	}

	public String getCommandName() {
		return commandName;
	}

	public String getUsage() {
		return usage;
	}

	/**
	 * Number of positional arguments the command takes.
	 */
	public int getArity() {
		return arity;
	}

	public boolean requiresAppCredentials() {
		return requiresAppCredentials;
	}

	public static Optional<CliCommand> fromName(String name) {
		return Arrays.stream(values()).filter(c -> c.commandName.equals(name)).findFirst();
	}

}
