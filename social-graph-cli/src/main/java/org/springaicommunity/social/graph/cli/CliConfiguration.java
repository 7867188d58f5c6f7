package org.springaicommunity.social.graph.cli;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration parsed from the command line.
 */
public class CliConfiguration {

	// Credentials, falling back to the environment when not given
	public @Nullable String appId;

	public @Nullable String appSecret;

	public @Nullable String callbackUrl;

	public @Nullable String accessToken;

	// Command
	public @Nullable CliCommand command;

	public List<String> commandArgs = new ArrayList<>();

	// Command options
	public @Nullable Long maxAgeSeconds; // null = configured default

	public List<String> permissions = new ArrayList<>();

	public Map<String, String> params = new LinkedHashMap<>();

	// Mode flags
	public boolean verbose = false;

	public boolean helpRequested = false;

	/**
	 * Returns the command argument at the given position.
	 */
	public String commandArg(int index) {
		return commandArgs.get(index);
	}

}
