package org.springaicommunity.social.graph.cli;

import org.springaicommunity.social.graph.EnvironmentSupport;
import org.springaicommunity.social.graph.GraphClientProperties;

import java.util.Arrays;
import java.util.function.UnaryOperator;

/**
 * Command-line argument parser for the Graph client CLI. Pure Java with no Spring
 * dependencies.
 */
public class CliArgumentParser {

	private final GraphClientProperties defaultProperties;

	private final UnaryOperator<String> environment;

	public CliArgumentParser(GraphClientProperties defaultProperties) {
		this(defaultProperties, EnvironmentSupport::get);
	}

	/**
	 * Create a parser with a custom environment lookup.
	 * @param defaultProperties default client properties, used in help text
	 * @param environment variable name to value, returning null when unset
	 */
	public CliArgumentParser(GraphClientProperties defaultProperties, UnaryOperator<String> environment) {
		this.defaultProperties = defaultProperties;
		this.environment = environment;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public CliConfiguration parseAndValidate(String[] args) {
		CliConfiguration config = new CliConfiguration();

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "--app-id":
					config.appId = getRequiredValue(args, i, "app-id");
					i++; // Skip next argument since we consumed it
					break;

				case "--app-secret":
					config.appSecret = getRequiredValue(args, i, "app-secret");
					i++;
					break;

				case "--callback":
					config.callbackUrl = getRequiredValue(args, i, "callback");
					i++;
					break;

				case "--access-token":
					config.accessToken = getRequiredValue(args, i, "access-token");
					i++;
					break;

				case "--max-age":
					String maxAgeStr = getRequiredValue(args, i, "max-age");
					try {
						config.maxAgeSeconds = Long.parseLong(maxAgeStr);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid max age '" + maxAgeStr + "': must be a positive number of seconds");
					}
					if (config.maxAgeSeconds <= 0) {
						throw new IllegalArgumentException("Max age must be positive: " + config.maxAgeSeconds);
					}
					i++;
					break;

				case "--permissions":
					String permissionStr = getRequiredValue(args, i, "permissions");
					Arrays.stream(permissionStr.split(","))
						.map(String::trim)
						.filter(s -> !s.isEmpty())
						.forEach(config.permissions::add);
					i++;
					break;

				case "-p", "--param":
					String param = getRequiredValue(args, i, "param");
					int separator = param.indexOf('=');
					if (separator <= 0) {
						throw new IllegalArgumentException("Invalid parameter '" + param + "': must be key=value");
					}
					config.params.put(param.substring(0, separator), param.substring(separator + 1));
					i++;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					if (config.command == null) {
						config.command = CliCommand.fromName(arg)
							.orElseThrow(() -> new IllegalArgumentException("Unknown command: " + arg));
					}
					else {
						config.commandArgs.add(arg);
					}
					break;
			}
		}

		applyEnvironment(config);
		if (!config.helpRequested) {
			validateConfiguration(config);
		}
		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: social-graph [OPTIONS] <command> [ARGS]\n");
		help.append("\n");
		help.append("Verify signed requests and cookies, build OAuth URLs, exchange tokens and call the Graph API.\n");
		help.append("\n");
		help.append("COMMANDS:\n");
		for (CliCommand command : CliCommand.values()) {
			help.append(String.format("    %-38s%s%n", command.getCommandName() + " " + command.getUsage(),
					describe(command)));
		}
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    --app-id ID             Application id (default: $")
			.append(EnvironmentSupport.APP_ID)
			.append(")\n");
		help.append("    --app-secret SECRET     Application secret (default: $")
			.append(EnvironmentSupport.APP_SECRET)
			.append(")\n");
		help.append("    --callback URL          OAuth redirect URI (default: $")
			.append(EnvironmentSupport.CALLBACK_URL)
			.append(")\n");
		help.append("    --access-token TOKEN    User access token for 'get' (default: $")
			.append(EnvironmentSupport.ACCESS_TOKEN)
			.append(")\n");
		help.append("    --max-age SECONDS       Maximum age of an encrypted signed request (default: ")
			.append(defaultProperties.getSignedRequestMaxAgeSeconds())
			.append(")\n");
		help.append("    --permissions a,b       Extended permissions for 'oauth-url'\n");
		help.append("    -p, --param KEY=VALUE   Request parameter for 'get' (repeatable)\n");
		help.append("    -v, --verbose           Enable verbose logging\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    Credentials are read from the environment or a .env file when not given as options.\n");
		help.append("\n");
		help.append("EXIT CODES:\n");
		help.append("    0 success, 1 request or verification failure, 2 invalid arguments\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    social-graph signed-request \"$SIGNED_REQUEST\" --max-age 600\n");
		help.append("    social-graph oauth-url --permissions email,publish_stream\n");
		help.append("    social-graph get me -p fields=id,name --access-token \"$TOKEN\"\n");
		return help.toString();
	}

	private static String describe(CliCommand command) {
		return switch (command) {
			case SIGNED_REQUEST -> "Verify and decode a signed request";
			case COOKIE -> "Verify a session cookie value";
			case OAUTH_URL -> "Print the OAuth authorization URL";
			case ACCESS_TOKEN_URL -> "Print the URL exchanging a code for a token";
			case ACCESS_TOKEN -> "Exchange an authorization code for a token";
			case APP_TOKEN -> "Fetch the application access token";
			case EXCHANGE_SESSIONS -> "Exchange legacy session keys for tokens";
			case GET -> "Fetch a Graph path";
		};
	}

	private void applyEnvironment(CliConfiguration config) {
		if (config.appId == null) {
			config.appId = environment.apply(EnvironmentSupport.APP_ID);
		}
		if (config.appSecret == null) {
			config.appSecret = environment.apply(EnvironmentSupport.APP_SECRET);
		}
		if (config.callbackUrl == null) {
			config.callbackUrl = environment.apply(EnvironmentSupport.CALLBACK_URL);
		}
		if (config.accessToken == null) {
			config.accessToken = environment.apply(EnvironmentSupport.ACCESS_TOKEN);
		}
	}

	private void validateConfiguration(CliConfiguration config) {
		CliCommand command = config.command;
		if (command == null) {
			throw new IllegalArgumentException("A command is required. Use --help for usage.");
		}
		if (config.commandArgs.size() != command.getArity()) {
			throw new IllegalArgumentException("Command '" + command.getCommandName() + "' expects "
					+ command.getArity() + " argument(s): " + command.getCommandName() + " " + command.getUsage());
		}
		if (config.maxAgeSeconds != null && command != CliCommand.SIGNED_REQUEST) {
			throw new IllegalArgumentException("--max-age is only valid with signed-request");
		}
		if (!config.permissions.isEmpty() && command != CliCommand.OAUTH_URL) {
			throw new IllegalArgumentException("--permissions is only valid with oauth-url");
		}
		if (!config.params.isEmpty() && command != CliCommand.GET) {
			throw new IllegalArgumentException("--param is only valid with get");
		}
		if (command.requiresAppCredentials() && (config.appId == null || config.appSecret == null)) {
			throw new IllegalArgumentException("Command '" + command.getCommandName()
					+ "' requires application credentials: use --app-id and --app-secret or set "
					+ EnvironmentSupport.APP_ID + " and " + EnvironmentSupport.APP_SECRET);
		}
	}

	private String getRequiredValue(String[] args, int index, String optionName) {
		if (index + 1 >= args.length) {
			throw new IllegalArgumentException("Option --" + optionName + " requires a value");
		}
		return args[index + 1];
	}

}
