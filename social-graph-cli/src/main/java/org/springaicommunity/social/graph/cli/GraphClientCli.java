package org.springaicommunity.social.graph.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.social.graph.*;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Social Graph Client CLI Application
 *
 * Plain Java command-line front end over the client core. No Spring dependencies - uses
 * GraphClientBuilder for wiring. Results are printed to standard output as JSON (URLs as
 * plain text); diagnostics go to the log.
 *
 * Usage: java -jar social-graph-cli.jar [OPTIONS] &lt;command&gt; [ARGS]
 *
 * Environment Variables: GRAPH_APP_ID, GRAPH_APP_SECRET, GRAPH_CALLBACK_URL,
 * GRAPH_ACCESS_TOKEN
 *
 * Examples: java -jar social-graph-cli.jar signed-request "$SIGNED_REQUEST" java -jar
 * social-graph-cli.jar oauth-url --permissions email java -jar social-graph-cli.jar get
 * cocacola -p fields=name
 */
public class GraphClientCli {

	private static final Logger logger = LoggerFactory.getLogger(GraphClientCli.class);

	static final int EXIT_OK = 0;

	static final int EXIT_FAILURE = 1;

	static final int EXIT_USAGE = 2;

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Command failed: {}", e.getMessage());
			System.exit(EXIT_FAILURE);
		}
	}

	public static int run(String[] args) throws Exception {
		return run(args, System.out, null);
	}

	/**
	 * Run a command.
	 * @param args command-line arguments
	 * @param out destination for command results
	 * @param transport transport to use, or null for the default HTTP transport
	 * @return process exit code
	 */
	static int run(String[] args, PrintStream out, @Nullable Transport transport) throws Exception {
		GraphClientProperties properties = new GraphClientProperties();
		CliArgumentParser argumentParser = new CliArgumentParser(properties);

		if (argumentParser.isHelpRequested(args)) {
			out.println(argumentParser.generateHelpText());
			return EXIT_OK;
		}

		CliConfiguration config;
		try {
			config = argumentParser.parseAndValidate(args);
		}
		catch (IllegalArgumentException e) {
			logger.error("{}", e.getMessage());
			return EXIT_USAGE;
		}

		if (config.verbose) {
			logConfiguration(config);
		}

		ObjectMapper objectMapper = ObjectMapperFactory.create();
		GraphClientBuilder builder = GraphClientBuilder.create()
			.properties(properties)
			.objectMapper(objectMapper)
			.transport(transport)
			.accessToken(config.accessToken);
		AppCredentials credentials = null;
		if (config.appId != null && config.appSecret != null) {
			credentials = new AppCredentials(config.appId, config.appSecret, config.callbackUrl);
			builder.appCredentials(credentials);
		}

		try {
			return execute(config, builder, credentials, objectMapper, out);
		}
		catch (SignedRequestException e) {
			logger.error("Signed request rejected: {}", e.getMessage());
			return EXIT_FAILURE;
		}
		catch (GraphApiException e) {
			logger.error("Request failed: {}", e.getMessage());
			return EXIT_FAILURE;
		}
		catch (IllegalArgumentException e) {
			logger.error("{}", e.getMessage());
			return EXIT_USAGE;
		}
		catch (IllegalStateException e) {
			logger.error("Unable to complete the request: {}", e.getMessage());
			return EXIT_FAILURE;
		}
	}

	private static int execute(CliConfiguration config, GraphClientBuilder builder,
			@Nullable AppCredentials credentials, ObjectMapper objectMapper, PrintStream out)
			throws JsonProcessingException {
		CliCommand command = config.command;
		if (command == null) {
			throw new IllegalArgumentException("A command is required. Use --help for usage.");
		}

		switch (command) {
			case SIGNED_REQUEST: {
				CredentialVerifier verifier = builder.buildCredentialVerifier();
				JsonNode data = config.maxAgeSeconds != null
						? verifier.parseSignedRequest(config.commandArg(0), config.maxAgeSeconds)
						: verifier.parseSignedRequest(config.commandArg(0));
				print(out, objectMapper, data);
				return EXIT_OK;
			}
			case COOKIE: {
				String cookieName = credentials != null ? credentials.cookieName() : "";
				Optional<CookieSession> session = builder.buildCredentialVerifier()
					.parseCookieSession(Map.of(cookieName, config.commandArg(0)));
				if (session.isEmpty()) {
					logger.warn("Cookie is not a valid session for {}", cookieName);
					return EXIT_FAILURE;
				}
				print(out, objectMapper, session.get().fields());
				return EXIT_OK;
			}
			case OAUTH_URL:
				out.println(builder.buildTokenExchangeClient()
					.urlForOAuthCode(new OAuthUrlOptions(null, config.permissions)));
				return EXIT_OK;
			case ACCESS_TOKEN_URL:
				out.println(builder.buildTokenExchangeClient()
					.urlForAccessToken(config.commandArg(0), OAuthUrlOptions.defaults()));
				return EXIT_OK;
			case ACCESS_TOKEN:
				print(out, objectMapper, builder.buildTokenExchangeClient().getAccessTokenInfo(config.commandArg(0)));
				return EXIT_OK;
			case APP_TOKEN:
				print(out, objectMapper, builder.buildTokenExchangeClient().getAppAccessTokenInfo());
				return EXIT_OK;
			case EXCHANGE_SESSIONS: {
				List<String> sessions = Arrays.stream(config.commandArg(0).split(","))
					.map(String::trim)
					.filter(s -> !s.isEmpty())
					.collect(Collectors.toList());
				print(out, objectMapper, builder.buildTokenExchangeClient().getTokenInfoFromSessionKeys(sessions));
				return EXIT_OK;
			}
			case GET: {
				JsonNode result = builder.buildGraphApi()
					.graphCall(config.commandArg(0), config.params, HttpVerb.GET, RequestOptions.defaults());
				if (result.isMissingNode()) {
					logger.info("Empty response");
					return EXIT_OK;
				}
				print(out, objectMapper, result);
				return EXIT_OK;
			}
			default:
				throw new IllegalArgumentException("Unsupported command: " + command.getCommandName());
		}
	}

	private static void print(PrintStream out, ObjectMapper objectMapper, Object value)
			throws JsonProcessingException {
		out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value));
	}

	private static void logConfiguration(CliConfiguration config) {
		logger.info("Configuration:");
		logger.info("  Command: {}", config.command != null ? config.command.getCommandName() : "(none)");
		logger.info("  App id: {}", config.appId != null ? config.appId : "(not set)");
		logger.info("  App secret: {}", config.appSecret != null ? "(set)" : "(not set)");
		logger.info("  Callback: {}", config.callbackUrl != null ? config.callbackUrl : "(not set)");
		logger.info("  Access token: {}", config.accessToken != null ? "(set)" : "(not set)");
		if (config.maxAgeSeconds != null) {
			logger.info("  Max age: {}s", config.maxAgeSeconds);
		}
		if (!config.permissions.isEmpty()) {
			logger.info("  Permissions: {}", config.permissions);
		}
		if (!config.params.isEmpty()) {
			logger.info("  Parameters: {}", config.params.keySet());
		}
	}

}
