package org.springaicommunity.review.discussion;

import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser for the discussion resolver. Pure Java implementation
 * with no Spring dependencies for maximum testability.
 */
public class ArgumentParser {

	private static final List<String> ACTIONS = List.of("show", "list", "resolve", "unresolve");

	private final ResolutionProperties defaultProperties;

	public ArgumentParser(ResolutionProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-s", "--store":
					config.storeDirectory = getRequiredValue(args, i, "store");
					i++; // Skip next argument since we consumed it
					break;

				case "-n", "--noteable":
					config.noteable = getRequiredValue(args, i, "noteable").toLowerCase();
					i++;
					break;

				case "-d", "--discussion":
					config.discussionId = getRequiredValue(args, i, "discussion");
					i++;
					break;

				case "-u", "--user":
					config.username = getRequiredValue(args, i, "user");
					i++;
					break;

				case "-a", "--action":
					String action = getRequiredValue(args, i, "action").toLowerCase();
					if (!ACTIONS.contains(action)) {
						throw new IllegalArgumentException("Invalid action '" + action
								+ "': must be 'show', 'list', 'resolve', or 'unresolve'");
					}
					config.action = action;
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
					break;
			}
		}

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
		help.append("Usage: discussion-resolver [OPTIONS]\n");
		help.append("\n");
		help.append("Show, resolve, or unresolve review discussions kept in a discussion store.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help                Show this help message\n");
		help.append("    -s, --store DIR           Discussion store directory (default: ")
			.append(defaultProperties.getStoreDirectory())
			.append(")\n");
		help.append("    -n, --noteable TYPE/ID    Noteable reference, e.g. merge_request/42 (required)\n");
		help.append("    -d, --discussion ID       Discussion id (required except for 'list')\n");
		help.append("    -u, --user LOGIN          Acting user (required for 'resolve' and 'unresolve')\n");
		help.append("    -a, --action ACTION       show, list, resolve, unresolve (default: show)\n");
		help.append("    -v, --verbose             Enable verbose logging\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    DISCUSSION_STORE_DIR      Store directory used when --store is not given\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    discussion-resolver --noteable merge_request/42 --action list\n");
		help.append("    discussion-resolver -n merge_request/42 -d 3f2a91 -u alice -a resolve\n");
		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.storeDirectory == null || config.storeDirectory.trim().isEmpty()) {
			errors.add("Store directory cannot be empty");
		}

		if (config.noteable == null || config.noteable.trim().isEmpty()) {
			errors.add("Noteable reference is required");
		}
		else if (!config.noteable.matches("^(merge_request|commit|issue)/\\d+$")) {
			errors.add("Noteable must be in format 'type/id' with type merge_request, commit, or issue "
					+ "(e.g., 'merge_request/42')");
		}

		if (!"list".equals(config.action) && (config.discussionId == null || config.discussionId.isBlank())) {
			errors.add("Discussion id is required for action '" + config.action + "'");
		}

		if (List.of("resolve", "unresolve").contains(config.action)
				&& (config.username == null || config.username.isBlank())) {
			errors.add("User is required for action '" + config.action + "'");
		}

		// Report validation errors
		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
