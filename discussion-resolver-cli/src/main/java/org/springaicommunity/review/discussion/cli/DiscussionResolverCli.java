package org.springaicommunity.review.discussion.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.review.discussion.*;

import java.io.PrintStream;
import java.util.List;

/**
 * Discussion Resolver CLI Application
 *
 * Plain Java command-line application to inspect, resolve, and unresolve discussions kept
 * in a file-based discussion store. No Spring dependencies - uses
 * DiscussionResolverBuilder for service wiring.
 *
 * Usage: java -jar discussion-resolver-cli.jar [OPTIONS]
 *
 * Environment Variables: DISCUSSION_STORE_DIR - store directory when --store is not given
 *
 * Examples: java -jar discussion-resolver-cli.jar --noteable merge_request/42 --action
 * list java -jar discussion-resolver-cli.jar -n merge_request/42 -d 3f2a91 -u alice -a
 * resolve
 */
public class DiscussionResolverCli {

	private static final Logger logger = LoggerFactory.getLogger(DiscussionResolverCli.class);

	static final int EXIT_OK = 0;

	static final int EXIT_FAILURE = 1;

	static final int EXIT_DENIED = 2;

	public static void main(String[] args) {
		int exitCode = run(args, System.out);
		if (exitCode != EXIT_OK) {
			System.exit(exitCode);
		}
	}

	public static int run(String[] args, PrintStream out) {
		ResolutionProperties properties = new ResolutionProperties();
		String storeFromEnv = EnvironmentSupport.get(EnvironmentSupport.STORE_DIR_VARIABLE);
		if (storeFromEnv != null && !storeFromEnv.isBlank()) {
			properties.setStoreDirectory(storeFromEnv.trim());
		}
		ArgumentParser argumentParser = new ArgumentParser(properties);

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			out.println(argumentParser.generateHelpText());
			return EXIT_OK;
		}

		ObjectMapper objectMapper = ObjectMapperFactory.create();
		try {
			ParsedConfiguration config = argumentParser.parseAndValidate(args);
			if (config.verbose) {
				logger.info("Configuration: {}", config);
			}

			DiscussionResolutionService service = DiscussionResolverBuilder.create()
				.properties(properties)
				.storeDirectory(config.storeDirectory)
				.objectMapper(objectMapper)
				.build();

			Object output = execute(service, config);
			out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(output));
			return EXIT_OK;
		}
		catch (ResolutionDeniedException e) {
			logger.error("Resolution denied: {}", e.getMessage());
			return EXIT_DENIED;
		}
		catch (Exception e) {
			logger.error("Discussion resolver failed: {}", e.getMessage());
			return EXIT_FAILURE;
		}
	}

	static Object execute(DiscussionResolutionService service, ParsedConfiguration config) {
		String noteable = required(config.noteable, "noteable");
		User user = config.user();
		switch (config.action) {
			case "list":
				List<DiscussionSummary> summaries = service.findDiscussions(noteable)
					.stream()
					.map(discussion -> DiscussionSummary.of(discussion, user))
					.toList();
				logger.info("Found {} discussions on {}", summaries.size(), noteable);
				return summaries;
			case "resolve":
				return service.resolve(noteable, required(config.discussionId, "discussion"), user);
			case "unresolve":
				return service.unresolve(noteable, required(config.discussionId, "discussion"), user);
			default:
				return DiscussionSummary.of(service.findDiscussion(noteable, required(config.discussionId, "discussion")),
						user);
		}
	}

	private static String required(@Nullable String value, String name) {
		if (value == null) {
			throw new IllegalArgumentException("Missing " + name);
		}
		return value;
	}

}
