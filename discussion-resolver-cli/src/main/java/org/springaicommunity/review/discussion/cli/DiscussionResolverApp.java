package org.springaicommunity.review.discussion.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.review.discussion.*;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

/**
 * Discussion Resolver Spring Boot Application
 *
 * Spring Boot command-line variant of {@link DiscussionResolverCli}. Services are wired by
 * {@link DiscussionConfig}; the store directory comes from the DISCUSSION_STORE_DIR
 * property or environment variable.
 *
 * Usage: java -cp discussion-resolver-cli.jar
 * org.springaicommunity.review.discussion.cli.DiscussionResolverApp [OPTIONS]
 */
@SpringBootApplication
@Import(DiscussionConfig.class)
public class DiscussionResolverApp implements CommandLineRunner {

	private static final Logger logger = LoggerFactory.getLogger(DiscussionResolverApp.class);

	private final DiscussionResolutionService resolutionService;

	private final ObjectMapper objectMapper;

	public DiscussionResolverApp(DiscussionResolutionService resolutionService, ObjectMapper objectMapper) {
		this.resolutionService = resolutionService;
		this.objectMapper = objectMapper;
	}

	public static void main(String[] args) {
		// Configure Spring Boot to run as console application
		SpringApplication app = new SpringApplication(DiscussionResolverApp.class);
		app.setWebApplicationType(WebApplicationType.NONE);
		app.run(args);
	}

	@Override
	public void run(String... args) throws Exception {
		ArgumentParser argumentParser = new ArgumentParser(new ResolutionProperties());
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return;
		}

		// --store is ignored here, the Spring context already fixed the store directory
		ParsedConfiguration config = argumentParser.parseAndValidate(args);
		try {
			Object output = DiscussionResolverCli.execute(resolutionService, config);
			System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(output));
		}
		catch (ResolutionDeniedException e) {
			logger.error("Resolution denied: {}", e.getMessage());
			System.exit(DiscussionResolverCli.EXIT_DENIED);
		}
		catch (DiscussionResolutionException e) {
			logger.error("Discussion resolver failed: {}", e.getMessage());
			if (config.verbose) {
				logger.error("Stack trace:", e);
			}
			System.exit(DiscussionResolverCli.EXIT_FAILURE);
		}
	}

}
