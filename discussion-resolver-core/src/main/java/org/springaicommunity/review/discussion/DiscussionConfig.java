package org.springaicommunity.review.discussion;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.ZoneId;

/**
 * Spring configuration for the discussion resolution service and its file-based
 * collaborators.
 */
@Configuration
public class DiscussionConfig {

	@Value("${DISCUSSION_STORE_DIR:discussions}")
	private String storeDirectory;

	@Value("${DISCUSSION_TIME_ZONE:UTC}")
	private String timeZone;

	@Bean
	public ObjectMapper objectMapper() {
		return ObjectMapperFactory.create();
	}

	@Bean
	public Clock clock() {
		return Clock.system(ZoneId.of(timeZone));
	}

	@Bean
	public FileSystemNoteStore noteStore(ObjectMapper objectMapper, Clock clock) {
		return new FileSystemNoteStore(storePath(), objectMapper, clock);
	}

	@Bean
	public Authorizer authorizer(ObjectMapper objectMapper) {
		return new CollaboratorAuthorizer(new FileSystemCollaboratorSource(storePath(), objectMapper));
	}

	@Bean
	public DiscussionResolutionService discussionResolutionService(FileSystemNoteStore noteStore,
			Authorizer authorizer) {
		return new DiscussionResolutionService(noteStore, authorizer, noteStore);
	}

	private Path storePath() {
		return Paths.get(storeDirectory);
	}

}
