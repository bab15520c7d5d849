package org.springaicommunity.review.discussion;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;

/**
 * Builder for creating discussion resolution services without Spring dependencies.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // File store located through DISCUSSION_STORE_DIR (or .env)
 * DiscussionResolutionService service = DiscussionResolverBuilder.create()
 *     .storeDirectoryFromEnv()
 *     .build();
 *
 * ResolutionResult result = service.resolve("merge_request/42", "a1b2c3", User.of("alice"));
 *
 * // For testing with mock collaborators
 * NoteStore mockStore = mock(NoteStore.class);
 * DiscussionResolutionService testService = DiscussionResolverBuilder.create()
 *     .noteStore(mockStore)
 *     .authorizer((user, project) -> false)
 *     .liveness((noteable, note) -> true)
 *     .build();
 * }
 * </pre>
 */
public class DiscussionResolverBuilder {

	private ResolutionProperties properties;

	private ObjectMapper objectMapper;

	private Clock clock;

	private NoteStore noteStore;

	private Authorizer authorizer;

	private DiffPositionLiveness liveness;

	private DiscussionResolverBuilder() {
		this.properties = new ResolutionProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new DiscussionResolverBuilder
	 */
	public static DiscussionResolverBuilder create() {
		return new DiscussionResolverBuilder();
	}

	/**
	 * Set the base directory of the file stores.
	 * @param storeDirectory directory path
	 * @return this builder
	 */
	public DiscussionResolverBuilder storeDirectory(String storeDirectory) {
		this.properties.setStoreDirectory(storeDirectory);
		return this;
	}

	/**
	 * Read the store directory from the DISCUSSION_STORE_DIR variable ({@code .env} file or
	 * environment).
	 * @return this builder
	 * @throws IllegalStateException if DISCUSSION_STORE_DIR is not set
	 */
	public DiscussionResolverBuilder storeDirectoryFromEnv() {
		String storeDirectory = EnvironmentSupport.get(EnvironmentSupport.STORE_DIR_VARIABLE);
		if (storeDirectory == null || storeDirectory.trim().isEmpty()) {
			throw new IllegalStateException(EnvironmentSupport.STORE_DIR_VARIABLE
					+ " environment variable is required. Please point it at the discussion store directory.");
		}
		this.properties.setStoreDirectory(storeDirectory.trim());
		return this;
	}

	/**
	 * Set resolution properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public DiscussionResolverBuilder properties(@Nullable ResolutionProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper for the file stores.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public DiscussionResolverBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set the clock used for resolution timestamps.
	 * @param clock clock (null to use the system clock in the configured time zone)
	 * @return this builder
	 */
	public DiscussionResolverBuilder clock(@Nullable Clock clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Set a custom NoteStore implementation. When set without a custom liveness source,
	 * every diff position is treated as active.
	 * @param noteStore custom NoteStore implementation (null to use the file store)
	 * @return this builder
	 */
	public DiscussionResolverBuilder noteStore(@Nullable NoteStore noteStore) {
		this.noteStore = noteStore;
		return this;
	}

	/**
	 * Set a custom Authorizer implementation.
	 * @param authorizer custom Authorizer (null to use file-based collaborator permissions)
	 * @return this builder
	 */
	public DiscussionResolverBuilder authorizer(@Nullable Authorizer authorizer) {
		this.authorizer = authorizer;
		return this;
	}

	/**
	 * Set a custom DiffPositionLiveness implementation.
	 * @param liveness custom liveness check (null for the default)
	 * @return this builder
	 */
	public DiscussionResolverBuilder liveness(@Nullable DiffPositionLiveness liveness) {
		this.liveness = liveness;
		return this;
	}

	/**
	 * Build a DiscussionResolutionService.
	 * @return configured DiscussionResolutionService
	 */
	public DiscussionResolutionService build() {
		Components components = buildComponents();
		return new DiscussionResolutionService(components.noteStore, components.authorizer, components.liveness);
	}

	/**
	 * Build the file-based NoteStore directly (for seeding or advanced usage).
	 * @return note store rooted at the configured store directory
	 */
	public FileSystemNoteStore buildFileSystemNoteStore() {
		return new FileSystemNoteStore(storePath(), mapper(), resolvedClock());
	}

	private Components buildComponents() {
		ObjectMapper mapper = mapper();
		FileSystemNoteStore fileStore = this.noteStore == null ? buildFileSystemNoteStore() : null;
		NoteStore store = fileStore != null ? fileStore : this.noteStore;
		Authorizer auth = this.authorizer != null ? this.authorizer
				: new CollaboratorAuthorizer(new FileSystemCollaboratorSource(storePath(), mapper));
		DiffPositionLiveness live = this.liveness != null ? this.liveness
				: fileStore != null ? fileStore : (noteable, note) -> true;
		return new Components(store, auth, live);
	}

	private ObjectMapper mapper() {
		return this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
	}

	private Clock resolvedClock() {
		return this.clock != null ? this.clock : Clock.system(properties.getZoneId());
	}

	private Path storePath() {
		return Paths.get(properties.getStoreDirectory());
	}

	/**
	 * Internal record to hold built components.
	 */
	private record Components(NoteStore noteStore, Authorizer authorizer, DiffPositionLiveness liveness) {
	}

}
