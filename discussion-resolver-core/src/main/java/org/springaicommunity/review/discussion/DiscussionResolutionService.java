package org.springaicommunity.review.discussion;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Function;

/**
 * Application service for resolving discussions.
 *
 * <p>
 * Loads the notes of a noteable from the {@link NoteStore}, builds the
 * {@link Discussion} aggregates, applies the permission check, runs the requested
 * operation and writes back only the notes whose state changed. Requests against a
 * discussion that cannot be resolved return its unchanged state. Store failures are not
 * caught here.
 */
public class DiscussionResolutionService {

	private static final Logger logger = LoggerFactory.getLogger(DiscussionResolutionService.class);

	private final NoteStore noteStore;

	private final Authorizer authorizer;

	private final DiffPositionLiveness liveness;

	public DiscussionResolutionService(NoteStore noteStore, Authorizer authorizer, DiffPositionLiveness liveness) {
		this.noteStore = noteStore;
		this.authorizer = authorizer;
		this.liveness = liveness;
	}

	/**
	 * Load every discussion of a noteable.
	 * @param reference noteable reference (e.g. "merge_request/42")
	 * @return discussions in order of appearance
	 * @throws DiscussionNotFoundException if the noteable does not exist
	 */
	public List<Discussion> findDiscussions(String reference) {
		Noteable noteable = noteStore.findNoteable(reference)
			.orElseThrow(() -> new DiscussionNotFoundException("Noteable not found: " + reference));
		List<Note> notes = noteStore.findNotes(noteable);
		return Discussions.forNotes(noteable, notes, liveness, authorizer);
	}

	/**
	 * Load one discussion of a noteable.
	 * @param reference noteable reference (e.g. "merge_request/42")
	 * @param discussionId the discussion id
	 * @return the discussion
	 * @throws DiscussionNotFoundException if the noteable or discussion does not exist
	 */
	public Discussion findDiscussion(String reference, String discussionId) {
		return findDiscussions(reference).stream()
			.filter(discussion -> discussion.id().equals(discussionId))
			.findFirst()
			.orElseThrow(() -> new DiscussionNotFoundException(
					"Discussion " + discussionId + " not found on " + reference));
	}

	/**
	 * Resolve a discussion on behalf of a user.
	 * @param reference noteable reference
	 * @param discussionId the discussion id
	 * @param user the acting user, null when not signed in
	 * @return the resulting discussion state and the saved note ids
	 * @throws ResolutionDeniedException if the user may not resolve the discussion
	 */
	public ResolutionResult resolve(String reference, String discussionId, @Nullable User user) {
		logger.info("Resolving discussion {} on {}", discussionId, reference);
		return apply(reference, discussionId, user, discussion -> discussion.resolve(requireUser(user)));
	}

	/**
	 * Unresolve a discussion on behalf of a user. The same permission rule as for
	 * resolving applies.
	 * @param reference noteable reference
	 * @param discussionId the discussion id
	 * @param user the acting user, null when not signed in
	 * @return the resulting discussion state and the saved note ids
	 * @throws ResolutionDeniedException if the user may not unresolve the discussion
	 */
	public ResolutionResult unresolve(String reference, String discussionId, @Nullable User user) {
		logger.info("Unresolving discussion {} on {}", discussionId, reference);
		return apply(reference, discussionId, user, Discussion::unresolve);
	}

	private ResolutionResult apply(String reference, String discussionId, @Nullable User user,
			Function<Discussion, List<Note>> operation) {
		Discussion discussion = findDiscussion(reference, discussionId);

		if (!discussion.isResolvable()) {
			logger.info("Discussion {} is not resolvable, nothing to do", discussionId);
			return new ResolutionResult(DiscussionSummary.of(discussion, user), List.of());
		}
		if (!discussion.canResolve(user)) {
			logger.warn("Denied resolution change on discussion {} for {}", discussionId,
					user != null ? user.username() : "anonymous user");
			throw new ResolutionDeniedException(discussionId, user);
		}

		List<Note> changed = operation.apply(discussion);
		if (changed.isEmpty()) {
			logger.info("Discussion {} unchanged, nothing to save", discussionId);
		}
		else {
			noteStore.saveNotes(discussion.noteable(), changed);
			logger.info("Discussion {} updated: {} notes changed, resolved={}", discussionId, changed.size(),
					discussion.isResolved());
		}

		List<Long> changedIds = changed.stream().map(Note::getId).toList();
		return new ResolutionResult(DiscussionSummary.of(discussion, user), changedIds);
	}

	private static User requireUser(@Nullable User user) {
		if (user == null) {
			// canResolve has already rejected anonymous users
			throw new IllegalStateException("Resolving user is required");
		}
		return user;
	}

}
