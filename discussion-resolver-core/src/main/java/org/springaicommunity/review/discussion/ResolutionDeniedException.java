package org.springaicommunity.review.discussion;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a user is not allowed to resolve or unresolve a discussion.
 */
public class ResolutionDeniedException extends DiscussionResolutionException {

	private final String discussionId;

	@Nullable
	private final String username;

	public ResolutionDeniedException(String discussionId, @Nullable User user) {
		super(user == null ? "Sign in required to resolve discussion " + discussionId
				: "User " + user.username() + " cannot resolve discussion " + discussionId);
		this.discussionId = discussionId;
		this.username = user != null ? user.username() : null;
	}

	public String getDiscussionId() {
		return discussionId;
	}

	@Nullable
	public String getUsername() {
		return username;
	}

}
