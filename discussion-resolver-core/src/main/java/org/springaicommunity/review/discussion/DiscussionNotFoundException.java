package org.springaicommunity.review.discussion;

/**
 * Thrown when a noteable or a discussion cannot be found.
 */
public class DiscussionNotFoundException extends DiscussionResolutionException {

	public DiscussionNotFoundException(String message) {
		super(message);
	}

}
