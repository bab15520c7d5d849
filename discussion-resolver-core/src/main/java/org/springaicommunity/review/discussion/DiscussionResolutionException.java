package org.springaicommunity.review.discussion;

/**
 * Base class for failures raised around discussion resolution.
 */
public class DiscussionResolutionException extends RuntimeException {

	public DiscussionResolutionException(String message) {
		super(message);
	}

	public DiscussionResolutionException(String message, Throwable cause) {
		super(message, cause);
	}

}
