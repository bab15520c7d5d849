package org.springaicommunity.review.discussion;

/**
 * Thrown when the note store cannot read or write its data.
 */
public class NoteStoreException extends DiscussionResolutionException {

	public NoteStoreException(String message, Throwable cause) {
		super(message, cause);
	}

}
