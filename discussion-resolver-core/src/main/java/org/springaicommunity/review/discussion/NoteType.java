package org.springaicommunity.review.discussion;

/**
 * Classification of a note. Only notes attached to a diff line take part in resolution.
 */
public enum NoteType {

	/**
	 * A plain remark on the noteable.
	 */
	NOTE,

	/**
	 * A comment anchored to a line of the diff.
	 */
	DIFF_NOTE;

	public boolean isResolvable() {
		return this == DIFF_NOTE;
	}

}
