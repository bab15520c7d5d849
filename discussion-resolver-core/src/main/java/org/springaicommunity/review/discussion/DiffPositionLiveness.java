package org.springaicommunity.review.discussion;

/**
 * Tells whether the diff position a discussion is anchored to still exists in the
 * current diff of its noteable.
 */
@FunctionalInterface
public interface DiffPositionLiveness {

	/**
	 * @param noteable the discussed subject
	 * @param firstNote the note that opened the discussion
	 * @return true if the position is still present in the current diff
	 */
	boolean isActive(Noteable noteable, Note firstNote);

}
