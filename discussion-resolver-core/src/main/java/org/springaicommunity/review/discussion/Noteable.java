package org.springaicommunity.review.discussion;

/**
 * The subject being discussed, such as a merge request. Read-only context for a
 * {@link Discussion}: its author and project feed the resolution permission check.
 *
 * @param type what kind of subject this is
 * @param id the identifier of the subject within its project (e.g. the merge request
 * number)
 * @param author the user who created the subject
 * @param project the project the subject belongs to
 */
public record Noteable(NoteableType type, long id, User author, Project project) {

	/**
	 * The reference used to look this noteable up, e.g. {@code merge_request/42}.
	 * @return reference string
	 */
	public String reference() {
		return type.pathSegment() + "/" + id;
	}

}
