package org.springaicommunity.review.discussion;

import java.util.Locale;

/**
 * Kinds of subjects that can carry discussions.
 */
public enum NoteableType {

	MERGE_REQUEST, COMMIT, ISSUE;

	/**
	 * The lower snake case form used in references and storage paths (e.g.
	 * {@code merge_request}).
	 * @return path segment for this type
	 */
	public String pathSegment() {
		return name().toLowerCase(Locale.ROOT);
	}

	/**
	 * Parse a type from its path segment, case-insensitively.
	 * @param value the path segment (e.g. "merge_request")
	 * @return the matching type
	 * @throws IllegalArgumentException if no type matches
	 */
	public static NoteableType fromPathSegment(String value) {
		for (NoteableType type : values()) {
			if (type.pathSegment().equalsIgnoreCase(value)) {
				return type;
			}
		}
		throw new IllegalArgumentException(
				"Invalid noteable type '" + value + "': must be 'merge_request', 'commit', or 'issue'");
	}

}
