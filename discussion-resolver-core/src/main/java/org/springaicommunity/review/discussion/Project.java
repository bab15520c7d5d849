package org.springaicommunity.review.discussion;

/**
 * The project (repository) a noteable belongs to. Authorization decisions are made
 * against this context.
 *
 * @param id the unique project identifier
 * @param fullPath the project path in "owner/repo" format
 */
public record Project(long id, String fullPath) {

	public Project {
		if (fullPath == null || !fullPath.contains("/")) {
			throw new IllegalArgumentException("Project path must be in 'owner/repo' format: " + fullPath);
		}
	}

	public String owner() {
		return fullPath.substring(0, fullPath.indexOf('/'));
	}

	public String name() {
		return fullPath.substring(fullPath.indexOf('/') + 1);
	}

}
