package org.springaicommunity.review.discussion;

import java.util.List;

/**
 * Supplies the collaborators of a project.
 */
@FunctionalInterface
public interface CollaboratorSource {

	/**
	 * @param project the project
	 * @return collaborators with their permissions, empty if none are known
	 */
	List<Collaborator> collaborators(Project project);

}
