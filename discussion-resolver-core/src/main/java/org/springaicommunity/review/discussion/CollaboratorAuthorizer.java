package org.springaicommunity.review.discussion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Authorizer} backed by project collaborator permissions. A user can push when
 * they are listed as a collaborator with push, maintain, or admin permission.
 */
public class CollaboratorAuthorizer implements Authorizer {

	private static final Logger logger = LoggerFactory.getLogger(CollaboratorAuthorizer.class);

	private final CollaboratorSource collaboratorSource;

	public CollaboratorAuthorizer(CollaboratorSource collaboratorSource) {
		this.collaboratorSource = collaboratorSource;
	}

	@Override
	public boolean canPush(User user, Project project) {
		boolean allowed = collaboratorSource.collaborators(project)
			.stream()
			.anyMatch(collaborator -> collaborator.username().equals(user.username()) && collaborator.canPush());
		logger.debug("Push access for {} on {}: {}", user.username(), project.fullPath(), allowed);
		return allowed;
	}

}
