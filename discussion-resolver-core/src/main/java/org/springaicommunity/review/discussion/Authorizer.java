package org.springaicommunity.review.discussion;

/**
 * Permission check consumed by {@link Discussion#canResolve(User)}.
 *
 * <p>
 * Only the yes/no decision is needed here; how permissions are stored is up to the
 * implementation.
 */
@FunctionalInterface
public interface Authorizer {

	/**
	 * Whether the user can push to the project (write access or higher).
	 * @param user the acting user
	 * @param project the project context
	 * @return true if the user has push capability
	 */
	boolean canPush(User user, Project project);

}
