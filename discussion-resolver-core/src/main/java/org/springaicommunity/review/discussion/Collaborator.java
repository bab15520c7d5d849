package org.springaicommunity.review.discussion;

import org.jspecify.annotations.Nullable;

/**
 * A project collaborator with their permissions.
 *
 * <p>
 * The permissions object indicates what actions the collaborator can perform:
 * <ul>
 * <li>{@code admin} - Full project access including settings</li>
 * <li>{@code maintain} - Manage the project without access to sensitive settings</li>
 * <li>{@code push} - Read and write access (can push commits)</li>
 * <li>{@code triage} - Read access plus manage issues and merge requests</li>
 * <li>{@code pull} - Read-only access</li>
 * </ul>
 *
 * @param username the collaborator's username
 * @param permissions the collaborator's project permissions (null if unknown)
 * @param roleName the role name (e.g., "admin", "write", "read", "maintain", "triage")
 */
public record Collaborator(String username, @Nullable Permissions permissions, @Nullable String roleName) {

	/**
	 * Whether this collaborator may push to the project. Maintainers and admins can
	 * always push.
	 * @return true for push, maintain, or admin permission
	 */
	public boolean canPush() {
		return permissions != null && (permissions.push() || permissions.maintain() || permissions.admin());
	}

	/**
	 * Project permission levels for a collaborator.
	 *
	 * @param admin full project access including settings
	 * @param maintain manage the project without sensitive settings access
	 * @param push read and write access (can push commits)
	 * @param triage read access plus manage issues and merge requests
	 * @param pull read-only access
	 */
	public record Permissions(boolean admin, boolean maintain, boolean push, boolean triage, boolean pull) {
	}
}
