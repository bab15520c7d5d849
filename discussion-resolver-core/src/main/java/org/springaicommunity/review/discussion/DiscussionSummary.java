package org.springaicommunity.review.discussion;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;

/**
 * Snapshot of a discussion's resolution state, ready for JSON output.
 *
 * @param id the discussion id
 * @param noteable the noteable reference (e.g. "merge_request/42")
 * @param resolvable whether the discussion takes part in resolution
 * @param resolved whether every resolvable note is resolved
 * @param toBeResolved whether the discussion still needs action
 * @param collapsed whether the discussion should be shown collapsed
 * @param resolvedAt when the discussion was resolved (null if not resolved)
 * @param resolvedBy username of the resolving user (null if not resolved)
 * @param canResolve whether the viewing user may resolve the discussion
 * @param noteCount number of notes in the discussion
 * @param lastUpdatedAt creation time of the latest note
 */
public record DiscussionSummary(String id, String noteable, boolean resolvable, boolean resolved,
		boolean toBeResolved, boolean collapsed, @Nullable LocalDateTime resolvedAt, @Nullable String resolvedBy,
		boolean canResolve, int noteCount, LocalDateTime lastUpdatedAt) {

	/**
	 * Capture the current state of a discussion as seen by a user.
	 * @param discussion the discussion
	 * @param viewer the viewing user, null when not signed in
	 * @return summary snapshot
	 */
	public static DiscussionSummary of(Discussion discussion, @Nullable User viewer) {
		User resolvedBy = discussion.resolvedBy();
		return new DiscussionSummary(discussion.id(), discussion.noteable().reference(), discussion.isResolvable(),
				discussion.isResolved(), discussion.isToBeResolved(), discussion.isCollapsed(),
				discussion.resolvedAt(), resolvedBy != null ? resolvedBy.username() : null,
				discussion.canResolve(viewer), discussion.notes().size(), discussion.lastUpdatedAt());
	}

}
