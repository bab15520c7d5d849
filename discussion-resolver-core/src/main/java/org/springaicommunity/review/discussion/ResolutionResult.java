package org.springaicommunity.review.discussion;

import java.util.List;

/**
 * Outcome of a resolve or unresolve request.
 *
 * @param discussion state of the discussion after the operation
 * @param changedNoteIds ids of the notes whose resolution state changed and were saved
 */
public record ResolutionResult(DiscussionSummary discussion, List<Long> changedNoteIds) {

	public ResolutionResult {
		changedNoteIds = List.copyOf(changedNoteIds);
	}

	public boolean changed() {
		return !changedNoteIds.isEmpty();
	}

}
