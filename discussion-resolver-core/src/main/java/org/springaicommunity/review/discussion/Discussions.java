package org.springaicommunity.review.discussion;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds {@link Discussion} aggregates from a flat note list.
 */
public final class Discussions {

	private Discussions() {
	}

	/**
	 * Group notes into discussions by discussion id. Discussions are returned in the order
	 * their first note appears; notes keep their relative order inside each discussion.
	 *
	 * <p>
	 * A discussion whose first note is a {@link NoteType#DIFF_NOTE} is a diff discussion,
	 * and its {@code active} flag comes from {@code liveness}. Other discussions are
	 * always active.
	 * @param noteable the noteable all notes belong to
	 * @param notes notes in creation order
	 * @param liveness diff position check for diff discussions
	 * @param authorizer push permission check handed to each discussion
	 * @return discussions, possibly empty
	 */
	public static List<Discussion> forNotes(Noteable noteable, List<Note> notes, DiffPositionLiveness liveness,
			Authorizer authorizer) {
		Map<String, List<Note>> grouped = new LinkedHashMap<>();
		for (Note note : notes) {
			grouped.computeIfAbsent(note.getDiscussionId(), id -> new ArrayList<>()).add(note);
		}

		List<Discussion> discussions = new ArrayList<>(grouped.size());
		for (List<Note> discussionNotes : grouped.values()) {
			Note first = discussionNotes.get(0);
			boolean diffDiscussion = first.getType() == NoteType.DIFF_NOTE;
			boolean active = !diffDiscussion || liveness.isActive(noteable, first);
			discussions.add(new Discussion(noteable, discussionNotes, diffDiscussion, active, authorizer));
		}
		return discussions;
	}

}
