package org.springaicommunity.review.discussion;

import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * On-disk document for one noteable, as written by {@link FileSystemNoteStore}.
 *
 * @param noteable the noteable itself
 * @param activeLineCodes line codes present in the noteable's current diff
 * @param notes all notes of the noteable in creation order
 */
public record StoredNoteable(Noteable noteable, List<String> activeLineCodes, List<StoredNote> notes) {

	public StoredNoteable {
		activeLineCodes = activeLineCodes != null ? List.copyOf(activeLineCodes) : List.of();
		notes = notes != null ? List.copyOf(notes) : List.of();
	}

	/**
	 * Serialized form of a {@link Note}.
	 *
	 * @param id the note id
	 * @param discussionId the id of the discussion the note belongs to
	 * @param type the note classification
	 * @param author the note author
	 * @param body the comment text
	 * @param createdAt when the note was created
	 * @param lineCode the diff line the note is anchored to (null for plain notes)
	 * @param resolvedAt when the note was resolved (null if unresolved)
	 * @param resolvedBy who resolved the note (null if unresolved)
	 */
	public record StoredNote(long id, String discussionId, NoteType type, User author, String body,
			LocalDateTime createdAt, @Nullable String lineCode, @Nullable LocalDateTime resolvedAt,
			@Nullable User resolvedBy) {

		public static StoredNote from(Note note) {
			return new StoredNote(note.getId(), note.getDiscussionId(), note.getType(), note.getAuthor(),
					note.getBody(), note.getCreatedAt(), note.getLineCode(), note.getResolvedAt(),
					note.getResolvedBy());
		}

		public Note toNote(Clock clock) {
			return new Note(id, discussionId, type, author, body, createdAt, lineCode, resolvedAt, resolvedBy, clock);
		}

	}
}
