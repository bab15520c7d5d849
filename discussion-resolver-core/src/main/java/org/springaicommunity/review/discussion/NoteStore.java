package org.springaicommunity.review.discussion;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for noteables and their notes.
 *
 * <p>
 * Abstracts storage to enable testability and alternative backends. Failures are
 * reported as {@link NoteStoreException} and are not caught by the resolution core.
 */
public interface NoteStore {

	/**
	 * Look up a noteable by reference.
	 * @param reference reference in "type/id" format (e.g. "merge_request/42")
	 * @return the noteable, or empty if unknown
	 */
	Optional<Noteable> findNoteable(String reference);

	/**
	 * Load all notes of a noteable in creation order.
	 * @param noteable the noteable
	 * @return ordered notes, possibly empty
	 */
	List<Note> findNotes(Noteable noteable);

	/**
	 * Persist the resolution state of the given notes.
	 * @param noteable the noteable the notes belong to
	 * @param notes the notes to write
	 */
	void saveNotes(Noteable noteable, Collection<Note> notes);

}
