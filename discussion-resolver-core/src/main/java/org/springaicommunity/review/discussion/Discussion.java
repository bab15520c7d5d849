package org.springaicommunity.review.discussion;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A thread of notes attached to a noteable.
 *
 * <p>
 * A discussion has no resolution state of its own. Whether it is resolvable or resolved,
 * and who resolved it when, is folded from its resolvable notes on every read.
 * {@link #resolve(User)} and {@link #unresolve()} fan out to the resolvable notes only;
 * other notes are never touched.
 *
 * <p>
 * Instances are built per operation from freshly loaded notes (see
 * {@link Discussions#forNotes}) and are not thread-safe.
 */
public class Discussion {

	private final Noteable noteable;

	private final List<Note> notes;

	private final boolean diffDiscussion;

	private final boolean active;

	private final Authorizer authorizer;

	/**
	 * Create a discussion over an ordered note collection.
	 * @param noteable the discussed subject
	 * @param notes the notes in insertion order, at least one
	 * @param diffDiscussion whether the thread is anchored to a diff line
	 * @param active whether the anchored diff position still exists in the current diff
	 * @param authorizer push permission check used by {@link #canResolve(User)}
	 */
	public Discussion(Noteable noteable, List<Note> notes, boolean diffDiscussion, boolean active,
			Authorizer authorizer) {
		if (notes == null || notes.isEmpty()) {
			throw new IllegalArgumentException("A discussion needs at least one note");
		}
		this.noteable = Objects.requireNonNull(noteable, "noteable");
		this.notes = Collections.unmodifiableList(new ArrayList<>(notes));
		this.diffDiscussion = diffDiscussion;
		this.active = active;
		this.authorizer = Objects.requireNonNull(authorizer, "authorizer");
	}

	public String id() {
		return firstNote().getDiscussionId();
	}

	public Noteable noteable() {
		return noteable;
	}

	public Project project() {
		return noteable.project();
	}

	public List<Note> notes() {
		return notes;
	}

	public Note firstNote() {
		return notes.get(0);
	}

	public Note lastNote() {
		return notes.get(notes.size() - 1);
	}

	public LocalDateTime lastUpdatedAt() {
		return lastNote().getCreatedAt();
	}

	public User lastUpdatedBy() {
		return lastNote().getAuthor();
	}

	public boolean isDiffDiscussion() {
		return diffDiscussion;
	}

	public boolean isActive() {
		return active;
	}

	/**
	 * The notes that take part in resolution, in collection order.
	 * @return resolvable notes, possibly empty
	 */
	public List<Note> resolvableNotes() {
		List<Note> resolvable = new ArrayList<>();
		for (Note note : notes) {
			if (note.isResolvable()) {
				resolvable.add(note);
			}
		}
		return resolvable;
	}

	public boolean isResolvable() {
		return diffDiscussion && notes.stream().anyMatch(Note::isResolvable);
	}

	public boolean isResolved() {
		if (!isResolvable()) {
			return false;
		}
		return resolvableNotes().stream().allMatch(Note::isResolved);
	}

	/**
	 * Whether this discussion still needs action. Never true for a discussion that cannot
	 * be resolved.
	 * @return true if resolvable and not resolved
	 */
	public boolean isToBeResolved() {
		if (!isResolvable()) {
			return false;
		}
		return !isResolved();
	}

	/**
	 * Whether the discussion should be shown collapsed. Resolvable diff discussions
	 * collapse once resolved; other diff discussions collapse once their diff position is
	 * outdated. Non-diff discussions are always expanded.
	 * @return true if collapsed
	 */
	public boolean isCollapsed() {
		if (!diffDiscussion) {
			return false;
		}
		if (isResolvable()) {
			return isResolved();
		}
		return !active;
	}

	/**
	 * When the discussion was resolved, read from its first resolved resolvable note.
	 * @return resolution timestamp, or null while not resolved
	 */
	@Nullable
	public LocalDateTime resolvedAt() {
		return resolvedNote().map(Note::getResolvedAt).orElse(null);
	}

	/**
	 * Who resolved the discussion, read from its first resolved resolvable note.
	 * @return resolving user, or null while not resolved
	 */
	@Nullable
	public User resolvedBy() {
		return resolvedNote().map(Note::getResolvedBy).orElse(null);
	}

	/**
	 * The first resolvable note still awaiting resolution.
	 * @return the note, or empty if none is pending or the discussion is not resolvable
	 */
	public Optional<Note> firstNoteToResolve() {
		if (!isResolvable()) {
			return Optional.empty();
		}
		return resolvableNotes().stream().filter(note -> !note.isResolved()).findFirst();
	}

	/**
	 * Whether the user may resolve or unresolve this discussion: the noteable author, or
	 * anyone who can push to the project.
	 * @param user the acting user, null when not signed in
	 * @return true if allowed
	 */
	public boolean canResolve(@Nullable User user) {
		if (!isResolvable()) {
			return false;
		}
		if (user == null) {
			return false;
		}
		if (user.isSameUser(noteable.author())) {
			return true;
		}
		return authorizer.canPush(user, noteable.project());
	}

	/**
	 * Resolve every resolvable note. Notes that are already resolved keep their original
	 * resolver and timestamp. No permission check happens here; callers check
	 * {@link #canResolve(User)} first.
	 * @param user the resolving user
	 * @return the notes whose state changed; empty if nothing changed or the discussion is
	 * not resolvable
	 */
	public List<Note> resolve(User user) {
		if (!isResolvable()) {
			return List.of();
		}
		List<Note> changed = new ArrayList<>();
		for (Note note : resolvableNotes()) {
			if (note.resolve(user)) {
				changed.add(note);
			}
		}
		return changed;
	}

	/**
	 * Clear the resolution of every resolvable note.
	 * @return the notes that were resolved before the call; empty if the discussion is not
	 * resolvable
	 */
	public List<Note> unresolve() {
		if (!isResolvable()) {
			return List.of();
		}
		List<Note> changed = new ArrayList<>();
		for (Note note : resolvableNotes()) {
			if (note.unresolve()) {
				changed.add(note);
			}
		}
		return changed;
	}

	private Optional<Note> resolvedNote() {
		if (!isResolved()) {
			return Optional.empty();
		}
		return resolvableNotes().stream().filter(Note::isResolved).findFirst();
	}

	@Override
	public String toString() {
		return "Discussion{id=" + id() + ", noteable=" + noteable.reference() + ", notes=" + notes.size()
				+ ", resolved=" + isResolved() + "}";
	}

}
