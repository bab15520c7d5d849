package org.springaicommunity.review.discussion;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A single comment in a discussion.
 *
 * <p>
 * Resolvable notes (see {@link NoteType#isResolvable()}) are a two-state machine:
 * <ul>
 * <li>{@link #resolve(User)} moves an unresolved note to resolved, capturing the user and
 * the current time. Resolving an already resolved note keeps the original user and
 * timestamp.</li>
 * <li>{@link #unresolve()} clears the user and timestamp unconditionally.</li>
 * </ul>
 * A note is resolved exactly when {@link #getResolvedAt()} is set.
 */
public class Note {

	private static final Logger logger = LoggerFactory.getLogger(Note.class);

	private final long id;

	private final String discussionId;

	private final NoteType type;

	private final User author;

	private final String body;

	private final LocalDateTime createdAt;

	@Nullable
	private final String lineCode;

	private final Clock clock;

	@Nullable
	private LocalDateTime resolvedAt;

	@Nullable
	private User resolvedBy;

	public Note(long id, String discussionId, NoteType type, User author, String body, LocalDateTime createdAt,
			@Nullable String lineCode) {
		this(id, discussionId, type, author, body, createdAt, lineCode, null, null, Clock.systemUTC());
	}

	public Note(long id, String discussionId, NoteType type, User author, String body, LocalDateTime createdAt,
			@Nullable String lineCode, @Nullable LocalDateTime resolvedAt, @Nullable User resolvedBy, Clock clock) {
		this.id = id;
		this.discussionId = Objects.requireNonNull(discussionId, "discussionId");
		this.type = Objects.requireNonNull(type, "type");
		this.author = Objects.requireNonNull(author, "author");
		this.body = Objects.requireNonNull(body, "body");
		this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
		this.lineCode = lineCode;
		this.clock = Objects.requireNonNull(clock, "clock");
		// A half-set resolution pair cannot be expressed; both or neither.
		if ((resolvedAt == null) != (resolvedBy == null)) {
			throw new IllegalArgumentException(
					"Note " + id + ": resolvedAt and resolvedBy must either both be set or both be null");
		}
		this.resolvedAt = resolvedAt;
		this.resolvedBy = resolvedBy;
	}

	public long getId() {
		return id;
	}

	public String getDiscussionId() {
		return discussionId;
	}

	public NoteType getType() {
		return type;
	}

	public User getAuthor() {
		return author;
	}

	public String getBody() {
		return body;
	}

	public LocalDateTime getCreatedAt() {
		return createdAt;
	}

	@Nullable
	public String getLineCode() {
		return lineCode;
	}

	@Nullable
	public LocalDateTime getResolvedAt() {
		return resolvedAt;
	}

	@Nullable
	public User getResolvedBy() {
		return resolvedBy;
	}

	public boolean isResolvable() {
		return type.isResolvable();
	}

	public boolean isResolved() {
		return resolvedAt != null;
	}

	/**
	 * Mark this note as resolved by the given user.
	 * @param user the user resolving the note
	 * @return true if the note changed state, false if it was already resolved or cannot
	 * be resolved
	 */
	public boolean resolve(User user) {
		if (!isResolvable()) {
			logger.debug("Note {} is not resolvable, ignoring resolve by {}", id, user.username());
			return false;
		}
		if (isResolved()) {
			return false;
		}
		this.resolvedAt = LocalDateTime.now(clock);
		this.resolvedBy = user;
		logger.debug("Note {} resolved by {} at {}", id, user.username(), resolvedAt);
		return true;
	}

	/**
	 * Clear the resolution of this note.
	 * @return true if the note was resolved before the call
	 */
	public boolean unresolve() {
		boolean wasResolved = isResolved();
		this.resolvedAt = null;
		this.resolvedBy = null;
		return wasResolved;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Note other)) {
			return false;
		}
		return id == other.id;
	}

	@Override
	public int hashCode() {
		return Long.hashCode(id);
	}

	@Override
	public String toString() {
		return "Note{id=" + id + ", discussionId=" + discussionId + ", type=" + type + ", resolved=" + isResolved()
				+ "}";
	}

}
