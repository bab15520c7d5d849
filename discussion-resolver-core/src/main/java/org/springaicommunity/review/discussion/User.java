package org.springaicommunity.review.discussion;

import org.jspecify.annotations.Nullable;

/**
 * Represents a user of the review system (note author, resolver, or noteable author).
 *
 * @param username the unique username (never null)
 * @param name the user's display name (may be null if not set in their profile)
 */
public record User(String username, @Nullable String name) {

	public User {
		if (username == null || username.isBlank()) {
			throw new IllegalArgumentException("Username must not be blank");
		}
	}

	/**
	 * Create a user reference from a username only.
	 * @param username the unique username
	 * @return user without a display name
	 */
	public static User of(String username) {
		return new User(username, null);
	}

	/**
	 * Whether this reference and the other denote the same account. Only the username is
	 * compared; display names are not part of the identity.
	 * @param other the other user, may be null
	 * @return true if both usernames match
	 */
	public boolean isSameUser(@Nullable User other) {
		return other != null && username.equals(other.username());
	}

}
