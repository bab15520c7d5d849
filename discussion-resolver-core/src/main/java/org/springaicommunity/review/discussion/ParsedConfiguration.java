package org.springaicommunity.review.discussion;

import org.jspecify.annotations.Nullable;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Store settings
	public String storeDirectory;

	// Target
	@Nullable
	public String noteable; // type/id, e.g. merge_request/42

	@Nullable
	public String discussionId;

	// Acting user (null = anonymous)
	@Nullable
	public String username;

	public String action = "show"; // show, list, resolve, unresolve

	// Mode flags
	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(ResolutionProperties defaultProperties) {
		// Initialize with defaults
		this.storeDirectory = defaultProperties.getStoreDirectory();
		this.verbose = defaultProperties.isVerbose();
	}

	/**
	 * @return the acting user, or null when no user was given
	 */
	@Nullable
	public User user() {
		return username != null && !username.isBlank() ? User.of(username.trim()) : null;
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "storeDirectory='" + storeDirectory + '\'' + ", noteable='" + noteable + '\''
				+ ", discussionId='" + discussionId + '\'' + ", username='" + username + '\'' + ", action='" + action
				+ '\'' + ", verbose=" + verbose + ", helpRequested=" + helpRequested + '}';
	}

}
