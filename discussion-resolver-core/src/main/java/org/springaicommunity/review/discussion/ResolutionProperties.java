package org.springaicommunity.review.discussion;

import java.time.ZoneId;

/**
 * Configuration properties for discussion resolution.
 *
 * <p>
 * Properties can be set directly via setters or passed to
 * {@link DiscussionResolverBuilder}. Default values are suitable for local use.
 */
public class ResolutionProperties {

	/**
	 * Base directory of the file-based note and collaborator stores.
	 */
	private String storeDirectory = "discussions";

	/**
	 * Time zone used for resolution timestamps.
	 */
	private String timeZone = "UTC";

	/**
	 * Enable verbose logging output.
	 */
	private boolean verbose = false;

	public String getStoreDirectory() {
		return storeDirectory;
	}

	public void setStoreDirectory(String storeDirectory) {
		this.storeDirectory = storeDirectory;
	}

	public String getTimeZone() {
		return timeZone;
	}

	public void setTimeZone(String timeZone) {
		this.timeZone = timeZone;
	}

	/**
	 * @return the configured time zone
	 * @throws java.time.DateTimeException if the zone id is invalid
	 */
	public ZoneId getZoneId() {
		return ZoneId.of(timeZone);
	}

	public boolean isVerbose() {
		return verbose;
	}

	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

}
