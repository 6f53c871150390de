package dev.jbang.pypimirror.discovery;

/** How the list of packages to scan is produced */
public enum DiscoveryMode {
	/** Parse every package name from the root of the simple index */
	FULL_INDEX,
	/** Ask BigQuery for the most downloaded packages of the last day */
	POPULARITY
}
