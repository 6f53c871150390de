package dev.jbang.pypimirror.model;

/** Path of one artifact relative to the package base. Only long-lived output of a snapshot run. */
public record SnapshotPath(String path) {

	@Override
	public String toString() {
		return path;
	}
}
