package dev.jbang.pypimirror.model;

/** Absolute URL a download stage fetches the bytes of one {@link SnapshotPath} from. */
public record TransferUrl(String url) {

	@Override
	public String toString() {
		return url;
	}
}
