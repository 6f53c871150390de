package dev.jbang.pypimirror.scraper;

import dev.jbang.pypimirror.model.SnapshotPath;
import dev.jbang.pypimirror.model.TransferUrl;
import dev.jbang.pypimirror.util.UrlUtils;

/** Maps snapshot paths back to the URL the artifact can be downloaded from */
public class TransferResolver {
	private final String packageBase;

	public TransferResolver(String packageBase) {
		this.packageBase = UrlUtils.withTrailingSlash(packageBase);
	}

	public TransferUrl resolve(SnapshotPath path) {
		return new TransferUrl(packageBase + path.path());
	}
}
