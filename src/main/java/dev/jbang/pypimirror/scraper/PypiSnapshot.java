package dev.jbang.pypimirror.scraper;

import dev.jbang.pypimirror.discovery.DiscoveryException;
import dev.jbang.pypimirror.discovery.PackageDiscovery;
import dev.jbang.pypimirror.discovery.QueryExecutor;
import dev.jbang.pypimirror.model.SnapshotPath;
import dev.jbang.pypimirror.model.TransferUrl;
import java.util.List;

/**
 * Takes a snapshot of a PyPI mirror: discover packages, scan every package listing, and collect
 * the artifact paths below the package base. Checksums embedded in listing URLs are removed, so
 * the snapshot only changes when the set of files does.
 */
public class PypiSnapshot {
	private final SnapshotConfig config;
	private final ScanContext context;
	private final PackageDiscovery discovery;
	private final ScrapeCoordinator coordinator;
	private final SnapshotAssembler assembler;
	private final TransferResolver resolver;

	public PypiSnapshot(SnapshotConfig config, ScanContext context, QueryExecutor.Provider queryExecutorProvider) {
		this.config = config;
		this.context = context;
		this.discovery = new PackageDiscovery(context, config, queryExecutorProvider);
		this.coordinator = new ScrapeCoordinator(config.concurrency(), context.reporter());
		this.assembler = new SnapshotAssembler(config.packageBase(), context.logger());
		this.resolver = new TransferResolver(config.packageBase());
	}

	/**
	 * Run discovery, then scan all discovered packages.
	 *
	 * @return the snapshot, in discovery order and page order within each package
	 * @throws DiscoveryException if the package list cannot be produced
	 * @throws InterruptedException if interrupted while waiting for package scans
	 */
	public List<SnapshotPath> snapshot() throws DiscoveryException, InterruptedException {
		List<String> packages = discovery.discover();

		context.logger().info("Downloading package indexes...");
		List<ScanResult> results =
				coordinator.scrapeAll(packages, name -> new PackageScraper(context, config, name).call());

		List<SnapshotPath> snapshot = assembler.assemble(results);
		context.logger()
				.info(
						"Snapshot done: {} artifacts from {} packages ({} failed)",
						snapshot.size(),
						results.size(),
						results.stream().filter(r -> !r.success()).count());
		return snapshot;
	}

	/** Map one snapshot path to the URL a download stage fetches it from */
	public TransferUrl transferUrl(SnapshotPath path) {
		return resolver.resolve(path);
	}

	/** Short description of this source for logs */
	public String describe() {
		return "pypi, simple base %s, package base %s, discovery %s, keep recent %s, debug %s"
				.formatted(
						config.simpleBase(),
						assembler.packageBase(),
						config.discoveryMode(),
						config.retention() != null ? config.retention().keepRecent() : "all",
						config.debug());
	}
}
