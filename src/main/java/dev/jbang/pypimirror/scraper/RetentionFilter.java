package dev.jbang.pypimirror.scraper;

import dev.jbang.pypimirror.model.ListingEntry;
import dev.jbang.pypimirror.model.RetentionBudget;
import dev.jbang.pypimirror.util.PythonVersion;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Keeps only the most recent versions of a package. Stable releases are preferred, pre-releases
 * and development releases may use at most half of the budget, and every artifact of a kept
 * version is kept.
 */
public class RetentionFilter {
	private final RetentionBudget budget;
	private final Logger logger;

	public RetentionFilter(RetentionBudget budget, Logger logger) {
		this.budget = budget;
		this.logger = logger;
	}

	private record Candidate(ListingEntry entry, PythonVersion version) {}

	/**
	 * Select the entries to keep for one package.
	 *
	 * @param packageName name of the package, for logging
	 * @param entries all artifacts of the package, in page order
	 * @return the kept artifacts, newest version first; the unchanged input if any filename does
	 *     not carry a parsable version
	 */
	public List<ListingEntry> apply(String packageName, List<ListingEntry> entries) {
		List<Candidate> candidates = new ArrayList<>(entries.size());
		for (ListingEntry entry : entries) {
			Optional<PythonVersion> version = PythonVersion.fromFilename(entry.filename());
			if (version.isEmpty()) {
				logger.debug("Failed to parse version from filename: {}", entry.filename());
				logger.warn("Giving up version retention for package {}: unrecognized filename {}", packageName, entry.filename());
				return entries;
			}
			candidates.add(new Candidate(entry, version.get()));
		}

		// List.sort is stable, artifacts of one version keep their relative page order
		candidates.sort(Comparator.comparing(Candidate::version));

		List<ListingEntry> result = new ArrayList<>();
		int atMostUnstable = budget.atMostUnstable();
		int selectedVersions = 0;
		int selectedUnstable = 0;
		PythonVersion previous = null;
		for (int i = candidates.size() - 1; i >= 0; i--) {
			Candidate candidate = candidates.get(i);
			PythonVersion version = candidate.version();
			if (version.equals(previous)) {
				// Another artifact of a version that is already kept
				result.add(candidate.entry());
				continue;
			}
			if (selectedVersions >= budget.keepRecent()) {
				break;
			}
			if (!version.isStable()) {
				if (selectedUnstable >= atMostUnstable) {
					continue;
				}
				selectedUnstable++;
			}
			result.add(candidate.entry());
			previous = version;
			selectedVersions++;
		}

		if (result.size() < entries.size()) {
			logger.debug("Kept {} of {} artifacts for package {}", result.size(), entries.size(), packageName);
		}
		return result;
	}
}
