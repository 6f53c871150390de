package dev.jbang.pypimirror.model;

/** Maximum number of distinct versions to keep per package. */
public record RetentionBudget(int keepRecent) {

	public RetentionBudget {
		if (keepRecent <= 0) {
			throw new IllegalArgumentException("keepRecent must be positive, got " + keepRecent);
		}
	}

	/** Pre-releases may take at most half of the budget */
	public int atMostUnstable() {
		return keepRecent / 2;
	}
}
