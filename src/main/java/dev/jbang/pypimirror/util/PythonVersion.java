package dev.jbang.pypimirror.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A PEP 440 version. Ordering follows PEP 440, and {@link #equals(Object)} is consistent with it,
 * so {@code 1.0} and {@code 1.0.0} are the same version.
 */
public final class PythonVersion implements Comparable<PythonVersion> {

	private static final Pattern VERSION_PATTERN = Pattern.compile(
			"""
			v?
			(?:(?<epoch>[0-9]+)!)?
			(?<release>[0-9]+(?:\\.[0-9]+)*)
			(?:[-_.]?(?<preL>alpha|a|beta|b|preview|pre|c|rc)[-_.]?(?<preN>[0-9]+)?)?
			(?:(?:-(?<postN1>[0-9]+))|(?:[-_.]?(?<postL>post|rev|r)[-_.]?(?<postN2>[0-9]+)?))?
			(?:[-_.]?(?<devL>dev)[-_.]?(?<devN>[0-9]+)?)?
			(?:\\+(?<local>[a-z0-9]+(?:[-_.][a-z0-9]+)*))?
			""",
			Pattern.COMMENTS | Pattern.CASE_INSENSITIVE);

	private static final Pattern ARCHIVE_PATTERN = Pattern.compile("^(.+)\\.(tar\\.gz|tar\\.bz2|zip|whl|exe|egg)$");

	/** Pre-release phases in PEP 440 order */
	public enum Phase {
		a,
		b,
		rc
	}

	private final String text;
	private final long epoch;
	private final List<Long> release;
	private final Phase prePhase;
	private final long preNumber;
	private final Long post;
	private final Long dev;
	private final List<Comparable<?>> local;

	private PythonVersion(
			String text,
			long epoch,
			List<Long> release,
			Phase prePhase,
			long preNumber,
			Long post,
			Long dev,
			List<Comparable<?>> local) {
		this.text = text;
		this.epoch = epoch;
		this.release = release;
		this.prePhase = prePhase;
		this.preNumber = preNumber;
		this.post = post;
		this.dev = dev;
		this.local = local;
	}

	/**
	 * Parse a PEP 440 version string.
	 *
	 * @return the version, or empty if the string is not a valid PEP 440 version
	 */
	public static Optional<PythonVersion> parse(String version) {
		if (version == null) {
			return Optional.empty();
		}
		Matcher m = VERSION_PATTERN.matcher(version.trim());
		if (!m.matches()) {
			return Optional.empty();
		}
		try {
			long epoch = m.group("epoch") != null ? Long.parseLong(m.group("epoch")) : 0;

			List<Long> release = new ArrayList<>();
			for (String part : m.group("release").split("\\.")) {
				release.add(Long.parseLong(part));
			}
			// Trailing zeros are insignificant: 1.0 == 1.0.0
			int significant = release.size();
			while (significant > 1 && release.get(significant - 1) == 0L) {
				significant--;
			}
			release = List.copyOf(release.subList(0, significant));

			Phase prePhase = null;
			long preNumber = 0;
			if (m.group("preL") != null) {
				prePhase = normalizePhase(m.group("preL"));
				preNumber = m.group("preN") != null ? Long.parseLong(m.group("preN")) : 0;
			}

			Long post = null;
			if (m.group("postN1") != null) {
				post = Long.parseLong(m.group("postN1"));
			} else if (m.group("postL") != null) {
				post = m.group("postN2") != null ? Long.parseLong(m.group("postN2")) : 0L;
			}

			Long dev = null;
			if (m.group("devL") != null) {
				dev = m.group("devN") != null ? Long.parseLong(m.group("devN")) : 0L;
			}

			List<Comparable<?>> local = null;
			if (m.group("local") != null) {
				local = new ArrayList<>();
				for (String part : m.group("local").split("[-_.]")) {
					local.add(isNumeric(part) ? (Comparable<?>) Long.valueOf(part) : part.toLowerCase(Locale.ROOT));
				}
				local = Collections.unmodifiableList(local);
			}

			return Optional.of(new PythonVersion(version, epoch, release, prePhase, preNumber, post, dev, local));
		} catch (NumberFormatException e) {
			// Segment does not fit in a long
			return Optional.empty();
		}
	}

	/**
	 * Extract the version from an artifact filename of the form {@code <name>-<version><suffix>.<ext>},
	 * where {@code <ext>} is one of the archive or wheel extensions PyPI serves. Package names may
	 * contain dashes themselves, so every dash followed by a digit is tried in turn and the first
	 * candidate that yields a version wins.
	 *
	 * <p>Wheel versions end at the next dash. Other artifacts may carry platform tags right after
	 * the version ({@code numpy-1.9.2.win32-py2.7.exe}), so the longest prefix ending at a {@code .}
	 * or {@code -} that parses is taken.
	 *
	 * @return the version, or empty if the filename does not follow the convention
	 */
	public static Optional<PythonVersion> fromFilename(String filename) {
		if (filename == null) {
			return Optional.empty();
		}
		Matcher archive = ARCHIVE_PATTERN.matcher(filename.trim());
		if (!archive.matches()) {
			return Optional.empty();
		}
		String stem = archive.group(1);
		boolean wheel = archive.group(2).equals("whl");
		for (int dash = stem.indexOf('-'); dash >= 0; dash = stem.indexOf('-', dash + 1)) {
			if (dash + 1 >= stem.length() || !Character.isDigit(stem.charAt(dash + 1))) {
				continue;
			}
			String rest = stem.substring(dash + 1);
			Optional<PythonVersion> version = wheel ? parseWheelVersion(rest) : parseLongestPrefix(rest);
			if (version.isPresent()) {
				return version;
			}
		}
		return Optional.empty();
	}

	private static Optional<PythonVersion> parseWheelVersion(String rest) {
		int end = rest.indexOf('-');
		return parse(end < 0 ? rest : rest.substring(0, end));
	}

	private static Optional<PythonVersion> parseLongestPrefix(String rest) {
		for (int end = rest.length(); end > 0; end--) {
			if (end < rest.length() && rest.charAt(end) != '.' && rest.charAt(end) != '-') {
				continue;
			}
			Optional<PythonVersion> version = parse(rest.substring(0, end));
			if (version.isPresent()) {
				return version;
			}
		}
		return Optional.empty();
	}

	private static Phase normalizePhase(String label) {
		return switch (label.toLowerCase(Locale.ROOT)) {
			case "a", "alpha" -> Phase.a;
			case "b", "beta" -> Phase.b;
			default -> Phase.rc; // c, pre, preview, rc
		};
	}

	private static boolean isNumeric(String s) {
		for (int i = 0; i < s.length(); i++) {
			if (!Character.isDigit(s.charAt(i))) {
				return false;
			}
		}
		return !s.isEmpty();
	}

	/** A version is stable unless it is a pre-release or a development release */
	public boolean isStable() {
		return prePhase == null && dev == null;
	}

	@Override
	public int compareTo(PythonVersion other) {
		int cmp = Long.compare(epoch, other.epoch);
		if (cmp != 0) return cmp;

		cmp = compareRelease(release, other.release);
		if (cmp != 0) return cmp;

		cmp = Integer.compare(preRank(), other.preRank());
		if (cmp != 0) return cmp;
		if (prePhase != null && other.prePhase != null) {
			cmp = Long.compare(preNumber, other.preNumber);
			if (cmp != 0) return cmp;
		}

		// Missing post sorts before any post release
		cmp = compareNullable(post, other.post, -1);
		if (cmp != 0) return cmp;

		// Missing dev sorts after any dev release
		cmp = compareNullable(dev, other.dev, 1);
		if (cmp != 0) return cmp;

		return compareLocal(local, other.local);
	}

	/**
	 * Rank of the pre-release part. A bare dev release (1.0.dev1) sorts before every pre-release of
	 * the same release, and a final release sorts after all of them.
	 */
	private int preRank() {
		if (prePhase == null && post == null && dev != null) {
			return -1;
		}
		if (prePhase == null) {
			return Phase.values().length;
		}
		return prePhase.ordinal();
	}

	private static int compareRelease(List<Long> r1, List<Long> r2) {
		int length = Math.max(r1.size(), r2.size());
		for (int i = 0; i < length; i++) {
			long p1 = i < r1.size() ? r1.get(i) : 0;
			long p2 = i < r2.size() ? r2.get(i) : 0;
			if (p1 != p2) {
				return Long.compare(p1, p2);
			}
		}
		return 0;
	}

	private static int compareNullable(Long v1, Long v2, int nullOrder) {
		if (v1 == null && v2 == null) return 0;
		if (v1 == null) return nullOrder;
		if (v2 == null) return -nullOrder;
		return Long.compare(v1, v2);
	}

	private static int compareLocal(List<Comparable<?>> l1, List<Comparable<?>> l2) {
		if (l1 == null && l2 == null) return 0;
		if (l1 == null) return -1;
		if (l2 == null) return 1;
		int length = Math.min(l1.size(), l2.size());
		for (int i = 0; i < length; i++) {
			Object p1 = l1.get(i);
			Object p2 = l2.get(i);
			int cmp;
			if (p1 instanceof Long n1 && p2 instanceof Long n2) {
				cmp = Long.compare(n1, n2);
			} else if (p1 instanceof String s1 && p2 instanceof String s2) {
				cmp = s1.compareTo(s2);
			} else {
				// Numeric segments sort after alphanumeric ones
				cmp = p1 instanceof Long ? 1 : -1;
			}
			if (cmp != 0) {
				return cmp;
			}
		}
		return Integer.compare(l1.size(), l2.size());
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof PythonVersion other)) return false;
		return compareTo(other) == 0;
	}

	@Override
	public int hashCode() {
		return Objects.hash(epoch, release, prePhase, prePhase != null ? preNumber : 0, post, dev, local);
	}

	@Override
	public String toString() {
		return text;
	}
}
