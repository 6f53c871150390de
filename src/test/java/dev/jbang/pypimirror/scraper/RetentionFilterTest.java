package dev.jbang.pypimirror.scraper;

import static org.assertj.core.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import dev.jbang.pypimirror.model.ListingEntry;
import dev.jbang.pypimirror.model.RetentionBudget;
import dev.jbang.pypimirror.util.PythonVersion;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class RetentionFilterTest {
	private Logger logger;
	private ListAppender<ILoggingEvent> appender;

	@BeforeEach
	void setUp() {
		logger = (Logger) LoggerFactory.getLogger("retention-filter-test");
		logger.setLevel(Level.DEBUG);
		appender = new ListAppender<>();
		appender.start();
		logger.addAppender(appender);
	}

	@AfterEach
	void tearDown() {
		logger.detachAppender(appender);
		appender.stop();
	}

	private static ListingEntry entry(String filename) {
		return new ListingEntry("https://files.example.org/packages/ab/cd/" + filename, filename);
	}

	private RetentionFilter filter(int keepRecent) {
		return new RetentionFilter(new RetentionBudget(keepRecent), logger);
	}

	private long warnings() {
		return appender.list.stream().filter(e -> e.getLevel() == Level.WARN).count();
	}

	@Test
	void testKeepsNewestVersionsWithinBudget() {
		// Given
		List<ListingEntry> entries = List.of(
				entry("foo-1.0.0.tar.gz"),
				entry("foo-1.0.0-py3-none-any.whl"),
				entry("foo-2.0.0rc1.tar.gz"),
				entry("foo-2.0.1.tar.gz"));

		// When
		List<ListingEntry> kept = filter(2).apply("foo", entries);

		// Then
		assertThat(kept).extracting(ListingEntry::filename).containsExactly("foo-2.0.1.tar.gz", "foo-2.0.0rc1.tar.gz");
		assertThat(warnings()).isZero();
	}

	@Test
	void testUnparsableFilenameDisablesFiltering() {
		// Given
		List<ListingEntry> entries = List.of(entry("data.tar"), entry("readme.txt"));

		// When
		List<ListingEntry> kept = filter(5).apply("misc", entries);

		// Then
		assertThat(kept).isEqualTo(entries);
		assertThat(warnings()).isEqualTo(1);
		assertThat(appender.list)
				.filteredOn(e -> e.getLevel() == Level.WARN)
				.first()
				.extracting(ILoggingEvent::getFormattedMessage)
				.asString()
				.contains("misc");
	}

	@Test
	void testOneBadFilenameAmongGoodOnesKeepsEverything() {
		// Given
		List<ListingEntry> entries =
				List.of(entry("foo-1.0.tar.gz"), entry("foo-2.0.tar.gz"), entry("foo-latest.tar.gz"), entry("foo-3.0.tar.gz"));

		// When
		List<ListingEntry> kept = filter(1).apply("foo", entries);

		// Then
		assertThat(kept).isEqualTo(entries);
		assertThat(warnings()).isEqualTo(1);
	}

	@Test
	void testWindowsInstallersAreFiltered() {
		// Given
		List<ListingEntry> entries = List.of(
				entry("foo-1.0.win32.exe"),
				entry("foo-1.0.tar.gz"),
				entry("foo-2.0.tar.gz"),
				entry("foo-2.0.win-amd64-py2.7.exe"),
				entry("foo-3.0.tar.gz"));

		// When
		List<ListingEntry> kept = filter(1).apply("foo", entries);

		// Then
		assertThat(kept).extracting(ListingEntry::filename).containsExactly("foo-3.0.tar.gz");
		assertThat(warnings()).isZero();
	}

	@Test
	void testUnstableVersionsUseAtMostHalfTheBudget() {
		// Given
		List<ListingEntry> entries = List.of(
				entry("foo-1.0.tar.gz"),
				entry("foo-2.0.tar.gz"),
				entry("foo-3.0a1.tar.gz"),
				entry("foo-3.0b1.tar.gz"),
				entry("foo-3.0rc1.tar.gz"));

		// When
		List<ListingEntry> kept = filter(4).apply("foo", entries);

		// Then
		assertThat(kept)
				.extracting(ListingEntry::filename)
				.containsExactly("foo-3.0rc1.tar.gz", "foo-3.0b1.tar.gz", "foo-2.0.tar.gz", "foo-1.0.tar.gz");
	}

	@Test
	void testBudgetOfOneNeverKeepsPreReleases() {
		// Given
		List<ListingEntry> entries =
				List.of(entry("foo-1.0.tar.gz"), entry("foo-2.0rc1.tar.gz"), entry("foo-2.0.dev3.tar.gz"));

		// When
		List<ListingEntry> kept = filter(1).apply("foo", entries);

		// Then
		assertThat(kept).extracting(ListingEntry::filename).containsExactly("foo-1.0.tar.gz");
	}

	@Test
	void testOnlyPreReleasesWithBudgetOfOne() {
		// Given
		List<ListingEntry> entries = List.of(entry("foo-1.0a1.tar.gz"), entry("foo-1.0b1.tar.gz"));

		// When
		List<ListingEntry> kept = filter(1).apply("foo", entries);

		// Then
		assertThat(kept).isEmpty();
	}

	@Test
	void testAllArtifactsOfKeptVersionsAreKept() {
		// Given
		List<ListingEntry> entries = List.of(
				entry("foo-2.0.tar.gz"),
				entry("foo-2.0-py3-none-any.whl"),
				entry("foo-2.0-cp311-cp311-win_amd64.whl"),
				entry("foo-1.0.tar.gz"),
				entry("foo-1.0.zip"),
				entry("foo-0.9.tar.gz"));

		// When
		List<ListingEntry> kept = filter(2).apply("foo", entries);

		// Then
		assertThat(kept)
				.extracting(ListingEntry::filename)
				.containsExactly(
						"foo-2.0-cp311-cp311-win_amd64.whl",
						"foo-2.0-py3-none-any.whl",
						"foo-2.0.tar.gz",
						"foo-1.0.zip",
						"foo-1.0.tar.gz");
	}

	@Test
	void testEquivalentSpellingsAreOneVersion() {
		// Given
		List<ListingEntry> entries = List.of(entry("foo-1.0.tar.gz"), entry("foo-1.0.0-py3-none-any.whl"), entry("foo-0.5.zip"));

		// When
		List<ListingEntry> kept = filter(1).apply("foo", entries);

		// Then
		assertThat(kept).hasSize(2).extracting(ListingEntry::filename).doesNotContain("foo-0.5.zip");
	}

	@Test
	void testEmptyListing() {
		assertThat(filter(3).apply("empty", List.of())).isEmpty();
		assertThat(warnings()).isZero();
	}

	@Test
	void testRandomListingsRespectBudget() {
		String[] suffixes = {"", "a1", "b2", "rc1", ".dev1", ".post1"};
		String[] extensions = {".tar.gz", "-py3-none-any.whl", ".zip"};
		Random random = new Random(20240501L);

		for (int round = 0; round < 200; round++) {
			// Given
			List<ListingEntry> entries = new ArrayList<>();
			int artifacts = random.nextInt(25);
			for (int i = 0; i < artifacts; i++) {
				String version = random.nextInt(4) + "." + random.nextInt(6) + suffixes[random.nextInt(suffixes.length)];
				entries.add(entry("pkg-" + version + extensions[random.nextInt(extensions.length)]));
			}
			RetentionBudget budget = new RetentionBudget(1 + random.nextInt(6));

			// When
			List<ListingEntry> kept = new RetentionFilter(budget, logger).apply("pkg", entries);

			// Then
			assertThat(entries).containsAll(kept);
			Set<PythonVersion> keptVersions = kept.stream().map(RetentionFilterTest::version).collect(Collectors.toSet());
			assertThat(keptVersions.size()).isLessThanOrEqualTo(budget.keepRecent());
			assertThat(keptVersions.stream().filter(v -> !v.isStable()).count())
					.isLessThanOrEqualTo(budget.atMostUnstable());
			for (ListingEntry candidate : entries) {
				if (keptVersions.contains(version(candidate))) {
					assertThat(kept).contains(candidate);
				}
			}
			// Nothing newer than a kept stable version was skipped unless it is unstable
			Set<PythonVersion> dropped = new HashSet<>();
			entries.stream().map(RetentionFilterTest::version).filter(v -> !keptVersions.contains(v)).forEach(dropped::add);
			for (PythonVersion keptVersion : keptVersions) {
				assertThat(dropped)
						.filteredOn(v -> v.isStable() && v.compareTo(keptVersion) > 0)
						.isEmpty();
			}
		}
	}

	private static PythonVersion version(ListingEntry entry) {
		return PythonVersion.fromFilename(entry.filename()).orElseThrow();
	}
}
