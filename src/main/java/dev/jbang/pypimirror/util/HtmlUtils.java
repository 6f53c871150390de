package dev.jbang.pypimirror.util;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.parser.Parser;

/** Minimal anchor extraction for PEP 503 "simple" index pages */
public class HtmlUtils {
	private static final Pattern ANCHOR_PATTERN =
			Pattern.compile("<a\\s[^>]*?href=\"([^\"]*)\"[^>]*>(.*?)</a>", Pattern.CASE_INSENSITIVE);

	/** One anchor tag: href and link text, with named and numeric character references decoded */
	public record Anchor(String href, String text) {}

	private HtmlUtils() {}

	/** Extract all anchors with an href, in document order */
	public static List<Anchor> extractAnchors(String html) {
		List<Anchor> anchors = new ArrayList<>();
		Matcher matcher = ANCHOR_PATTERN.matcher(html);
		while (matcher.find()) {
			anchors.add(new Anchor(
					Parser.unescapeEntities(matcher.group(1), true),
					Parser.unescapeEntities(matcher.group(2).trim(), false)));
		}
		return anchors;
	}

	/** Extract the link texts of all anchors with an href, in document order */
	public static List<String> extractLinkTexts(String html) {
		return extractAnchors(html).stream().map(Anchor::text).toList();
	}
}
