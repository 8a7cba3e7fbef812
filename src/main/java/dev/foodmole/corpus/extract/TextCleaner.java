package dev.foodmole.corpus.extract;

import java.util.regex.Pattern;

/** Normalizes extracted article text for training corpora */
public class TextCleaner {
	private static final Pattern WHITESPACE = Pattern.compile("\\s+");
	// [1], [1,2], [1-3], [1–3]
	private static final Pattern CITATION_MARKER = Pattern.compile("\\[[\\d,\\s\\-–]+\\]");
	private static final Pattern REPEATED_PERIODS = Pattern.compile("\\.{2,}");
	private static final Pattern SPACE_BEFORE_PUNCTUATION = Pattern.compile("\\s+([.,;:!?])");

	private TextCleaner() {}

	public static String clean(String text) {
		if (text == null || text.isEmpty()) {
			return "";
		}
		String result = WHITESPACE.matcher(text).replaceAll(" ");
		result = CITATION_MARKER.matcher(result).replaceAll("");
		result = REPEATED_PERIODS.matcher(result).replaceAll(".");
		result = SPACE_BEFORE_PUNCTUATION.matcher(result).replaceAll("$1");
		return result.strip();
	}
}
