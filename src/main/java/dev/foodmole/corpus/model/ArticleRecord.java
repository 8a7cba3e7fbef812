package dev.foodmole.corpus.model;

import java.util.List;

/** Clean text extracted from one fetched article */
public record ArticleRecord(
		String pmcid,
		String title,
		String abstractText,
		List<String> keywords,
		String journal,
		List<Section> sections,
		List<String> figureCaptions,
		List<String> tableCaptions,
		String fullText) {

	/** A body section; the title is empty for paragraphs outside any section */
	public record Section(String title, String text) {}

	public int textLength() {
		return fullText.length();
	}

	public int bodyLength() {
		return sections.stream().mapToInt(s -> s.text().length()).sum();
	}
}
