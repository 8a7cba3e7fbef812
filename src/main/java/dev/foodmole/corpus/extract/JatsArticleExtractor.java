package dev.foodmole.corpus.extract;

import dev.foodmole.corpus.model.ArticleRecord;
import dev.foodmole.corpus.model.ArticleRecord.Section;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a PMC JATS XML document into an {@link ArticleRecord}: title, abstract, keywords,
 * journal, body sections and figure/table captions.
 *
 * <p>Articles whose body holds less than {@value #MIN_BODY_CHARS} characters (abstract-only
 * records, errata, scanned PDFs) are skipped.
 */
public class JatsArticleExtractor {
	private static final Logger logger = LoggerFactory.getLogger(JatsArticleExtractor.class);

	public static final int MIN_BODY_CHARS = 500;
	public static final int MIN_CAPTION_CHARS = 10;

	private static final Set<String> SKIPPED_ELEMENTS = Set.of("graphic", "media", "inline-graphic");

	private static final Set<String> SKIPPED_SECTION_TITLES = Set.of(
			"competing interests",
			"conflict of interest",
			"conflicts of interest",
			"credit authorship contribution statement",
			"authorship contribution",
			"declaration of competing interest",
			"author contributions",
			"funding",
			"acknowledgements",
			"acknowledgments",
			"acknowledgment",
			"data availability",
			"supplementary material",
			"supplementary data",
			"abbreviations",
			"ethics statement",
			"ethical approval");

	/**
	 * Extract one article file.
	 *
	 * @param xmlFile A fetched JATS document
	 * @return The record, or empty if the file is unreadable, is not an article, or is too short
	 */
	public Optional<ArticleRecord> extract(Path xmlFile) {
		String fileName = xmlFile.getFileName().toString();
		String stem = fileName.endsWith(".xml") ? fileName.substring(0, fileName.length() - 4) : fileName;
		String xml;
		try {
			xml = new String(Files.readAllBytes(xmlFile), StandardCharsets.UTF_8);
		} catch (IOException e) {
			logger.warn("Cannot read {}: {}", xmlFile, e.getMessage());
			return Optional.empty();
		}
		return extract(xml, stem);
	}

	/**
	 * Extract an article from XML text.
	 *
	 * @param xml The JATS document
	 * @param fallbackId Identifier to use when the document carries no PMC id
	 */
	public Optional<ArticleRecord> extract(String xml, String fallbackId) {
		Document doc = Jsoup.parse(xml, "", Parser.xmlParser());
		Element article = doc.selectFirst("article");
		if (article == null) {
			logger.debug("{}: no <article> element", fallbackId);
			return Optional.empty();
		}
		Element meta = article.selectFirst("article-meta");
		if (meta == null) {
			logger.debug("{}: no <article-meta> element", fallbackId);
			return Optional.empty();
		}

		List<Section> rawSections = extractBody(article);
		int bodyChars = rawSections.stream().mapToInt(s -> s.text().length()).sum();
		if (bodyChars < MIN_BODY_CHARS) {
			logger.debug("{}: body too short ({} chars)", fallbackId, bodyChars);
			return Optional.empty();
		}

		String pmcid = extractPmcid(meta);
		if (pmcid.isEmpty()) {
			pmcid = fallbackId;
		}
		String title = TextCleaner.clean(textOf(meta.selectFirst("article-title")));
		String abstractText = TextCleaner.clean(extractAbstract(meta));
		List<String> keywords = extractKeywords(meta);
		String journal = extractJournal(doc, meta);
		List<Section> sections = rawSections.stream()
				.map(s -> new Section(s.title(), TextCleaner.clean(s.text())))
				.toList();
		List<String> figureCaptions = extractCaptions(article, "fig");
		List<String> tableCaptions = extractCaptions(article, "table-wrap");

		String fullText = buildFullText(title, abstractText, keywords, sections, figureCaptions, tableCaptions);
		return Optional.of(new ArticleRecord(
				pmcid, title, abstractText, keywords, journal, sections, figureCaptions, tableCaptions, fullText));
	}

	static String buildFullText(
			String title,
			String abstractText,
			List<String> keywords,
			List<Section> sections,
			List<String> figureCaptions,
			List<String> tableCaptions) {
		List<String> parts = new ArrayList<>();
		if (!title.isEmpty()) {
			parts.add("Title: " + title);
		}
		if (!abstractText.isEmpty()) {
			parts.add("\nAbstract: " + abstractText);
		}
		if (!keywords.isEmpty()) {
			parts.add("\nKeywords: " + String.join(", ", keywords));
		}
		for (Section section : sections) {
			if (section.title().isEmpty()) {
				parts.add("\n" + section.text());
			} else {
				parts.add("\n" + section.title() + "\n" + section.text());
			}
		}
		if (!figureCaptions.isEmpty()) {
			parts.add("\nFigure Descriptions:");
			figureCaptions.forEach(c -> parts.add("  " + c));
		}
		if (!tableCaptions.isEmpty()) {
			parts.add("\nTable Descriptions:");
			tableCaptions.forEach(c -> parts.add("  " + c));
		}
		return String.join("\n", parts);
	}

	private static String extractPmcid(Element meta) {
		for (Element id : meta.select("article-id")) {
			String type = id.attr("pub-id-type");
			String value = id.text().trim();
			if (value.isEmpty()) {
				continue;
			}
			if ("pmc".equals(type) || "pmcid".equals(type)) {
				return value.startsWith("PMC") ? value : "PMC" + value;
			}
		}
		return "";
	}

	private static String extractAbstract(Element meta) {
		Element abstractElement = meta.selectFirst("abstract");
		if (abstractElement == null) {
			return "";
		}
		List<Element> sections = abstractElement.select("sec");
		if (!sections.isEmpty()) {
			List<String> parts = new ArrayList<>();
			for (Element sec : sections) {
				String title = textOf(firstChild(sec, "title")).strip();
				String body = joinParagraphs(sec.select("p"));
				if (!title.isEmpty() && !body.isEmpty()) {
					parts.add(title + ": " + body);
				} else if (!body.isEmpty()) {
					parts.add(body);
				}
			}
			return String.join(" ", parts);
		}
		List<Element> paragraphs = abstractElement.select("p");
		if (!paragraphs.isEmpty()) {
			return joinParagraphs(paragraphs);
		}
		return textOf(abstractElement).strip();
	}

	private static List<String> extractKeywords(Element meta) {
		return meta.select("kwd").stream()
				.map(k -> TextCleaner.clean(textOf(k)))
				.filter(k -> !k.isEmpty())
				.toList();
	}

	private static String extractJournal(Document doc, Element meta) {
		Element journal = doc.selectFirst("journal-meta journal-title");
		if (journal == null) {
			journal = meta.selectFirst("journal-title");
		}
		return TextCleaner.clean(textOf(journal));
	}

	private static List<Section> extractBody(Element article) {
		Element body = article.selectFirst("body");
		if (body == null) {
			return List.of();
		}
		List<Section> sections = new ArrayList<>();
		for (Element sec : body.children()) {
			if ("sec".equals(sec.tagName())) {
				collectSection(sec, sections);
			}
		}
		if (sections.isEmpty()) {
			String text = joinParagraphs(childrenNamed(body, "p"));
			if (!text.isEmpty()) {
				sections.add(new Section("", text));
			}
		}
		return sections;
	}

	/** Adds the section's own paragraphs, then its subsections, in document order */
	private static void collectSection(Element sec, List<Section> sections) {
		String title = TextCleaner.clean(textOf(firstChild(sec, "title")));
		if (SKIPPED_SECTION_TITLES.contains(title.toLowerCase(Locale.ROOT))) {
			return;
		}
		String text = joinParagraphs(childrenNamed(sec, "p"));
		if (!text.isEmpty()) {
			sections.add(new Section(title, text));
		}
		for (Element child : childrenNamed(sec, "sec")) {
			collectSection(child, sections);
		}
	}

	private static List<String> extractCaptions(Element article, String container) {
		List<String> captions = new ArrayList<>();
		for (Element element : article.select(container)) {
			Element caption = firstChild(element, "caption");
			if (caption == null) {
				continue;
			}
			String text = TextCleaner.clean(textOf(caption));
			if (text.length() <= MIN_CAPTION_CHARS) {
				continue;
			}
			String label = TextCleaner.clean(textOf(firstChild(element, "label")));
			captions.add(label.isEmpty() ? text : label + ": " + text);
		}
		return captions;
	}

	private static String joinParagraphs(List<Element> paragraphs) {
		return paragraphs.stream()
				.map(p -> textOf(p).strip())
				.filter(t -> !t.isEmpty())
				.collect(Collectors.joining(" "));
	}

	private static List<Element> childrenNamed(Element parent, String tag) {
		return parent.children().stream().filter(c -> tag.equals(c.tagName())).toList();
	}

	private static Element firstChild(Element parent, String tag) {
		for (Element child : parent.children()) {
			if (tag.equals(child.tagName())) {
				return child;
			}
		}
		return null;
	}

	/** All descendant text in document order, leaving out image references */
	static String textOf(Element element) {
		if (element == null) {
			return "";
		}
		StringBuilder sb = new StringBuilder();
		appendText(element, sb);
		return sb.toString();
	}

	private static void appendText(Node node, StringBuilder sb) {
		for (Node child : node.childNodes()) {
			if (child instanceof TextNode text) {
				sb.append(text.getWholeText());
			} else if (child instanceof Element element && !SKIPPED_ELEMENTS.contains(element.tagName())) {
				appendText(element, sb);
			}
		}
	}
}
