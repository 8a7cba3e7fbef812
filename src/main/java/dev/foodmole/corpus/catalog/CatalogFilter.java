package dev.foodmole.corpus.catalog;

import dev.foodmole.corpus.model.ArticleRef;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects articles from the PMC open-access file list ({@code oa_file_list.csv}) whose citation
 * mentions any of a set of keywords.
 */
public class CatalogFilter {
	private static final Logger logger = LoggerFactory.getLogger(CatalogFilter.class);

	public static final String DEFAULT_KEYWORDS_RESOURCE = "/catalog-keywords.txt";

	static final String ACCESSION_COLUMN = "Accession ID";
	static final String CITATION_COLUMN = "Article Citation";
	static final String PMID_COLUMN = "PMID";
	static final String LICENSE_COLUMN = "License";

	private final List<String> keywords;

	public CatalogFilter(List<String> keywords) {
		if (keywords.isEmpty()) {
			throw new IllegalArgumentException("At least one keyword is required");
		}
		this.keywords =
				keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
	}

	/** Create a filter using the keyword list bundled with the application */
	public static CatalogFilter withDefaultKeywords() throws IOException {
		try (InputStream in = CatalogFilter.class.getResourceAsStream(DEFAULT_KEYWORDS_RESOURCE)) {
			if (in == null) {
				throw new IOException("Keyword resource not found: " + DEFAULT_KEYWORDS_RESOURCE);
			}
			return new CatalogFilter(readKeywords(new InputStreamReader(in, StandardCharsets.UTF_8)));
		}
	}

	/** Create a filter from a keyword file, one keyword per line */
	public static CatalogFilter fromFile(Path keywordFile) throws IOException {
		try (Reader reader = Files.newBufferedReader(keywordFile, StandardCharsets.UTF_8)) {
			return new CatalogFilter(readKeywords(reader));
		}
	}

	/** The keyword file if one is given, the bundled list otherwise */
	public static CatalogFilter load(Path keywordFile) throws IOException {
		return keywordFile != null ? fromFile(keywordFile) : withDefaultKeywords();
	}

	static List<String> readKeywords(Reader source) throws IOException {
		List<String> result = new ArrayList<>();
		BufferedReader reader = source instanceof BufferedReader br ? br : new BufferedReader(source);
		String line;
		while ((line = reader.readLine()) != null) {
			String keyword = line.trim();
			if (!keyword.isEmpty() && !keyword.startsWith("#")) {
				result.add(keyword);
			}
		}
		return result;
	}

	public List<String> keywords() {
		return keywords;
	}

	public boolean matches(String citation) {
		if (citation == null || citation.isEmpty()) {
			return false;
		}
		String lower = citation.toLowerCase(Locale.ROOT);
		for (String keyword : keywords) {
			if (lower.contains(keyword)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Stream the file list and collect matching articles in file order.
	 *
	 * @param csv The open-access file list
	 * @param maxArticles Stop after this many matches; {@code null} or non-positive means no limit
	 * @return The matching articles
	 * @throws IOException if the file cannot be read or lacks the required columns
	 */
	public List<ArticleRef> filter(Path csv, Integer maxArticles) throws IOException {
		logger.info("Reading {}...", csv);
		boolean limited = maxArticles != null && maxArticles > 0;
		List<ArticleRef> matches = new ArrayList<>();
		long scanned = 0;

		// the file list contains the odd malformed byte; drop it rather than fail the scan
		var decoder = StandardCharsets.UTF_8
				.newDecoder()
				.onMalformedInput(CodingErrorAction.IGNORE)
				.onUnmappableCharacter(CodingErrorAction.IGNORE);
		try (Reader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(csv), decoder));
				CSVParser parser = csvParser(reader)) {
			requireColumn(parser, ACCESSION_COLUMN, csv);
			requireColumn(parser, CITATION_COLUMN, csv);
			for (CSVRecord record : parser) {
				scanned++;
				String citation = column(record, CITATION_COLUMN);
				if (!matches(citation)) {
					continue;
				}
				String pmcid = column(record, ACCESSION_COLUMN);
				if (pmcid.isEmpty()) {
					logger.debug("Skipping row {} without accession id", record.getRecordNumber());
					continue;
				}
				matches.add(ArticleRef.of(
						pmcid, column(record, PMID_COLUMN), citation, column(record, LICENSE_COLUMN)));
				if (limited && matches.size() >= maxArticles) {
					break;
				}
			}
		}

		logger.info("Scanned {} articles", scanned);
		logger.info("Found {} matching articles", matches.size());
		return matches;
	}

	private static CSVParser csvParser(Reader reader) throws IOException {
		CSVFormat format = CSVFormat.DEFAULT
				.builder()
				.setHeader()
				.setSkipHeaderRecord(true)
				.setIgnoreSurroundingSpaces(true)
				.build();
		return format.parse(reader);
	}

	private static void requireColumn(CSVParser parser, String column, Path csv) throws IOException {
		if (!parser.getHeaderMap().containsKey(column)) {
			throw new IOException("Column '" + column + "' not found in " + csv);
		}
	}

	private static String column(CSVRecord record, String column) {
		if (!record.isMapped(column) || !record.isSet(column)) {
			return "";
		}
		return record.get(column).trim();
	}
}
