package dev.foodmole.corpus.extract;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import dev.foodmole.corpus.model.ArticleRecord;
import dev.foodmole.corpus.util.FileUtils;
import dev.foodmole.corpus.util.JsonUtils;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes an extracted corpus as {@code <name>.jsonl}, {@code <name>.txt} and {@code
 * <name>_stats.json} in the output directory.
 */
public class CorpusWriter {
	public static final String DEFAULT_NAME = "food_science_corpus";
	static final String DOCUMENT_SEPARATOR = "\n\n" + "=".repeat(40) + "\n\n";

	private final Path outputDir;
	private final String name;

	public CorpusWriter(Path outputDir, String name) {
		this.outputDir = outputDir;
		this.name = name;
	}

	public Path jsonlFile() {
		return outputDir.resolve(name + ".jsonl");
	}

	public Path textFile() {
		return outputDir.resolve(name + ".txt");
	}

	public Path statsFile() {
		return outputDir.resolve(name + "_stats.json");
	}

	/** One compact JSON document per line */
	public Path writeJsonl(List<ArticleRecord> records) throws IOException {
		Path file = jsonlFile();
		FileUtils.ensureDirectory(outputDir);
		try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
			for (ArticleRecord record : records) {
				JsonUtils.writeLine(writer, CorpusDocument.of(record));
				writer.write('\n');
			}
		}
		return file;
	}

	/** Plain full texts separated by a rule of 40 {@code =} characters */
	public Path writeText(List<ArticleRecord> records) throws IOException {
		Path file = textFile();
		FileUtils.ensureDirectory(outputDir);
		try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
			for (ArticleRecord record : records) {
				writer.write(record.fullText());
				writer.write(DOCUMENT_SEPARATOR);
			}
		}
		return file;
	}

	public Path writeStats(CorpusStats stats) throws IOException {
		Path file = statsFile();
		FileUtils.ensureDirectory(outputDir);
		FileUtils.writeAtomically(file, JsonUtils.toPrettyJson(stats));
		return file;
	}

	@JsonPropertyOrder({"pmcid", "title", "abstract", "keywords", "journal", "text"})
	record CorpusDocument(
			@JsonProperty("pmcid") String pmcid,
			@JsonProperty("title") String title,
			@JsonProperty("abstract") String abstractText,
			@JsonProperty("keywords") List<String> keywords,
			@JsonProperty("journal") String journal,
			@JsonProperty("text") String text) {

		static CorpusDocument of(ArticleRecord record) {
			return new CorpusDocument(
					record.pmcid(),
					record.title(),
					record.abstractText(),
					record.keywords(),
					record.journal(),
					record.fullText());
		}
	}
}
