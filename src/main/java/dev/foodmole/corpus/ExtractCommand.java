package dev.foodmole.corpus;

import dev.foodmole.corpus.extract.CorpusStats;
import dev.foodmole.corpus.extract.CorpusWriter;
import dev.foodmole.corpus.extract.JatsArticleExtractor;
import dev.foodmole.corpus.model.ArticleRecord;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.PropertiesDefaultProvider;

/** Extract command to turn downloaded XML articles into a training corpus */
@Command(
		name = "extract",
		description = "Convert downloaded PMC XML articles into JSONL and plain text corpora",
		mixinStandardHelpOptions = true,
		defaultValueProvider = PropertiesDefaultProvider.class)
public class ExtractCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	/** Enum for corpus output formats */
	public enum Format {
		jsonl,
		txt,
		both
	}

	@Option(
			names = {"-i", "--input-dir"},
			description = "Directory containing the downloaded XML files (default: data/xml)",
			defaultValue = "data/xml")
	private Path inputDir;

	@Option(
			names = {"-o", "--output-dir"},
			description = "Directory to write the corpus to (default: data/processed)",
			defaultValue = "data/processed")
	private Path outputDir;

	@Option(
			names = {"-f", "--format"},
			description = "Output format: jsonl, txt or both (default: both)",
			defaultValue = "both")
	private Format format;

	@Option(
			names = {"--name"},
			description = "Base name of the output files (default: " + CorpusWriter.DEFAULT_NAME + ")",
			defaultValue = CorpusWriter.DEFAULT_NAME)
	private String name;

	@Option(
			names = {"-w", "--workers"},
			description = "Number of parallel threads (default: number of processors minus one)",
			defaultValue = "-1")
	private int workers;

	@Option(
			names = {"-n", "--max-files"},
			description = "Maximum number of files to process (default: all)")
	private Integer maxFiles;

	@Override
	public Integer call() throws Exception {
		int threadCount = workers > 0 ? workers : Math.max(1, Runtime.getRuntime().availableProcessors() - 1);

		logger.info("PMC Corpus - Extract");
		logger.info("====================");
		logger.info("Input: {}", inputDir.toAbsolutePath());
		logger.info("Output: {}", outputDir.toAbsolutePath());
		logger.info("Workers: {}", threadCount);
		logger.info("");

		if (!Files.isDirectory(inputDir)) {
			logger.error("Error: Input directory not found: {}", inputDir.toAbsolutePath());
			return 1;
		}

		List<Path> xmlFiles;
		try (Stream<Path> paths = Files.list(inputDir)) {
			xmlFiles = paths.filter(Files::isRegularFile)
					.filter(p -> {
						String fileName = p.getFileName().toString();
						return fileName.startsWith("PMC") && fileName.endsWith(".xml");
					})
					.sorted()
					.limit(maxFiles != null && maxFiles > 0 ? maxFiles : Long.MAX_VALUE)
					.toList();
		}
		logger.info("Found {} XML files", xmlFiles.size());
		if (xmlFiles.isEmpty()) {
			logger.warn("No XML files found!");
			return 0;
		}

		List<ArticleRecord> records = new ArrayList<>();
		int skipped = 0;
		JatsArticleExtractor extractor = new JatsArticleExtractor();
		ExecutorService executor = Executors.newFixedThreadPool(threadCount);
		try {
			List<Future<Optional<ArticleRecord>>> futures = new ArrayList<>();
			for (Path file : xmlFiles) {
				futures.add(executor.submit(() -> extractor.extract(file)));
			}
			for (int i = 0; i < futures.size(); i++) {
				try {
					Optional<ArticleRecord> record = futures.get(i).get();
					if (record.isPresent()) {
						records.add(record.get());
					} else {
						skipped++;
					}
				} catch (ExecutionException e) {
					logger.warn("Failed to process {}: {}", xmlFiles.get(i).getFileName(), e.getCause().getMessage());
					skipped++;
				}
				if ((i + 1) % 1000 == 0) {
					logger.info("Processed {}/{} files", i + 1, xmlFiles.size());
				}
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.error("Extraction interrupted");
			return 1;
		} finally {
			executor.shutdownNow();
		}

		records.sort(Comparator.comparing(ArticleRecord::pmcid));
		CorpusStats stats = CorpusStats.of(records, skipped);

		logger.info("");
		logger.info("Processing complete!");
		logger.info("  Successful: {}", records.size());
		logger.info("  Skipped (too short/invalid): {}", skipped);
		logger.info("");
		logger.info("Text Statistics:");
		logger.info("  Total text: {} characters", stats.totalCharacters());
		logger.info("  Average per article: {} characters", stats.avgCharacters());
		logger.info("  Estimated tokens: ~{}", stats.estimatedTokens());

		CorpusWriter writer = new CorpusWriter(outputDir, name);
		try {
			if (format == Format.jsonl || format == Format.both) {
				Path file = writer.writeJsonl(records);
				logger.info("Wrote JSONL to {} ({} bytes)", file, Files.size(file));
			}
			if (format == Format.txt || format == Format.both) {
				Path file = writer.writeText(records);
				logger.info("Wrote TXT to {} ({} bytes)", file, Files.size(file));
			}
			writer.writeStats(stats);
		} catch (IOException e) {
			logger.error("Error: Failed to write corpus: {}", e.getMessage());
			return 1;
		}

		logger.info("");
		logger.info("Done! Output saved to: {}", outputDir.toAbsolutePath());
		return 0;
	}
}
