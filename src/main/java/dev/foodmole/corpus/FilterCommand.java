package dev.foodmole.corpus;

import dev.foodmole.corpus.catalog.ArticleListStore;
import dev.foodmole.corpus.catalog.CatalogFilter;
import dev.foodmole.corpus.model.ArticleRef;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.PropertiesDefaultProvider;

/** Filter command to select articles from the open-access file list by keyword */
@Command(
		name = "filter",
		description = "Select articles from oa_file_list.csv whose citation matches the keyword list",
		mixinStandardHelpOptions = true,
		defaultValueProvider = PropertiesDefaultProvider.class)
public class FilterCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Option(
			names = {"-c", "--csv"},
			description = "Path to oa_file_list.csv (default: oa_file_list.csv)",
			defaultValue = "oa_file_list.csv")
	private Path csv;

	@Option(
			names = {"-o", "--output-dir"},
			description = "Directory to write the article list to (default: data)",
			defaultValue = "data")
	private Path outputDir;

	@Option(
			names = {"-n", "--max-results"},
			description = "Maximum number of articles to select (default: unlimited)")
	private Integer maxResults;

	@Option(
			names = {"-k", "--keywords-file"},
			description = "File with one keyword per line (default: the bundled keyword list)")
	private Path keywordsFile;

	@Override
	public Integer call() throws Exception {
		logger.info("PMC Corpus - Filter");
		logger.info("===================");
		logger.info("CSV: {}", csv.toAbsolutePath());
		logger.info("");

		if (!Files.isRegularFile(csv)) {
			logger.error("Error: CSV not found: {}", csv.toAbsolutePath());
			return 1;
		}

		ArticleListStore listStore = new ArticleListStore(outputDir.resolve(ArticleListStore.DEFAULT_FILENAME));
		try {
			List<ArticleRef> articles = CatalogFilter.load(keywordsFile).filter(csv, maxResults);
			listStore.save(articles);
			logger.info("Saved {} articles to {}", articles.size(), listStore.file());
		} catch (IOException e) {
			logger.error("Error: {}", e.getMessage());
			return 1;
		}
		return 0;
	}
}
