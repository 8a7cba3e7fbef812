package dev.foodmole.corpus;

import dev.foodmole.corpus.catalog.ArticleListStore;
import dev.foodmole.corpus.catalog.CatalogFilter;
import dev.foodmole.corpus.fetch.ArtifactStore;
import dev.foodmole.corpus.fetch.EntrezSource;
import dev.foodmole.corpus.fetch.FetchConfig;
import dev.foodmole.corpus.fetch.FetchConfigurationException;
import dev.foodmole.corpus.fetch.FetchCoordinator;
import dev.foodmole.corpus.fetch.FetchSummary;
import dev.foodmole.corpus.fetch.NcbiSettings;
import dev.foodmole.corpus.fetch.ProgressStore;
import dev.foodmole.corpus.fetch.RateLimiter;
import dev.foodmole.corpus.model.ArticleRef;
import dev.foodmole.corpus.model.WorkItem;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.PropertiesDefaultProvider;

/** Download command to fetch the JATS XML of the selected articles from PMC */
@Command(
		name = "download",
		description = "Download full-text XML for the articles selected from oa_file_list.csv",
		mixinStandardHelpOptions = true,
		defaultValueProvider = PropertiesDefaultProvider.class)
public class DownloadCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	static final String XML_DIR = "xml";
	static final double ESTIMATED_KB_PER_ARTICLE = 150.0;
	private static final int DRY_RUN_PREVIEW = 10;
	private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

	@Option(
			names = {"-c", "--csv"},
			description = "Path to oa_file_list.csv (default: oa_file_list.csv)",
			defaultValue = "oa_file_list.csv")
	private Path csv;

	@Option(
			names = {"-o", "--output-dir"},
			description =
					"Output directory; XML goes to <dir>/xml, progress and article list next to it (default: data)",
			defaultValue = "data")
	private Path outputDir;

	@Option(
			names = {"--email"},
			description = "Contact e-mail sent to NCBI with every request (default: $NCBI_EMAIL)",
			defaultValue = "${env:NCBI_EMAIL}")
	private String email;

	@Option(
			names = {"--api-key"},
			description = "NCBI API key, allows 10 instead of 3 requests per second (default: $NCBI_API_KEY)",
			defaultValue = "${env:NCBI_API_KEY}")
	private String apiKey;

	@Option(
			names = {"--tool"},
			description = "Tool name reported to NCBI (default: pmc-corpus)",
			defaultValue = NcbiSettings.DEFAULT_TOOL)
	private String tool;

	@Option(
			names = {"--base-url"},
			description = "E-utilities base URL (default: " + NcbiSettings.DEFAULT_BASE_URL + ")",
			defaultValue = NcbiSettings.DEFAULT_BASE_URL)
	private String baseUrl;

	@Option(
			names = {"-w", "--workers"},
			description = "Number of parallel download threads (default: 8)",
			defaultValue = "8")
	private int workers;

	@Option(
			names = {"--rate"},
			description = "Maximum requests per second (default: 9 with an API key, 3 without)")
	private Double rate;

	@Option(
			names = {"--max-retries"},
			description = "Attempts per article before it is marked as failed (default: 3)",
			defaultValue = "3")
	private int maxRetries;

	@Option(
			names = {"--timeout"},
			description = "Timeout of a single request in seconds (default: 60)",
			defaultValue = "60")
	private int timeoutSeconds;

	@Option(
			names = {"--checkpoint-every"},
			description = "Save progress after this many articles (default: 500)",
			defaultValue = "500")
	private int checkpointEvery;

	@Option(
			names = {"-n", "--max-results"},
			description = "Maximum number of articles to select (default: unlimited)")
	private Integer maxResults;

	@Option(
			names = {"-k", "--keywords-file"},
			description = "File with one keyword per line (default: the bundled keyword list)")
	private Path keywordsFile;

	@Option(
			names = {"--resume"},
			description = "Reuse the article list of a previous run instead of filtering the CSV again")
	private boolean resume;

	@Option(
			names = {"--retry-failed"},
			description = "Retry articles that failed in earlier runs")
	private boolean retryFailed;

	@Option(
			names = {"--dry-run"},
			description = "Show what would be downloaded without downloading anything")
	private boolean dryRun;

	@Override
	public Integer call() throws Exception {
		NcbiSettings settings = new NcbiSettings(email, tool, apiKey, baseUrl, Duration.ofSeconds(timeoutSeconds));
		Path xmlDir = outputDir.resolve(XML_DIR);

		logger.info("PMC Corpus - Download");
		logger.info("=====================");
		logger.info("Output: {}", xmlDir.toAbsolutePath());
		logger.info("API key: {}", settings.hasApiKey() ? "yes (10 req/s)" : "no (3 req/s)");

		try {
			settings.validate();
		} catch (FetchConfigurationException e) {
			logger.error("Error: {}", e.getMessage());
			return 1;
		}

		List<ArticleRef> articles;
		try {
			articles = loadArticles();
		} catch (IOException e) {
			logger.error("Error: {}", e.getMessage());
			return 1;
		}
		if (articles == null) {
			return 1;
		}
		if (articles.isEmpty()) {
			logger.warn("No articles found!");
			return 0;
		}

		double estimatedGb = articles.size() * ESTIMATED_KB_PER_ARTICLE / 1024 / 1024;
		logger.info("Estimated download size: ~{} GB", String.format("%.1f", estimatedGb));

		if (dryRun) {
			logger.info("");
			logger.info("DRY RUN - Would download:");
			for (ArticleRef article : articles.subList(0, Math.min(DRY_RUN_PREVIEW, articles.size()))) {
				logger.info("  - {}: {}...", article.pmcid(), abbreviate(article.citation(), 50));
			}
			if (articles.size() > DRY_RUN_PREVIEW) {
				logger.info("  ... and {} more", articles.size() - DRY_RUN_PREVIEW);
			}
			return 0;
		}

		double requestsPerSecond = rate != null && rate > 0 ? rate : settings.defaultRequestsPerSecond();
		FetchConfig config = FetchConfig.defaults(
						new ArtifactStore(xmlDir),
						new ProgressStore(outputDir.resolve(ProgressStore.DEFAULT_FILENAME)),
						new EntrezSource(settings),
						RateLimiter.perSecond(requestsPerSecond))
				.withWorkers(workers)
				.withRetries(maxRetries, FetchConfig.DEFAULT_RETRY_BACKOFF)
				.withCheckpointEvery(checkpointEvery)
				.withRetryFailed(retryFailed);

		List<WorkItem> items = articles.stream().map(ArticleRef::toWorkItem).toList();
		FetchCoordinator coordinator = new FetchCoordinator(config);
		Thread shutdownHook = new Thread(() -> stopAndWait(coordinator), "fetch-shutdown");
		Runtime.getRuntime().addShutdownHook(shutdownHook);

		FetchSummary summary;
		try {
			summary = coordinator.run(items);
		} catch (FetchConfigurationException e) {
			logger.error("Error: {}", e.getMessage());
			return 1;
		} finally {
			removeShutdownHook(shutdownHook);
		}

		logger.info("");
		logger.info("Summary");
		logger.info("=======");
		logger.info("{}", summary);
		logger.info("XML files saved to: {}", xmlDir.toAbsolutePath());
		return 0;
	}

	/** The article list to download, or {@code null} after reporting a fatal problem */
	private List<ArticleRef> loadArticles() throws IOException {
		ArticleListStore listStore = new ArticleListStore(outputDir.resolve(ArticleListStore.DEFAULT_FILENAME));
		if (resume && listStore.exists()) {
			logger.info("Loading previously filtered articles...");
			List<ArticleRef> articles = listStore.load();
			logger.info("Loaded {} articles", articles.size());
			return articles;
		}
		if (!Files.isRegularFile(csv)) {
			logger.error("Error: CSV not found: {}", csv.toAbsolutePath());
			return null;
		}
		List<ArticleRef> articles = CatalogFilter.load(keywordsFile).filter(csv, maxResults);
		listStore.save(articles);
		return articles;
	}

	private static void stopAndWait(FetchCoordinator coordinator) {
		coordinator.requestStop();
		try {
			if (!coordinator.awaitFinished(SHUTDOWN_GRACE)) {
				logger.warn("Download did not stop within {} seconds", SHUTDOWN_GRACE.toSeconds());
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	private static void removeShutdownHook(Thread hook) {
		try {
			Runtime.getRuntime().removeShutdownHook(hook);
		} catch (IllegalStateException e) {
			logger.debug("JVM is shutting down, leaving shutdown hook in place");
		}
	}

	private static String abbreviate(String text, int length) {
		if (text == null) {
			return "";
		}
		return text.length() > length ? text.substring(0, length) : text;
	}
}
