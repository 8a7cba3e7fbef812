package dev.foodmole.corpus;

import dev.foodmole.corpus.fetch.ArtifactStore;
import dev.foodmole.corpus.fetch.ProgressStore;
import dev.foodmole.corpus.model.ProgressRecord;
import dev.foodmole.corpus.util.FileUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.PropertiesDefaultProvider;

/** Clean command to remove broken downloads so the next download run fetches them again */
@Command(
		name = "clean",
		description = "Remove truncated or leftover partial XML files and fix up the download progress",
		mixinStandardHelpOptions = true,
		defaultValueProvider = PropertiesDefaultProvider.class)
public class CleanCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Option(
			names = {"-o", "--output-dir"},
			description = "Download output directory containing xml/ and the progress file (default: data)",
			defaultValue = "data")
	private Path outputDir;

	@Option(
			names = {"--reset-failed"},
			description = "Forget previously failed articles so the next run retries them")
	private boolean resetFailed;

	@Option(
			names = {"--dry-run"},
			description = "Show statistics without actually deleting files or changing progress")
	private boolean dryRun;

	@Override
	public Integer call() throws Exception {
		Path xmlDir = outputDir.resolve(DownloadCommand.XML_DIR);
		ArtifactStore artifactStore = new ArtifactStore(xmlDir);
		ProgressStore progressStore = new ProgressStore(outputDir.resolve(ProgressStore.DEFAULT_FILENAME));

		logger.info("PMC Corpus - Clean");
		logger.info("==================");
		logger.info("XML directory: {}", xmlDir.toAbsolutePath());
		logger.info("  Reset failed: {}", resetFailed);
		logger.info("  Dry run: {}", dryRun);
		logger.info("");

		if (!Files.isDirectory(xmlDir)) {
			logger.error("Error: XML directory not found: {}", xmlDir.toAbsolutePath());
			return 1;
		}

		List<Path> invalidFiles = artifactStore.scanInvalid();
		ProgressRecord progress = progressStore.load();

		Set<String> downloaded = new TreeSet<>(progress.downloaded());
		Set<String> stale = new TreeSet<>();
		for (Path file : invalidFiles) {
			if (!FileUtils.isPartialFile(file)) {
				String fileName = file.getFileName().toString();
				String id = fileName.substring(0, fileName.length() - ArtifactStore.EXTENSION.length());
				if (downloaded.contains(id)) {
					stale.add(id);
				}
			}
			logger.debug("  - {}", file.getFileName());
		}
		for (String id : downloaded) {
			if (!Files.exists(artifactStore.pathFor(id))) {
				stale.add(id);
			}
		}
		downloaded.removeAll(stale);
		Set<String> failed = resetFailed ? Set.of() : progress.failed();

		logger.info("Summary:");
		logger.info("========");
		logger.info("Invalid or partial files: {}", invalidFiles.size());
		logger.info("Stale progress entries: {}", stale.size());
		logger.info("Failed entries to reset: {}", resetFailed ? progress.failed().size() : 0);
		logger.info("");

		if (invalidFiles.isEmpty() && stale.isEmpty() && failed.size() == progress.failed().size()) {
			logger.info("Nothing to clean.");
			return 0;
		}

		if (dryRun) {
			logger.info("DRY RUN - No files were actually deleted.");
			logger.info("Run without --dry-run to perform actual deletion.");
			return 0;
		}

		int deletedCount = 0;
		int failedCount = 0;
		for (Path file : invalidFiles) {
			try {
				Files.delete(file);
				deletedCount++;
				logger.info("  Deleted: {}", file.getFileName());
			} catch (IOException e) {
				logger.error("  Failed to delete {}: {}", file.getFileName(), e.getMessage());
				failedCount++;
			}
		}

		progressStore.save(ProgressRecord.of(downloaded, failed, null));
		logger.info("");
		logger.info("Deleted: {} files", deletedCount);
		if (failedCount > 0) {
			logger.info("Failed: {} files", failedCount);
		}
		logger.info("Progress now lists {} downloaded and {} failed", downloaded.size(), failed.size());
		return failedCount > 0 ? 1 : 0;
	}
}
