package dev.foodmole.corpus.fetch;

import dev.foodmole.corpus.model.ProgressRecord;
import dev.foodmole.corpus.util.FileUtils;
import dev.foodmole.corpus.util.JsonUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable checkpoint of a fetch run. Saves replace the file atomically, so a crash during a save
 * leaves the previous checkpoint in place.
 */
public class ProgressStore {
	private static final Logger logger = LoggerFactory.getLogger(ProgressStore.class);

	public static final String DEFAULT_FILENAME = "download_xml_progress.json";

	private final Path progressFile;

	public ProgressStore(Path progressFile) {
		this.progressFile = Objects.requireNonNull(progressFile, "progressFile");
	}

	public Path file() {
		return progressFile;
	}

	/**
	 * Read the last saved checkpoint. A missing, empty or unreadable checkpoint yields an empty
	 * record; the run then relies on reconciliation against the artifacts on disk.
	 */
	public ProgressRecord load() {
		if (!Files.isRegularFile(progressFile)) {
			logger.debug("No checkpoint at {}, starting fresh", progressFile);
			return ProgressRecord.empty();
		}
		try {
			ProgressRecord record = JsonUtils.read(progressFile, ProgressRecord.class);
			if (record == null) {
				logger.warn("Checkpoint {} is empty, starting fresh", progressFile);
				return ProgressRecord.empty();
			}
			logger.debug(
					"Loaded checkpoint {} ({} downloaded, {} failed, last updated {})",
					progressFile,
					record.downloaded().size(),
					record.failed().size(),
					record.lastUpdated());
			return record;
		} catch (IOException e) {
			logger.warn("Ignoring unreadable checkpoint {}: {}", progressFile, e.getMessage());
			return ProgressRecord.empty();
		}
	}

	/**
	 * Persist the record, stamping it with the current time.
	 *
	 * @return the record as written
	 */
	public ProgressRecord save(ProgressRecord record) throws IOException {
		ProgressRecord stamped = record.withLastUpdated(LocalDateTime.now().toString());
		FileUtils.ensureDirectory(progressFile.toAbsolutePath().getParent());
		FileUtils.writeAtomically(progressFile, JsonUtils.toJson(stamped));
		logger.debug(
				"Saved checkpoint {} ({} downloaded, {} failed)",
				progressFile,
				stamped.downloaded().size(),
				stamped.failed().size());
		return stamped;
	}
}
