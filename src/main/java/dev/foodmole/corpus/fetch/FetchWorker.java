package dev.foodmole.corpus.fetch;

import dev.foodmole.corpus.model.WorkItem;
import java.io.IOException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retrieves a single work item with retries. Workers share nothing but the rate limiter, so one
 * instance can serve every thread of the pool.
 */
public class FetchWorker {
	private static final Logger logger = LoggerFactory.getLogger(FetchWorker.class);

	static final String NOT_AVAILABLE = "item not available";
	static final String EMPTY_RESPONSE = "empty response";
	static final String TRUNCATED_RESPONSE = "truncated response";
	static final String MAX_RETRIES_EXCEEDED = "max retries exceeded";

	private static final int ERROR_SCAN_CHARS = 500;
	private static final String[] ERROR_MARKERS = {"<error>", "id not found"};

	private final ArtifactStore artifactStore;
	private final RemoteSource remoteSource;
	private final RateLimiter rateLimiter;
	private final int maxRetries;
	private final Duration retryBackoff;
	private final int minResponseBytes;

	public FetchWorker(FetchConfig config) {
		this(
				config.artifactStore(),
				config.remoteSource(),
				config.rateLimiter(),
				config.maxRetries(),
				config.retryBackoff(),
				config.minResponseBytes());
	}

	public FetchWorker(
			ArtifactStore artifactStore,
			RemoteSource remoteSource,
			RateLimiter rateLimiter,
			int maxRetries,
			Duration retryBackoff,
			int minResponseBytes) {
		this.artifactStore = artifactStore;
		this.remoteSource = remoteSource;
		this.rateLimiter = rateLimiter;
		this.maxRetries = maxRetries;
		this.retryBackoff = retryBackoff;
		this.minResponseBytes = minResponseBytes;
	}

	/**
	 * Fetch one item. Every per-item problem is reported as a {@link FetchOutcome.Status#FAILED}
	 * outcome; only an interrupt escapes, leaving the item unrecorded so a later run picks it up.
	 *
	 * @param item The item to fetch
	 * @return The outcome for this item
	 * @throws InterruptedException if the worker is interrupted while waiting or fetching
	 */
	public FetchOutcome fetch(WorkItem item) throws InterruptedException {
		String id = item.identifier();
		Path artifact = artifactStore.pathFor(item);

		if (artifactStore.isValid(artifact)) {
			logger.debug("Skipping {} (already exists)", id);
			return FetchOutcome.skippedExisting(id);
		}

		String lastCause = null;
		for (int attempt = 1; attempt <= maxRetries; attempt++) {
			rateLimiter.acquire();

			byte[] content;
			try {
				content = remoteSource.fetchRaw(item.remoteId());
			} catch (InterruptedException e) {
				throw e;
			} catch (Exception e) {
				if (Thread.currentThread().isInterrupted()) {
					throw new InterruptedException("Interrupted while fetching " + id);
				}
				lastCause = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
				logger.debug("Attempt {}/{} for {} failed: {}", attempt, maxRetries, id, lastCause);
				backoff(attempt);
				continue;
			}

			// error bodies can be shorter than minResponseBytes
			if (content != null && hasErrorMarker(content)) {
				return FetchOutcome.failed(id, NOT_AVAILABLE);
			}

			if (content == null || content.length < minResponseBytes) {
				lastCause = EMPTY_RESPONSE;
				logger.debug("Attempt {}/{} for {} returned an empty response", attempt, maxRetries, id);
				backoff(attempt);
				continue;
			}

			if (!artifactStore.isValidContent(content)) {
				lastCause = TRUNCATED_RESPONSE;
				logger.debug("Attempt {}/{} for {} returned a truncated document", attempt, maxRetries, id);
				backoff(attempt);
				continue;
			}

			try {
				artifactStore.write(artifact, content);
			} catch (ClosedByInterruptException e) {
				throw new InterruptedException("Interrupted while writing " + artifact);
			} catch (IOException e) {
				return FetchOutcome.failed(id, "write failed: " + e.getMessage());
			}
			logger.trace("Fetched {} ({} bytes)", id, content.length);
			return FetchOutcome.success(id);
		}

		logger.debug("Giving up on {} after {} attempts, last cause: {}", id, maxRetries, lastCause);
		return FetchOutcome.failed(id, MAX_RETRIES_EXCEEDED);
	}

	private void backoff(int attempt) throws InterruptedException {
		if (attempt < maxRetries && !retryBackoff.isZero() && !retryBackoff.isNegative()) {
			Thread.sleep(retryBackoff.toMillis());
		}
	}

	private static boolean hasErrorMarker(byte[] content) {
		int length = Math.min(content.length, ERROR_SCAN_CHARS * 4);
		String head = new String(content, 0, length, StandardCharsets.UTF_8);
		if (head.length() > ERROR_SCAN_CHARS) {
			head = head.substring(0, ERROR_SCAN_CHARS);
		}
		head = head.toLowerCase(Locale.ROOT);
		for (String marker : ERROR_MARKERS) {
			if (head.contains(marker)) {
				return true;
			}
		}
		return false;
	}
}
