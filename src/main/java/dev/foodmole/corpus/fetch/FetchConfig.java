package dev.foodmole.corpus.fetch;

import java.time.Duration;

/**
 * Configuration record for a fetch run. Encapsulates where artifacts and the checkpoint live, the
 * remote source and its rate limit, and the retry and checkpoint policy.
 */
public record FetchConfig(
		ArtifactStore artifactStore,
		ProgressStore progressStore,
		RemoteSource remoteSource,
		RateLimiter rateLimiter,
		int workers,
		int maxRetries,
		Duration retryBackoff,
		int minResponseBytes,
		int checkpointEvery,
		int reportEvery,
		boolean retryFailed) {

	public static final int DEFAULT_WORKERS = 8;
	public static final int DEFAULT_MAX_RETRIES = 3;
	public static final Duration DEFAULT_RETRY_BACKOFF = Duration.ofSeconds(1);
	public static final int DEFAULT_MIN_RESPONSE_BYTES = 200;
	public static final int DEFAULT_CHECKPOINT_EVERY = 500;
	public static final int DEFAULT_REPORT_EVERY = 100;

	public FetchConfig {
		if (workers < 1) {
			throw new IllegalArgumentException("workers must be at least 1, got " + workers);
		}
		if (maxRetries < 1) {
			throw new IllegalArgumentException("maxRetries must be at least 1, got " + maxRetries);
		}
		if (checkpointEvery < 1) {
			throw new IllegalArgumentException("checkpointEvery must be at least 1, got " + checkpointEvery);
		}
		if (reportEvery < 1) {
			throw new IllegalArgumentException("reportEvery must be at least 1, got " + reportEvery);
		}
	}

	public static FetchConfig defaults(
			ArtifactStore artifactStore, ProgressStore progressStore, RemoteSource remoteSource, RateLimiter rateLimiter) {
		return new FetchConfig(
				artifactStore,
				progressStore,
				remoteSource,
				rateLimiter,
				DEFAULT_WORKERS,
				DEFAULT_MAX_RETRIES,
				DEFAULT_RETRY_BACKOFF,
				DEFAULT_MIN_RESPONSE_BYTES,
				DEFAULT_CHECKPOINT_EVERY,
				DEFAULT_REPORT_EVERY,
				false);
	}

	public FetchConfig withWorkers(int workers) {
		return new FetchConfig(
				artifactStore,
				progressStore,
				remoteSource,
				rateLimiter,
				workers,
				maxRetries,
				retryBackoff,
				minResponseBytes,
				checkpointEvery,
				reportEvery,
				retryFailed);
	}

	public FetchConfig withRetries(int maxRetries, Duration retryBackoff) {
		return new FetchConfig(
				artifactStore,
				progressStore,
				remoteSource,
				rateLimiter,
				workers,
				maxRetries,
				retryBackoff,
				minResponseBytes,
				checkpointEvery,
				reportEvery,
				retryFailed);
	}

	public FetchConfig withCheckpointEvery(int checkpointEvery) {
		return new FetchConfig(
				artifactStore,
				progressStore,
				remoteSource,
				rateLimiter,
				workers,
				maxRetries,
				retryBackoff,
				minResponseBytes,
				checkpointEvery,
				reportEvery,
				retryFailed);
	}

	public FetchConfig withRetryFailed(boolean retryFailed) {
		return new FetchConfig(
				artifactStore,
				progressStore,
				remoteSource,
				rateLimiter,
				workers,
				maxRetries,
				retryBackoff,
				minResponseBytes,
				checkpointEvery,
				reportEvery,
				retryFailed);
	}
}
