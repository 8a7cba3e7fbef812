package dev.foodmole.corpus.fetch;

import dev.foodmole.corpus.model.ProgressRecord;
import dev.foodmole.corpus.model.WorkItem;
import dev.foodmole.corpus.util.FileUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a resumable fetch of many independent items on a fixed pool of workers.
 *
 * <p>Workers hand their outcomes back through a completion queue. The thread calling {@link
 * #run(List)} is the only one that touches the downloaded/failed sets and the counters, and it
 * writes a checkpoint every {@code checkpointEvery} outcomes and once more when the run ends,
 * including runs cut short by {@link #requestStop()}.
 */
public class FetchCoordinator {
	private static final Logger logger = LoggerFactory.getLogger(FetchCoordinator.class);
	private static final long POLL_MILLIS = 200;

	private final FetchConfig config;
	private final FetchWorker worker;
	private final AtomicBoolean started = new AtomicBoolean(false);
	private final CountDownLatch finished = new CountDownLatch(1);
	private volatile boolean stopRequested;
	private volatile ExecutorService executorService;

	public FetchCoordinator(FetchConfig config) {
		this(config, new FetchWorker(config));
	}

	FetchCoordinator(FetchConfig config, FetchWorker worker) {
		this.config = config;
		this.worker = worker;
	}

	/**
	 * Fetch every item that is neither downloaded nor failed according to the checkpoint and the
	 * artifacts on disk.
	 *
	 * @param items The requested items, in order; duplicates are fetched once
	 * @return Counts for this run and the size of the progress sets afterwards
	 * @throws FetchConfigurationException if the output locations are unusable; nothing is
	 *     dispatched in that case
	 */
	public FetchSummary run(List<WorkItem> items) throws FetchConfigurationException {
		if (!started.compareAndSet(false, true)) {
			throw new IllegalStateException("A FetchCoordinator can only run once");
		}
		try {
			return doRun(items);
		} finally {
			finished.countDown();
		}
	}

	/**
	 * Ask a running fetch to stop. Items not yet started are left for the next run, in-flight
	 * workers are interrupted, and the final checkpoint is still written by {@link #run(List)}.
	 */
	public void requestStop() {
		if (stopRequested) {
			return;
		}
		stopRequested = true;
		logger.info("Stop requested, abandoning queued items and saving progress");
		ExecutorService executor = executorService;
		if (executor != null) {
			executor.shutdownNow();
		}
	}

	/** Wait for a started run to write its final checkpoint and return */
	public boolean awaitFinished(Duration timeout) throws InterruptedException {
		return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
	}

	private FetchSummary doRun(List<WorkItem> items) throws FetchConfigurationException {
		ProgressStore progressStore = config.progressStore();
		prepareDirectory(config.artifactStore().directory(), "artifact");
		prepareDirectory(progressStore.file().toAbsolutePath().getParent(), "checkpoint");
		for (WorkItem item : items) {
			try {
				config.artifactStore().pathFor(item);
			} catch (IllegalArgumentException e) {
				throw new FetchConfigurationException(e.getMessage(), e);
			}
		}

		ProgressRecord loaded = progressStore.load();
		Set<String> downloaded = new HashSet<>(loaded.downloaded());
		Set<String> failed = new HashSet<>(loaded.failed());
		boolean changed = false;

		if (config.retryFailed() && !failed.isEmpty()) {
			logger.info("Retrying {} previously failed items", failed.size());
			failed.clear();
			changed = true;
		}

		int reconciled = reconcile(downloaded, failed);
		if (reconciled > 0) {
			logger.info("Found {} artifacts on disk missing from the checkpoint", reconciled);
			changed = true;
		}
		if (changed) {
			saveCheckpoint(downloaded, failed);
		}

		Map<String, WorkItem> unique = new LinkedHashMap<>();
		for (WorkItem item : items) {
			unique.putIfAbsent(item.identifier(), item);
		}
		List<WorkItem> toFetch = unique.values().stream()
				.filter(item -> !downloaded.contains(item.identifier()))
				.filter(item -> !failed.contains(item.identifier()))
				.toList();

		if (toFetch.isEmpty()) {
			logger.info("All {} requested items already processed", unique.size());
			return FetchSummary.nothingToDo(unique.size(), reconciled, downloaded.size(), failed.size());
		}

		logger.info("Fetching {} items...", toFetch.size());
		logger.info("Previously downloaded: {}", downloaded.size());
		logger.info("Previously failed: {}", failed.size());
		logger.info("Workers: {} threads", config.workers());
		logger.info("Minimum request interval: {} ms", config.rateLimiter().minInterval().toMillis());

		Aggregator aggregator = new Aggregator(downloaded, failed, toFetch.size());
		dispatch(toFetch, aggregator);

		FetchSummary summary = new FetchSummary(
				unique.size(),
				toFetch.size(),
				aggregator.succeeded,
				aggregator.skipped,
				aggregator.failures,
				toFetch.size() - aggregator.processed(),
				reconciled,
				downloaded.size(),
				failed.size(),
				stopRequested);

		logger.info("");
		logger.info("Fetch {}", stopRequested ? "interrupted" : "complete!");
		logger.info("  Successful: {}", summary.succeeded() + summary.skippedExisting());
		logger.info("  Failed: {}", summary.failed());
		if (summary.cancelled() > 0) {
			logger.info("  Not finished: {}", summary.cancelled());
		}
		logger.info("  Total downloaded: {}", summary.totalDownloaded());
		return summary;
	}

	private void dispatch(List<WorkItem> toFetch, Aggregator aggregator) {
		ExecutorService executor = Executors.newFixedThreadPool(config.workers(), new WorkerThreadFactory());
		executorService = executor;
		CompletionService<FetchOutcome> completion = new ExecutorCompletionService<>(executor);
		Map<Future<FetchOutcome>, WorkItem> submitted = new HashMap<>();
		try {
			for (WorkItem item : toFetch) {
				if (stopRequested) {
					break;
				}
				submitted.put(completion.submit(() -> worker.fetch(item)), item);
			}
			executor.shutdown();
			if (stopRequested) {
				executor.shutdownNow();
			}

			int received = 0;
			while (received < submitted.size()) {
				Future<FetchOutcome> future = completion.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
				if (future == null) {
					if (executor.isTerminated()) {
						// workers are gone; whatever was never started will not complete
						drainCompleted(completion, submitted, aggregator);
						break;
					}
					continue;
				}
				received++;
				aggregator.accept(future, submitted.get(future));
			}
		} catch (InterruptedException e) {
			logger.warn("Interrupted while waiting for workers");
			requestStop();
			drainCompleted(completion, submitted, aggregator);
			Thread.currentThread().interrupt();
		} finally {
			executor.shutdownNow();
			aggregator.finish();
		}
	}

	private static void drainCompleted(
			CompletionService<FetchOutcome> completion,
			Map<Future<FetchOutcome>, WorkItem> submitted,
			Aggregator aggregator) {
		Future<FetchOutcome> future;
		while ((future = completion.poll()) != null) {
			aggregator.accept(future, submitted.get(future));
		}
	}

	private int reconcile(Set<String> downloaded, Set<String> failed) throws FetchConfigurationException {
		Set<String> onDisk;
		try {
			onDisk = config.artifactStore().scanValidIdentifiers();
		} catch (IOException e) {
			throw new FetchConfigurationException(
					"Cannot scan artifact directory " + config.artifactStore().directory() + ": " + e.getMessage(), e);
		}
		int added = 0;
		for (String id : onDisk) {
			if (downloaded.add(id)) {
				added++;
			}
			failed.remove(id);
		}
		return added;
	}

	private void saveCheckpoint(Set<String> downloaded, Set<String> failed) {
		try {
			config.progressStore().save(ProgressRecord.of(downloaded, failed, null));
		} catch (IOException e) {
			logger.error("Failed to save checkpoint {}: {}", config.progressStore().file(), e.getMessage(), e);
		}
	}

	private static void prepareDirectory(Path directory, String purpose) throws FetchConfigurationException {
		try {
			FileUtils.ensureDirectory(directory);
		} catch (IOException e) {
			throw new FetchConfigurationException(
					"Cannot create " + purpose + " directory " + directory + ": " + e.getMessage(), e);
		}
		if (!Files.isDirectory(directory) || !Files.isWritable(directory)) {
			throw new FetchConfigurationException("The " + purpose + " directory is not writable: " + directory);
		}
	}

	/** Owns all run state; only ever called from the thread running {@link #run(List)} */
	private final class Aggregator {
		private final Set<String> downloaded;
		private final Set<String> failed;
		private final int total;
		private int succeeded;
		private int skipped;
		private int failures;
		private int sinceCheckpoint;

		Aggregator(Set<String> downloaded, Set<String> failed, int total) {
			this.downloaded = downloaded;
			this.failed = failed;
			this.total = total;
		}

		int processed() {
			return succeeded + skipped + failures;
		}

		/** Record a completed future; never blocks since the completion queue only hands out done futures */
		void accept(Future<FetchOutcome> future, WorkItem item) {
			FetchOutcome outcome;
			try {
				outcome = future.get();
			} catch (CancellationException e) {
				return;
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return;
			} catch (ExecutionException e) {
				if (e.getCause() instanceof InterruptedException) {
					logger.debug("Abandoned {} (interrupted)", item.identifier());
					return;
				}
				logger.error("Unexpected error fetching {}", item.identifier(), e.getCause());
				outcome = FetchOutcome.failed(item.identifier(), String.valueOf(e.getCause()));
			}
			record(outcome);
		}

		private void record(FetchOutcome outcome) {
			String id = outcome.identifier();
			switch (outcome.status()) {
				case SUCCESS -> succeeded++;
				case SKIPPED_EXISTING -> skipped++;
				case FAILED -> {
					failures++;
					logger.debug("{}: {}", id, outcome.detail());
				}
			}
			if (outcome.isDownloaded()) {
				downloaded.add(id);
				failed.remove(id);
			} else {
				failed.add(id);
				downloaded.remove(id);
			}

			int processed = processed();
			if (processed % config.reportEvery() == 0 || processed == total) {
				logger.info(
						"Fetched {}/{} ({} ok, {} already on disk, {} failed)",
						processed,
						total,
						succeeded,
						skipped,
						failures);
			}
			if (++sinceCheckpoint >= config.checkpointEvery()) {
				saveCheckpoint(downloaded, failed);
				sinceCheckpoint = 0;
			}
		}

		/** Final save; file channels refuse to open on an interrupted thread */
		void finish() {
			boolean interrupted = Thread.interrupted();
			try {
				saveCheckpoint(downloaded, failed);
			} finally {
				if (interrupted) {
					Thread.currentThread().interrupt();
				}
			}
		}
	}

	private static final class WorkerThreadFactory implements ThreadFactory {
		private final AtomicInteger counter = new AtomicInteger(0);

		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable, "fetch-worker-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}
	}
}
