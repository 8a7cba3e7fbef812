package dev.foodmole.corpus.fetch;

import static org.assertj.core.api.Assertions.*;

import dev.foodmole.corpus.model.ProgressRecord;
import dev.foodmole.corpus.model.WorkItem;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FetchCoordinatorTest {

	@TempDir
	Path tempDir;

	private ArtifactStore artifactStore;
	private ProgressStore progressStore;
	private DummyRemoteSource source;

	@BeforeEach
	void setUp() {
		artifactStore = new ArtifactStore(tempDir.resolve("xml"));
		progressStore = new ProgressStore(tempDir.resolve(ProgressStore.DEFAULT_FILENAME));
		source = new DummyRemoteSource();
	}

	@Test
	void testFetchesAllItems() throws Exception {
		// When
		FetchSummary summary = new FetchCoordinator(config()).run(items(1, 2, 3));

		// Then
		assertThat(summary.requested()).isEqualTo(3);
		assertThat(summary.dispatched()).isEqualTo(3);
		assertThat(summary.succeeded()).isEqualTo(3);
		assertThat(summary.failed()).isZero();
		assertThat(summary.interrupted()).isFalse();
		assertThat(summary.totalDownloaded()).isEqualTo(3);
		assertThat(artifactStore.scanValidIdentifiers()).containsExactly("PMC1", "PMC2", "PMC3");
		assertThat(progressStore.load().downloaded()).containsExactly("PMC1", "PMC2", "PMC3");
	}

	@Test
	void testResumesFromCheckpoint() throws Exception {
		// Given
		writeArtifact("PMC1");
		writeArtifact("PMC2");
		progressStore.save(ProgressRecord.of(List.of("PMC1", "PMC2"), List.of(), null));

		// When
		FetchSummary summary = new FetchCoordinator(config()).run(items(1, 2, 3));

		// Then
		assertThat(summary.dispatched()).isEqualTo(1);
		assertThat(summary.reconciled()).isZero();
		assertThat(source.getCallCount("1")).isZero();
		assertThat(source.getCallCount("2")).isZero();
		assertThat(source.getCallCount("3")).isEqualTo(1);
		assertThat(progressStore.load().downloaded()).containsExactly("PMC1", "PMC2", "PMC3");
	}

	@Test
	void testCheckpointedItemIsNotDispatched() throws Exception {
		// Given
		progressStore.save(ProgressRecord.of(List.of("PMC1"), List.of(), null));

		// When
		FetchSummary summary = new FetchCoordinator(config()).run(items(1));

		// Then
		assertThat(summary.dispatched()).isZero();
		assertThat(source.getTotalCallCount()).isZero();
	}

	@Test
	void testReconcilesArtifactsMissingFromCheckpoint() throws Exception {
		// Given
		writeArtifact("PMC1");
		writeArtifact("PMC2");
		progressStore.save(ProgressRecord.of(List.of(), List.of("PMC2"), null));

		// When
		FetchSummary summary = new FetchCoordinator(config()).run(items(1, 2, 3));

		// Then
		assertThat(summary.reconciled()).isEqualTo(2);
		assertThat(summary.dispatched()).isEqualTo(1);
		assertThat(source.getCallCount("1")).isZero();
		assertThat(source.getCallCount("2")).isZero();
		ProgressRecord progress = progressStore.load();
		assertThat(progress.downloaded()).containsExactly("PMC1", "PMC2", "PMC3");
		assertThat(progress.failed()).isEmpty();
	}

	@Test
	void testReconciliationIgnoresTruncatedArtifacts() throws Exception {
		// Given
		Files.createDirectories(artifactStore.directory());
		Files.writeString(artifactStore.pathFor("PMC1"), "<article><body>" + "x".repeat(500));

		// When
		FetchSummary summary = new FetchCoordinator(config()).run(items(1));

		// Then
		assertThat(summary.reconciled()).isZero();
		assertThat(summary.succeeded()).isEqualTo(1);
		assertThat(source.getCallCount("1")).isEqualTo(1);
		assertThat(artifactStore.isValid(artifactStore.pathFor("PMC1"))).isTrue();
	}

	@Test
	void testPreviouslyFailedItemsAreNotRetried() throws Exception {
		// Given
		progressStore.save(ProgressRecord.of(List.of(), List.of("PMC2"), null));

		// When
		FetchSummary summary = new FetchCoordinator(config()).run(items(1, 2));

		// Then
		assertThat(summary.dispatched()).isEqualTo(1);
		assertThat(summary.totalFailed()).isEqualTo(1);
		assertThat(source.getCallCount("2")).isZero();
	}

	@Test
	void testRetryFailed() throws Exception {
		// Given
		progressStore.save(ProgressRecord.of(List.of(), List.of("PMC2"), null));

		// When
		FetchSummary summary = new FetchCoordinator(config().withRetryFailed(true)).run(items(1, 2));

		// Then
		assertThat(summary.dispatched()).isEqualTo(2);
		assertThat(summary.totalFailed()).isZero();
		assertThat(source.getCallCount("2")).isEqualTo(1);
		assertThat(progressStore.load().failed()).isEmpty();
	}

	@Test
	void testFailuresAreRecorded() throws Exception {
		// Given
		source.respond("2", DummyRemoteSource.notFound());
		source.respond("3", new IOException("reset"), new IOException("reset"), new IOException("reset"));

		// When
		FetchSummary summary = new FetchCoordinator(config()).run(items(1, 2, 3));

		// Then
		assertThat(summary.succeeded()).isEqualTo(1);
		assertThat(summary.failed()).isEqualTo(2);
		assertThat(source.getCallCount("2")).isEqualTo(1);
		assertThat(source.getCallCount("3")).isEqualTo(3);
		ProgressRecord progress = progressStore.load();
		assertThat(progress.downloaded()).containsExactly("PMC1");
		assertThat(progress.failed()).containsExactly("PMC2", "PMC3");
		assertThat(artifactStore.pathFor("PMC2")).doesNotExist();
		assertThat(artifactStore.pathFor("PMC3")).doesNotExist();
	}

	@Test
	void testEachItemFetchedOnceWithManyWorkers() throws Exception {
		// Given
		List<WorkItem> items = IntStream.rangeClosed(1, 200)
				.mapToObj(i -> WorkItem.of("PMC" + i))
				.toList();

		// When
		FetchSummary summary = new FetchCoordinator(config().withWorkers(8)).run(items);

		// Then
		assertThat(summary.succeeded()).isEqualTo(200);
		assertThat(source.getCalls()).hasSize(200);
		assertThat(source.getCalls().values()).allSatisfy(count -> assertThat(count.get()).isEqualTo(1));
		assertThat(source.getMaxInFlight()).isLessThanOrEqualTo(8);
		assertThat(progressStore.load().downloaded()).hasSize(200);
		assertThat(artifactStore.scanValidIdentifiers()).hasSize(200);
	}

	@Test
	void testDuplicateInputIsFetchedOnce() throws Exception {
		// When
		FetchSummary summary = new FetchCoordinator(config()).run(items(1, 1, 2, 1));

		// Then
		assertThat(summary.requested()).isEqualTo(2);
		assertThat(summary.dispatched()).isEqualTo(2);
		assertThat(source.getCallCount("1")).isEqualTo(1);
	}

	@Test
	void testSecondRunIsANoOp() throws Exception {
		// Given
		new FetchCoordinator(config()).run(items(1, 2, 3));
		ProgressRecord afterFirst = progressStore.load();

		// When
		FetchSummary summary = new FetchCoordinator(config()).run(items(1, 2, 3));

		// Then
		assertThat(summary.dispatched()).isZero();
		assertThat(summary.totalDownloaded()).isEqualTo(3);
		assertThat(source.getTotalCallCount()).isEqualTo(3);
		ProgressRecord afterSecond = progressStore.load();
		assertThat(afterSecond.downloaded()).isEqualTo(afterFirst.downloaded());
		assertThat(afterSecond.failed()).isEqualTo(afterFirst.failed());
	}

	@Test
	void testCheckpointCadence() throws Exception {
		// Given
		CountingProgressStore counting = new CountingProgressStore(tempDir.resolve("counted.json"));
		FetchConfig config = new FetchConfig(
				artifactStore,
				counting,
				source,
				new RateLimiter(Duration.ZERO),
				1,
				3,
				Duration.ZERO,
				200,
				2,
				100,
				false);

		// When
		new FetchCoordinator(config).run(items(1, 2, 3, 4, 5));

		// Then
		assertThat(counting.savedSizes).containsExactly(2, 4, 5);
	}

	@Test
	void testUnusableArtifactDirectoryIsFatal() throws Exception {
		// Given
		Files.writeString(tempDir.resolve("xml"), "not a directory");
		FetchCoordinator coordinator = new FetchCoordinator(config());

		// When/Then
		assertThatThrownBy(() -> coordinator.run(items(1)))
				.isInstanceOf(FetchConfigurationException.class)
				.hasMessageContaining("xml");
		assertThat(source.getTotalCallCount()).isZero();
		assertThat(progressStore.file()).doesNotExist();
	}

	@Test
	void testArtifactPathOutsideDirectoryIsFatal() throws Exception {
		// Given
		WorkItem stray = new WorkItem("PMC1", "1", tempDir.resolve("elsewhere").resolve("PMC1.xml"));
		FetchCoordinator coordinator = new FetchCoordinator(config());

		// When/Then
		assertThatThrownBy(() -> coordinator.run(List.of(stray)))
				.isInstanceOf(FetchConfigurationException.class)
				.hasMessageContaining("PMC1");
		assertThat(source.getTotalCallCount()).isZero();
		assertThat(progressStore.file()).doesNotExist();
	}

	@Test
	void testExplicitArtifactPathIsReconciled() throws Exception {
		// Given
		Path nested = tempDir.resolve("xml").resolve("shard-1").resolve("PMC1.xml");
		WorkItem first = new WorkItem("PMC1", "1", nested);
		new FetchCoordinator(config()).run(List.of(first));
		progressStore.save(ProgressRecord.empty());

		// When
		FetchSummary summary = new FetchCoordinator(config()).run(List.of(first));

		// Then
		assertThat(artifactStore.isValid(nested)).isTrue();
		assertThat(summary.reconciled()).isEqualTo(1);
		assertThat(summary.dispatched()).isZero();
		assertThat(source.getCallCount("1")).isEqualTo(1);
		assertThat(progressStore.load().downloaded()).containsExactly("PMC1");
	}

	@Test
	void testRunOnlyOnce() throws Exception {
		// Given
		FetchCoordinator coordinator = new FetchCoordinator(config());
		coordinator.run(items(1));

		// When/Then
		assertThatThrownBy(() -> coordinator.run(items(2))).isInstanceOf(IllegalStateException.class);
	}

	@Test
	void testStopSavesProgressAndLeavesUnfinishedItemsUnrecorded() throws Exception {
		// Given
		source.withDelay(Duration.ofMillis(200));
		FetchCoordinator coordinator = new FetchCoordinator(config().withWorkers(2));
		List<WorkItem> items = IntStream.rangeClosed(1, 20)
				.mapToObj(i -> WorkItem.of("PMC" + i))
				.toList();
		AtomicReference<FetchSummary> result = new AtomicReference<>();
		AtomicReference<Exception> error = new AtomicReference<>();
		Thread runner = new Thread(() -> {
			try {
				result.set(coordinator.run(items));
			} catch (Exception e) {
				error.set(e);
			}
		});

		// When
		runner.start();
		long deadline = System.currentTimeMillis() + 10_000;
		while (source.getTotalCallCount() < 4 && System.currentTimeMillis() < deadline) {
			Thread.sleep(10);
		}
		coordinator.requestStop();

		// Then
		assertThat(coordinator.awaitFinished(Duration.ofSeconds(10))).isTrue();
		runner.join(10_000);
		assertThat(error.get()).isNull();
		FetchSummary summary = result.get();
		assertThat(summary.interrupted()).isTrue();
		assertThat(summary.cancelled()).isPositive();
		assertThat(summary.processed() + summary.cancelled()).isEqualTo(20);

		ProgressRecord progress = progressStore.load();
		assertThat(progress.lastUpdated()).isNotNull();
		assertThat(progress.failed()).isEmpty();
		assertThat(progress.downloaded()).hasSize(summary.succeeded());
		for (String id : progress.downloaded()) {
			assertThat(artifactStore.isValid(artifactStore.pathFor(id))).isTrue();
		}
	}

	@Test
	void testInterruptedRunnerStillSavesFinalCheckpoint() throws Exception {
		// Given
		source.withDelay(Duration.ofMillis(100));
		source.respond("1", DummyRemoteSource.notFound());
		FetchCoordinator coordinator = new FetchCoordinator(config().withWorkers(2));
		List<WorkItem> items = IntStream.rangeClosed(1, 20)
				.mapToObj(i -> WorkItem.of("PMC" + i))
				.toList();
		AtomicReference<FetchSummary> result = new AtomicReference<>();
		AtomicReference<Exception> error = new AtomicReference<>();
		AtomicBoolean interruptKept = new AtomicBoolean();
		Thread runner = new Thread(() -> {
			try {
				result.set(coordinator.run(items));
				interruptKept.set(Thread.currentThread().isInterrupted());
			} catch (Exception e) {
				error.set(e);
			}
		});

		// When
		runner.start();
		long deadline = System.currentTimeMillis() + 10_000;
		while (source.getTotalCallCount() < 4 && System.currentTimeMillis() < deadline) {
			Thread.sleep(10);
		}
		runner.interrupt();
		runner.join(10_000);

		// Then
		assertThat(runner.isAlive()).isFalse();
		assertThat(error.get()).isNull();
		assertThat(interruptKept.get()).isTrue();
		FetchSummary summary = result.get();
		assertThat(summary.interrupted()).isTrue();
		assertThat(summary.cancelled()).isPositive();

		ProgressRecord progress = progressStore.load();
		assertThat(progress.lastUpdated()).isNotNull();
		assertThat(progress.failed()).containsExactly("PMC1");
		assertThat(progress.downloaded()).hasSize(summary.succeeded());
	}

	private FetchConfig config() {
		return new FetchConfig(
				artifactStore,
				progressStore,
				source,
				new RateLimiter(Duration.ZERO),
				4,
				3,
				Duration.ZERO,
				FetchConfig.DEFAULT_MIN_RESPONSE_BYTES,
				FetchConfig.DEFAULT_CHECKPOINT_EVERY,
				FetchConfig.DEFAULT_REPORT_EVERY,
				false);
	}

	private static List<WorkItem> items(int... numbers) {
		List<WorkItem> items = new ArrayList<>();
		for (int number : numbers) {
			items.add(WorkItem.of("PMC" + number));
		}
		return items;
	}

	private void writeArtifact(String identifier) throws IOException {
		artifactStore.write(artifactStore.pathFor(identifier), DummyRemoteSource.article(WorkItem.normalize(identifier)));
	}

	/** Records the size of the downloaded set at every save */
	private static class CountingProgressStore extends ProgressStore {
		final List<Integer> savedSizes = Collections.synchronizedList(new ArrayList<>());

		CountingProgressStore(Path file) {
			super(file);
		}

		@Override
		public ProgressRecord save(ProgressRecord record) throws IOException {
			savedSizes.add(record.downloaded().size());
			return super.save(record);
		}
	}
}
