package dev.foodmole.corpus.fetch;

import static org.assertj.core.api.Assertions.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class RateLimiterTest {

	@Test
	void testPerSecondInterval() {
		// When
		RateLimiter limiter = RateLimiter.perSecond(4);

		// Then
		assertThat(limiter.minInterval()).isEqualTo(Duration.ofMillis(250));
	}

	@Test
	void testNonPositiveRateDisablesLimiting() throws Exception {
		// Given
		RateLimiter limiter = RateLimiter.perSecond(0);

		// When
		long start = System.nanoTime();
		for (int i = 0; i < 100; i++) {
			limiter.acquire();
		}
		long elapsed = System.nanoTime() - start;

		// Then
		assertThat(limiter.minInterval()).isEqualTo(Duration.ZERO);
		assertThat(TimeUnit.NANOSECONDS.toMillis(elapsed)).isLessThan(1000);
	}

	@Test
	void testGrantsAreSpacedAcrossThreads() throws Exception {
		// Given
		Duration interval = Duration.ofMillis(20);
		RateLimiter limiter = new RateLimiter(interval);
		Queue<Long> grants = new ConcurrentLinkedQueue<>();
		List<Thread> threads = new ArrayList<>();
		for (int t = 0; t < 4; t++) {
			threads.add(new Thread(() -> {
				try {
					for (int i = 0; i < 5; i++) {
						grants.add(limiter.acquire());
					}
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
			}));
		}

		// When
		threads.forEach(Thread::start);
		for (Thread thread : threads) {
			thread.join(10_000);
		}

		// Then
		List<Long> sorted = grants.stream().sorted().toList();
		assertThat(sorted).hasSize(20);
		for (int i = 1; i < sorted.size(); i++) {
			assertThat(sorted.get(i) - sorted.get(i - 1)).isGreaterThanOrEqualTo(interval.toNanos());
		}
	}

	@Test
	void testAcquireIsInterruptible() throws Exception {
		// Given
		RateLimiter limiter = new RateLimiter(Duration.ofSeconds(30));
		limiter.acquire();

		// When
		Thread.currentThread().interrupt();

		// Then
		try {
			assertThatThrownBy(limiter::acquire).isInstanceOf(InterruptedException.class);
		} finally {
			Thread.interrupted();
		}
	}
}
