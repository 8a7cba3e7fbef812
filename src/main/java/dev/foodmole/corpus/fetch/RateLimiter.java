package dev.foodmole.corpus.fetch;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Enforces a minimum interval between requests across all worker threads of a run.
 *
 * <p>The lock is fair, so callers are granted in arrival order. It is held while a caller sleeps
 * towards its slot, which keeps consecutive grants at least {@code minInterval} apart, but it is
 * never held during the remote call itself.
 */
public class RateLimiter {
	private final long minIntervalNanos;
	private final ReentrantLock lock = new ReentrantLock(true);

	// guarded by lock
	private long lastGrant;
	private boolean granted;

	public RateLimiter(Duration minInterval) {
		this.minIntervalNanos = minInterval.toNanos();
	}

	/** Create a limiter allowing at most {@code requestsPerSecond} grants per second */
	public static RateLimiter perSecond(double requestsPerSecond) {
		if (requestsPerSecond <= 0) {
			return new RateLimiter(Duration.ZERO);
		}
		return new RateLimiter(Duration.ofNanos((long) (TimeUnit.SECONDS.toNanos(1) / requestsPerSecond)));
	}

	public Duration minInterval() {
		return Duration.ofNanos(Math.max(0, minIntervalNanos));
	}

	/**
	 * Block until the next request may be issued and grant it.
	 *
	 * @return the {@link System#nanoTime()} at which the request was granted
	 * @throws InterruptedException if interrupted while waiting for a slot
	 */
	public long acquire() throws InterruptedException {
		if (minIntervalNanos <= 0) {
			return System.nanoTime();
		}
		lock.lockInterruptibly();
		try {
			if (granted) {
				long remaining = lastGrant + minIntervalNanos - System.nanoTime();
				while (remaining > 0) {
					TimeUnit.NANOSECONDS.sleep(remaining);
					remaining = lastGrant + minIntervalNanos - System.nanoTime();
				}
			}
			lastGrant = System.nanoTime();
			granted = true;
			return lastGrant;
		} finally {
			lock.unlock();
		}
	}
}
