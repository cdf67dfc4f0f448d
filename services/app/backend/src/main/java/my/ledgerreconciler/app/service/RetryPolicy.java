package my.ledgerreconciler.app.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Bounded retry with a fixed or growing delay between attempts.
 */
public class RetryPolicy {
	private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

	private final int maxAttempts;
	private final Duration delay;
	private final double backoffMultiplier;
	private final Sleeper sleeper;

	public RetryPolicy(int maxAttempts, Duration delay, double backoffMultiplier, Sleeper sleeper) {
		this.maxAttempts = Math.max(1, maxAttempts);
		this.delay = delay == null || delay.isNegative() ? Duration.ZERO : delay;
		this.backoffMultiplier = backoffMultiplier < 1.0 ? 1.0 : backoffMultiplier;
		this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
	}

	public static RetryPolicy fixed(int maxAttempts, Duration delay, Sleeper sleeper) {
		return new RetryPolicy(maxAttempts, delay, 1.0, sleeper);
	}

	public int maxAttempts() {
		return maxAttempts;
	}

	/**
	 * Delay slept after the given failed attempt (1-based).
	 */
	public Duration delayAfter(int attempt) {
		if (attempt < 1 || backoffMultiplier == 1.0) {
			return delay;
		}
		double factor = Math.pow(backoffMultiplier, attempt - 1);
		return Duration.ofMillis(Math.round(delay.toMillis() * factor));
	}

	/**
	 * Runs {@code call} until it succeeds, a non-retryable exception is thrown, or attempts run out.
	 * The last retryable exception is rethrown once attempts are exhausted.
	 */
	public <T> T execute(Supplier<T> call, Predicate<RuntimeException> retryable) throws InterruptedException {
		RuntimeException last = null;
		for (int attempt = 1; attempt <= maxAttempts; attempt++) {
			try {
				return call.get();
			} catch (RuntimeException ex) {
				if (!retryable.test(ex)) {
					throw ex;
				}
				last = ex;
				if (attempt == maxAttempts) {
					break;
				}
				Duration wait = delayAfter(attempt);
				logger.debug("Attempt {}/{} failed ({}), retrying in {} ms",
						attempt, maxAttempts, ex.getMessage(), wait.toMillis());
				sleeper.sleep(wait);
			}
		}
		throw last;
	}
}
