package org.springaicommunity.github.releasenotes;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Random;

/**
 * Retry policy with smart backoff for remote calls against GitHub.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Exponential backoff with jitter for transient errors (5xx, network, timeout)</li>
 * <li>Reset-aware backoff for rate limit errors: sleeps until {@code X-RateLimit-Reset}
 * (+1s) instead of the exponential delay</li>
 * <li>No retry for anything else (bad credentials, forbidden, not found, programming
 * errors): those fail on the first attempt</li>
 * </ul>
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * // With defaults (3 retries, 2 second initial delay, 20% jitter)
 * RetryPolicy retry = RetryPolicy.builder().build();
 * RepositoryInfo repo = retry.execute("get repository", () -> provider.getRepository("owner", "repo"));
 *
 * // With custom settings
 * RetryPolicy retry = RetryPolicy.builder()
 *     .maxRetries(5)
 *     .initialDelay(Duration.ofSeconds(1))
 *     .jitter(0)
 *     .build();
 * }
 * </pre>
 */
public final class RetryPolicy {

	private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

	private final int maxRetries;

	private final long initialDelayMs;

	private final double jitter;

	private final Clock clock;

	private final Sleeper sleeper;

	private final Random random;

	/**
	 * Private constructor - use {@link #builder()} to create instances.
	 */
	private RetryPolicy(Builder builder) {
		this.maxRetries = builder.maxRetries;
		this.initialDelayMs = builder.initialDelayMs;
		this.jitter = builder.jitter;
		this.clock = builder.clock;
		this.sleeper = builder.sleeper;
		this.random = builder.random != null ? builder.random : new Random();
	}

	/**
	 * Create a new builder for RetryPolicy.
	 * @return new Builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	public int getMaxRetries() {
		return maxRetries;
	}

	/**
	 * Run a remote call, retrying rate limit and transient failures.
	 * @param description short description of the call, used in log messages
	 * @param call the remote call
	 * @param <T> result type
	 * @return the call result
	 * @throws GitHubHttpClient.GitHubApiException the last API failure when retries are
	 * exhausted or the failure is not retryable
	 * @throws RuntimeException any other failure of the call, checked exceptions wrapped
	 */
	public <T> T execute(String description, RemoteCall<T> call) {
		Exception lastException = new IllegalStateException("No attempt made");
		long delay = initialDelayMs;

		for (int attempt = 0; attempt <= maxRetries; attempt++) {
			try {
				return call.call();
			}
			catch (Exception e) {
				lastException = e;
				ErrorKind kind = classify(e);
				if (!kind.isRetryable()) {
					throw propagate(e, description);
				}

				if (attempt < maxRetries) {
					long waitMs = computeWaitTime(e, withJitter(delay));
					logger.warn("{} failed with {} (attempt {}/{}): {}. Retrying in {}ms...", description, kind,
							attempt + 1, maxRetries, e.getMessage(), waitMs);
					sleep(waitMs);
					delay *= 2; // Exponential backoff for next non-rate-limit error
				}
			}
		}

		logger.error("{} failed after {} attempts", description, maxRetries + 1);
		throw propagate(lastException, description);
	}

	/**
	 * Classify a failure for retry purposes.
	 * @param e the failure
	 * @return the failure kind
	 */
	static ErrorKind classify(Exception e) {
		if (e instanceof GitHubHttpClient.GitHubApiException) {
			return ((GitHubHttpClient.GitHubApiException) e).errorKind();
		}
		if (e instanceof IOException) {
			return ErrorKind.TRANSIENT;
		}
		if (e instanceof InterruptedException) {
			return ErrorKind.CANCELLED;
		}
		return ErrorKind.UNEXPECTED;
	}

	/**
	 * Compute how long to wait before retrying. For rate limit errors with a reset time in
	 * the future, waits until that time (+1s buffer). Otherwise uses the backoff delay.
	 * @param e the failure
	 * @param backoffDelayMs exponential backoff delay for this attempt
	 * @return delay in milliseconds
	 */
	long computeWaitTime(Exception e, long backoffDelayMs) {
		if (!(e instanceof GitHubHttpClient.GitHubApiException)) {
			return backoffDelayMs;
		}
		GitHubHttpClient.GitHubApiException apiException = (GitHubHttpClient.GitHubApiException) e;
		if (apiException.isRateLimitError() && apiException.getResetEpochSeconds() > 0) {
			long nowMs = clock.millis();
			long untilResetMs = apiException.getResetEpochSeconds() * 1000 - nowMs;
			if (untilResetMs > 0) {
				logger.info("Rate limit exceeded. Waiting {} seconds until reset at epoch {}",
						(untilResetMs + 1000) / 1000, apiException.getResetEpochSeconds());
				return untilResetMs + 1000;
			}
			// reset is in the past, use backoff
		}
		return backoffDelayMs;
	}

	private long withJitter(long delayMs) {
		if (jitter <= 0) {
			return delayMs;
		}
		double factor = 1 + jitter * (2 * random.nextDouble() - 1);
		return Math.max(1, Math.round(delayMs * factor));
	}

	private void sleep(long ms) {
		try {
			sleeper.sleep(ms);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ReleaseNotesException(ErrorKind.CANCELLED, "Retry interrupted", e);
		}
	}

	private static RuntimeException propagate(Exception e, String description) {
		if (e instanceof RuntimeException) {
			return (RuntimeException) e;
		}
		if (e instanceof InterruptedException) {
			Thread.currentThread().interrupt();
			return new ReleaseNotesException(ErrorKind.CANCELLED, description + " interrupted", e);
		}
		return new ReleaseNotesException(classify(e), description + " failed: " + e.getMessage(), e);
	}

	/**
	 * A remote call that may fail.
	 *
	 * @param <T> result type
	 */
	@FunctionalInterface
	public interface RemoteCall<T> {

		T call() throws Exception;

	}

	/**
	 * Blocks the calling thread between attempts.
	 */
	@FunctionalInterface
	public interface Sleeper {

		void sleep(long millis) throws InterruptedException;

	}

	/**
	 * Builder for {@link RetryPolicy}.
	 *
	 * <p>
	 * Provides sensible defaults:
	 * <ul>
	 * <li>maxRetries: 3</li>
	 * <li>initialDelay: 2 seconds</li>
	 * <li>jitter: 0.2 (delays vary by up to 20% either way)</li>
	 * </ul>
	 */
	public static class Builder {

		private int maxRetries = 3;

		private long initialDelayMs = 2000;

		private double jitter = 0.2;

		private Clock clock = Clock.systemUTC();

		private Sleeper sleeper = Thread::sleep;

		private @Nullable Random random;

		private Builder() {
		}

		/**
		 * Set the maximum number of retry attempts.
		 * @param maxRetries maximum retries (default: 3)
		 * @return this builder
		 */
		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		/**
		 * Set the initial delay between retries using Duration.
		 * @param delay initial delay (doubles on each retry, default: 2 seconds)
		 * @return this builder
		 */
		public Builder initialDelay(Duration delay) {
			this.initialDelayMs = delay.toMillis();
			return this;
		}

		/**
		 * Set the initial delay between retries in milliseconds.
		 * @param delayMs initial delay in milliseconds (doubles on each retry, default:
		 * 2000)
		 * @return this builder
		 */
		public Builder initialDelayMs(long delayMs) {
			this.initialDelayMs = delayMs;
			return this;
		}

		/**
		 * Set the relative jitter applied to backoff delays.
		 * @param jitter fraction between 0 (no jitter) and 1 (default: 0.2)
		 * @return this builder
		 */
		public Builder jitter(double jitter) {
			this.jitter = jitter;
			return this;
		}

		/**
		 * Set the clock used to compute rate limit waits.
		 * @param clock clock (default: system UTC)
		 * @return this builder
		 */
		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		/**
		 * Set the sleeper used between attempts.
		 * @param sleeper sleeper (default: {@link Thread#sleep(long)})
		 * @return this builder
		 */
		public Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		/**
		 * Set the random source for jitter.
		 * @param random random source (default: a new {@link Random})
		 * @return this builder
		 */
		public Builder random(Random random) {
			this.random = random;
			return this;
		}

		/**
		 * Build the RetryPolicy.
		 * @return configured RetryPolicy
		 * @throws IllegalStateException if parameters are invalid
		 */
		public RetryPolicy build() {
			if (maxRetries < 0) {
				throw new IllegalStateException("maxRetries must be non-negative");
			}
			if (initialDelayMs <= 0) {
				throw new IllegalStateException("initialDelay must be positive");
			}
			if (jitter < 0 || jitter > 1) {
				throw new IllegalStateException("jitter must be between 0 and 1");
			}
			return new RetryPolicy(this);
		}

	}

}
