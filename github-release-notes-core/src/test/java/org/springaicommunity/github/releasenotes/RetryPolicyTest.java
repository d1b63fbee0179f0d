package org.springaicommunity.github.releasenotes;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link RetryPolicy}.
 *
 * Tests retry logic, exponential backoff, rate limit waits and error classification.
 * Sleeps are recorded instead of performed.
 */
@DisplayName("RetryPolicy Tests")
class RetryPolicyTest {

	private static final long NOW_EPOCH_SECONDS = 1_700_000_000L;

	private final List<Long> sleeps = new ArrayList<>();

	private final AtomicInteger attempts = new AtomicInteger();

	private RetryPolicy retryPolicy;

	@BeforeEach
	void setUp() {
		retryPolicy = RetryPolicy.builder()
			.maxRetries(3)
			.initialDelayMs(2000)
			.jitter(0)
			.clock(Clock.fixed(Instant.ofEpochSecond(NOW_EPOCH_SECONDS), ZoneOffset.UTC))
			.sleeper(sleeps::add)
			.build();
	}

	private RetryPolicy.RemoteCall<String> failingTimes(int failures, Exception error) {
		return () -> {
			if (attempts.incrementAndGet() <= failures) {
				throw error;
			}
			return "success";
		};
	}

	private static GitHubHttpClient.GitHubApiException apiError(int status) {
		return new GitHubHttpClient.GitHubApiException("HTTP " + status, status, "body");
	}

	@Nested
	@DisplayName("Retry Behavior Tests")
	class RetryBehaviorTest {

		@Test
		@DisplayName("Should return immediately on success")
		void shouldReturnOnSuccess() {
			assertThat(retryPolicy.execute("call", failingTimes(0, apiError(500)))).isEqualTo("success");

			assertThat(attempts).hasValue(1);
			assertThat(sleeps).isEmpty();
		}

		@Test
		@DisplayName("Should retry server errors with exponential backoff")
		void shouldRetryServerErrors() {
			assertThat(retryPolicy.execute("call", failingTimes(2, apiError(502)))).isEqualTo("success");

			assertThat(attempts).hasValue(3);
			assertThat(sleeps).containsExactly(2000L, 4000L);
		}

		@Test
		@DisplayName("Should rethrow the last error after 1 + maxRetries attempts")
		void shouldGiveUpAfterMaxRetries() {
			GitHubHttpClient.GitHubApiException error = apiError(503);

			assertThatThrownBy(() -> retryPolicy.execute("call", failingTimes(10, error))).isSameAs(error);

			assertThat(attempts).hasValue(4);
			assertThat(sleeps).containsExactly(2000L, 4000L, 8000L);
		}

		@Test
		@DisplayName("Should retry network failures")
		void shouldRetryNetworkFailures() {
			GitHubHttpClient.GitHubApiException timeout = new GitHubHttpClient.GitHubApiException("timed out",
					new java.net.http.HttpTimeoutException("timed out"));

			assertThat(retryPolicy.execute("call", failingTimes(1, timeout))).isEqualTo("success");
			assertThat(attempts).hasValue(2);
		}

		@Test
		@DisplayName("Should wrap checked I/O failures once retries are exhausted")
		void shouldWrapCheckedExceptions() {
			IOException error = new IOException("connection reset");

			assertThatThrownBy(() -> retryPolicy.execute("list commits", failingTimes(10, error)))
				.isInstanceOfSatisfying(ReleaseNotesException.class,
						e -> assertThat(e.getKind()).isEqualTo(ErrorKind.TRANSIENT))
				.hasMessageContaining("list commits")
				.hasCause(error);
			assertThat(attempts).hasValue(4);
		}

	}

	@Nested
	@DisplayName("Non-Retryable Error Tests")
	class NonRetryableErrorTest {

		@Test
		@DisplayName("Should not retry not found")
		void shouldNotRetryNotFound() {
			GitHubHttpClient.GitHubApiException error = apiError(404);

			assertThatThrownBy(() -> retryPolicy.execute("call", failingTimes(1, error))).isSameAs(error);

			assertThat(attempts).hasValue(1);
			assertThat(sleeps).isEmpty();
		}

		@Test
		@DisplayName("Should not retry bad credentials")
		void shouldNotRetryUnauthorized() {
			assertThatThrownBy(() -> retryPolicy.execute("call", failingTimes(1, apiError(401))))
				.isInstanceOf(GitHubHttpClient.GitHubApiException.class);

			assertThat(attempts).hasValue(1);
		}

		@Test
		@DisplayName("Should not retry forbidden without exhausted quota")
		void shouldNotRetryForbidden() {
			GitHubHttpClient.GitHubApiException forbidden = new GitHubHttpClient.GitHubApiException("Forbidden", 403,
					"", 42, NOW_EPOCH_SECONDS + 60);

			assertThatThrownBy(() -> retryPolicy.execute("call", failingTimes(1, forbidden))).isSameAs(forbidden);
			assertThat(attempts).hasValue(1);
		}

		@Test
		@DisplayName("Should not retry programming errors")
		void shouldNotRetryUnexpectedErrors() {
			IllegalStateException error = new IllegalStateException("boom");

			assertThatThrownBy(() -> retryPolicy.execute("call", failingTimes(1, error))).isSameAs(error);
			assertThat(attempts).hasValue(1);
		}

	}

	@Nested
	@DisplayName("Rate Limit Tests")
	class RateLimitTest {

		@Test
		@DisplayName("Should wait until the reset time plus one second")
		void shouldWaitUntilReset() {
			GitHubHttpClient.GitHubApiException rateLimited = new GitHubHttpClient.GitHubApiException(
					"Rate limit exceeded", 403, "", 0, NOW_EPOCH_SECONDS + 10);

			assertThat(retryPolicy.computeWaitTime(rateLimited, 2000)).isEqualTo(11_000L);
		}

		@Test
		@DisplayName("Should sleep until reset before retrying a rate limited call")
		void shouldSleepUntilReset() {
			GitHubHttpClient.GitHubApiException rateLimited = new GitHubHttpClient.GitHubApiException(
					"Too Many Requests", 429, "", 0, NOW_EPOCH_SECONDS + 10);

			assertThat(retryPolicy.execute("call", failingTimes(1, rateLimited))).isEqualTo("success");

			assertThat(sleeps).containsExactly(11_000L);
		}

		@Test
		@DisplayName("Should use the backoff delay when the reset time has passed")
		void shouldUseBackoffWhenResetPassed() {
			GitHubHttpClient.GitHubApiException rateLimited = new GitHubHttpClient.GitHubApiException(
					"Rate limit exceeded", 403, "", 0, NOW_EPOCH_SECONDS - 5);

			assertThat(retryPolicy.computeWaitTime(rateLimited, 2000)).isEqualTo(2000L);
		}

		@Test
		@DisplayName("Should use the backoff delay when no reset time is known")
		void shouldUseBackoffWithoutReset() {
			assertThat(retryPolicy.computeWaitTime(apiError(429), 4000)).isEqualTo(4000L);
		}

		@Test
		@DisplayName("Should use the backoff delay for non rate limit errors")
		void shouldUseBackoffForOtherErrors() {
			GitHubHttpClient.GitHubApiException serverError = new GitHubHttpClient.GitHubApiException("Bad Gateway",
					502, "", 100, NOW_EPOCH_SECONDS + 10);

			assertThat(retryPolicy.computeWaitTime(serverError, 2000)).isEqualTo(2000L);
		}

	}

	@Nested
	@DisplayName("Jitter and Interruption Tests")
	class JitterTest {

		@Test
		@DisplayName("Should keep jittered delays within the configured fraction")
		void shouldBoundJitter() {
			RetryPolicy jittered = RetryPolicy.builder()
				.maxRetries(1)
				.initialDelayMs(1000)
				.jitter(0.2)
				.random(new Random(42))
				.sleeper(sleeps::add)
				.build();

			jittered.execute("call", failingTimes(1, apiError(500)));

			assertThat(sleeps).singleElement().satisfies(delay -> assertThat(delay).isBetween(800L, 1200L));
		}

		@Test
		@DisplayName("Should abort with CANCELLED when interrupted while waiting")
		void shouldAbortWhenInterrupted() {
			RetryPolicy interrupted = RetryPolicy.builder().initialDelayMs(1).jitter(0).sleeper(ms -> {
				throw new InterruptedException();
			}).build();

			try {
				assertThatThrownBy(() -> interrupted.execute("call", failingTimes(10, apiError(500))))
					.isInstanceOfSatisfying(ReleaseNotesException.class,
							e -> assertThat(e.getKind()).isEqualTo(ErrorKind.CANCELLED));
				assertThat(Thread.currentThread().isInterrupted()).isTrue();
				assertThat(attempts).hasValue(1);
			}
			finally {
				Thread.interrupted();
			}
		}

	}

	@Nested
	@DisplayName("Classification and Builder Tests")
	class ClassificationTest {

		@Test
		@DisplayName("Should classify failures")
		void shouldClassifyFailures() {
			assertThat(RetryPolicy.classify(apiError(500))).isEqualTo(ErrorKind.TRANSIENT);
			assertThat(RetryPolicy.classify(apiError(404))).isEqualTo(ErrorKind.NOT_FOUND);
			assertThat(RetryPolicy.classify(new IOException("reset"))).isEqualTo(ErrorKind.TRANSIENT);
			assertThat(RetryPolicy.classify(new InterruptedException())).isEqualTo(ErrorKind.CANCELLED);
			assertThat(RetryPolicy.classify(new IllegalArgumentException())).isEqualTo(ErrorKind.UNEXPECTED);
		}

		@Test
		@DisplayName("Should validate builder parameters")
		void shouldValidateBuilder() {
			assertThatIllegalStateException().isThrownBy(() -> RetryPolicy.builder().maxRetries(-1).build());
			assertThatIllegalStateException().isThrownBy(() -> RetryPolicy.builder().initialDelayMs(0).build());
			assertThatIllegalStateException().isThrownBy(() -> RetryPolicy.builder().jitter(1.5).build());
			assertThat(RetryPolicy.builder().build().getMaxRetries()).isEqualTo(3);
		}

	}

}
