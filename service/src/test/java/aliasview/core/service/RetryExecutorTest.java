package aliasview.core.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import aliasview.core.model.CatalogErrorKind;
import aliasview.core.model.CatalogException;
import aliasview.core.port.out.CatalogMetrics;

@DisplayName("RetryExecutor")
class RetryExecutorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final Duration SHORT_DELAY = Duration.ofMillis(5);

    private CatalogMetrics metrics;
    private RetryExecutor executor;
    private AtomicInteger calls;

    @BeforeEach
    void setUp() {
        metrics = mock(CatalogMetrics.class);
        executor = new RetryExecutor(3, SHORT_DELAY, metrics);
        calls = new AtomicInteger();
    }

    @Nested
    @DisplayName("Retryable failures")
    class RetryableFailureTests {

        @Test
        @DisplayName("should return the first successful result without retrying")
        void shouldReturnFirstSuccess() {
            var result = executor.execute(() -> succeedAfter(0)).await().atMost(TIMEOUT);

            assertEquals("ok", result);
            assertEquals(1, calls.get());
            verify(metrics, never()).recordRetry(anyInt());
        }

        @Test
        @DisplayName("should retry transient failures until success")
        void shouldRetryTransientFailuresUntilSuccess() {
            var result = executor.execute(() -> succeedAfter(2)).await().atMost(TIMEOUT);

            assertEquals("ok", result);
            assertEquals(3, calls.get());
            verify(metrics).recordRetry(1);
            verify(metrics).recordRetry(2);
        }

        @Test
        @DisplayName("should retry listing failures")
        void shouldRetryListingFailures() {
            var result = executor.execute(() -> Uni.createFrom().item(() -> {
                        if (calls.incrementAndGet() == 1) {
                            throw new CatalogException(CatalogErrorKind.LIST_FAILED, "listing unavailable");
                        }
                        return "ok";
                    }))
                    .await()
                    .atMost(TIMEOUT);

            assertEquals("ok", result);
            assertEquals(2, calls.get());
        }

        @Test
        @DisplayName("should propagate the last transient error once attempts are exhausted")
        void shouldPropagateLastErrorWhenExhausted() {
            var thrown = assertThrows(CatalogException.class, () -> executor.execute(() -> Uni.createFrom()
                            .<String>item(() -> {
                                throw CatalogException.transientFailure("failure " + calls.incrementAndGet());
                            }))
                    .await()
                    .atMost(TIMEOUT));

            assertEquals(3, calls.get());
            assertEquals("failure 3", thrown.getMessage());
            verify(metrics, times(2)).recordRetry(anyInt());
        }
    }

    @Nested
    @DisplayName("Non-retryable failures")
    class NonRetryableFailureTests {

        @Test
        @DisplayName("should not retry authentication failures")
        void shouldNotRetryAuthFailures() {
            var auth = CatalogException.auth("credentials rejected");

            var thrown = assertThrows(
                    CatalogException.class,
                    () -> executor.execute(() -> fail(auth)).await().atMost(TIMEOUT));

            assertSame(auth, thrown);
            assertEquals(1, calls.get());
        }

        @Test
        @DisplayName("should not retry unclassified failures")
        void shouldNotRetryUnclassifiedFailures() {
            var error = new IllegalStateException("unexpected");

            var thrown = assertThrows(
                    IllegalStateException.class,
                    () -> executor.execute(() -> fail(error)).await().atMost(TIMEOUT));

            assertSame(error, thrown);
            assertEquals(1, calls.get());
        }

        @Test
        @DisplayName("should treat a supplier that throws as a failed attempt")
        void shouldTreatThrowingSupplierAsFailedAttempt() {
            var result = executor.execute(() -> {
                        if (calls.incrementAndGet() == 1) {
                            throw CatalogException.transientFailure("connection reset");
                        }
                        return Uni.createFrom().item("ok");
                    })
                    .await()
                    .atMost(TIMEOUT);

            assertEquals("ok", result);
            assertEquals(2, calls.get());
        }
    }

    @Nested
    @DisplayName("Configuration")
    class ConfigurationTests {

        @Test
        @DisplayName("should fail without running the operation when max retries is zero")
        void shouldFailWhenMaxRetriesIsZero() {
            var noRetries = new RetryExecutor(0, SHORT_DELAY, metrics);

            var thrown = assertThrows(
                    CatalogException.class,
                    () -> noRetries.execute(() -> succeedAfter(0)).await().atMost(TIMEOUT));

            assertEquals(CatalogErrorKind.OTHER, thrown.kind());
            assertEquals("Retry failed", thrown.getMessage());
            assertEquals(0, calls.get());
        }

        @Test
        @DisplayName("should double the delay for each attempt")
        void shouldDoubleDelayPerAttempt() {
            var defaults = new RetryExecutor(3, Duration.ofSeconds(1), metrics);

            assertEquals(Duration.ofSeconds(1), defaults.backoffDelay(0));
            assertEquals(Duration.ofSeconds(2), defaults.backoffDelay(1));
            assertEquals(Duration.ofSeconds(4), defaults.backoffDelay(2));
        }

        @Test
        @DisplayName("should reject negative settings")
        void shouldRejectNegativeSettings() {
            assertThrows(IllegalArgumentException.class, () -> new RetryExecutor(-1, SHORT_DELAY, metrics));
            assertThrows(
                    IllegalArgumentException.class, () -> new RetryExecutor(3, Duration.ofMillis(-1), metrics));
        }

        @Test
        @DisplayName("should retry immediately when the base delay is zero")
        void shouldRetryImmediatelyWithZeroDelay() {
            var immediate = new RetryExecutor(3, Duration.ZERO, metrics);

            var result = immediate.execute(() -> succeedAfter(1)).await().atMost(TIMEOUT);

            assertEquals("ok", result);
            assertEquals(2, calls.get());
        }
    }

    private Uni<String> succeedAfter(int failures) {
        return Uni.createFrom().item(() -> {
            if (calls.incrementAndGet() <= failures) {
                throw CatalogException.transientFailure("attempt " + calls.get() + " failed");
            }
            return "ok";
        });
    }

    private Uni<String> fail(RuntimeException error) {
        return Uni.createFrom().item(() -> {
            calls.incrementAndGet();
            throw error;
        });
    }
}
