package aliasview.core.service;

import java.time.Duration;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import aliasview.core.config.CatalogConfig;
import aliasview.core.model.CatalogErrorKind;
import aliasview.core.model.CatalogException;
import aliasview.core.port.out.CatalogMetrics;

/**
 * Runs an asynchronous operation with bounded exponential-backoff retry.
 *
 * <p>Failures are classified with {@link CatalogException#kindOf(Throwable)}:
 * <ul>
 *   <li>{@link CatalogErrorKind#AUTH} - propagated immediately</li>
 *   <li>retryable kinds - retried after {@code baseDelay * 2^attempt}</li>
 *   <li>anything else - propagated immediately</li>
 * </ul>
 *
 * <p>The backoff pause is a timer-driven delay; no thread is blocked while waiting.
 * When every attempt fails, the last retryable error is propagated.
 */
@ApplicationScoped
public class RetryExecutor {

    private static final Logger LOG = Logger.getLogger(RetryExecutor.class);

    private final int maxRetries;
    private final Duration baseDelay;
    private final CatalogMetrics metrics;

    @Inject
    public RetryExecutor(CatalogConfig config, CatalogMetrics metrics) {
        this(config.retry().maxRetries(), config.retry().baseDelay(), metrics);
    }

    public RetryExecutor(int maxRetries, Duration baseDelay, CatalogMetrics metrics) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative, got: " + maxRetries);
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be zero or positive, got: " + baseDelay);
        }
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.metrics = metrics;
    }

    /**
     * Execute the operation, retrying retryable failures.
     *
     * @param operation supplies a fresh attempt each time it is called
     * @param <T>       the result type
     * @return a Uni emitting the first successful result
     */
    public <T> Uni<T> execute(Supplier<Uni<T>> operation) {
        if (maxRetries == 0) {
            return Uni.createFrom().failure(new CatalogException(CatalogErrorKind.OTHER, "Retry failed"));
        }
        return attempt(operation, 0);
    }

    /**
     * Delay before the attempt following {@code attempt} (0-based).
     */
    Duration backoffDelay(int attempt) {
        return baseDelay.multipliedBy(1L << attempt);
    }

    private <T> Uni<T> attempt(Supplier<Uni<T>> operation, int attempt) {
        return Uni.createFrom()
                .deferred(() -> operation.get())
                .onFailure()
                .recoverWithUni(error -> onAttemptFailed(operation, attempt, error));
    }

    private <T> Uni<T> onAttemptFailed(Supplier<Uni<T>> operation, int attempt, Throwable error) {
        var kind = CatalogException.kindOf(error);
        if (kind == CatalogErrorKind.AUTH) {
            LOG.errorv("Authentication error: {0}", error.getMessage());
            return Uni.createFrom().failure(error);
        }
        if (!kind.isRetryable()) {
            LOG.errorv(error, "Unexpected error: {0}", error.getMessage());
            return Uni.createFrom().failure(error);
        }
        if (attempt >= maxRetries - 1) {
            LOG.errorv("All {0} attempts failed", maxRetries);
            return Uni.createFrom().failure(error);
        }

        var delay = backoffDelay(attempt);
        LOG.warnv("Attempt {0} failed: {1}. Retrying in {2}ms...", attempt + 1, error.getMessage(), delay.toMillis());
        metrics.recordRetry(attempt + 1);

        return pause(delay).onItem().transformToUni(ignored -> attempt(operation, attempt + 1));
    }

    private static Uni<Void> pause(Duration delay) {
        var pause = Uni.createFrom().voidItem();
        if (delay.isZero()) {
            return pause;
        }
        return pause.onItem().delayIt().by(delay);
    }
}
