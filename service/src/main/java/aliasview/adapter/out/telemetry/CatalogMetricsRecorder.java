package aliasview.adapter.out.telemetry;

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import aliasview.core.config.CatalogConfig;
import aliasview.core.model.CatalogErrorKind;
import aliasview.core.model.FetchOutcome;
import aliasview.core.port.out.CatalogMetrics;

/**
 * Records catalog metrics using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code aliasview.fetch.total} - Fetches by outcome (success, partial, failure)</li>
 *   <li>{@code aliasview.fetch.duration} - Fan-out fetch duration</li>
 *   <li>{@code aliasview.fetch.aliases} - Aliases returned by the last successful fetch</li>
 *   <li>{@code aliasview.fetch.failed.namespaces} - Namespaces that failed during fetches</li>
 *   <li>{@code aliasview.retry.attempts} - Retries scheduled after failed attempts</li>
 *   <li>{@code aliasview.cache.requests} - Cache lookups by result (hit, miss, stale)</li>
 * </ul>
 */
@ApplicationScoped
public class CatalogMetricsRecorder implements CatalogMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;
    private final AtomicLong lastAliasCount = new AtomicLong();

    @Inject
    public CatalogMetricsRecorder(MeterRegistry registry, CatalogConfig config) {
        this(registry, config != null && config.metrics().enabled());
    }

    public CatalogMetricsRecorder(MeterRegistry registry, boolean enabled) {
        this.registry = registry;
        this.enabled = enabled;
    }

    @PostConstruct
    void init() {
        if (!enabled) {
            return;
        }
        Gauge.builder("aliasview.fetch.aliases", lastAliasCount, AtomicLong::get)
                .description("Aliases returned by the last successful fetch")
                .register(registry);
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordFetch(FetchOutcome outcome) {
        if (!enabled) {
            return;
        }
        lastAliasCount.set(outcome.aliases().size());

        fetchCounter(outcome.hasFailures() ? "partial" : "success", "none").increment();

        Timer.builder("aliasview.fetch.duration")
                .description("Time to fetch aliases from every namespace")
                .register(registry)
                .record(outcome.elapsed().toNanos(), TimeUnit.NANOSECONDS);

        if (outcome.hasFailures()) {
            Counter.builder("aliasview.fetch.failed.namespaces")
                    .description("Namespaces whose detail fetch failed")
                    .register(registry)
                    .increment(outcome.failedNamespaces().size());
        }
    }

    @Override
    public void recordFetchFailure(CatalogErrorKind kind) {
        if (!enabled) {
            return;
        }
        fetchCounter("failure", kind.name().toLowerCase(Locale.ROOT)).increment();
    }

    @Override
    public void recordRetry(int attempt) {
        if (!enabled) {
            return;
        }
        Counter.builder("aliasview.retry.attempts")
                .description("Retries scheduled after a failed fetch attempt")
                .tag("attempt", String.valueOf(attempt))
                .register(registry)
                .increment();
    }

    @Override
    public void recordCacheHit() {
        cacheCounter("hit");
    }

    @Override
    public void recordCacheMiss() {
        cacheCounter("miss");
    }

    @Override
    public void recordStaleFallback() {
        cacheCounter("stale");
    }

    private void cacheCounter(String result) {
        if (!enabled) {
            return;
        }
        Counter.builder("aliasview.cache.requests")
                .description("Alias cache lookups by result")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    private Counter fetchCounter(String outcome, String errorKind) {
        return Counter.builder("aliasview.fetch.total")
                .description("Alias fetches by outcome")
                .tag("outcome", outcome)
                .tag("error_kind", errorKind)
                .register(registry);
    }
}
