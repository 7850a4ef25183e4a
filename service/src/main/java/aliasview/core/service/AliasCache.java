package aliasview.core.service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import aliasview.core.config.CatalogConfig;
import aliasview.core.model.CacheSnapshot;
import aliasview.core.model.CatalogException;
import aliasview.core.model.FetchOutcome;
import aliasview.core.model.PolicyAlias;
import aliasview.core.port.out.CatalogMetrics;

/**
 * Holds the most recent successful alias fetch and serves it until its TTL elapses.
 *
 * <p>Features:
 * <ul>
 *   <li>TTL-based freshness, bypassed by {@code forceRefresh}</li>
 *   <li>Retried fetches via {@link RetryExecutor}</li>
 *   <li>Stale data served when a refresh fails and a previous fetch exists</li>
 *   <li>Request coalescing: concurrent callers needing a fetch share one in-flight refresh</li>
 * </ul>
 *
 * <p>The cache state is an immutable {@link CacheSnapshot} replaced atomically, so readers
 * always see a consistent alias list and timestamp.
 */
@ApplicationScoped
public class AliasCache {

    private static final Logger LOG = Logger.getLogger(AliasCache.class);
    private static final String REFRESH_KEY = "aliases";

    private final RetryExecutor retryExecutor;
    private final ParallelNamespaceFetcher fetcher;
    private final CatalogMetrics metrics;
    private final Duration ttl;
    private final Clock clock;
    private final Executor fetchExecutor;

    private volatile CacheSnapshot snapshot;
    private final Map<String, Uni<List<PolicyAlias>>> inFlightRefreshes = new ConcurrentHashMap<>();

    @Inject
    public AliasCache(
            RetryExecutor retryExecutor,
            ParallelNamespaceFetcher fetcher,
            CatalogMetrics metrics,
            CatalogConfig config) {
        this(
                retryExecutor,
                fetcher,
                metrics,
                config.cache().ttl(),
                Clock.systemUTC(),
                Infrastructure.getDefaultWorkerPool());
    }

    public AliasCache(
            RetryExecutor retryExecutor,
            ParallelNamespaceFetcher fetcher,
            CatalogMetrics metrics,
            Duration ttl,
            Clock clock,
            Executor fetchExecutor) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive, got: " + ttl);
        }
        this.retryExecutor = retryExecutor;
        this.fetcher = fetcher;
        this.metrics = metrics;
        this.ttl = ttl;
        this.clock = clock;
        this.fetchExecutor = fetchExecutor;
    }

    /**
     * Get the cached aliases, fetching them when the cache is empty, expired or bypassed.
     *
     * @param forceRefresh fetch even if the cache is valid
     * @return the alias sequence; stale data if the fetch fails after a previous success
     */
    public Uni<List<PolicyAlias>> getAliases(boolean forceRefresh) {
        return Uni.createFrom().deferred(() -> {
            var current = snapshot;
            if (!forceRefresh && current != null && current.isValid(clock.instant(), ttl)) {
                LOG.debugv("Returning cached policy aliases ({0} items)", current.aliases().size());
                metrics.recordCacheHit();
                return Uni.createFrom().item(current.aliases());
            }
            metrics.recordCacheMiss();
            return inFlightRefreshes.computeIfAbsent(REFRESH_KEY, key -> createRefresh());
        });
    }

    /**
     * Returns true if the cache holds data younger than the TTL.
     */
    public boolean isValid() {
        var current = snapshot;
        return current != null && current.isValid(clock.instant(), ttl);
    }

    /**
     * Age of the cached data, empty if nothing was ever fetched.
     */
    public Optional<Duration> cacheAge() {
        return Optional.ofNullable(snapshot).map(current -> current.age(clock.instant()));
    }

    public Optional<CacheSnapshot> snapshot() {
        return Optional.ofNullable(snapshot);
    }

    /**
     * The outcome of the most recent successful fetch, including namespaces that failed.
     */
    public Optional<FetchOutcome> lastOutcome() {
        return Optional.ofNullable(snapshot).map(CacheSnapshot::outcome);
    }

    public Duration ttl() {
        return ttl;
    }

    private Uni<List<PolicyAlias>> createRefresh() {
        return fetchAndStore()
                .onTermination()
                .invoke(() -> inFlightRefreshes.remove(REFRESH_KEY))
                .memoize()
                .indefinitely();
    }

    private Uni<List<PolicyAlias>> fetchAndStore() {
        LOG.info("Fetching policy aliases from remote catalog");
        return retryExecutor
                .execute(() -> Uni.createFrom().item(() -> fetcher.fetchAll()).runSubscriptionOn(fetchExecutor))
                .map(this::store)
                .onFailure()
                .recoverWithUni(this::fallbackToStale);
    }

    private List<PolicyAlias> store(FetchOutcome outcome) {
        var fresh = CacheSnapshot.of(outcome, clock.instant());
        snapshot = fresh;
        metrics.recordFetch(outcome);
        LOG.infov("Successfully cached {0} policy aliases", fresh.aliases().size());
        return fresh.aliases();
    }

    private Uni<List<PolicyAlias>> fallbackToStale(Throwable error) {
        LOG.errorv("Failed to fetch policy aliases: {0}", error.getMessage());
        metrics.recordFetchFailure(CatalogException.kindOf(error));

        var stale = snapshot;
        if (stale == null) {
            return Uni.createFrom().failure(error);
        }
        LOG.warnv("Returning stale cache due to fetch failure ({0} items, fetched at {1})",
                stale.aliases().size(), stale.fetchedAt());
        metrics.recordStaleFallback();
        return Uni.createFrom().item(stale.aliases());
    }
}
