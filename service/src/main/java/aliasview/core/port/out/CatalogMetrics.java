package aliasview.core.port.out;

import aliasview.core.model.CatalogErrorKind;
import aliasview.core.model.FetchOutcome;

/**
 * Port interface for recording catalog fetch and cache metrics.
 */
public interface CatalogMetrics {

    /**
     * Record a completed fan-out fetch.
     *
     * @param outcome the fetch outcome
     */
    void recordFetch(FetchOutcome outcome);

    /**
     * Record a top-level fetch that failed after retries.
     *
     * @param kind the classified failure
     */
    void recordFetchFailure(CatalogErrorKind kind);

    /**
     * Record a retry scheduled after a failed attempt.
     *
     * @param attempt the 1-based attempt that failed
     */
    void recordRetry(int attempt);

    void recordCacheHit();

    void recordCacheMiss();

    /**
     * Record stale data served because a refresh failed.
     */
    void recordStaleFallback();
}
