package aliasview.adapter.out.telemetry;

import aliasview.core.model.CatalogErrorKind;
import aliasview.core.model.FetchOutcome;
import aliasview.core.port.out.CatalogMetrics;

/**
 * {@link CatalogMetrics} that records nothing.
 */
public final class NoOpCatalogMetrics implements CatalogMetrics {

    public static final NoOpCatalogMetrics INSTANCE = new NoOpCatalogMetrics();

    private NoOpCatalogMetrics() {}

    @Override
    public void recordFetch(FetchOutcome outcome) {}

    @Override
    public void recordFetchFailure(CatalogErrorKind kind) {}

    @Override
    public void recordRetry(int attempt) {}

    @Override
    public void recordCacheHit() {}

    @Override
    public void recordCacheMiss() {}

    @Override
    public void recordStaleFallback() {}
}
