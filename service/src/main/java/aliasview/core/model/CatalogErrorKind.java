package aliasview.core.model;

/**
 * Classification of catalog failures, checked explicitly by the retry and fetch layers.
 *
 * <ul>
 *   <li>{@link #AUTH} - credentials rejected, never retried</li>
 *   <li>{@link #TRANSIENT} - network or service-side failure, retried with backoff</li>
 *   <li>{@link #LIST_FAILED} - the namespace listing could not be obtained, retried with backoff</li>
 *   <li>{@link #NAMESPACE_FAILED} - one namespace's detail could not be fetched, absorbed by the fan-out</li>
 *   <li>{@link #OTHER} - anything else, never retried</li>
 * </ul>
 */
public enum CatalogErrorKind {
    AUTH(false),
    TRANSIENT(true),
    LIST_FAILED(true),
    NAMESPACE_FAILED(false),
    OTHER(false);

    private final boolean retryable;

    CatalogErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
