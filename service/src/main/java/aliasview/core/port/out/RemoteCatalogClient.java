package aliasview.core.port.out;

import java.util.List;

import aliasview.core.model.CatalogException;
import aliasview.core.model.NamespaceDetail;
import aliasview.core.model.NamespaceSummary;

/**
 * Port for the remote management catalog that owns namespace and alias metadata.
 *
 * <p>Both operations are blocking and are expected to be called from worker threads.
 * Pagination of the remote API is the implementation's concern.
 *
 * <p>Failures should be raised as {@link CatalogException} tagged with
 * {@code AUTH} or {@code TRANSIENT}; anything else is treated as a non-retryable error.
 */
public interface RemoteCatalogClient {

    /**
     * Expansion requested when fetching namespace detail so aliases are included.
     */
    String EXPAND_ALIASES = "resourceTypes/aliases";

    /**
     * List every namespace known to the remote catalog.
     *
     * @return the namespace listing
     */
    List<NamespaceSummary> listNamespaces();

    /**
     * Fetch full metadata for one namespace.
     *
     * @param namespace the namespace name
     * @param expand    the expansion to request, normally {@link #EXPAND_ALIASES}
     * @return the namespace detail
     */
    NamespaceDetail getNamespaceDetail(String namespace, String expand);
}
