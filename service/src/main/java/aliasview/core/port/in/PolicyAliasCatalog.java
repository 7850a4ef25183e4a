package aliasview.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import aliasview.core.model.AliasStatistics;
import aliasview.core.model.NamespaceCount;
import aliasview.core.model.PolicyAlias;
import aliasview.core.model.RefreshReport;

/**
 * Port for querying the policy alias catalog.
 *
 * <p>Every operation is served from the alias cache, fetching from the remote catalog
 * only when the cache is empty, expired or a refresh is forced. Read-only queries never
 * force a refresh.
 */
public interface PolicyAliasCatalog {

    /**
     * Get all policy aliases.
     *
     * @param forceRefresh bypass the cache and fetch from the remote catalog
     * @return the alias sequence
     */
    Uni<List<PolicyAlias>> getPolicyAliases(boolean forceRefresh);

    /**
     * Get statistics over the cached catalog.
     *
     * @return the statistics
     */
    Uni<AliasStatistics> getStatistics();

    /**
     * Search aliases with all-terms matching and an optional exact namespace filter.
     *
     * @param query           whitespace-separated search terms (nullable)
     * @param namespaceFilter exact namespace to restrict to (nullable)
     * @return matching aliases in catalog order
     */
    Uni<List<PolicyAlias>> searchAliases(String query, String namespaceFilter);

    /**
     * Get alias counts per namespace, most aliases first.
     *
     * @return the namespace counts
     */
    Uni<List<NamespaceCount>> getNamespacesWithCounts();

    /**
     * Get the distinct namespace names in alphabetical order.
     *
     * @return the namespace names
     */
    Uni<List<String>> getNamespaces();

    /**
     * Force a refresh and report the resulting statistics.
     *
     * @return the refresh report
     */
    Uni<RefreshReport> refresh();
}
