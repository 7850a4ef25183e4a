package aliasview.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Aggregate statistics over the cached alias catalog.
 *
 * @param totalAliases       number of aliases
 * @param totalNamespaces    number of distinct namespaces
 * @param totalResourceTypes number of distinct (namespace, resourceType) pairs
 * @param cacheAgeSeconds    whole seconds since the last successful fetch, empty if never fetched
 * @param cacheValid         whether the cache is currently within its TTL
 * @param topNamespaces      at most ten namespaces with the most aliases
 */
public record AliasStatistics(
        int totalAliases,
        int totalNamespaces,
        int totalResourceTypes,
        Optional<Long> cacheAgeSeconds,
        boolean cacheValid,
        List<NamespaceCount> topNamespaces) {

    public AliasStatistics {
        if (cacheAgeSeconds == null) {
            cacheAgeSeconds = Optional.empty();
        }
        topNamespaces = topNamespaces != null ? List.copyOf(topNamespaces) : List.of();
    }
}
