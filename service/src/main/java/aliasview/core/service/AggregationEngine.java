package aliasview.core.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import aliasview.core.model.AliasStatistics;
import aliasview.core.model.NamespaceCount;
import aliasview.core.model.PolicyAlias;

/**
 * Statistics, search and namespace summaries over the cached alias catalog.
 *
 * <p>Every query reads the catalog through {@link AliasCache#getAliases(boolean)} without
 * forcing a refresh. Results preserve catalog order unless stated otherwise.
 */
@ApplicationScoped
public class AggregationEngine {

    static final int TOP_NAMESPACE_LIMIT = 10;

    private final AliasCache cache;

    @Inject
    public AggregationEngine(AliasCache cache) {
        this.cache = cache;
    }

    public Uni<AliasStatistics> statistics() {
        return cache.getAliases(false).map(this::statisticsOf);
    }

    /**
     * Search aliases. Every whitespace-separated query term must occur (case-insensitively)
     * in the alias's namespace, resource type, alias name or default path.
     *
     * @param query           search terms (nullable)
     * @param namespaceFilter exact namespace match (nullable)
     * @return matching aliases in catalog order
     */
    public Uni<List<PolicyAlias>> search(String query, String namespaceFilter) {
        return cache.getAliases(false).map(aliases -> filter(aliases, query, namespaceFilter));
    }

    public Uni<List<NamespaceCount>> namespacesWithCounts() {
        return cache.getAliases(false).map(AggregationEngine::countByNamespace);
    }

    public Uni<List<String>> namespaces() {
        return cache.getAliases(false).map(AggregationEngine::distinctNamespaces);
    }

    /**
     * Compute statistics for the given aliases, reading cache age and validity from the cache.
     */
    public AliasStatistics statisticsOf(List<PolicyAlias> aliases) {
        Set<String> resourceTypes = new HashSet<>();
        for (PolicyAlias alias : aliases) {
            resourceTypes.add(alias.namespace() + "/" + alias.resourceType());
        }
        var counts = countInOrder(aliases);

        return new AliasStatistics(
                aliases.size(),
                counts.size(),
                resourceTypes.size(),
                cache.cacheAge().map(age -> age.toSeconds()),
                cache.isValid(),
                topNamespaces(counts, TOP_NAMESPACE_LIMIT));
    }

    static List<PolicyAlias> filter(List<PolicyAlias> aliases, String query, String namespaceFilter) {
        var hasQuery = query != null && !query.isBlank();
        var hasNamespace = namespaceFilter != null && !namespaceFilter.isEmpty();
        if (!hasQuery && !hasNamespace) {
            return aliases;
        }

        var terms = hasQuery ? query.trim().toLowerCase(Locale.ROOT).split("\\s+") : new String[0];
        List<PolicyAlias> matches = new ArrayList<>();
        for (PolicyAlias alias : aliases) {
            if (hasNamespace && !alias.namespace().equals(namespaceFilter)) {
                continue;
            }
            if (terms.length > 0 && !containsAll(alias.searchableText(), terms)) {
                continue;
            }
            matches.add(alias);
        }
        return matches;
    }

    /**
     * Alias counts per namespace, descending by count with ties in alphabetical order.
     */
    static List<NamespaceCount> countByNamespace(List<PolicyAlias> aliases) {
        return countInOrder(aliases).entrySet().stream()
                .map(entry -> new NamespaceCount(entry.getKey(), entry.getValue()))
                .sorted(Comparator.comparingLong(NamespaceCount::count)
                        .reversed()
                        .thenComparing(NamespaceCount::namespace))
                .toList();
    }

    /**
     * The namespaces with the most aliases, descending by count. Ties keep first-seen order.
     */
    static List<NamespaceCount> topNamespaces(Map<String, Long> countsInOrder, int limit) {
        return countsInOrder.entrySet().stream()
                .map(entry -> new NamespaceCount(entry.getKey(), entry.getValue()))
                .sorted(Comparator.comparingLong(NamespaceCount::count).reversed())
                .limit(limit)
                .toList();
    }

    static List<String> distinctNamespaces(List<PolicyAlias> aliases) {
        Set<String> namespaces = new TreeSet<>();
        for (PolicyAlias alias : aliases) {
            namespaces.add(alias.namespace());
        }
        return List.copyOf(namespaces);
    }

    static Map<String, Long> countInOrder(List<PolicyAlias> aliases) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (PolicyAlias alias : aliases) {
            counts.merge(alias.namespace(), 1L, Long::sum);
        }
        return counts;
    }

    private static boolean containsAll(String text, String[] terms) {
        for (String term : terms) {
            if (!text.contains(term)) {
                return false;
            }
        }
        return true;
    }
}
