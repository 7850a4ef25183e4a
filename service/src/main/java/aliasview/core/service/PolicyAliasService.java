package aliasview.core.service;

import java.time.Duration;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import aliasview.core.model.AliasStatistics;
import aliasview.core.model.NamespaceCount;
import aliasview.core.model.PolicyAlias;
import aliasview.core.model.RefreshReport;
import aliasview.core.port.in.PolicyAliasCatalog;

/**
 * Use-case implementation for the policy alias catalog.
 */
@ApplicationScoped
public class PolicyAliasService implements PolicyAliasCatalog {

    private static final Logger LOG = Logger.getLogger(PolicyAliasService.class);

    private final AliasCache cache;
    private final AggregationEngine aggregation;

    @Inject
    public PolicyAliasService(AliasCache cache, AggregationEngine aggregation) {
        this.cache = cache;
        this.aggregation = aggregation;
    }

    @Override
    public Uni<List<PolicyAlias>> getPolicyAliases(boolean forceRefresh) {
        return cache.getAliases(forceRefresh);
    }

    @Override
    public Uni<AliasStatistics> getStatistics() {
        return aggregation.statistics();
    }

    @Override
    public Uni<List<PolicyAlias>> searchAliases(String query, String namespaceFilter) {
        return aggregation.search(query, namespaceFilter);
    }

    @Override
    public Uni<List<NamespaceCount>> getNamespacesWithCounts() {
        return aggregation.namespacesWithCounts();
    }

    @Override
    public Uni<List<String>> getNamespaces() {
        return aggregation.namespaces();
    }

    @Override
    public Uni<RefreshReport> refresh() {
        return Uni.createFrom().deferred(() -> {
            final long start = System.nanoTime();
            return cache.getAliases(true).map(aliases -> {
                var report = new RefreshReport(
                        aliases.size(),
                        aggregation.statisticsOf(aliases),
                        Duration.ofNanos(System.nanoTime() - start));
                LOG.infov("Cache refreshed: {0} aliases in {1}ms",
                        report.aliasesCount(), report.refreshTime().toMillis());
                return report;
            });
        });
    }
}
