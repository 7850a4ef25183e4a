package aliasview.core.service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import aliasview.core.config.CatalogConfig;
import aliasview.core.model.AliasEntry;
import aliasview.core.model.AliasPattern;
import aliasview.core.model.CatalogErrorKind;
import aliasview.core.model.CatalogException;
import aliasview.core.model.FetchOutcome;
import aliasview.core.model.NamespaceDetail;
import aliasview.core.model.NamespaceSummary;
import aliasview.core.model.PolicyAlias;
import aliasview.core.model.ResourceTypeEntry;
import aliasview.core.port.out.RemoteCatalogClient;

/**
 * Fetches aliases for every namespace in the remote catalog using a bounded worker pool.
 *
 * <p>Threading model:
 * <ul>
 *   <li>Workers run one blocking {@code getNamespaceDetail} call each and never share state</li>
 *   <li>Results flow through an {@link ExecutorCompletionService} to the calling thread,
 *       which is the only writer of the accumulated aliases and failures</li>
 *   <li>The calling thread blocks until every namespace has completed</li>
 * </ul>
 *
 * <p>A failure fetching one namespace is logged and recorded in
 * {@link FetchOutcome#failedNamespaces()}; it never aborts the fan-out. Only a failure to
 * list namespaces fails {@link #fetchAll()}.
 */
@ApplicationScoped
public class ParallelNamespaceFetcher implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(ParallelNamespaceFetcher.class);
    private static final int FAILURE_SUMMARY_LIMIT = 5;

    private final RemoteCatalogClient client;
    private final int progressInterval;
    private final ExecutorService workers;

    @Inject
    public ParallelNamespaceFetcher(RemoteCatalogClient client, CatalogConfig config) {
        this(client, config.fetch().maxWorkers(), config.fetch().progressInterval());
    }

    public ParallelNamespaceFetcher(RemoteCatalogClient client, int maxWorkers, int progressInterval) {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be at least 1, got: " + maxWorkers);
        }
        if (progressInterval < 1) {
            throw new IllegalArgumentException("progressInterval must be at least 1, got: " + progressInterval);
        }
        this.client = client;
        this.progressInterval = progressInterval;
        this.workers = Executors.newFixedThreadPool(maxWorkers, new FetchThreadFactory());
    }

    /**
     * Fetch and flatten the aliases of every listed namespace.
     *
     * @return the aggregated outcome, including namespaces that failed
     * @throws CatalogException with kind {@code AUTH} or {@code LIST_FAILED} if namespaces cannot be listed
     */
    public FetchOutcome fetchAll() {
        final long start = System.nanoTime();
        final var listing = listNamespaces();
        LOG.infov("Fetched {0} namespaces in {1}ms", listing.size(), elapsedSince(start).toMillis());

        CompletionService<NamespaceResult> completion = new ExecutorCompletionService<>(workers);
        int submitted = 0;
        for (NamespaceSummary summary : listing) {
            if (summary == null || !summary.hasNamespace()) {
                continue;
            }
            final var namespace = summary.namespace();
            completion.submit(() -> fetchNamespace(namespace));
            submitted++;
        }

        List<PolicyAlias> aliases = new ArrayList<>();
        List<String> failedNamespaces = new ArrayList<>();
        int namespacesWithAliases = 0;

        for (int completed = 1; completed <= submitted; completed++) {
            var result = awaitNext(completion);
            if (result.failed()) {
                failedNamespaces.add(result.namespace());
            } else if (!result.aliases().isEmpty()) {
                namespacesWithAliases++;
                aliases.addAll(result.aliases());
            }

            if (completed % progressInterval == 0) {
                LOG.infov(
                        "Progress: {0}/{1} namespaces, {2} aliases found ({3}ms)",
                        completed, listing.size(), aliases.size(), elapsedSince(start).toMillis());
            }
        }

        var elapsed = elapsedSince(start);
        LOG.infov("Namespaces with aliases: {0}", namespacesWithAliases);
        if (!failedNamespaces.isEmpty()) {
            LOG.warnv("Failed to fetch {0} namespaces: {1}", failedNamespaces.size(), summarize(failedNamespaces));
        }
        LOG.infov(
                "Successfully processed {0} policy aliases from {1} namespaces in {2}ms",
                aliases.size(), listing.size(), elapsed.toMillis());

        return new FetchOutcome(aliases, failedNamespaces, listing.size(), namespacesWithAliases, elapsed);
    }

    @PreDestroy
    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Flatten a namespace's resource types into aliases, copying optional fields null-safely.
     * Resource types or aliases without a name are skipped.
     */
    static List<PolicyAlias> flatten(String namespace, NamespaceDetail detail) {
        if (detail == null) {
            return List.of();
        }
        List<PolicyAlias> aliases = new ArrayList<>();
        for (ResourceTypeEntry resourceType : detail.resourceTypes()) {
            if (resourceType.resourceType() == null) {
                LOG.debugv("Skipping unnamed resource type in {0}", namespace);
                continue;
            }
            for (AliasEntry alias : resourceType.aliases()) {
                if (alias.name() == null) {
                    LOG.debugv("Skipping unnamed alias in {0}/{1}", namespace, resourceType.resourceType());
                    continue;
                }
                aliases.add(new PolicyAlias(
                        namespace,
                        resourceType.resourceType(),
                        alias.name(),
                        alias.defaultPath(),
                        AliasPattern.copyOf(alias.defaultPattern()),
                        alias.type()));
            }
        }
        return aliases;
    }

    private List<NamespaceSummary> listNamespaces() {
        try {
            var listing = client.listNamespaces();
            return listing != null ? listing : List.of();
        } catch (CatalogException e) {
            if (e.kind() == CatalogErrorKind.AUTH) {
                throw e;
            }
            throw listFailed(e);
        } catch (RuntimeException e) {
            throw listFailed(e);
        }
    }

    private NamespaceResult fetchNamespace(String namespace) {
        try {
            var detail = client.getNamespaceDetail(namespace, RemoteCatalogClient.EXPAND_ALIASES);
            return NamespaceResult.success(namespace, flatten(namespace, detail));
        } catch (RuntimeException e) {
            LOG.warnv("Failed to fetch aliases for {0}: {1}", namespace, e.getMessage());
            return NamespaceResult.failure(namespace);
        }
    }

    private static NamespaceResult awaitNext(CompletionService<NamespaceResult> completion) {
        try {
            return completion.take().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CatalogException(CatalogErrorKind.OTHER, "Interrupted while fetching namespaces", e);
        } catch (ExecutionException e) {
            throw new CatalogException(CatalogErrorKind.OTHER, "Namespace worker failed", e.getCause());
        }
    }

    private static CatalogException listFailed(RuntimeException cause) {
        return new CatalogException(
                CatalogErrorKind.LIST_FAILED, "Failed to list namespaces: " + cause.getMessage(), cause);
    }

    private static String summarize(List<String> namespaces) {
        var shown = String.join(", ", namespaces.subList(0, Math.min(FAILURE_SUMMARY_LIMIT, namespaces.size())));
        return namespaces.size() > FAILURE_SUMMARY_LIMIT ? shown + "..." : shown;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private record NamespaceResult(String namespace, List<PolicyAlias> aliases, boolean failed) {

        static NamespaceResult success(String namespace, List<PolicyAlias> aliases) {
            return new NamespaceResult(namespace, aliases, false);
        }

        static NamespaceResult failure(String namespace) {
            return new NamespaceResult(namespace, List.of(), true);
        }
    }

    private static final class FetchThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            var thread = new Thread(task, "alias-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
