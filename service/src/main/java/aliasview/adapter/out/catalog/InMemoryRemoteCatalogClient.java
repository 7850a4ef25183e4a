package aliasview.adapter.out.catalog;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.quarkus.arc.DefaultBean;
import org.jboss.logging.Logger;

import aliasview.core.model.CatalogErrorKind;
import aliasview.core.model.CatalogException;
import aliasview.core.model.NamespaceDetail;
import aliasview.core.model.NamespaceSummary;
import aliasview.core.model.ResourceTypeEntry;
import aliasview.core.port.out.RemoteCatalogClient;

/**
 * In-memory implementation of {@link RemoteCatalogClient}.
 *
 * <p>Suitable for development and testing. Used unless another {@code RemoteCatalogClient}
 * bean is provided. Namespaces are listed in alphabetical order.
 */
@ApplicationScoped
@DefaultBean
public class InMemoryRemoteCatalogClient implements RemoteCatalogClient {

    private static final Logger LOG = Logger.getLogger(InMemoryRemoteCatalogClient.class);

    private final Map<String, NamespaceDetail> namespaces = new ConcurrentSkipListMap<>();

    public InMemoryRemoteCatalogClient() {}

    public InMemoryRemoteCatalogClient(List<NamespaceDetail> details) {
        details.forEach(this::register);
    }

    /**
     * Register or replace a namespace.
     *
     * @param detail the namespace detail to serve
     */
    public void register(NamespaceDetail detail) {
        namespaces.put(detail.namespace(), detail);
        LOG.debugv("Registered namespace {0} ({1} resource types)", detail.namespace(), detail.resourceTypes().size());
    }

    public void remove(String namespace) {
        namespaces.remove(namespace);
    }

    public void clear() {
        namespaces.clear();
    }

    @Override
    public List<NamespaceSummary> listNamespaces() {
        return namespaces.keySet().stream().map(NamespaceSummary::new).toList();
    }

    @Override
    public NamespaceDetail getNamespaceDetail(String namespace, String expand) {
        var detail = namespaces.get(namespace);
        if (detail == null) {
            throw new CatalogException(CatalogErrorKind.OTHER, "Namespace not found: " + namespace);
        }
        if (EXPAND_ALIASES.equals(expand)) {
            return detail;
        }
        // Without the alias expansion only resource type names are returned
        var withoutAliases = detail.resourceTypes().stream()
                .map(resourceType -> new ResourceTypeEntry(resourceType.resourceType(), List.of()))
                .toList();
        return new NamespaceDetail(detail.namespace(), withoutAliases);
    }
}
