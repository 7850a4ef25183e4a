package aliasview.core.model;

import java.util.List;

/**
 * Full metadata for a single namespace, fetched on demand.
 *
 * @param namespace     the namespace name
 * @param resourceTypes the resource types declared by the namespace, never null
 */
public record NamespaceDetail(String namespace, List<ResourceTypeEntry> resourceTypes) {

    public NamespaceDetail {
        resourceTypes = resourceTypes != null ? List.copyOf(resourceTypes) : List.of();
    }
}
