package aliasview.core.model;

import java.util.List;

/**
 * A resource type within a namespace and the aliases it declares.
 *
 * @param resourceType the resource type name
 * @param aliases      the declared aliases, never null
 */
public record ResourceTypeEntry(String resourceType, List<AliasEntry> aliases) {

    public ResourceTypeEntry {
        aliases = aliases != null ? List.copyOf(aliases) : List.of();
    }
}
