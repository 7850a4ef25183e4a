package aliasview.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A single policy alias, the unit of the catalog.
 *
 * <p>{@code namespace}, {@code resourceType} and {@code aliasName} are always present;
 * every other component may be null. No uniqueness is implied: the catalog is a flat
 * ordered sequence and may legitimately contain duplicates.
 */
public record PolicyAlias(
        String namespace,
        String resourceType,
        String aliasName,
        String defaultPath,
        AliasPattern defaultPattern,
        String type) {

    public PolicyAlias {
        Objects.requireNonNull(namespace, "namespace cannot be null");
        Objects.requireNonNull(resourceType, "resourceType cannot be null");
        Objects.requireNonNull(aliasName, "aliasName cannot be null");
    }

    /**
     * Lowercase text matched by free-text search: namespace, resource type,
     * alias name and default path joined by spaces.
     */
    public String searchableText() {
        return String.join(" ", namespace, resourceType, aliasName, defaultPath != null ? defaultPath : "")
                .toLowerCase(Locale.ROOT);
    }
}
