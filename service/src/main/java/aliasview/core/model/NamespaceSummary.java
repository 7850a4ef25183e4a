package aliasview.core.model;

/**
 * Lightweight listing entry returned by the remote catalog, one per provider namespace.
 *
 * @param namespace the namespace name, may be null or blank for malformed entries
 */
public record NamespaceSummary(String namespace) {

    /**
     * Returns true if the entry carries a usable namespace name.
     */
    public boolean hasNamespace() {
        return namespace != null && !namespace.isBlank();
    }
}
