package aliasview.core.model;

import java.time.Duration;
import java.util.List;

/**
 * Result of one fan-out fetch attempt across all namespaces.
 *
 * <p>A non-empty {@code failedNamespaces} list does not make the outcome a failure;
 * partial data is acceptable.
 *
 * @param aliases               flattened aliases in completion order
 * @param failedNamespaces      namespaces whose detail fetch failed
 * @param namespacesScanned     size of the namespace listing
 * @param namespacesWithAliases namespaces that contributed at least one alias
 * @param elapsed               wall-clock duration of the fetch
 */
public record FetchOutcome(
        List<PolicyAlias> aliases,
        List<String> failedNamespaces,
        int namespacesScanned,
        int namespacesWithAliases,
        Duration elapsed) {

    public FetchOutcome {
        aliases = aliases != null ? List.copyOf(aliases) : List.of();
        failedNamespaces = failedNamespaces != null ? List.copyOf(failedNamespaces) : List.of();
        if (elapsed == null) {
            elapsed = Duration.ZERO;
        }
    }

    public boolean hasFailures() {
        return !failedNamespaces.isEmpty();
    }
}
