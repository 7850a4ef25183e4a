package aliasview.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable view of the alias cache: the most recent successful fetch and when it completed.
 *
 * <p>Replaced wholesale on every successful refresh, never merged.
 */
public record CacheSnapshot(List<PolicyAlias> aliases, Instant fetchedAt, FetchOutcome outcome) {

    public CacheSnapshot {
        aliases = aliases != null ? List.copyOf(aliases) : List.of();
        Objects.requireNonNull(fetchedAt, "fetchedAt cannot be null");
    }

    public static CacheSnapshot of(FetchOutcome outcome, Instant fetchedAt) {
        return new CacheSnapshot(outcome.aliases(), fetchedAt, outcome);
    }

    /**
     * Age of the snapshot relative to the given instant.
     */
    public Duration age(Instant now) {
        return Duration.between(fetchedAt, now);
    }

    /**
     * A snapshot is valid while it is younger than the TTL.
     */
    public boolean isValid(Instant now, Duration ttl) {
        return age(now).compareTo(ttl) < 0;
    }
}
