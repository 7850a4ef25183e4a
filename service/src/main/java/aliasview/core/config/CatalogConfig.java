package aliasview.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for catalog fetching, retry and caching.
 *
 * <p>Configuration prefix: {@code aliasview.catalog}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code ALIASVIEW_CATALOG_FETCH_MAX_WORKERS} - e.g., "25"</li>
 *   <li>{@code ALIASVIEW_CATALOG_RETRY_MAX_RETRIES} - e.g., "3"</li>
 *   <li>{@code ALIASVIEW_CATALOG_RETRY_BASE_DELAY} - e.g., "PT1S"</li>
 *   <li>{@code ALIASVIEW_CATALOG_CACHE_TTL} - e.g., "PT1H"</li>
 * </ul>
 */
@ConfigMapping(prefix = "aliasview.catalog")
public interface CatalogConfig {

    FetchConfig fetch();

    RetryConfig retry();

    CacheConfig cache();

    MetricsConfig metrics();

    /**
     * Fan-out settings.
     */
    interface FetchConfig {

        /**
         * Maximum concurrent namespace detail fetches.
         *
         * <p>The remote API enforces a request budget (about 200 requests per minute);
         * with several hundred namespaces an unbounded fan-out would exceed it.
         *
         * @return worker pool size (default: 25)
         */
        @WithDefault("25")
        int maxWorkers();

        /**
         * Number of completed namespaces between progress log lines.
         *
         * @return progress interval (default: 100)
         */
        @WithDefault("100")
        int progressInterval();
    }

    /**
     * Retry settings for the top-level fetch.
     */
    interface RetryConfig {

        /**
         * Maximum number of attempts, including the first.
         *
         * @return max attempts (default: 3)
         */
        @WithDefault("3")
        int maxRetries();

        /**
         * Base backoff delay. Attempt {@code n} (0-based) waits {@code baseDelay * 2^n}.
         *
         * @return base delay (default: 1 second)
         */
        @WithDefault("PT1S")
        Duration baseDelay();
    }

    /**
     * Alias cache settings.
     */
    interface CacheConfig {

        /**
         * Age after which cached aliases are refreshed on next access.
         *
         * @return cache TTL (default: 1 hour)
         */
        @WithDefault("PT1H")
        Duration ttl();

        /**
         * Populate the cache in the background when the application starts.
         *
         * @return true to warm the cache on startup (default: false)
         */
        @WithDefault("false")
        boolean warmOnStartup();
    }

    interface MetricsConfig {

        @WithDefault("true")
        boolean enabled();
    }
}
