package aliasview.adapter.in.lifecycle;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import aliasview.core.config.CatalogConfig;
import aliasview.core.port.in.PolicyAliasCatalog;

/**
 * Populates the alias cache in the background when the application starts.
 *
 * <p>Enabled by {@code aliasview.catalog.cache.warm-on-startup}. Startup does not wait for
 * the fetch, and a failed warm-up only logs; the next query fetches again.
 */
@ApplicationScoped
public class CatalogWarmup {

    private static final Logger LOG = Logger.getLogger(CatalogWarmup.class);

    private final PolicyAliasCatalog catalog;
    private final CatalogConfig config;

    @Inject
    public CatalogWarmup(PolicyAliasCatalog catalog, CatalogConfig config) {
        this.catalog = catalog;
        this.config = config;
    }

    void onStart(@Observes StartupEvent event) {
        warm();
    }

    /**
     * Trigger a background fetch if warm-up is enabled.
     *
     * @return true if a warm-up fetch was started
     */
    boolean warm() {
        if (!config.cache().warmOnStartup()) {
            LOG.debug("Alias cache warm-up is disabled");
            return false;
        }

        LOG.info("Warming alias cache");
        catalog.getPolicyAliases(false)
                .subscribe()
                .with(
                        aliases -> LOG.infov("Alias cache warmed with {0} aliases", aliases.size()),
                        error -> LOG.warnv("Alias cache warm-up failed: {0}", error.getMessage()));
        return true;
    }
}
