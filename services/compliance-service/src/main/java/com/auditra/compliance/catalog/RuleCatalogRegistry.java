package com.auditra.compliance.catalog;

import com.auditra.compliance.config.ComplianceProperties;
import com.auditra.compliance.exception.CatalogException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the active rule catalog.
 *
 * Readers take a snapshot with {@link #current()} once per run. A reload builds a
 * complete new catalog and swaps the reference, so an in-flight run keeps
 * evaluating against the catalog it started with.
 */
@Slf4j
@Component
public class RuleCatalogRegistry {

    private final RuleCatalogLoader loader;
    private final String location;
    private final AtomicReference<RuleCatalog> active = new AtomicReference<>();
    private final Object reloadLock = new Object();

    public RuleCatalogRegistry(RuleCatalogLoader loader, ComplianceProperties properties) {
        this.loader = loader;
        this.location = properties.getCatalog().getLocation();
    }

    /**
     * Initial load. A {@link CatalogException} here aborts application startup.
     */
    @PostConstruct
    public void initialize() {
        active.set(loader.load(location));
    }

    public RuleCatalog current() {
        RuleCatalog catalog = active.get();
        if (catalog == null) {
            throw new CatalogException("Rule catalog has not been loaded");
        }
        return catalog;
    }

    /**
     * Rebuild the catalog from its source and swap it in. On failure the previous
     * catalog stays active and the exception propagates to the caller.
     */
    public RuleCatalog reload() {
        synchronized (reloadLock) {
            RuleCatalog previous = active.get();
            RuleCatalog next;
            try {
                next = loader.load(location);
            } catch (CatalogException e) {
                log.error("Rule catalog reload from {} failed, keeping version {}: {}",
                    location, previous != null ? previous.version() : "none", e.getMessage());
                throw e;
            }
            active.set(next);
            log.info("Rule catalog swapped: {} -> {}", previous != null ? previous.version() : "none", next.version());
            return next;
        }
    }
}
