/* (C)2026 */
package com.ammann.sleep.config;

import com.ammann.sleep.properties.MetricCatalog;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

/**
 * Exposes the immutable {@link MetricCatalog} as a CDI bean so that every stage shares one table.
 */
@ApplicationScoped
public class MetricCatalogProducer {

    @Produces
    @Singleton
    public MetricCatalog metricCatalog() {
        return MetricCatalog.standard();
    }
}
