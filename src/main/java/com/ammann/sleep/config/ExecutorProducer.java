/* (C)2026 */
package com.ammann.sleep.config;

import com.ammann.sleep.properties.ReportProperties;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for creating named ManagedExecutor instances.
 *
 * <p>Provides the "night-analysis-executor" bean used by the report pipeline to fan out
 * per-night work (wake-episode detection) when {@code sleep.report.parallel-nights} is enabled.
 */
@ApplicationScoped
public class ExecutorProducer {

    static final int NIGHT_EXECUTOR_MAX_ASYNC = 4;

    /**
     * Produces a named ManagedExecutor for per-night analysis tasks.
     *
     * <p>The queue is unbounded: a batch submits one task per night and waits for all of them.
     *
     * @return Configured ManagedExecutor instance
     */
    @Produces
    @Named(ReportProperties.NIGHT_EXECUTOR)
    @ApplicationScoped
    public ManagedExecutor createNightAnalysisExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(NIGHT_EXECUTOR_MAX_ASYNC)
                .maxQueued(-1)
                .propagated(ThreadContext.ALL_REMAINING)
                .build();
    }
}
