/* (C)2026 */
package com.ammann.sleep.service;

import com.ammann.sleep.exception.ValidationException;
import com.ammann.sleep.model.EpochSample;
import com.ammann.sleep.model.NightSummary;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.jboss.logging.Logger;

/**
 * Service that narrows a batch of nights before analysis.
 *
 * <p>The date-range filter compares each night's end against whole UTC days. The nap filter
 * drops sleeps shorter than a threshold and is meant for the statistics input only.
 */
@ApplicationScoped
public class NightFilterService {

    private static final Logger LOG = Logger.getLogger(NightFilterService.class);

    /**
     * Keeps nights ending between the start of {@code from} and the end of {@code to} (UTC).
     *
     * @param from first day, null for no lower bound
     * @param to   last day, null for no upper bound
     * @return matching nights in input order; nights without a parsed end are dropped when a
     *     bound is given
     */
    public List<NightSummary> filterByDateRange(List<NightSummary> nights, LocalDate from, LocalDate to) {
        if (from == null && to == null) {
            return nights;
        }
        if (from != null && to != null && to.isBefore(from)) {
            throw ValidationException.invalidParameter("to", to, "a date on or after " + from);
        }
        Instant lower = from == null ? null : from.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant upperExclusive = to == null ? null : to.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();

        List<NightSummary> kept = nights.stream()
                .filter(n -> n.endUtc() != null)
                .filter(n -> lower == null || !n.endUtc().isBefore(lower))
                .filter(n -> upperExclusive == null || n.endUtc().isBefore(upperExclusive))
                .toList();
        LOG.debugf("Date range %s..%s kept %d of %d nights", from, to, kept.size(), nights.size());
        return kept;
    }

    /**
     * Keeps nights whose total sleep time is at least {@code minHours}. Nights without a total
     * sleep time are dropped.
     */
    public List<NightSummary> filterNaps(List<NightSummary> nights, double minHours) {
        if (minHours < 0 || Double.isNaN(minHours)) {
            throw ValidationException.invalidParameter("minHours", minHours, "a non-negative number");
        }
        double minSeconds = minHours * 3600.0;
        List<NightSummary> kept = nights.stream()
                .filter(n -> {
                    Double sleep = n.metric(NightSummary.TOTAL_SLEEP_TIME);
                    return sleep != null && sleep >= minSeconds;
                })
                .toList();
        LOG.debugf("Nap filter (%.2f h) kept %d of %d nights", minHours, kept.size(), nights.size());
        return kept;
    }

    /**
     * Keeps the samples that belong to one of the given nights.
     */
    public List<EpochSample> restrictSamples(List<EpochSample> samples, Collection<NightSummary> nights) {
        Set<String> ids = nights.stream().map(NightSummary::id).collect(Collectors.toSet());
        return samples.stream().filter(s -> ids.contains(s.nightId())).toList();
    }
}
