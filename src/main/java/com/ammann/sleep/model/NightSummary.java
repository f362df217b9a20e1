/* (C)2026 */
package com.ammann.sleep.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One night of the canonical summary model, independent of the shape it was read from.
 *
 * <p>{@code metrics} holds every numeric catalog field in catalog order; a value is null when
 * the source was missing or not a number. Durations are raw seconds and sleep efficiency is a
 * fraction. {@code derived} holds the hour, minute and percent equivalents computed once at
 * normalization time. A night whose start or end could not be parsed, or whose start lies
 * after its end, keeps null markers and reports {@link #hasValidInterval()} false.
 *
 * @param id          vendor night identifier, never blank
 * @param timezone    IANA zone name as delivered, may be null or invalid
 * @param startUtc    night start, null when unparseable
 * @param endUtc      night end, null when unparseable
 * @param label       subject or lab label used for report titles
 * @param metrics     raw numeric metrics keyed by catalog field
 * @param derived     converted metrics keyed by derived field name
 * @param nightEvents structured night events (event code to second offsets), may be null
 */
public record NightSummary(
        String id,
        String timezone,
        Instant startUtc,
        Instant endUtc,
        String label,
        Map<String, Double> metrics,
        Map<String, Double> derived,
        JsonNode nightEvents
) {

    public static final String TOTAL_TIME_IN_BED = "total_timeinbed";
    public static final String TOTAL_SLEEP_TIME = "total_sleep_time";
    public static final String SLEEP_EFFICIENCY = "sleep_efficiency";
    public static final String SLEEP_LATENCY = "sleep_latency";
    public static final String APNEA_HYPOPNEA_INDEX = "apnea_hypopnea_index";
    public static final String SNORING = "snoring";
    public static final String OUT_OF_BED_COUNT = "out_of_bed_count";
    public static final String HR_AVERAGE = "hr_average";
    public static final String HR_MIN = "hr_min";
    public static final String HR_MAX = "hr_max";
    public static final String DURATION_TO_SLEEP = "durationtosleep";
    public static final String DURATION_TO_WAKE_UP = "durationtowakeup";

    public NightSummary {
        metrics = metrics == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        derived = derived == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(derived));
    }

    /** Both endpoints parsed and the start does not lie after the end. */
    @JsonIgnore
    public boolean hasValidInterval() {
        return startUtc != null && endUtc != null && !startUtc.isAfter(endUtc);
    }

    public Double metric(String field) {
        return metrics.get(field);
    }

    public Double derivedValue(String name) {
        return derived.get(name);
    }

    @JsonIgnore
    public Double totalTimeInBedHours() {
        return derived.get(TOTAL_TIME_IN_BED + "_hours");
    }

    @JsonIgnore
    public Double totalSleepTimeHours() {
        return derived.get(TOTAL_SLEEP_TIME + "_hours");
    }

    @JsonIgnore
    public Double sleepEfficiencyPercent() {
        return derived.get(SLEEP_EFFICIENCY + "_percent");
    }

    @JsonIgnore
    public Double sleepLatencyMinutes() {
        return derived.get(SLEEP_LATENCY + "_minutes");
    }

    @JsonIgnore
    public Double snoringMinutes() {
        return derived.get(SNORING + "_minutes");
    }

    @JsonIgnore
    public Double apneaHypopneaIndex() {
        return metrics.get(APNEA_HYPOPNEA_INDEX);
    }
}
