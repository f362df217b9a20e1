/* (C)2026 */
package com.ammann.sleep.properties;

import com.ammann.sleep.enumeration.MetricUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable table of the nightly summary fields: their order, display names and display units.
 *
 * <p>Durations are delivered in seconds and displayed in hours (stage durations, time in bed)
 * or minutes (latencies, wake time, snoring); sleep efficiency is a fraction displayed as a
 * percentage. Every other field is passed through unchanged. The same table drives the
 * normalizer (derived fields), the statistics engine (unit conversion) and the tabular export
 * (column order).
 */
public final class MetricCatalog {

    /** Opaque structured field; part of the export columns but never aggregated. */
    public static final String NIGHT_EVENTS = "night_events";

    /**
     * One summary field.
     *
     * @param field       vendor field name
     * @param displayName human readable name including the unit
     * @param unit        display unit the raw value converts to
     */
    public record MetricDefinition(String field, String displayName, MetricUnit unit) {}

    private static final MetricCatalog STANDARD = new MetricCatalog(List.of(
            new MetricDefinition("total_timeinbed", "Time in Bed (hours)", MetricUnit.HOURS),
            new MetricDefinition("total_sleep_time", "Total Sleep Time (hours)", MetricUnit.HOURS),
            new MetricDefinition("asleepduration", "Time Asleep (hours)", MetricUnit.HOURS),
            new MetricDefinition("lightsleepduration", "Light Sleep (hours)", MetricUnit.HOURS),
            new MetricDefinition("remsleepduration", "REM Sleep (hours)", MetricUnit.HOURS),
            new MetricDefinition("deepsleepduration", "Deep Sleep (hours)", MetricUnit.HOURS),
            new MetricDefinition("sleep_efficiency", "Sleep Efficiency (%)", MetricUnit.PERCENT),
            new MetricDefinition("sleep_latency", "Sleep Latency (minutes)", MetricUnit.MINUTES),
            new MetricDefinition("wakeup_latency", "Wake-up Latency (minutes)", MetricUnit.MINUTES),
            new MetricDefinition("wakeupduration", "Time Awake (minutes)", MetricUnit.MINUTES),
            new MetricDefinition("waso", "Wake After Sleep Onset (minutes)", MetricUnit.MINUTES),
            new MetricDefinition("nb_rem_episodes", "REM Episodes", MetricUnit.NONE),
            new MetricDefinition("apnea_hypopnea_index", "Apnea-Hypopnea Index (events/hour)", MetricUnit.NONE),
            new MetricDefinition("withings_index", "Sleep Quality Index", MetricUnit.NONE),
            new MetricDefinition("durationtosleep", "Time to Fall Asleep (minutes)", MetricUnit.MINUTES),
            new MetricDefinition("durationtowakeup", "Time to Get Up (minutes)", MetricUnit.MINUTES),
            new MetricDefinition("out_of_bed_count", "Out of Bed Count", MetricUnit.NONE),
            new MetricDefinition("hr_average", "Average Heart Rate (bpm)", MetricUnit.NONE),
            new MetricDefinition("hr_min", "Minimum Heart Rate (bpm)", MetricUnit.NONE),
            new MetricDefinition("hr_max", "Maximum Heart Rate (bpm)", MetricUnit.NONE),
            new MetricDefinition("rr_average", "Average Respiratory Rate (breaths/min)", MetricUnit.NONE),
            new MetricDefinition("rr_min", "Minimum Respiratory Rate (breaths/min)", MetricUnit.NONE),
            new MetricDefinition("rr_max", "Maximum Respiratory Rate (breaths/min)", MetricUnit.NONE),
            new MetricDefinition("snoring", "Snoring (minutes)", MetricUnit.MINUTES),
            new MetricDefinition("snoringepisodecount", "Snoring Episodes", MetricUnit.NONE),
            new MetricDefinition("sleep_score", "Sleep Score", MetricUnit.NONE),
            new MetricDefinition("mvt_score_avg", "Average Movement Score", MetricUnit.NONE),
            new MetricDefinition("mvt_active_duration", "Active Movement (minutes)", MetricUnit.MINUTES),
            new MetricDefinition("chest_movement_rate_average", "Average Chest Movement Rate", MetricUnit.NONE),
            new MetricDefinition("chest_movement_rate_min", "Minimum Chest Movement Rate", MetricUnit.NONE),
            new MetricDefinition("chest_movement_rate_max", "Maximum Chest Movement Rate", MetricUnit.NONE),
            new MetricDefinition("breathing_sounds", "Breathing Sounds", MetricUnit.NONE),
            new MetricDefinition("breathing_sounds_episode_count", "Breathing Sound Episodes", MetricUnit.NONE)));

    private final Map<String, MetricDefinition> definitions;
    private final List<String> numericFields;
    private final List<String> exportFields;
    private final Map<String, String> derivedFields;

    private MetricCatalog(List<MetricDefinition> entries) {
        Map<String, MetricDefinition> byField = new LinkedHashMap<>();
        Map<String, String> derived = new LinkedHashMap<>();
        for (MetricDefinition entry : entries) {
            byField.put(entry.field(), entry);
            if (entry.unit().isConverted()) {
                derived.put(entry.unit().derivedName(entry.field()), entry.field());
            }
        }
        List<String> export = new ArrayList<>(byField.keySet());
        export.add(NIGHT_EVENTS);

        this.definitions = Collections.unmodifiableMap(byField);
        this.numericFields = List.copyOf(byField.keySet());
        this.exportFields = List.copyOf(export);
        this.derivedFields = Collections.unmodifiableMap(derived);
    }

    /** The catalog of the vendor's nightly summary. */
    public static MetricCatalog standard() {
        return STANDARD;
    }

    /** Numeric summary fields in declaration order. */
    public List<String> numericFields() {
        return numericFields;
    }

    /** Numeric fields followed by {@link #NIGHT_EVENTS}; the metric columns of an export. */
    public List<String> exportFields() {
        return exportFields;
    }

    /** Derived field name to its source field, in declaration order. */
    public Map<String, String> derivedFields() {
        return derivedFields;
    }

    public boolean isNumeric(String field) {
        return definitions.containsKey(field);
    }

    public Optional<MetricDefinition> definition(String field) {
        return Optional.ofNullable(definitions.get(field));
    }

    public MetricUnit unitOf(String field) {
        MetricDefinition definition = definitions.get(field);
        return definition == null ? MetricUnit.NONE : definition.unit();
    }

    public String displayName(String field) {
        MetricDefinition definition = definitions.get(field);
        return definition == null ? field : definition.displayName();
    }
}
