/* (C)2026 */
package com.ammann.sleep.model;

import com.ammann.sleep.enumeration.EpochMetric;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One segment of a vendor epoch series: a single sleep state and, per metric, a sparse map from
 * epoch-seconds key to value.
 *
 * @param state  state code, null when the vendor omitted it
 * @param series per-metric series; metrics without data are absent or empty
 */
public record EpochSegment(Integer state, Map<EpochMetric, Map<String, Double>> series)
{
    public EpochSegment {
        Map<EpochMetric, Map<String, Double>> copy = new EnumMap<>(EpochMetric.class);
        if (series != null) {
            series.forEach((metric, values) -> copy.put(metric,
                    values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values))));
        }
        series = Collections.unmodifiableMap(copy);
    }

    public Map<String, Double> seriesOf(EpochMetric metric) {
        return series.getOrDefault(metric, Map.of());
    }
}
