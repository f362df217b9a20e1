/* (C)2026 */
package com.ammann.sleep.model;

import com.ammann.sleep.enumeration.EpochMetric;
import java.time.Instant;
import java.util.Map;

/**
 * One dense epoch row of a night. Metrics without a value at this timestamp are null.
 *
 * @param nightId           id of the owning {@link NightSummary}
 * @param timestamp         UTC instant of the epoch
 * @param state             sleep state code (0 awake, 1 light, 2 deep, 3 REM)
 * @param hr                heart rate in bpm
 * @param rr                respiratory rate in breaths per minute
 * @param snoring           snoring intensity
 * @param sdnn              heart rate variability SDNN in ms
 * @param rmssd             heart rate variability RMSSD in ms
 * @param movementScore     movement score
 * @param chestMovementRate chest movement rate
 * @param vendorIndex       vendor sleep-quality index
 * @param breathingSounds   breathing sound intensity
 */
public record EpochSample(
        String nightId,
        Instant timestamp,
        int state,
        Double hr,
        Double rr,
        Double snoring,
        Double sdnn,
        Double rmssd,
        Double movementScore,
        Double chestMovementRate,
        Double vendorIndex,
        Double breathingSounds
) {

    /**
     * Builds a sample from a metric lookup; absent metrics become null.
     */
    public static EpochSample of(String nightId, Instant timestamp, int state, Map<EpochMetric, Double> values) {
        return new EpochSample(
                nightId,
                timestamp,
                state,
                values.get(EpochMetric.HR),
                values.get(EpochMetric.RR),
                values.get(EpochMetric.SNORING),
                values.get(EpochMetric.SDNN),
                values.get(EpochMetric.RMSSD),
                values.get(EpochMetric.MOVEMENT_SCORE),
                values.get(EpochMetric.CHEST_MOVEMENT_RATE),
                values.get(EpochMetric.VENDOR_INDEX),
                values.get(EpochMetric.BREATHING_SOUNDS));
    }

    public Double value(EpochMetric metric) {
        return switch (metric) {
            case HR -> hr;
            case RR -> rr;
            case SNORING -> snoring;
            case SDNN -> sdnn;
            case RMSSD -> rmssd;
            case MOVEMENT_SCORE -> movementScore;
            case CHEST_MOVEMENT_RATE -> chestMovementRate;
            case VENDOR_INDEX -> vendorIndex;
            case BREATHING_SOUNDS -> breathingSounds;
        };
    }
}
