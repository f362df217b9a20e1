/* (C)2026 */
package com.ammann.sleep.enumeration;


/**
 * Per-epoch metrics in the fixed order used to pick the reference field of a segment.
 *
 * <p>The first metric (in declaration order) whose series is non-empty defines the timestamps
 * emitted for the segment. {@link #sourceKey} is the key of the vendor epoch payload,
 * {@link #exportColumn} the column of the epoch CSV.
 */
public enum EpochMetric {
    HR("hr", "hr", "Heart Rate (bpm)", true),
    RR("rr", "rr", "Respiratory Rate (breaths/min)", true),
    SNORING("snoring", "snoring", "Snoring", true),
    SDNN("sdnn_1", "sdnn", "HRV SDNN (ms)", true),
    RMSSD("rmssd", "rmssd", "HRV RMSSD (ms)", true),
    MOVEMENT_SCORE("mvt_score", "movement_score", "Movement Score", true),
    CHEST_MOVEMENT_RATE("chest_movement_rate", "chest_movement_rate", "Chest Movement Rate", true),
    VENDOR_INDEX("withings_index", "vendor_index", "Sleep Quality Index", false),
    BREATHING_SOUNDS("breathing_sounds", "breathing_sounds", "Breathing Sounds", true);

    private final String sourceKey;
    private final String exportColumn;
    private final String label;
    private final boolean charted;

    EpochMetric(String sourceKey, String exportColumn, String label, boolean charted) {
        this.sourceKey = sourceKey;
        this.exportColumn = exportColumn;
        this.label = label;
        this.charted = charted;
    }

    public String getSourceKey() {
        return sourceKey;
    }

    public String getExportColumn() {
        return exportColumn;
    }

    public String getLabel() {
        return label;
    }

    /** Whether a line chart is drawn for this metric. */
    public boolean isCharted() {
        return charted;
    }
}
