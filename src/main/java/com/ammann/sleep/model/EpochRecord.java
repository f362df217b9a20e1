/* (C)2026 */
package com.ammann.sleep.model;

import java.util.List;

/**
 * Epoch payload of one night as delivered by the vendor.
 *
 * @param nightId id of the night the segments belong to
 * @param series  segments in delivery order
 */
public record EpochRecord(String nightId, List<EpochSegment> series)
{
    public EpochRecord {
        series = series == null ? List.of() : List.copyOf(series);
    }
}
