/* (C)2026 */
package com.ammann.sleep.dto;

/**
 * Weekday versus weekend averages of the sleep schedule.
 */
public record RegularitySummaryDTO(Partition weekday, Partition weekend) {

    /**
     * Averages of one day category.
     *
     * @param nights            number of nights in the category
     * @param durationHours     mean total sleep time
     * @param latencyMinutes    mean sleep latency
     * @param timeInBedHours    mean time in bed
     * @param efficiencyPercent mean sleep efficiency
     */
    public record Partition(
            int nights,
            double durationHours,
            double latencyMinutes,
            double timeInBedHours,
            double efficiencyPercent) {}
}
