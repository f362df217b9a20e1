/* (C)2026 */
package com.ammann.sleep.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.LocalDate;

/**
 * Headline figures of a report.
 *
 * @param firstNight         UTC date of the earliest night start, null without valid nights
 * @param lastNight          UTC date of the latest night end, null without valid nights
 * @param nightCount         number of nights
 * @param averageSleepHours  mean total sleep time
 * @param efficiency         sleep efficiency in percent
 * @param apneaHypopneaIndex AHI in events per hour
 * @param snoringMinutes     snoring time in minutes
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReportOverviewDTO(
        LocalDate firstNight,
        LocalDate lastNight,
        int nightCount,
        double averageSleepHours,
        MeanStd efficiency,
        MeanStd apneaHypopneaIndex,
        MeanStd snoringMinutes
) {
    /** Mean with population standard deviation. */
    public record MeanStd(double mean, double std) {}
}
