/* (C)2026 */
package com.ammann.sleep.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Average clock times of the nightly routine, split into weekdays and weekends.
 */
public record SleepRitualDTO(Partition weekday, Partition weekend) {

    /**
     * Average routine of one day category. Times are null when the category has no nights.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Partition(
            int nights,
            ClockTime bedtime,
            ClockTime fallAsleep,
            ClockTime wakeUp,
            ClockTime getUp) {}

    /**
     * Local clock time.
     *
     * @param minuteOfDay minutes after local midnight, in [0, 1440)
     * @param display     {@code HH:mm}
     */
    public record ClockTime(int minuteOfDay, String display) {

        public static ClockTime ofMinuteOfDay(int minuteOfDay) {
            int normalized = Math.floorMod(minuteOfDay, 1440);
            return new ClockTime(
                    normalized, String.format("%02d:%02d", normalized / 60, normalized % 60));
        }
    }
}
