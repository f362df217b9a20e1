/* (C)2026 */
package com.ammann.sleep.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * One bar of the sleep-timing chart. Offsets are minutes from local noon.
 *
 * @param nightId                id of the night
 * @param label                  category label (local end date)
 * @param baseMinutes            start of the night on the axis, in [0, 1440)
 * @param durationMinutes        length of the night bar
 * @param latencyMinutes         sleep latency drawn from the base, null when unknown
 * @param wakeOverlays           extended wake episodes of the night
 * @param outOfBedCount          times out of bed
 * @param apneaHypopneaIndex     rounded AHI
 * @param snoringMinutes         snoring time in minutes
 * @param hrAverage              average heart rate
 * @param sleepEfficiencyPercent sleep efficiency in percent
 * @param timeInBedHours         time in bed in hours
 * @param timeAsleepHours        total sleep time in hours
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TimingRecordDTO(
        String nightId,
        String label,
        double baseMinutes,
        double durationMinutes,
        Double latencyMinutes,
        List<WakeOverlayDTO> wakeOverlays,
        Integer outOfBedCount,
        Long apneaHypopneaIndex,
        Double snoringMinutes,
        Double hrAverage,
        Double sleepEfficiencyPercent,
        Double timeInBedHours,
        Double timeAsleepHours
) {

    /** End of the night bar on the axis. */
    public double endMinutes() {
        return baseMinutes + durationMinutes;
    }
}
