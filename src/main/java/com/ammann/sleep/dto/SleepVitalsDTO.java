/* (C)2026 */
package com.ammann.sleep.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Breathing and heart figures of a report. Values are null when no night carries the metric.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SleepVitalsDTO(
        Double ahiMin,
        Double ahiAverage,
        Double ahiMax,
        String osaSeverity,
        Double snoringAverageMinutes,
        Double snoringPercentOfNight,
        String snoringSeverity,
        Double hrAverage,
        Double hrMin,
        Double hrMax
) {}
