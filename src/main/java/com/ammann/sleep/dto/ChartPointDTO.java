/* (C)2026 */
package com.ammann.sleep.dto;

import java.time.Instant;

/**
 * One point of a per-night line chart.
 *
 * @param timestamp UTC instant
 * @param localTime local display time {@code yyyy-MM-dd HH:mm:ss}
 * @param value     metric value
 */
public record ChartPointDTO(Instant timestamp, String localTime, double value) {}
