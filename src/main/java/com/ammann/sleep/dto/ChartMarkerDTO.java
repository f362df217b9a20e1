/* (C)2026 */
package com.ammann.sleep.dto;

import java.time.Instant;

/**
 * Vertical marker on a per-night chart (night events and local midnight).
 */
public record ChartMarkerDTO(String name, Instant timestamp, String localTime) {}
