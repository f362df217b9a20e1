/* (C)2026 */
package com.ammann.sleep.dto;

/**
 * Position of a wake episode on the minutes-from-noon axis of its night.
 *
 * @param startMinutes    offset of the episode start, aligned with the night's base
 * @param durationMinutes episode length on the axis
 * @param durationSeconds episode length in seconds
 */
public record WakeOverlayDTO(double startMinutes, double durationMinutes, long durationSeconds) {}
