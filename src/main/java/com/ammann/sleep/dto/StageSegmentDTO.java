/* (C)2026 */
package com.ammann.sleep.dto;

/**
 * A run of equal sleep stage on the hypnogram of one night.
 *
 * @param stage     stage display name
 * @param state     stage code
 * @param start     local display time of the first epoch of the run
 * @param end       local display time where the next run starts, or of the last epoch
 * @param epochs    number of epochs in the run
 */
public record StageSegmentDTO(String stage, int state, String start, String end, int epochs) {}
