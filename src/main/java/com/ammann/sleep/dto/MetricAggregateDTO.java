/* (C)2026 */
package com.ammann.sleep.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Population statistics of one metric over a set of nights, in display units.
 *
 * <p>For an empty set the mean and standard deviation are 0 and min/max are absent.
 *
 * @param field       catalog field name
 * @param displayName human readable name
 * @param unit        display unit symbol, empty for pass-through values
 * @param count       number of numeric values
 * @param mean        arithmetic mean
 * @param std         population standard deviation (divided by N)
 * @param min         smallest value, null when empty
 * @param max         largest value, null when empty
 * @param severity    classification of the mean for AHI and snoring, null otherwise
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MetricAggregateDTO(
        String field,
        String displayName,
        String unit,
        long count,
        double mean,
        double std,
        Double min,
        Double max,
        String severity
) {
    public boolean isEmpty() {
        return count == 0;
    }
}
