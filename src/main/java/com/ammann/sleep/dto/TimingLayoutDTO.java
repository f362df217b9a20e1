/* (C)2026 */
package com.ammann.sleep.dto;

import java.util.List;

/**
 * Chart-ready layout of all valid nights on the minutes-from-noon axis.
 *
 * @param records    one record per valid night, ordered by night end
 * @param tickValues hourly tick positions covering the plotted range
 * @param tickLabels 12-hour clock label per tick ({@code 12PM}, {@code 1PM}, ...)
 */
public record TimingLayoutDTO(
        List<TimingRecordDTO> records, List<Integer> tickValues, List<String> tickLabels) {

    public TimingLayoutDTO {
        records = List.copyOf(records);
        tickValues = List.copyOf(tickValues);
        tickLabels = List.copyOf(tickLabels);
    }

    public static TimingLayoutDTO empty() {
        return new TimingLayoutDTO(List.of(), List.of(), List.of());
    }
}
