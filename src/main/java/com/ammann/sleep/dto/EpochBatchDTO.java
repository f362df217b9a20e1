/* (C)2026 */
package com.ammann.sleep.dto;

import com.ammann.sleep.model.EpochSample;
import java.util.List;

/**
 * Dense epoch samples produced by flattening or by importing an epoch export.
 *
 * @param samples  samples grouped by night in input order, ascending within each segment
 * @param warnings skipped segments, keys or rows
 */
public record EpochBatchDTO(List<EpochSample> samples, List<ProcessingWarningDTO> warnings) {

    public EpochBatchDTO {
        samples = List.copyOf(samples);
        warnings = List.copyOf(warnings);
    }

    public static EpochBatchDTO empty() {
        return new EpochBatchDTO(List.of(), List.of());
    }
}
