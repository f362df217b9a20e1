/* (C)2026 */
package com.ammann.sleep.dto;

import com.ammann.sleep.enumeration.InputShape;
import com.ammann.sleep.model.NightSummary;
import java.util.List;

/**
 * Output of the summary normalizer for one batch.
 *
 * @param shape    detected input shape
 * @param nights   one summary per input row, in input order
 * @param warnings row-level problems
 */
public record NormalizationResultDTO(
        InputShape shape, List<NightSummary> nights, List<ProcessingWarningDTO> warnings) {

    public NormalizationResultDTO {
        nights = List.copyOf(nights);
        warnings = List.copyOf(warnings);
    }
}
