/* (C)2026 */
package com.ammann.sleep.service.normalizer;

import com.ammann.sleep.dto.ProcessingWarningDTO;
import com.ammann.sleep.enumeration.InputShape;
import com.ammann.sleep.model.NightSummary;
import java.util.List;
import java.util.Map;

/**
 * Converts one raw summary row of a known {@link InputShape} into a {@link NightSummary}.
 *
 * <p>Implementations never throw for malformed cells; they record a warning and fall back to a
 * null marker. Only a row without an identifying id aborts the batch.
 */
public interface SummaryRowNormalizer {

    InputShape shape();

    /**
     * @param row           raw row as read from the source
     * @param rowIndex      zero-based position of the row in the batch
     * @param fallbackLabel label used when the row has no {@code lab_id}
     * @param warnings      sink for row-level problems
     * @return the canonical night
     * @throws com.ammann.sleep.exception.ValidationException if the row has no id
     */
    NightSummary normalize(
            Map<String, Object> row,
            int rowIndex,
            String fallbackLabel,
            List<ProcessingWarningDTO> warnings);
}
