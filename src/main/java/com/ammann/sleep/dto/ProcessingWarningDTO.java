/* (C)2026 */
package com.ammann.sleep.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A recoverable, row-level problem encountered while processing a batch.
 *
 * @param stage   pipeline stage that raised the warning (normalize, flatten, import)
 * @param nightId night the problem belongs to, null when not attributable
 * @param field   offending field or column, null when not attributable
 * @param message human readable description
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessingWarningDTO(String stage, String nightId, String field, String message) {}
