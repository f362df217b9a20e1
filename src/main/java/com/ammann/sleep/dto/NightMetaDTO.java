/* (C)2026 */
package com.ammann.sleep.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Per-night metadata for detail views.
 *
 * @param label display label
 * @param start local start {@code yyyy-MM-dd HH:mm}, null for an unparseable start
 * @param end   local end {@code yyyy-MM-dd HH:mm}, null for an unparseable end
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NightMetaDTO(String label, String start, String end) {}
