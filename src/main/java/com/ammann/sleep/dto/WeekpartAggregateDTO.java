/* (C)2026 */
package com.ammann.sleep.dto;

/**
 * Statistics of one metric split by the local day of week of each night's end.
 */
public record WeekpartAggregateDTO(
        String field, MetricAggregateDTO weekday, MetricAggregateDTO weekend) {}
