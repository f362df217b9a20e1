/* (C)2026 */
package com.ammann.sleep.dto;

import com.ammann.sleep.enumeration.ChartKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Renderer-independent description of one per-night chart.
 *
 * @param nightId       id of the night
 * @param kind          stage hypnogram or metric line
 * @param metric        epoch export column of the plotted metric, null for the hypnogram
 * @param title         chart title
 * @param points        line points (metric charts)
 * @param stageSegments stage runs (hypnogram)
 * @param markers       night events and midnight, shared by all charts of a night
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NightChartDTO(
        String nightId,
        ChartKind kind,
        String metric,
        String title,
        List<ChartPointDTO> points,
        List<StageSegmentDTO> stageSegments,
        List<ChartMarkerDTO> markers
) {}
