/* (C)2026 */
package com.ammann.sleep.dto;

import com.ammann.sleep.enumeration.InputShape;
import com.ammann.sleep.model.NightSummary;
import com.ammann.sleep.model.WakeEpisode;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * All artifacts of one report run.
 *
 * @param label              report label
 * @param generatedAt        time the report was built
 * @param inputShape         detected summary shape, null for an empty batch
 * @param nights             nights after the date-range filter, ordered by end
 * @param epochSampleCount   epoch samples kept for those nights
 * @param wakeEpisodes       extended wake episodes of all nights
 * @param timingLayout       sleep-timing chart layout
 * @param metricAggregates   per-metric statistics over the statistics set
 * @param weekpartAggregates weekday/weekend statistics over the statistics set
 * @param overview           headline figures
 * @param regularity         weekday/weekend schedule averages
 * @param ritual             average routine clock times
 * @param vitals             breathing and heart figures
 * @param nightCharts        chart descriptions keyed by night id
 * @param nightMeta          metadata keyed by night id
 * @param summaryCsv         canonical summary export
 * @param epochCsv           epoch export, null without epoch data
 * @param warnings           recoverable problems of all stages
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SleepReportDTO(
        String label,
        Instant generatedAt,
        InputShape inputShape,
        List<NightSummary> nights,
        int epochSampleCount,
        List<WakeEpisode> wakeEpisodes,
        TimingLayoutDTO timingLayout,
        List<MetricAggregateDTO> metricAggregates,
        List<WeekpartAggregateDTO> weekpartAggregates,
        ReportOverviewDTO overview,
        RegularitySummaryDTO regularity,
        SleepRitualDTO ritual,
        SleepVitalsDTO vitals,
        Map<String, List<NightChartDTO>> nightCharts,
        Map<String, NightMetaDTO> nightMeta,
        String summaryCsv,
        String epochCsv,
        List<ProcessingWarningDTO> warnings
) {}
