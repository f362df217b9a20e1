/* (C)2026 */
package com.ammann.sleep.service;

import com.ammann.sleep.dto.EpochBatchDTO;
import com.ammann.sleep.dto.MetricAggregateDTO;
import com.ammann.sleep.dto.NormalizationResultDTO;
import com.ammann.sleep.dto.ProcessingWarningDTO;
import com.ammann.sleep.dto.SleepReportDTO;
import com.ammann.sleep.dto.SleepReportRequestDTO;
import com.ammann.sleep.dto.TimingLayoutDTO;
import com.ammann.sleep.dto.WeekpartAggregateDTO;
import com.ammann.sleep.enumeration.TabularLayout;
import com.ammann.sleep.exception.ApiException;
import com.ammann.sleep.model.EpochSample;
import com.ammann.sleep.model.NightSummary;
import com.ammann.sleep.model.WakeEpisode;
import com.ammann.sleep.properties.ReportProperties;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.jboss.logging.Logger;

/**
 * Facade that runs one report end to end:
 * normalize, filter by date, flatten epochs, detect wake episodes, lay out the timeline,
 * aggregate, describe charts and export.
 *
 * <p>The pipeline keeps no state between runs. With {@code sleep.report.parallel-nights}
 * enabled, wake-episode detection fans out per night on the {@code night-analysis-executor};
 * results are merged back in night order. An empty batch yields an empty report.
 */
@ApplicationScoped
public class SleepReportPipeline {

    private static final Logger LOG = Logger.getLogger(SleepReportPipeline.class);

    static final double DEFAULT_NAP_MIN_HOURS = 3.0;

    static final Comparator<NightSummary> BY_END =
            Comparator.comparing(NightSummary::endUtc, Comparator.nullsLast(Comparator.naturalOrder()));

    @ConfigProperty(name = ReportProperties.Config.APPLY_TIMEZONE, defaultValue = "true")
    boolean applyTimezone = true;

    @ConfigProperty(name = ReportProperties.Config.NAP_FILTER_ENABLED, defaultValue = "false")
    boolean napFilterEnabled;

    @ConfigProperty(name = ReportProperties.Config.NAP_FILTER_MIN_HOURS, defaultValue = "3.0")
    double napFilterMinHours = DEFAULT_NAP_MIN_HOURS;

    @ConfigProperty(name = ReportProperties.Config.PARALLEL_NIGHTS, defaultValue = "false")
    boolean parallelNights;

    @Inject
    @Named(ReportProperties.NIGHT_EXECUTOR)
    ManagedExecutor nightExecutor;

    private final SummaryNormalizationService normalizationService;
    private final NightFilterService filterService;
    private final EpochFlatteningService flatteningService;
    private final WakeEpisodeDetectionService wakeEpisodeService;
    private final TimingLayoutService timingLayoutService;
    private final NightStatisticsService statisticsService;
    private final ReportSummaryService summaryService;
    private final NightChartService chartService;
    private final TabularExportService exportService;

    @Inject
    public SleepReportPipeline(
            SummaryNormalizationService normalizationService,
            NightFilterService filterService,
            EpochFlatteningService flatteningService,
            WakeEpisodeDetectionService wakeEpisodeService,
            TimingLayoutService timingLayoutService,
            NightStatisticsService statisticsService,
            ReportSummaryService summaryService,
            NightChartService chartService,
            TabularExportService exportService) {
        this.normalizationService = normalizationService;
        this.filterService = filterService;
        this.flatteningService = flatteningService;
        this.wakeEpisodeService = wakeEpisodeService;
        this.timingLayoutService = timingLayoutService;
        this.statisticsService = statisticsService;
        this.summaryService = summaryService;
        this.chartService = chartService;
        this.exportService = exportService;
    }

    /**
     * Builds a report.
     *
     * @param request summary rows, optional epoch data and switches
     * @return all report artifacts with the warnings of every stage
     * @throws com.ammann.sleep.exception.ValidationException for an invalid request, an
     *     unrecognized input shape or a row without id
     */
    public SleepReportDTO run(SleepReportRequestDTO request) {
        long startTime = System.nanoTime();
        request.validate();

        boolean useTimezone = request.applyTimezone != null ? request.applyTimezone : applyTimezone;
        boolean napFilter = request.napFilterEnabled != null ? request.napFilterEnabled : napFilterEnabled;
        double napMinHours = request.napFilterMinHours != null ? request.napFilterMinHours : napFilterMinHours;

        NormalizationResultDTO normalized =
                normalizationService.normalize(request.summaryRows, request.label);
        List<ProcessingWarningDTO> warnings = new ArrayList<>(normalized.warnings());

        List<NightSummary> nights = filterService
                .filterByDateRange(normalized.nights(), request.startDate, request.endDate)
                .stream()
                .sorted(BY_END)
                .toList();

        List<EpochSample> samples = List.of();
        if (request.epochRecords != null) {
            EpochBatchDTO flattened = flatteningService.flatten(request.epochRecords, normalized.nights());
            warnings.addAll(flattened.warnings());
            samples = filterService.restrictSamples(flattened.samples(), nights);
        } else if (request.epochSamples != null) {
            samples = filterService.restrictSamples(request.epochSamples, nights);
        }

        Map<String, List<WakeEpisode>> wakeEpisodes = detectWakeEpisodes(nights, samples);
        TimingLayoutDTO timingLayout = timingLayoutService.buildLayout(nights, wakeEpisodes, useTimezone);

        List<NightSummary> statisticsNights =
                napFilter ? filterService.filterNaps(nights, napMinHours) : nights;
        List<MetricAggregateDTO> aggregates = statisticsService.aggregateAll(statisticsNights);
        List<WeekpartAggregateDTO> weekpartAggregates = aggregates.stream()
                .map(a -> statisticsService.aggregateByWeekpart(statisticsNights, a.field(), useTimezone))
                .toList();

        SleepReportDTO report = new SleepReportDTO(
                request.label,
                Instant.now(),
                normalized.shape(),
                nights,
                samples.size(),
                wakeEpisodes.values().stream().flatMap(List::stream).toList(),
                timingLayout,
                aggregates,
                weekpartAggregates,
                summaryService.overview(statisticsNights),
                summaryService.regularity(statisticsNights, useTimezone),
                summaryService.ritual(statisticsNights, useTimezone),
                summaryService.vitals(statisticsNights),
                chartService.buildCharts(nights, samples, useTimezone),
                chartService.buildMeta(nights, useTimezone),
                exportService.exportSummaries(nights, TabularLayout.CANONICAL),
                samples.isEmpty() ? null : exportService.exportEpochSamples(samples),
                List.copyOf(warnings));

        LOG.infof(
                "Report '%s' built in %.2fms: %d nights (%d in statistics), %d epoch samples, %d warnings",
                request.label,
                (System.nanoTime() - startTime) / 1_000_000.0,
                nights.size(),
                statisticsNights.size(),
                samples.size(),
                warnings.size());
        return report;
    }

    /**
     * Detects wake episodes per night, on the night executor when parallel processing is
     * enabled.
     *
     * @return episodes keyed by night id in the order of {@code nights}
     */
    Map<String, List<WakeEpisode>> detectWakeEpisodes(List<NightSummary> nights, List<EpochSample> samples) {
        if (!parallelNights || nightExecutor == null || nights.size() < 2 || samples.isEmpty()) {
            return wakeEpisodeService.detectAll(nights, samples);
        }

        Map<String, List<EpochSample>> byNight =
                samples.stream().collect(Collectors.groupingBy(EpochSample::nightId));
        Map<String, CompletableFuture<List<WakeEpisode>>> futures = new LinkedHashMap<>();
        for (NightSummary night : nights) {
            List<EpochSample> nightSamples = byNight.getOrDefault(night.id(), List.of());
            futures.put(night.id(), CompletableFuture.supplyAsync(
                    () -> wakeEpisodeService.detect(night, nightSamples), nightExecutor));
        }

        Map<String, List<WakeEpisode>> result = new LinkedHashMap<>();
        try {
            futures.forEach((id, future) -> result.put(id, future.join()));
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new ApiException("Wake-episode detection failed", e.getCause());
        }
        LOG.debugf("Detected wake episodes for %d nights in parallel", nights.size());
        return result;
    }
}
