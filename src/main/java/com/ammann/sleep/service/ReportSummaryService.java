/* (C)2026 */
package com.ammann.sleep.service;

import com.ammann.sleep.dto.RegularitySummaryDTO;
import com.ammann.sleep.dto.ReportOverviewDTO;
import com.ammann.sleep.dto.ReportOverviewDTO.MeanStd;
import com.ammann.sleep.dto.SleepRitualDTO;
import com.ammann.sleep.dto.SleepRitualDTO.ClockTime;
import com.ammann.sleep.dto.SleepVitalsDTO;
import com.ammann.sleep.enumeration.DayCategory;
import com.ammann.sleep.model.NightSummary;
import com.ammann.sleep.service.NightStatisticsService.BasicStatistics;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.jboss.logging.Logger;

/**
 * Service that condenses a set of nights into the report's summary sections: overview,
 * weekday/weekend regularity, average nightly routine and vital signs.
 *
 * <p>Clock times of the routine are averaged on the minutes-from-noon axis, so bedtimes on
 * both sides of midnight average to a time near midnight instead of midday.
 */
@ApplicationScoped
public class ReportSummaryService {

    private static final Logger LOG = Logger.getLogger(ReportSummaryService.class);

    private final NightStatisticsService statisticsService;

    @Inject
    public ReportSummaryService(NightStatisticsService statisticsService) {
        this.statisticsService = statisticsService;
    }

    public ReportOverviewDTO overview(List<NightSummary> nights) {
        LocalDate first = nights.stream()
                .filter(NightSummary::hasValidInterval)
                .map(NightSummary::startUtc)
                .min(Comparator.naturalOrder())
                .map(ReportSummaryService::utcDate)
                .orElse(null);
        LocalDate last = nights.stream()
                .filter(NightSummary::hasValidInterval)
                .map(NightSummary::endUtc)
                .max(Comparator.naturalOrder())
                .map(ReportSummaryService::utcDate)
                .orElse(null);

        return new ReportOverviewDTO(
                first,
                last,
                nights.size(),
                mean(nights, NightSummary::totalSleepTimeHours),
                meanStd(nights, NightSummary::sleepEfficiencyPercent),
                meanStd(nights, NightSummary::apneaHypopneaIndex),
                meanStd(nights, NightSummary::snoringMinutes));
    }

    public RegularitySummaryDTO regularity(List<NightSummary> nights, boolean applyTimezone) {
        Map<DayCategory, List<NightSummary>> partitions =
                statisticsService.partitionByDayCategory(nights, applyTimezone);
        return new RegularitySummaryDTO(
                regularityOf(partitions.get(DayCategory.WEEKDAY)),
                regularityOf(partitions.get(DayCategory.WEEKEND)));
    }

    public SleepRitualDTO ritual(List<NightSummary> nights, boolean applyTimezone) {
        Map<DayCategory, List<NightSummary>> partitions =
                statisticsService.partitionByDayCategory(nights, applyTimezone);
        return new SleepRitualDTO(
                ritualOf(partitions.get(DayCategory.WEEKDAY), applyTimezone),
                ritualOf(partitions.get(DayCategory.WEEKEND), applyTimezone));
    }

    public SleepVitalsDTO vitals(List<NightSummary> nights) {
        BasicStatistics ahi = describe(nights, NightSummary::apneaHypopneaIndex);
        BasicStatistics snoring = describe(nights, NightSummary::snoringMinutes);
        BasicStatistics snoringShare = describe(nights, ReportSummaryService::snoringPercentOfNight);
        BasicStatistics hrAverage = describe(nights, n -> n.metric(NightSummary.HR_AVERAGE));
        BasicStatistics hrMin = describe(nights, n -> n.metric(NightSummary.HR_MIN));
        BasicStatistics hrMax = describe(nights, n -> n.metric(NightSummary.HR_MAX));

        LOG.debugf("Vitals over %d nights: %d with AHI, %d with snoring",
                nights.size(), ahi.count(), snoring.count());
        return new SleepVitalsDTO(
                ahi.min(),
                meanOrNull(ahi),
                ahi.max(),
                ahi.count() == 0 ? null : NightStatisticsService.classifyApnea(ahi.mean()).getLabel(),
                meanOrNull(snoring),
                meanOrNull(snoringShare),
                snoring.count() == 0 ? null : NightStatisticsService.classifySnoring(snoring.mean()).getLabel(),
                meanOrNull(hrAverage),
                hrMin.min(),
                hrMax.max());
    }

    private RegularitySummaryDTO.Partition regularityOf(List<NightSummary> nights) {
        return new RegularitySummaryDTO.Partition(
                nights.size(),
                mean(nights, NightSummary::totalSleepTimeHours),
                mean(nights, NightSummary::sleepLatencyMinutes),
                mean(nights, NightSummary::totalTimeInBedHours),
                mean(nights, NightSummary::sleepEfficiencyPercent));
    }

    private SleepRitualDTO.Partition ritualOf(List<NightSummary> nights, boolean applyTimezone) {
        if (nights.isEmpty()) {
            return new SleepRitualDTO.Partition(0, null, null, null, null);
        }
        Function<NightSummary, Double> bedtime =
                n -> LocalTimeSupport.minutesFromNoon(n.startUtc(), zone(n, applyTimezone));
        Function<NightSummary, Double> wakeUp =
                n -> LocalTimeSupport.minutesFromNoon(n.endUtc(), zone(n, applyTimezone));

        return new SleepRitualDTO.Partition(
                nights.size(),
                clockTime(nights, bedtime),
                clockTime(nights, n -> plusMinutes(bedtime.apply(n), n.metric(NightSummary.DURATION_TO_SLEEP))),
                clockTime(nights, wakeUp),
                clockTime(nights, n -> plusMinutes(wakeUp.apply(n), n.metric(NightSummary.DURATION_TO_WAKE_UP))));
    }

    private static Double plusMinutes(double minutesFromNoon, Double seconds) {
        return seconds == null ? null : minutesFromNoon + seconds / 60.0;
    }

    private static ClockTime clockTime(List<NightSummary> nights, Function<NightSummary, Double> extractor) {
        BasicStatistics stats = describe(nights, extractor);
        return stats.count() == 0
                ? null
                : ClockTime.ofMinuteOfDay(LocalTimeSupport.toMinuteOfDay(stats.mean()));
    }

    private static Double snoringPercentOfNight(NightSummary night) {
        Double snoringMinutes = night.snoringMinutes();
        Double sleepSeconds = night.metric(NightSummary.TOTAL_SLEEP_TIME);
        if (snoringMinutes == null || sleepSeconds == null || sleepSeconds <= 0) {
            return null;
        }
        return snoringMinutes / (sleepSeconds / 60.0) * 100.0;
    }

    private static ZoneId zone(NightSummary night, boolean applyTimezone) {
        return LocalTimeSupport.resolveZone(night.timezone(), applyTimezone);
    }

    private static LocalDate utcDate(Instant instant) {
        return instant.atZone(ZoneOffset.UTC).toLocalDate();
    }

    private static BasicStatistics describe(
            List<NightSummary> nights, Function<NightSummary, Double> extractor) {
        return NightStatisticsService.describe(
                nights.stream().map(extractor).filter(Objects::nonNull).toList());
    }

    private static double mean(List<NightSummary> nights, Function<NightSummary, Double> extractor) {
        return describe(nights, extractor).mean();
    }

    private static MeanStd meanStd(List<NightSummary> nights, Function<NightSummary, Double> extractor) {
        BasicStatistics stats = describe(nights, extractor);
        return new MeanStd(stats.mean(), stats.standardDeviation());
    }

    private static Double meanOrNull(BasicStatistics stats) {
        return stats.count() == 0 ? null : stats.mean();
    }
}
