/* (C)2026 */
package com.ammann.sleep.service;

import com.ammann.sleep.dto.TimingLayoutDTO;
import com.ammann.sleep.dto.TimingRecordDTO;
import com.ammann.sleep.dto.WakeOverlayDTO;
import com.ammann.sleep.model.NightSummary;
import com.ammann.sleep.model.WakeEpisode;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Service that lays out nights on the minutes-from-noon axis of the sleep-timing chart.
 *
 * <p>A night starts at {@code base = mfn(start)}; its end is moved onto the following day when
 * it lies before the base, so nights crossing midnight stay contiguous. Wake episodes and the
 * latency bar are expressed on the same axis, aligned to the night's base. Nights without a
 * valid interval are left out.
 */
@ApplicationScoped
public class TimingLayoutService {

    private static final Logger LOG = Logger.getLogger(TimingLayoutService.class);

    static final int TICK_STEP_MINUTES = 60;
    static final int TICK_LIMIT_MINUTES = 2 * LocalTimeSupport.MINUTES_PER_DAY;
    static final int TICK_PADDING_MINUTES = 30;

    /**
     * Builds the chart layout.
     *
     * @param nights        normalized nights in any order
     * @param wakeEpisodes  wake episodes keyed by night id, may be empty
     * @param applyTimezone false to place every night in UTC
     * @return records ordered by night end plus hourly ticks
     */
    public TimingLayoutDTO buildLayout(
            List<NightSummary> nights,
            Map<String, List<WakeEpisode>> wakeEpisodes,
            boolean applyTimezone) {
        List<TimingRecordDTO> records = nights.stream()
                .filter(NightSummary::hasValidInterval)
                .sorted(Comparator.comparing(NightSummary::endUtc))
                .map(n -> buildRecord(n, wakeEpisodes.getOrDefault(n.id(), List.of()), applyTimezone))
                .toList();
        if (records.isEmpty()) {
            return TimingLayoutDTO.empty();
        }

        double minX = records.stream().mapToDouble(TimingRecordDTO::baseMinutes).min().orElse(0.0);
        double maxX = records.stream().mapToDouble(TimingRecordDTO::endMinutes).max().orElse(0.0);

        List<Integer> tickValues = new ArrayList<>();
        List<String> tickLabels = new ArrayList<>();
        for (int v = 0; v <= TICK_LIMIT_MINUTES; v += TICK_STEP_MINUTES) {
            if (v >= minX - TICK_PADDING_MINUTES && v <= maxX + TICK_PADDING_MINUTES) {
                tickValues.add(v);
                tickLabels.add(LocalTimeSupport.tickLabel(v));
            }
        }

        LOG.debugf("Timing layout: %d nights on [%.1f, %.1f], %d ticks",
                records.size(), minX, maxX, tickValues.size());
        return new TimingLayoutDTO(records, tickValues, tickLabels);
    }

    /**
     * Places one night with a valid interval on the axis.
     */
    public TimingRecordDTO buildRecord(
            NightSummary night, List<WakeEpisode> episodes, boolean applyTimezone) {
        ZoneId zone = LocalTimeSupport.resolveZone(night.timezone(), applyTimezone);
        double base = LocalTimeSupport.minutesFromNoon(night.startUtc(), zone);
        double end = LocalTimeSupport.minutesFromNoon(night.endUtc(), zone);
        if (end < base || (end == base && spansFullDay(night))) {
            end += LocalTimeSupport.MINUTES_PER_DAY;
        }

        List<WakeOverlayDTO> overlays = episodes.stream()
                .map(episode -> overlay(episode, base, zone))
                .toList();

        Double latency = night.metric(NightSummary.SLEEP_LATENCY);
        Double ahi = night.apneaHypopneaIndex();
        Double outOfBed = night.metric(NightSummary.OUT_OF_BED_COUNT);

        return new TimingRecordDTO(
                night.id(),
                LocalTimeSupport.formatDate(night.endUtc(), zone),
                base,
                end - base,
                latency == null ? null : latency / 60.0,
                overlays,
                outOfBed == null ? null : (int) Math.round(outOfBed),
                ahi == null ? null : Math.round(ahi),
                night.snoringMinutes(),
                night.metric(NightSummary.HR_AVERAGE),
                night.sleepEfficiencyPercent(),
                night.totalTimeInBedHours(),
                night.totalSleepTimeHours());
    }

    /** A night whose start and end share a local minute covers either no time or a whole day. */
    private static boolean spansFullDay(NightSummary night) {
        return Duration.between(night.startUtc(), night.endUtc()).toMinutes()
                >= LocalTimeSupport.MINUTES_PER_DAY / 2;
    }

    private static WakeOverlayDTO overlay(WakeEpisode episode, double base, ZoneId zone) {
        double start = LocalTimeSupport.alignAfter(
                LocalTimeSupport.minutesFromNoon(episode.start(), zone), base);
        double end = LocalTimeSupport.alignAfter(
                LocalTimeSupport.minutesFromNoon(episode.end(), zone), start);
        return new WakeOverlayDTO(start, end - start, episode.durationSeconds());
    }
}
