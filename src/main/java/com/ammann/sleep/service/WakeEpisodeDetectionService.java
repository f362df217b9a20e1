/* (C)2026 */
package com.ammann.sleep.service;

import com.ammann.sleep.enumeration.SleepState;
import com.ammann.sleep.model.EpochSample;
import com.ammann.sleep.model.NightSummary;
import com.ammann.sleep.model.WakeEpisode;
import com.ammann.sleep.properties.ReportProperties;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.jboss.logging.Logger;

/**
 * Service that finds extended wake episodes (at least ten minutes awake) within a night.
 *
 * <p>Samples are scanned once in timestamp order. A maximal run of awake samples ends at its last
 * awake sample, or at the night's end when the run reaches the end of the samples. Both ends are
 * clipped into the night's interval before the length check.
 */
@ApplicationScoped
public class WakeEpisodeDetectionService {

    private static final Logger LOG = Logger.getLogger(WakeEpisodeDetectionService.class);

    /**
     * Detects wake episodes of one night.
     *
     * @param night   the night; without a valid interval no episodes are reported
     * @param samples epoch samples; samples of other nights are ignored
     * @return episodes in chronological order
     */
    public List<WakeEpisode> detect(NightSummary night, Collection<EpochSample> samples) {
        if (!night.hasValidInterval() || samples == null || samples.isEmpty()) {
            return List.of();
        }
        List<EpochSample> ordered = samples.stream()
                .filter(s -> night.id().equals(s.nightId()))
                .sorted(Comparator.comparing(EpochSample::timestamp))
                .toList();

        List<WakeEpisode> episodes = new ArrayList<>();
        Instant runStart = null;
        Instant runLast = null;
        for (EpochSample sample : ordered) {
            if (sample.state() == SleepState.AWAKE.getCode()) {
                if (runStart == null) {
                    runStart = sample.timestamp();
                }
                runLast = sample.timestamp();
            } else if (runStart != null) {
                addIfExtended(episodes, night, runStart, runLast);
                runStart = null;
            }
        }
        if (runStart != null) {
            addIfExtended(episodes, night, runStart, night.endUtc());
        }

        LOG.debugf("Night %s: %d wake episodes from %d samples", night.id(), episodes.size(), ordered.size());
        return episodes;
    }

    /**
     * Detects wake episodes of every night.
     *
     * @return episodes keyed by night id, in the order of {@code nights}
     */
    public Map<String, List<WakeEpisode>> detectAll(
            Collection<NightSummary> nights, Collection<EpochSample> samples) {
        Map<String, List<EpochSample>> byNight = samples == null
                ? Map.of()
                : samples.stream().collect(Collectors.groupingBy(EpochSample::nightId));
        Map<String, List<WakeEpisode>> result = new LinkedHashMap<>();
        for (NightSummary night : nights) {
            result.put(night.id(), detect(night, byNight.getOrDefault(night.id(), List.of())));
        }
        return result;
    }

    private static void addIfExtended(
            List<WakeEpisode> episodes, NightSummary night, Instant runStart, Instant runEnd) {
        Instant start = runStart.isBefore(night.startUtc()) ? night.startUtc() : runStart;
        Instant end = runEnd.isAfter(night.endUtc()) ? night.endUtc() : runEnd;
        long seconds = Duration.between(start, end).getSeconds();
        if (seconds >= ReportProperties.MIN_WAKE_EPISODE_SECONDS) {
            episodes.add(new WakeEpisode(night.id(), start, end, seconds));
        }
    }
}
