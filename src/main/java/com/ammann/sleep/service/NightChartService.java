/* (C)2026 */
package com.ammann.sleep.service;

import com.ammann.sleep.dto.ChartMarkerDTO;
import com.ammann.sleep.dto.ChartPointDTO;
import com.ammann.sleep.dto.NightChartDTO;
import com.ammann.sleep.dto.NightMetaDTO;
import com.ammann.sleep.dto.StageSegmentDTO;
import com.ammann.sleep.enumeration.ChartKind;
import com.ammann.sleep.enumeration.EpochMetric;
import com.ammann.sleep.enumeration.NightEventType;
import com.ammann.sleep.enumeration.SleepState;
import com.ammann.sleep.model.EpochSample;
import com.ammann.sleep.model.NightSummary;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.jboss.logging.Logger;

/**
 * Service that describes the per-night detail charts: a sleep-stage hypnogram, one line chart
 * per epoch metric and the markers shared by all charts of a night.
 *
 * <p>Markers are the vendor night events (placed at the night start plus their offset) and local
 * midnight when it falls inside the sampled range.
 */
@ApplicationScoped
public class NightChartService {

    private static final Logger LOG = Logger.getLogger(NightChartService.class);

    static final String MIDNIGHT_MARKER = "Midnight";
    static final String STAGE_CHART_TITLE = "Sleep Stages";

    /**
     * Builds the charts of every night that has epoch samples.
     *
     * @return charts keyed by night id, in the order of {@code nights}
     */
    public Map<String, List<NightChartDTO>> buildCharts(
            List<NightSummary> nights, List<EpochSample> samples, boolean applyTimezone) {
        Map<String, List<EpochSample>> byNight = samples.stream()
                .collect(Collectors.groupingBy(EpochSample::nightId));
        Map<String, List<NightChartDTO>> charts = new LinkedHashMap<>();
        for (NightSummary night : nights) {
            List<EpochSample> nightSamples = byNight.get(night.id());
            if (nightSamples != null && !nightSamples.isEmpty()) {
                charts.put(night.id(), buildNightCharts(night, nightSamples, applyTimezone));
            }
        }
        LOG.debugf("Built charts for %d of %d nights", charts.size(), nights.size());
        return charts;
    }

    /**
     * Builds the metadata of every night.
     */
    public Map<String, NightMetaDTO> buildMeta(List<NightSummary> nights, boolean applyTimezone) {
        Map<String, NightMetaDTO> meta = new LinkedHashMap<>();
        for (NightSummary night : nights) {
            ZoneId zone = LocalTimeSupport.resolveZone(night.timezone(), applyTimezone);
            meta.put(night.id(), new NightMetaDTO(
                    night.label(),
                    LocalTimeSupport.formatMinutes(night.startUtc(), zone),
                    LocalTimeSupport.formatMinutes(night.endUtc(), zone)));
        }
        return meta;
    }

    /**
     * Builds the hypnogram and the metric charts of one night.
     *
     * @param samples non-empty samples of the night in any order
     */
    public List<NightChartDTO> buildNightCharts(
            NightSummary night, List<EpochSample> samples, boolean applyTimezone) {
        ZoneId zone = LocalTimeSupport.resolveZone(night.timezone(), applyTimezone);
        List<EpochSample> ordered = samples.stream()
                .sorted(Comparator.comparing(EpochSample::timestamp))
                .toList();
        List<ChartMarkerDTO> markers = markers(night, ordered, zone);

        List<NightChartDTO> charts = new ArrayList<>();
        charts.add(new NightChartDTO(
                night.id(), ChartKind.SLEEP_STAGES, null, STAGE_CHART_TITLE,
                null, stageSegments(ordered, zone), markers));

        for (EpochMetric metric : EpochMetric.values()) {
            if (!metric.isCharted()) {
                continue;
            }
            List<ChartPointDTO> points = ordered.stream()
                    .filter(s -> s.value(metric) != null)
                    .map(s -> new ChartPointDTO(
                            s.timestamp(), LocalTimeSupport.formatSeconds(s.timestamp(), zone), s.value(metric)))
                    .toList();
            if (points.size() >= 2) {
                charts.add(new NightChartDTO(
                        night.id(), ChartKind.METRIC_LINE, metric.getExportColumn(), metric.getLabel(),
                        points, null, markers));
            }
        }
        return charts;
    }

    /**
     * Collapses consecutive samples of equal stage into segments. A segment ends where the next
     * one starts; the last segment ends at its last sample.
     */
    List<StageSegmentDTO> stageSegments(List<EpochSample> ordered, ZoneId zone) {
        List<StageSegmentDTO> segments = new ArrayList<>();
        Iterator<EpochSample> it = ordered.iterator();
        if (!it.hasNext()) {
            return segments;
        }
        EpochSample first = it.next();
        EpochSample last = first;
        int epochs = 1;
        while (it.hasNext()) {
            EpochSample sample = it.next();
            if (sample.state() != first.state()) {
                segments.add(segment(first, sample.timestamp(), epochs, zone));
                first = sample;
                epochs = 0;
            }
            last = sample;
            epochs++;
        }
        segments.add(segment(first, last.timestamp(), epochs, zone));
        return segments;
    }

    private static StageSegmentDTO segment(EpochSample first, Instant end, int epochs, ZoneId zone) {
        String stage = SleepState.fromCode(first.state())
                .map(SleepState::getDisplayName)
                .orElse(String.valueOf(first.state()));
        return new StageSegmentDTO(
                stage,
                first.state(),
                LocalTimeSupport.formatSeconds(first.timestamp(), zone),
                LocalTimeSupport.formatSeconds(end, zone),
                epochs);
    }

    List<ChartMarkerDTO> markers(NightSummary night, List<EpochSample> ordered, ZoneId zone) {
        List<ChartMarkerDTO> markers = new ArrayList<>(eventMarkers(night, zone));
        if (!ordered.isEmpty()) {
            Instant first = ordered.get(0).timestamp();
            Instant last = ordered.get(ordered.size() - 1).timestamp();
            Instant midnight = first.atZone(zone).toLocalDate().plusDays(1).atStartOfDay(zone).toInstant();
            if (midnight.isAfter(first) && midnight.isBefore(last)) {
                markers.add(new ChartMarkerDTO(
                        MIDNIGHT_MARKER, midnight, LocalTimeSupport.formatSeconds(midnight, zone)));
            }
        }
        return List.copyOf(markers);
    }

    /**
     * Night events are an object from event code to an array of second offsets from the start
     * of the night. Unknown codes, non-integral offsets and offsets outside the night are ignored.
     */
    List<ChartMarkerDTO> eventMarkers(NightSummary night, ZoneId zone) {
        JsonNode events = night.nightEvents();
        if (events == null || !events.isObject() || !night.hasValidInterval()) {
            return List.of();
        }
        long nightSeconds = night.endUtc().getEpochSecond() - night.startUtc().getEpochSecond();
        List<ChartMarkerDTO> markers = new ArrayList<>();
        events.fields().forEachRemaining(entry -> NightEventType.fromCode(entry.getKey()).ifPresent(type -> {
            JsonNode offsets = entry.getValue();
            Iterable<JsonNode> values = offsets.isArray() ? offsets : List.of(offsets);
            for (JsonNode offset : values) {
                if (isOffsetWithin(offset, nightSeconds)) {
                    markers.add(eventMarker(type, night.startUtc(), offset.asLong(), zone));
                } else {
                    LOG.debugf("Night %s: event %s offset %s outside the night ignored",
                            night.id(), entry.getKey(), offset);
                }
            }
        }));
        markers.sort(Comparator.comparing(ChartMarkerDTO::timestamp));
        return markers;
    }

    private static boolean isOffsetWithin(JsonNode offset, long nightSeconds) {
        if (!offset.isNumber() || !offset.canConvertToLong()) {
            return false;
        }
        double value = offset.asDouble();
        return value == Math.rint(value) && value >= 0 && value <= nightSeconds;
    }

    private static ChartMarkerDTO eventMarker(NightEventType type, Instant start, long offsetSeconds, ZoneId zone) {
        Instant at = start.plusSeconds(offsetSeconds);
        return new ChartMarkerDTO(type.getDisplayName(), at, LocalTimeSupport.formatSeconds(at, zone));
    }
}
