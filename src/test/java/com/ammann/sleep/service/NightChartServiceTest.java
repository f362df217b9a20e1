/* (C)2026 */
package com.ammann.sleep.service;

import static com.ammann.sleep.support.TestDataFactory.metrics;
import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.sleep.dto.ChartMarkerDTO;
import com.ammann.sleep.dto.NightChartDTO;
import com.ammann.sleep.dto.NightMetaDTO;
import com.ammann.sleep.dto.StageSegmentDTO;
import com.ammann.sleep.enumeration.ChartKind;
import com.ammann.sleep.model.EpochSample;
import com.ammann.sleep.model.NightSummary;
import com.ammann.sleep.support.TestDataFactory;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class NightChartServiceTest {

    private final NightChartService service = new NightChartService();

    private final NightSummary night = TestDataFactory.night("n1", "UTC", "2024-01-05T23:00:00Z",
            "2024-01-06T01:00:00Z", metrics("night_events", "{\"1\":[0],\"2\":[600],\"9\":[5]}"));

    private final List<EpochSample> samples = List.of(
            TestDataFactory.sample("n1", Instant.parse("2024-01-06T00:20:00Z"), 0, 70.0),
            TestDataFactory.sample("n1", Instant.parse("2024-01-05T23:40:00Z"), 1, 60.0),
            TestDataFactory.sample("n1", Instant.parse("2024-01-05T23:50:00Z"), 1, 61.0),
            TestDataFactory.sample("n1", Instant.parse("2024-01-06T00:10:00Z"), 2, 55.0));

    @Test
    void buildsHypnogramAndMetricLines() {
        List<NightChartDTO> charts = service.buildNightCharts(night, samples, true);

        assertThat(charts).extracting(NightChartDTO::kind)
                .containsExactly(ChartKind.SLEEP_STAGES, ChartKind.METRIC_LINE);
        assertThat(charts.get(0).title()).isEqualTo("Sleep Stages");

        NightChartDTO hr = charts.get(1);
        assertThat(hr.metric()).isEqualTo("hr");
        assertThat(hr.title()).isEqualTo("Heart Rate (bpm)");
        assertThat(hr.points()).extracting(p -> p.value()).containsExactly(60.0, 61.0, 55.0, 70.0);
        assertThat(hr.points().get(0).localTime()).isEqualTo("2024-01-05 23:40:00");
    }

    @Test
    void stageSegmentsEndWhereTheNextBegins() {
        List<StageSegmentDTO> segments = service.buildNightCharts(night, samples, true).get(0).stageSegments();

        assertThat(segments).containsExactly(
                new StageSegmentDTO("Light", 1, "2024-01-05 23:40:00", "2024-01-06 00:10:00", 2),
                new StageSegmentDTO("Deep", 2, "2024-01-06 00:10:00", "2024-01-06 00:20:00", 1),
                new StageSegmentDTO("Awake", 0, "2024-01-06 00:20:00", "2024-01-06 00:20:00", 1));
    }

    @Test
    void markersCombineNightEventsAndMidnight() {
        List<ChartMarkerDTO> markers = service.buildNightCharts(night, samples, true).get(0).markers();

        assertThat(markers).extracting(ChartMarkerDTO::name)
                .containsExactly("Got in Bed", "Fell Asleep", "Midnight");
        assertThat(markers.get(1).timestamp()).isEqualTo(Instant.parse("2024-01-05T23:10:00Z"));
        assertThat(markers.get(2).localTime()).isEqualTo("2024-01-06 00:00:00");
    }

    @Test
    void eventOffsetsOutsideTheNightAreSkipped() {
        NightSummary withBadOffsets = TestDataFactory.night("n2", "UTC", "2024-01-05T23:00:00Z",
                "2024-01-06T01:00:00Z",
                metrics("night_events", "{\"1\":[1e30,0],\"2\":[-60,12.5,1200],\"4\":[7200,7201]}"));

        List<ChartMarkerDTO> markers = service.eventMarkers(withBadOffsets, ZoneOffset.UTC);

        assertThat(markers).extracting(ChartMarkerDTO::name)
                .containsExactly("Got in Bed", "Fell Asleep", "Got out of Bed");
        assertThat(markers).extracting(ChartMarkerDTO::timestamp).containsExactly(
                Instant.parse("2024-01-05T23:00:00Z"),
                Instant.parse("2024-01-05T23:20:00Z"),
                Instant.parse("2024-01-06T01:00:00Z"));
    }

    @Test
    void midnightOnTheSampleBoundaryIsNotMarked() {
        List<EpochSample> afterMidnight = List.of(
                TestDataFactory.sample("n1", Instant.parse("2024-01-06T00:00:00Z"), 1, 60.0),
                TestDataFactory.sample("n1", Instant.parse("2024-01-06T00:30:00Z"), 1, 62.0));

        assertThat(service.buildNightCharts(night, afterMidnight, true).get(0).markers())
                .extracting(ChartMarkerDTO::name)
                .doesNotContain("Midnight");
    }

    @Test
    void singlePointMetricsAreNotCharted() {
        List<EpochSample> one = List.of(
                TestDataFactory.sample("n1", Instant.parse("2024-01-05T23:40:00Z"), 1, 60.0),
                TestDataFactory.sample("n1", Instant.parse("2024-01-05T23:41:00Z"), 1));

        assertThat(service.buildNightCharts(night, one, true)).hasSize(1);
    }

    @Test
    void onlyNightsWithSamplesGetCharts() {
        NightSummary other = TestDataFactory.night("n2", "2024-01-06T23:00:00Z", "2024-01-07T06:00:00Z");

        Map<String, List<NightChartDTO>> charts = service.buildCharts(List.of(night, other), samples, true);

        assertThat(charts).containsOnlyKeys("n1");
    }

    @Test
    void metaUsesTheNightsZone() {
        NightSummary berlin = TestDataFactory.night(
                "n3", "Europe/Berlin", "2024-01-05T23:00:00Z", "2024-01-06T06:00:00Z", Map.of());

        Map<String, NightMetaDTO> meta = service.buildMeta(List.of(night, berlin), true);

        assertThat(meta.get("n1")).isEqualTo(new NightMetaDTO("lab", "2024-01-05 23:00", "2024-01-06 01:00"));
        assertThat(meta.get("n3").start()).isEqualTo("2024-01-06 00:00");
        assertThat(service.buildMeta(List.of(berlin), false).get("n3").start()).isEqualTo("2024-01-05 23:00");
    }
}
