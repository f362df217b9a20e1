/* (C)2026 */
package com.ammann.sleep.service;

import static com.ammann.sleep.support.TestDataFactory.metrics;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ammann.sleep.dto.MetricAggregateDTO;
import com.ammann.sleep.dto.WeekpartAggregateDTO;
import com.ammann.sleep.enumeration.DayCategory;
import com.ammann.sleep.exception.ValidationException;
import com.ammann.sleep.model.NightSummary;
import com.ammann.sleep.service.NightStatisticsService.BasicStatistics;
import com.ammann.sleep.support.TestDataFactory;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Unit tests for {@link NightStatisticsService}.
 */
class NightStatisticsServiceTest {

    private final NightStatisticsService service = TestDataFactory.statisticsService();

    // Monday, Tuesday and Saturday mornings
    private final List<NightSummary> nights = List.of(
            TestDataFactory.night("mon", "UTC", "2024-01-07T23:00:00Z", "2024-01-08T07:00:00Z",
                    metrics("total_sleep_time", 21600, "sleep_efficiency", 0.8)),
            TestDataFactory.night("tue", "UTC", "2024-01-08T23:00:00Z", "2024-01-09T07:00:00Z",
                    metrics("total_sleep_time", 25200, "sleep_efficiency", 0.9)),
            TestDataFactory.night("sat", "UTC", "2024-01-05T23:00:00Z", "2024-01-06T07:00:00Z",
                    metrics("total_sleep_time", 28800)));

    @Test
    void aggregatesInDisplayUnitsWithPopulationStd() {
        MetricAggregateDTO aggregate = service.aggregate(nights, "total_sleep_time");

        assertThat(aggregate.count()).isEqualTo(3);
        assertThat(aggregate.mean()).isEqualTo(7.0, within(1e-12));
        assertThat(aggregate.std()).isEqualTo(Math.sqrt(2.0 / 3.0), within(1e-12));
        assertThat(aggregate.min()).isEqualTo(6.0);
        assertThat(aggregate.max()).isEqualTo(8.0);
        assertThat(aggregate.unit()).isEqualTo("hours");
        assertThat(aggregate.displayName()).isEqualTo("Total Sleep Time (hours)");
        assertThat(aggregate.severity()).isNull();
    }

    @Test
    void missingValuesAreDropped() {
        MetricAggregateDTO aggregate = service.aggregate(nights, "sleep_efficiency");

        assertThat(aggregate.count()).isEqualTo(2);
        assertThat(aggregate.mean()).isEqualTo(85.0, within(1e-9));
        assertThat(aggregate.std()).isEqualTo(5.0, within(1e-9));
    }

    @Test
    void emptySetHasZeroMeanAndNoExtremes() {
        MetricAggregateDTO aggregate = service.aggregate(List.of(), "total_sleep_time");

        assertThat(aggregate.count()).isZero();
        assertThat(aggregate.mean()).isZero();
        assertThat(aggregate.std()).isZero();
        assertThat(aggregate.min()).isNull();
        assertThat(aggregate.max()).isNull();
        assertThat(aggregate.isEmpty()).isTrue();
    }

    @Test
    void describeKeepsStdNonNegativeAndMeanWithinBounds() {
        BasicStatistics stats = NightStatisticsService.describe(List.of(3.5, 3.5, 3.5));

        assertThat(stats.standardDeviation()).isZero();
        assertThat(stats.mean()).isBetween(stats.min(), stats.max());
    }

    @Test
    void prefixedFieldNamesResolveToCatalogFields() {
        assertThat(service.aggregate(nights, "w_total_sleep_time").field()).isEqualTo("total_sleep_time");
        assertThat(service.extractValues(nights, "w_total_sleep_time")).containsExactly(6.0, 7.0, 8.0);
    }

    @Test
    void unknownFieldIsRejected() {
        assertThatThrownBy(() -> service.aggregate(nights, "shoe_size"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("shoe_size");
    }

    @Test
    void aggregateAllSkipsFieldsWithoutValues() {
        List<MetricAggregateDTO> aggregates = service.aggregateAll(nights);

        assertThat(aggregates)
                .extracting(MetricAggregateDTO::field)
                .containsExactly("total_sleep_time", "sleep_efficiency");
    }

    @ParameterizedTest
    @CsvSource({"2,none/minimal", "5,none/minimal", "10,mild", "22,moderate", "40,severe"})
    void apneaAggregateCarriesSeverity(double ahi, String expected) {
        NightSummary night = TestDataFactory.night("n1", "UTC", "2024-01-05T23:00:00Z", "2024-01-06T07:00:00Z",
                metrics("apnea_hypopnea_index", ahi));

        assertThat(service.aggregate(List.of(night), "apnea_hypopnea_index").severity()).isEqualTo(expected);
    }

    @Test
    void snoringAggregateIsClassifiedInMinutes() {
        NightSummary night = TestDataFactory.night("n1", "UTC", "2024-01-05T23:00:00Z", "2024-01-06T07:00:00Z",
                metrics("snoring", 1500));

        MetricAggregateDTO aggregate = service.aggregate(List.of(night), "snoring");

        assertThat(aggregate.mean()).isEqualTo(25.0);
        assertThat(aggregate.severity()).isEqualTo("moderate");
    }

    @Test
    void weekpartSplitsByEndDay() {
        WeekpartAggregateDTO split = service.aggregateByWeekpart(nights, "total_sleep_time", true);

        assertThat(split.weekday().mean()).isEqualTo(6.5, within(1e-12));
        assertThat(split.weekday().count()).isEqualTo(2);
        assertThat(split.weekend().mean()).isEqualTo(8.0);
    }

    @Test
    void dayCategoryUsesLocalEndDate() {
        // 23:30 UTC on a Sunday is already Monday in Berlin
        NightSummary night = TestDataFactory.night(
                "n1", "Europe/Berlin", "2024-01-07T16:00:00Z", "2024-01-07T23:30:00Z", Map.of());

        assertThat(NightStatisticsService.dayCategory(night, true)).isEqualTo(DayCategory.WEEKDAY);
        assertThat(NightStatisticsService.dayCategory(night, false)).isEqualTo(DayCategory.WEEKEND);
    }

    @Test
    void invalidNightsBelongToNoPartition() {
        NightSummary invalid = new NightSummary("bad", "UTC", null, Instant.parse("2024-01-08T07:00:00Z"),
                "lab", Map.of(NightSummary.TOTAL_SLEEP_TIME, 3600.0), Map.of(), null);

        Map<DayCategory, List<NightSummary>> partitions =
                service.partitionByDayCategory(List.of(invalid), true);

        assertThat(partitions.get(DayCategory.WEEKDAY)).isEmpty();
        assertThat(partitions.get(DayCategory.WEEKEND)).isEmpty();
    }
}
