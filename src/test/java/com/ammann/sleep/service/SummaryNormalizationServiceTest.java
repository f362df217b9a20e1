/* (C)2026 */
package com.ammann.sleep.service;

import static com.ammann.sleep.support.TestDataFactory.apiRow;
import static com.ammann.sleep.support.TestDataFactory.metrics;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ammann.sleep.dto.NormalizationResultDTO;
import com.ammann.sleep.dto.ProcessingWarningDTO;
import com.ammann.sleep.enumeration.InputShape;
import com.ammann.sleep.exception.ValidationException;
import com.ammann.sleep.model.NightSummary;
import com.ammann.sleep.support.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Unit tests for {@link SummaryNormalizationService}.
 *
 * <p>Covers shape detection, the three row normalizers, date parsing, derived fields and the
 * split between fatal errors and row-level warnings.
 */
class SummaryNormalizationServiceTest {

    private static final Instant START = Instant.parse("2024-01-05T22:00:00Z");
    private static final Instant END = Instant.parse("2024-01-06T06:00:00Z");

    private final SummaryNormalizationService service = TestDataFactory.normalizationService();

    @Test
    void derivesHoursAndPercentFromApiRow() {
        Map<String, Object> row = apiRow("n1", "Europe/Paris", START, END,
                metrics("total_sleep_time", 25200, "sleep_efficiency", 0.89));

        NormalizationResultDTO result = service.normalize(List.of(row), "lab");

        NightSummary night = result.nights().get(0);
        assertThat(result.shape()).isEqualTo(InputShape.API);
        assertThat(result.warnings()).isEmpty();
        assertThat(night.id()).isEqualTo("n1");
        assertThat(night.startUtc()).isEqualTo(START);
        assertThat(night.endUtc()).isEqualTo(END);
        assertThat(night.totalSleepTimeHours()).isEqualTo(7.0);
        assertThat(night.sleepEfficiencyPercent()).isCloseTo(89.0, within(1e-9));
        assertThat(night.hasValidInterval()).isTrue();
    }

    @ParameterizedTest
    @MethodSource("totalSleepTimeValues")
    void derivedFieldIsNullExactlyWhenSourceIsNotNumeric(Object raw, Double expectedHours) {
        Map<String, Object> row = apiRow("n1", "UTC", START, END, metrics("total_sleep_time", raw));

        NightSummary night = service.normalize(List.of(row), "lab").nights().get(0);

        if (expectedHours == null) {
            assertThat(night.metric("total_sleep_time")).isNull();
            assertThat(night.totalSleepTimeHours()).isNull();
        } else {
            assertThat(night.totalSleepTimeHours())
                    .isEqualTo(night.metric("total_sleep_time") / 3600.0)
                    .isCloseTo(expectedHours, within(1e-9));
        }
    }

    static Stream<Arguments> totalSleepTimeValues() {
        return Stream.of(
                Arguments.of(25200, 7.0),
                Arguments.of(27000L, 7.5),
                Arguments.of(1800.0, 0.5),
                Arguments.of(0, 0.0),
                Arguments.of("not a number", null),
                Arguments.of(true, null));
    }

    @Test
    void nestedDataWinsOverTopLevelKeys() {
        Map<String, Object> row = apiRow("n1", "UTC", START, END, metrics("snoring", 600));
        row.put("snoring", 60);

        NightSummary night = service.normalize(List.of(row), "lab").nights().get(0);

        assertThat(night.metric("snoring")).isEqualTo(600.0);
        assertThat(night.snoringMinutes()).isEqualTo(10.0);
    }

    @Test
    void negativeApneaIndexMeansNoMeasurement() {
        Map<String, Object> row = apiRow("n1", "UTC", START, END, metrics("apnea_hypopnea_index", -1));

        NormalizationResultDTO result = service.normalize(List.of(row), "lab");

        assertThat(result.nights().get(0).apneaHypopneaIndex()).isNull();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void apiTextValuesAreNotNumbers() {
        Map<String, Object> row = apiRow("n1", "UTC", START, END, metrics("hr_average", "58"));

        NormalizationResultDTO result = service.normalize(List.of(row), "lab");

        assertThat(result.nights().get(0).metric("hr_average")).isNull();
        assertThat(result.warnings())
                .singleElement()
                .satisfies(w -> {
                    assertThat(w.nightId()).isEqualTo("n1");
                    assertThat(w.field()).isEqualTo("hr_average");
                    assertThat(w.stage()).isEqualTo("normalize");
                });
    }

    @Test
    void parsesNumericTextOfCanonicalRows() {
        Map<String, Object> row = canonicalRow("n1", "2024-01-05T22:00:00Z", "2024-01-06T06:00:00Z");
        row.put("total_sleep_time", "25200");
        row.put("sleep_efficiency", " 0.5 ");
        row.put("hr_average", "");
        row.put("rr_average", "fast");

        NormalizationResultDTO result = service.normalize(List.of(row), "lab");

        NightSummary night = result.nights().get(0);
        assertThat(result.shape()).isEqualTo(InputShape.CANONICAL_TABULAR);
        assertThat(night.metric("total_sleep_time")).isEqualTo(25200.0);
        assertThat(night.sleepEfficiencyPercent()).isEqualTo(50.0);
        assertThat(night.metric("hr_average")).isNull();
        assertThat(night.metric("rr_average")).isNull();
        assertThat(result.warnings()).extracting(ProcessingWarningDTO::field).containsExactly("rr_average");
    }

    @Test
    void prefixedRowsPreferUnprefixedValues() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("w_id", "n7");
        row.put("w_timezone", "Europe/Berlin");
        row.put("w_startdate", "2024-01-05T22:00:00Z");
        row.put("w_enddate", "2024-01-06T06:00:00Z");
        row.put("w_total_sleep_time", "100");
        row.put("total_sleep_time", "200");
        row.put("w_snoring", "120");
        row.put("snoring", "");
        row.put("lab_id", "sleep-lab");

        NormalizationResultDTO result = service.normalize(List.of(row), "fallback");

        NightSummary night = result.nights().get(0);
        assertThat(result.shape()).isEqualTo(InputShape.PREFIXED_TABULAR);
        assertThat(night.id()).isEqualTo("n7");
        assertThat(night.timezone()).isEqualTo("Europe/Berlin");
        assertThat(night.label()).isEqualTo("sleep-lab");
        assertThat(night.metric("total_sleep_time")).isEqualTo(200.0);
        assertThat(night.metric("snoring")).isEqualTo(120.0);
        assertThat(night.startUtc()).isEqualTo(START);
    }

    @ParameterizedTest
    @CsvSource({
        "2024-01-05T22:00:00Z,2024-01-05T22:00:00Z",
        "2024-01-05T23:00:00+01:00,2024-01-05T22:00:00Z",
        "2024-01-05 22:00:00,2024-01-05T22:00:00Z",
        "2024-01-05T22:00,2024-01-05T22:00:00Z",
        "1704492000,2024-01-05T22:00:00Z",
        "2024-01-05,2024-01-05T00:00:00Z"
    })
    void parsesSupportedDateFormats(String raw, String expected) {
        Map<String, Object> row = canonicalRow("n1", raw, "2024-01-06T06:00:00Z");

        NightSummary night = service.normalize(List.of(row), "lab").nights().get(0);

        assertThat(night.startUtc()).isEqualTo(Instant.parse(expected));
    }

    @Test
    void unparseableDateKeepsRowWithInvalidMarker() {
        Map<String, Object> row = canonicalRow("n1", "yesterday", "2024-01-06T06:00:00Z");

        NormalizationResultDTO result = service.normalize(List.of(row), "lab");

        NightSummary night = result.nights().get(0);
        assertThat(result.nights()).hasSize(1);
        assertThat(night.startUtc()).isNull();
        assertThat(night.hasValidInterval()).isFalse();
        assertThat(result.warnings())
                .singleElement()
                .satisfies(w -> assertThat(w.field()).isEqualTo("startdate_utc"));
    }

    @ParameterizedTest
    @MethodSource("outOfRangeEpochValues")
    void outOfRangeEpochKeepsRowWithInvalidMarker(Object raw) {
        Map<String, Object> row = canonicalRow("n1", null, "2024-01-06T06:00:00Z");
        row.put("startdate_utc", raw);

        NormalizationResultDTO result = service.normalize(List.of(row), "lab");

        assertThat(result.nights()).singleElement()
                .satisfies(night -> assertThat(night.hasValidInterval()).isFalse());
        assertThat(result.warnings())
                .singleElement()
                .satisfies(w -> assertThat(w.field()).isEqualTo("startdate_utc"));
    }

    static Stream<Object> outOfRangeEpochValues() {
        return Stream.of("1e20", "-1e30", 1e20, -9.3e18, Long.MAX_VALUE);
    }

    @Test
    void startAfterEndIsInvalidInterval() {
        Map<String, Object> row = canonicalRow("n1", "2024-01-06T06:00:00Z", "2024-01-05T22:00:00Z");

        NormalizationResultDTO result = service.normalize(List.of(row), "lab");

        assertThat(result.nights().get(0).hasValidInterval()).isFalse();
        assertThat(result.warnings()).hasSize(1);
    }

    @Test
    void parsesSerializedNightEvents() {
        Map<String, Object> row = apiRow("n1", "UTC", START, END, Map.of());
        row.put("night_events", "{\"1\":[0],\"2\":[900,1800]}");

        NightSummary night = service.normalize(List.of(row), "lab").nights().get(0);

        assertThat(night.nightEvents().isObject()).isTrue();
        assertThat(night.nightEvents().get("2").get(1).asInt()).isEqualTo(1800);
    }

    @Test
    void malformedNightEventsBecomeNullWithWarning() {
        Map<String, Object> row = apiRow("n1", "UTC", START, END, Map.of());
        row.put("night_events", "{\"1\":[0");

        NormalizationResultDTO result = service.normalize(List.of(row), "lab");

        assertThat(result.nights().get(0).nightEvents()).isNull();
        assertThat(result.warnings()).extracting(ProcessingWarningDTO::field).containsExactly("night_events");
    }

    @Test
    void unknownTimezoneIsKeptWithWarning() {
        Map<String, Object> row = apiRow("n1", "Mars/Olympus", START, END, Map.of());

        NormalizationResultDTO result = service.normalize(List.of(row), "lab");

        assertThat(result.nights().get(0).timezone()).isEqualTo("Mars/Olympus");
        assertThat(result.warnings()).extracting(ProcessingWarningDTO::field).containsExactly("timezone");
    }

    @Test
    void fallbackLabelIsUsedWithoutLabId() {
        Map<String, Object> row = apiRow("n1", "UTC", START, END, Map.of());

        assertThat(service.normalize(List.of(row), "subject-42").nights().get(0).label())
                .isEqualTo("subject-42");
    }

    @Test
    void numericIdsBecomeText() {
        Map<String, Object> row = apiRow("n1", "UTC", START, END, Map.of());
        row.put("id", 123456789L);

        assertThat(service.normalize(List.of(row), "lab").nights().get(0).id()).isEqualTo("123456789");
    }

    @Test
    void unrecognizedShapeAbortsTheBatch() {
        Map<String, Object> row = Map.of("id", "n1", "date", "2024-01-05");

        assertThatThrownBy(() -> service.normalize(List.of(row), "lab"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Unrecognized input shape");
    }

    @Test
    void missingIdAbortsTheBatch() {
        Map<String, Object> first = apiRow("n1", "UTC", START, END, Map.of());
        Map<String, Object> second = apiRow("n2", "UTC", START, END, Map.of());
        second.put("id", " ");

        assertThatThrownBy(() -> service.normalize(List.of(first, second), "lab"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Missing required column 'id' in row 1");
    }

    @Test
    void emptyBatchIsNotAnError() {
        NormalizationResultDTO result = service.normalize(List.of(), "lab");

        assertThat(result.shape()).isNull();
        assertThat(result.nights()).isEmpty();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void countsNightsAndWarnings() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        service.meterRegistry = registry;
        Map<String, Object> good = apiRow("n1", "UTC", START, END, Map.of());
        Map<String, Object> bad = apiRow("n2", "UTC", START, END, metrics("hr_min", "low"));

        service.normalize(List.of(good, bad), "lab");

        assertThat(registry.counter("sleep_report_nights_total").count()).isEqualTo(2.0);
        assertThat(registry.counter("sleep_report_warnings_total", "stage", "normalize").count())
                .isEqualTo(1.0);
    }

    private static Map<String, Object> canonicalRow(String id, String start, String end) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", id);
        row.put("timezone", "UTC");
        row.put("startdate_utc", start);
        row.put("enddate_utc", end);
        return row;
    }
}
