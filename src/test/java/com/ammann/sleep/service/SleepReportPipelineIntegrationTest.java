/* (C)2026 */
package com.ammann.sleep.service;

import static com.ammann.sleep.support.TestDataFactory.apiRow;
import static com.ammann.sleep.support.TestDataFactory.metrics;
import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.sleep.dto.SleepReportDTO;
import com.ammann.sleep.dto.SleepReportRequestDTO;
import com.ammann.sleep.enumeration.InputShape;
import com.ammann.sleep.enumeration.TabularLayout;
import com.ammann.sleep.model.NightSummary;
import com.ammann.sleep.properties.MetricCatalog;
import com.ammann.sleep.properties.ReportProperties;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.junit.jupiter.api.Test;

@QuarkusTest
class SleepReportPipelineIntegrationTest {

    @Inject SleepReportPipeline pipeline;

    @Inject TabularExportService exportService;

    @Inject VendorPayloadMapper payloadMapper;

    @Inject MetricCatalog catalog;

    @Inject
    @Named(ReportProperties.NIGHT_EXECUTOR)
    ManagedExecutor nightExecutor;

    @ConfigProperty(name = ReportProperties.Config.TABULAR_PREFIX)
    String tabularPrefix;

    @Test
    void wiresCatalogExecutorAndConfiguration() {
        assertThat(catalog.numericFields()).contains(NightSummary.TOTAL_SLEEP_TIME);
        assertThat(tabularPrefix).isEqualTo("w_");
        assertThat(nightExecutor.supplyAsync(() -> "done").join()).isEqualTo("done");
    }

    @Test
    void vendorResponseBecomesReport() {
        List<Map<String, Object>> rows = payloadMapper.readSummaryRows("""
                {"status": 0, "body": {"series": [
                  {"id": 42, "timezone": "Europe/Berlin", "startdate": 1704492000, "enddate": 1704520800,
                   "data": {"total_sleep_time": 25200, "sleep_efficiency": 0.89, "apnea_hypopnea_index": 10}}
                ]}}
                """);

        SleepReportDTO report = pipeline.run(SleepReportRequestDTO.of("lab-1", rows));

        assertThat(report.inputShape()).isEqualTo(InputShape.API);
        assertThat(report.nights()).singleElement().satisfies(night -> {
            assertThat(night.id()).isEqualTo("42");
            assertThat(night.label()).isEqualTo("lab-1");
            assertThat(night.totalSleepTimeHours()).isEqualTo(7.0);
            assertThat(night.sleepEfficiencyPercent()).isEqualTo(89.0);
        });
        assertThat(report.timingLayout().records()).singleElement().satisfies(record -> {
            assertThat(record.baseMinutes()).isEqualTo(660.0);
            assertThat(record.durationMinutes()).isEqualTo(480.0);
        });
        assertThat(report.vitals().osaSeverity()).isEqualTo("mild");
    }

    @Test
    void summaryExportReimportsThroughPipeline() {
        SleepReportRequestDTO request = SleepReportRequestDTO.of("lab-2", List.of(apiRow(
                "n1", "UTC", Instant.parse("2024-01-05T22:00:00Z"), Instant.parse("2024-01-06T06:00:00Z"),
                metrics("total_sleep_time", 27000, "snoring", 900))));
        SleepReportDTO first = pipeline.run(request);

        String prefixed = exportService.exportSummaries(first.nights(), TabularLayout.PREFIXED);
        SleepReportDTO second = pipeline.run(SleepReportRequestDTO.of("lab-3", exportService.readRows(prefixed)));

        assertThat(second.inputShape()).isEqualTo(InputShape.PREFIXED_TABULAR);
        assertThat(second.nights()).isEqualTo(first.nights());
        assertThat(second.metricAggregates()).isEqualTo(first.metricAggregates());
    }
}
