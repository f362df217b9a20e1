/* (C)2026 */
package com.ammann.sleep.service;

import com.ammann.sleep.dto.EpochBatchDTO;
import com.ammann.sleep.dto.ProcessingWarningDTO;
import com.ammann.sleep.enumeration.EpochMetric;
import com.ammann.sleep.enumeration.SleepState;
import com.ammann.sleep.enumeration.TabularLayout;
import com.ammann.sleep.exception.TabularFormatException;
import com.ammann.sleep.model.EpochSample;
import com.ammann.sleep.model.NightSummary;
import com.ammann.sleep.properties.MetricCatalog;
import com.ammann.sleep.properties.ReportProperties;
import com.ammann.sleep.properties.ReportProperties.Columns;
import com.ammann.sleep.properties.ReportProperties.EpochColumns;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Service that writes and reads the tabular exports.
 *
 * <p>The summary export has a stable column order: identity and timing columns, the catalog
 * metric columns (with {@code night_events} as JSON text) and the derived columns. In the
 * {@link TabularLayout#PREFIXED} layout every vendor column carries the configured prefix.
 * Both layouts re-import through {@link SummaryNormalizationService} into the same nights.
 * Numbers are written so that they parse back to the identical double.
 *
 * <p>The epoch export has the fixed column list {@code id, timestamp, state, hr, rr, snoring,
 * sdnn, rmssd, movement_score, chest_movement_rate, vendor_index, breathing_sounds} with
 * timestamps as epoch seconds.
 */
@ApplicationScoped
public class TabularExportService {

    private static final Logger LOG = Logger.getLogger(TabularExportService.class);

    private static final CsvMapper CSV_MAPPER = new CsvMapper();

    @ConfigProperty(name = ReportProperties.Config.TABULAR_PREFIX, defaultValue = "w_")
    String tabularPrefix = ReportProperties.DEFAULT_TABULAR_PREFIX;

    @Inject MeterRegistry meterRegistry;

    private final MetricCatalog catalog;
    private final ObjectMapper objectMapper;

    @Inject
    public TabularExportService(MetricCatalog catalog, ObjectMapper objectMapper) {
        this.catalog = catalog;
        this.objectMapper = objectMapper;
    }

    /**
     * Column order of the summary export.
     */
    public List<String> summaryColumns(TabularLayout layout) {
        List<String> columns = new ArrayList<>();
        if (layout == TabularLayout.PREFIXED) {
            columns.add(Columns.LAB_ID);
            columns.add(tabularPrefix + Columns.ID);
            columns.add(tabularPrefix + Columns.TIMEZONE);
            columns.add(tabularPrefix + Columns.START_DATE);
            columns.add(tabularPrefix + Columns.END_DATE);
            catalog.exportFields().forEach(field -> columns.add(tabularPrefix + field));
        } else {
            columns.add(Columns.ID);
            columns.add(Columns.TIMEZONE);
            columns.add(Columns.LAB_ID);
            columns.add(Columns.START_DATE_UTC);
            columns.add(Columns.END_DATE_UTC);
            columns.addAll(catalog.exportFields());
        }
        columns.addAll(catalog.derivedFields().keySet());
        return columns;
    }

    /**
     * Writes nights as CSV with a header row.
     *
     * @throws TabularFormatException if serialization fails
     */
    public String exportSummaries(List<NightSummary> nights, TabularLayout layout) {
        List<String> columns = summaryColumns(layout);
        String prefix = layout == TabularLayout.PREFIXED ? tabularPrefix : "";
        String startColumn = layout == TabularLayout.PREFIXED ? prefix + Columns.START_DATE : Columns.START_DATE_UTC;
        String endColumn = layout == TabularLayout.PREFIXED ? prefix + Columns.END_DATE : Columns.END_DATE_UTC;

        List<Map<String, String>> rows = new ArrayList<>(nights.size());
        for (NightSummary night : nights) {
            Map<String, String> row = new LinkedHashMap<>();
            row.put(prefix + Columns.ID, night.id());
            row.put(prefix + Columns.TIMEZONE, night.timezone());
            row.put(Columns.LAB_ID, night.label());
            row.put(startColumn, night.startUtc() == null ? null : night.startUtc().toString());
            row.put(endColumn, night.endUtc() == null ? null : night.endUtc().toString());
            night.metrics().forEach((field, value) -> row.put(prefix + field, formatNumber(value)));
            row.put(prefix + MetricCatalog.NIGHT_EVENTS, writeJson(night));
            night.derived().forEach((name, value) -> row.put(name, formatNumber(value)));
            rows.add(row);
        }

        String csv = write(columns, rows);
        LOG.infof("Exported %d nights in %s layout", nights.size(), layout);
        return csv;
    }

    /**
     * Writes epoch samples as CSV with a header row.
     *
     * @throws TabularFormatException if serialization fails
     */
    public String exportEpochSamples(List<EpochSample> samples) {
        List<Map<String, String>> rows = new ArrayList<>(samples.size());
        for (EpochSample sample : samples) {
            Map<String, String> row = new LinkedHashMap<>();
            row.put(EpochColumns.ID, sample.nightId());
            row.put(EpochColumns.TIMESTAMP, Long.toString(sample.timestamp().getEpochSecond()));
            row.put(EpochColumns.STATE, Integer.toString(sample.state()));
            for (EpochMetric metric : EpochMetric.values()) {
                row.put(metric.getExportColumn(), formatNumber(sample.value(metric)));
            }
            rows.add(row);
        }
        String csv = write(epochColumns(), rows);
        LOG.infof("Exported %d epoch samples", samples.size());
        return csv;
    }

    public static List<String> epochColumns() {
        List<String> columns = new ArrayList<>();
        columns.add(EpochColumns.ID);
        columns.add(EpochColumns.TIMESTAMP);
        columns.add(EpochColumns.STATE);
        for (EpochMetric metric : EpochMetric.values()) {
            columns.add(metric.getExportColumn());
        }
        return columns;
    }

    /**
     * Reads a CSV with a header row into raw rows for the normalizer. Empty cells stay empty
     * strings and count as missing values downstream.
     *
     * @throws TabularFormatException if the text is not readable CSV
     */
    public List<Map<String, Object>> readRows(String csv) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Map<String, String> row : read(csv)) {
            rows.add(new LinkedHashMap<>(row));
        }
        LOG.debugf("Read %d tabular rows", rows.size());
        return rows;
    }

    /**
     * Reads an epoch export. Rows without id, with a non-integer timestamp or an unknown state
     * are skipped with a warning; malformed metric cells become null with a warning.
     *
     * @throws TabularFormatException if the text is not readable CSV
     */
    public EpochBatchDTO readEpochSamples(String csv) {
        List<EpochSample> samples = new ArrayList<>();
        List<ProcessingWarningDTO> warnings = new ArrayList<>();
        List<Map<String, String>> rows = read(csv);
        for (int i = 0; i < rows.size(); i++) {
            Map<String, String> row = rows.get(i);
            String nightId = blankToNull(row.get(EpochColumns.ID));
            if (nightId == null) {
                warn(warnings, null, EpochColumns.ID, "Epoch row " + i + " without night id skipped");
                continue;
            }
            Long timestamp = parseLong(row.get(EpochColumns.TIMESTAMP));
            if (timestamp == null) {
                warn(warnings, nightId, EpochColumns.TIMESTAMP, String.format(
                        "Epoch row %d with timestamp '%s' skipped", i, row.get(EpochColumns.TIMESTAMP)));
                continue;
            }
            Long state = parseLong(row.get(EpochColumns.STATE));
            if (state == null || SleepState.fromCode(state.intValue()).isEmpty()) {
                warn(warnings, nightId, EpochColumns.STATE, String.format(
                        "Epoch row %d with state '%s' skipped", i, row.get(EpochColumns.STATE)));
                continue;
            }

            Map<EpochMetric, Double> values = new EnumMap<>(EpochMetric.class);
            for (EpochMetric metric : EpochMetric.values()) {
                String cell = blankToNull(row.get(metric.getExportColumn()));
                if (cell == null) {
                    continue;
                }
                Double value = parseDouble(cell);
                if (value == null) {
                    warn(warnings, nightId, metric.getExportColumn(),
                            String.format("Non-numeric value '%s' ignored", cell));
                } else {
                    values.put(metric, value);
                }
            }
            samples.add(EpochSample.of(nightId, Instant.ofEpochSecond(timestamp), state.intValue(), values));
        }

        LOG.infof("Imported %d epoch samples (%d warnings)", samples.size(), warnings.size());
        recordWarnings(warnings.size());
        return new EpochBatchDTO(samples, warnings);
    }

    /**
     * Formats a number so that {@link Double#parseDouble} restores the identical value;
     * integral values are written without a fraction.
     */
    static String formatNumber(Double value) {
        if (value == null) {
            return null;
        }
        double d = value;
        boolean negativeZero = d == 0.0 && 1.0 / d < 0;
        if (d == Math.rint(d) && Math.abs(d) < 1e15 && !negativeZero) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }

    private String writeJson(NightSummary night) {
        if (night.nightEvents() == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(night.nightEvents());
        } catch (JsonProcessingException e) {
            throw new TabularFormatException("Cannot serialize night events of night " + night.id(), e);
        }
    }

    private static String write(List<String> columns, List<Map<String, String>> rows) {
        CsvSchema.Builder schema = CsvSchema.builder();
        columns.forEach(schema::addColumn);
        try {
            return CSV_MAPPER.writer(schema.build().withHeader())
                    .with(JsonGenerator.Feature.IGNORE_UNKNOWN)
                    .writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new TabularFormatException("Cannot write CSV export", e);
        }
    }

    private static List<Map<String, String>> read(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> it =
                CSV_MAPPER.readerForMapOf(String.class).with(schema).readValues(csv)) {
            return it.readAll();
        } catch (IOException | RuntimeException e) {
            throw new TabularFormatException("Cannot read CSV input: " + e.getMessage(), e);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Long parseLong(String value) {
        String text = blankToNull(value);
        if (text == null) {
            return null;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double parseDouble(String value) {
        try {
            double d = Double.parseDouble(value);
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private void warn(List<ProcessingWarningDTO> warnings, String nightId, String field, String message) {
        LOG.warnf("Epoch import: %s", message);
        warnings.add(new ProcessingWarningDTO(ReportProperties.Stages.IMPORT, nightId, field, message));
    }

    private void recordWarnings(int count) {
        if (meterRegistry == null || count == 0) {
            return;
        }

        Counter.builder("sleep_report_warnings_total")
                .description("Total number of recoverable row-level problems by pipeline stage")
                .tag("stage", ReportProperties.Stages.IMPORT)
                .register(meterRegistry)
                .increment(count);
    }
}
