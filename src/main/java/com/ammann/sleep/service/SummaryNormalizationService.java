/* (C)2026 */
package com.ammann.sleep.service;

import com.ammann.sleep.dto.NormalizationResultDTO;
import com.ammann.sleep.dto.ProcessingWarningDTO;
import com.ammann.sleep.enumeration.InputShape;
import com.ammann.sleep.exception.ValidationException;
import com.ammann.sleep.model.NightSummary;
import com.ammann.sleep.properties.MetricCatalog;
import com.ammann.sleep.properties.ReportProperties;
import com.ammann.sleep.service.normalizer.ApiRowNormalizer;
import com.ammann.sleep.service.normalizer.CanonicalTabularRowNormalizer;
import com.ammann.sleep.service.normalizer.PrefixedTabularRowNormalizer;
import com.ammann.sleep.service.normalizer.SummaryRowNormalizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Service that canonicalizes a batch of raw summary rows into {@link NightSummary} records.
 *
 * <p>The input shape is decided once per batch from the union of all row keys (see
 * {@link InputShape#detect}); every row is then converted by the matching
 * {@link SummaryRowNormalizer}. A batch of unrecognized shape, or a row without an id, aborts
 * with a {@link ValidationException}. Malformed cells only produce warnings.
 *
 * <p>The prefix of the prefixed tabular export is configurable via
 * {@code sleep.report.tabular.prefix}.
 */
@ApplicationScoped
public class SummaryNormalizationService {

    private static final Logger LOG = Logger.getLogger(SummaryNormalizationService.class);

    @ConfigProperty(name = ReportProperties.Config.TABULAR_PREFIX, defaultValue = "w_")
    String tabularPrefix = ReportProperties.DEFAULT_TABULAR_PREFIX;

    @Inject MeterRegistry meterRegistry;

    private final MetricCatalog catalog;
    private final ObjectMapper objectMapper;

    @Inject
    public SummaryNormalizationService(MetricCatalog catalog, ObjectMapper objectMapper) {
        this.catalog = catalog;
        this.objectMapper = objectMapper;
    }

    /**
     * Normalizes a batch of rows.
     *
     * @param rows  raw rows of one shape; an empty batch yields an empty result
     * @param label label for rows without {@code lab_id}
     * @return nights in input order plus row-level warnings
     * @throws ValidationException if the shape is unrecognized or a row has no id
     */
    public NormalizationResultDTO normalize(List<Map<String, Object>> rows, String label) {
        if (rows == null || rows.isEmpty()) {
            LOG.debug("Empty summary batch, nothing to normalize");
            return new NormalizationResultDTO(null, List.of(), List.of());
        }

        InputShape shape = detectShape(rows);
        SummaryRowNormalizer normalizer = normalizerFor(shape);

        List<NightSummary> nights = new ArrayList<>(rows.size());
        List<ProcessingWarningDTO> warnings = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            nights.add(normalizer.normalize(rows.get(i), i, label, warnings));
        }

        long invalid = nights.stream().filter(n -> !n.hasValidInterval()).count();
        LOG.infof(
                "Normalized %d %s rows: %d without valid interval, %d warnings",
                nights.size(), shape, invalid, warnings.size());

        recordNights(nights.size());
        recordWarnings(warnings.size());
        return new NormalizationResultDTO(shape, nights, warnings);
    }

    /**
     * Detects the shape of a non-empty batch.
     *
     * @throws ValidationException if no known start-date column is present
     */
    public InputShape detectShape(List<Map<String, Object>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        rows.forEach(row -> columns.addAll(row.keySet()));
        return InputShape.detect(columns, tabularPrefix)
                .orElseThrow(() -> ValidationException.unrecognizedInputShape(columns));
    }

    SummaryRowNormalizer normalizerFor(InputShape shape) {
        return switch (shape) {
            case PREFIXED_TABULAR -> new PrefixedTabularRowNormalizer(catalog, objectMapper, tabularPrefix);
            case CANONICAL_TABULAR -> new CanonicalTabularRowNormalizer(catalog, objectMapper, tabularPrefix);
            case API -> new ApiRowNormalizer(catalog, objectMapper);
        };
    }

    private void recordNights(int count) {
        if (meterRegistry == null || count == 0) {
            return;
        }

        Counter.builder("sleep_report_nights_total")
                .description("Total number of normalized nights")
                .register(meterRegistry)
                .increment(count);
    }

    private void recordWarnings(int count) {
        if (meterRegistry == null || count == 0) {
            return;
        }

        Counter.builder("sleep_report_warnings_total")
                .description("Total number of recoverable row-level problems by pipeline stage")
                .tag("stage", ReportProperties.Stages.NORMALIZE)
                .register(meterRegistry)
                .increment(count);
    }
}
