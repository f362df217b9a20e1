/* (C)2026 */
package com.ammann.sleep.service.normalizer;

import com.ammann.sleep.enumeration.InputShape;
import com.ammann.sleep.properties.MetricCatalog;
import com.ammann.sleep.properties.ReportProperties.Columns;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;

/**
 * Normalizes rows of a tabular export whose vendor columns carry a fixed prefix
 * ({@code w_startdate}, {@code w_total_sleep_time}, ...).
 */
public class PrefixedTabularRowNormalizer extends AbstractSummaryRowNormalizer {

    private final String prefix;

    public PrefixedTabularRowNormalizer(MetricCatalog catalog, ObjectMapper objectMapper, String prefix) {
        super(catalog, objectMapper);
        this.prefix = prefix;
    }

    @Override
    public InputShape shape() {
        return InputShape.PREFIXED_TABULAR;
    }

    @Override
    protected Map<String, Object> canonicalize(Map<String, Object> row) {
        return stripPrefix(row, prefix);
    }

    @Override
    protected String startColumn() {
        return Columns.START_DATE;
    }

    @Override
    protected String endColumn() {
        return Columns.END_DATE;
    }

    @Override
    protected boolean acceptsNumericText() {
        return true;
    }
}
