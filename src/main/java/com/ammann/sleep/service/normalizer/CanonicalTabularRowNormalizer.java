/* (C)2026 */
package com.ammann.sleep.service.normalizer;

import com.ammann.sleep.enumeration.InputShape;
import com.ammann.sleep.properties.MetricCatalog;
import com.ammann.sleep.properties.ReportProperties.Columns;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;

/**
 * Normalizes rows of a canonical tabular export with {@code startdate_utc}/{@code enddate_utc}
 * columns. Prefixed alternates are still accepted for metric columns.
 */
public class CanonicalTabularRowNormalizer extends AbstractSummaryRowNormalizer {

    private final String prefix;

    public CanonicalTabularRowNormalizer(MetricCatalog catalog, ObjectMapper objectMapper, String prefix) {
        super(catalog, objectMapper);
        this.prefix = prefix;
    }

    @Override
    public InputShape shape() {
        return InputShape.CANONICAL_TABULAR;
    }

    @Override
    protected Map<String, Object> canonicalize(Map<String, Object> row) {
        return prefix == null || prefix.isEmpty() ? row : stripPrefix(row, prefix);
    }

    @Override
    protected String startColumn() {
        return Columns.START_DATE_UTC;
    }

    @Override
    protected String endColumn() {
        return Columns.END_DATE_UTC;
    }

    @Override
    protected boolean acceptsNumericText() {
        return true;
    }
}
