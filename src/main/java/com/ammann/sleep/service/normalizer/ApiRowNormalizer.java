/* (C)2026 */
package com.ammann.sleep.service.normalizer;

import com.ammann.sleep.enumeration.InputShape;
import com.ammann.sleep.properties.MetricCatalog;
import com.ammann.sleep.properties.ReportProperties.Columns;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalizes rows of a vendor API response: identity and dates on the top level, metrics in a
 * nested {@code data} object which is merged into the top level (nested keys win).
 */
public class ApiRowNormalizer extends AbstractSummaryRowNormalizer {

    private static final TypeReference<Map<String, Object>> ROW_TYPE = new TypeReference<>() {};

    public ApiRowNormalizer(MetricCatalog catalog, ObjectMapper objectMapper) {
        super(catalog, objectMapper);
    }

    @Override
    public InputShape shape() {
        return InputShape.API;
    }

    @Override
    protected Map<String, Object> canonicalize(Map<String, Object> row) {
        Map<String, Object> merged = new LinkedHashMap<>(row);
        Object data = merged.remove(Columns.DATA);
        if (data instanceof Map<?, ?> nested) {
            nested.forEach((key, value) -> merged.put(String.valueOf(key), value));
        } else if (data instanceof JsonNode node && node.isObject()) {
            merged.putAll(objectMapper.convertValue(node, ROW_TYPE));
        }
        return merged;
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
        return false;
    }
}
