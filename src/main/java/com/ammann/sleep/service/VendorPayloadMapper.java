/* (C)2026 */
package com.ammann.sleep.service;

import com.ammann.sleep.enumeration.EpochMetric;
import com.ammann.sleep.exception.ValidationException;
import com.ammann.sleep.model.EpochRecord;
import com.ammann.sleep.model.EpochSegment;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Maps vendor JSON payloads onto the inputs of the report pipeline.
 *
 * <p>A summary response is either the full envelope {@code {status, body: {series: [...]}}} or
 * the bare series array. Epoch payloads are arrays of {@code {sleep_id, series: [...]}} where
 * each segment carries a {@code state} and one {@code {epochSeconds: value}} object per metric.
 * A non-zero status is fatal; status 293 means the vendor has no data for the range.
 */
@ApplicationScoped
public class VendorPayloadMapper {

    private static final Logger LOG = Logger.getLogger(VendorPayloadMapper.class);

    private static final TypeReference<Map<String, Object>> ROW_TYPE = new TypeReference<>() {};

    static final String STATUS = "status";
    static final String BODY = "body";
    static final String SERIES = "series";
    static final String SLEEP_ID = "sleep_id";
    static final String STATE = "state";

    private final ObjectMapper objectMapper;

    @Inject
    public VendorPayloadMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Reads summary rows from a vendor response.
     *
     * @throws ValidationException if the text is not JSON, has an unexpected structure or carries
     *     a non-zero status
     */
    public List<Map<String, Object>> readSummaryRows(String json) {
        return readSummaryRows(parse(json));
    }

    public List<Map<String, Object>> readSummaryRows(JsonNode payload) {
        JsonNode series = seriesOf(payload);
        List<Map<String, Object>> rows = new ArrayList<>(series.size());
        for (JsonNode node : series) {
            if (!node.isObject()) {
                throw ValidationException.invalidParameter("series", node.getNodeType(), "an array of objects");
            }
            rows.add(objectMapper.convertValue(node, ROW_TYPE));
        }
        LOG.debugf("Mapped %d summary rows from vendor payload", rows.size());
        return rows;
    }

    /**
     * Reads epoch records from a vendor epoch payload.
     *
     * @throws ValidationException if the text is not JSON or has an unexpected structure
     */
    public List<EpochRecord> readEpochRecords(String json) {
        return readEpochRecords(parse(json));
    }

    public List<EpochRecord> readEpochRecords(JsonNode payload) {
        JsonNode records = seriesOf(payload);
        List<EpochRecord> result = new ArrayList<>(records.size());
        for (JsonNode record : records) {
            JsonNode sleepId = record.get(SLEEP_ID);
            String nightId = sleepId == null || sleepId.isNull() ? null : sleepId.asText();
            List<EpochSegment> segments = new ArrayList<>();
            JsonNode series = record.get(SERIES);
            if (series != null && series.isArray()) {
                series.forEach(segment -> segments.add(toSegment(segment)));
            }
            result.add(new EpochRecord(nightId, segments));
        }
        LOG.debugf("Mapped %d epoch records from vendor payload", result.size());
        return result;
    }

    private EpochSegment toSegment(JsonNode segment) {
        Map<EpochMetric, Map<String, Double>> series = new EnumMap<>(EpochMetric.class);
        for (EpochMetric metric : EpochMetric.values()) {
            JsonNode values = segment.get(metric.getSourceKey());
            if (values == null || !values.isObject()) {
                continue;
            }
            Map<String, Double> byKey = new LinkedHashMap<>();
            values.fields().forEachRemaining(entry -> {
                JsonNode value = entry.getValue();
                if (value.isNumber()) {
                    byKey.put(entry.getKey(), value.doubleValue());
                }
            });
            series.put(metric, byKey);
        }
        return new EpochSegment(stateOf(segment.get(STATE)), series);
    }

    private static Integer stateOf(JsonNode state) {
        if (state == null || state.isNull()) {
            return null;
        }
        if (state.isIntegralNumber()) {
            return state.intValue();
        }
        if (state.isTextual()) {
            try {
                return Integer.parseInt(state.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private JsonNode seriesOf(JsonNode payload) {
        if (payload == null || payload.isNull()) {
            return objectMapper.createArrayNode();
        }
        if (payload.isArray()) {
            return payload;
        }
        if (!payload.isObject()) {
            throw ValidationException.invalidParameter(
                    "payload", payload.getNodeType(), "an array or a response object");
        }
        JsonNode status = payload.get(STATUS);
        if (status != null && status.asInt(0) != 0) {
            throw ValidationException.vendorStatus(status.asInt());
        }
        JsonNode body = payload.has(BODY) ? payload.get(BODY) : payload;
        JsonNode series = body.get(SERIES);
        if (series == null || series.isNull()) {
            return objectMapper.createArrayNode();
        }
        if (!series.isArray()) {
            throw ValidationException.invalidParameter("series", series.getNodeType(), "an array");
        }
        return series;
    }

    private JsonNode parse(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Vendor payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
