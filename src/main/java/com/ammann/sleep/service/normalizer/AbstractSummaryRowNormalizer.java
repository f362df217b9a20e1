/* (C)2026 */
package com.ammann.sleep.service.normalizer;

import com.ammann.sleep.dto.ProcessingWarningDTO;
import com.ammann.sleep.enumeration.MetricUnit;
import com.ammann.sleep.exception.ValidationException;
import com.ammann.sleep.model.NightSummary;
import com.ammann.sleep.properties.MetricCatalog;
import com.ammann.sleep.properties.ReportProperties;
import com.ammann.sleep.properties.ReportProperties.Columns;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Shared conversion from a shape-specific key set to the canonical {@link NightSummary}.
 *
 * <p>Subclasses only decide how raw keys map onto canonical keys ({@link #canonicalize}) and
 * which canonical keys carry the start and end of the night.
 */
public abstract class AbstractSummaryRowNormalizer implements SummaryRowNormalizer {

    private static final Logger LOG = Logger.getLogger(AbstractSummaryRowNormalizer.class);

    protected final MetricCatalog catalog;
    protected final ObjectMapper objectMapper;

    protected AbstractSummaryRowNormalizer(MetricCatalog catalog, ObjectMapper objectMapper) {
        this.catalog = catalog;
        this.objectMapper = objectMapper;
    }

    /** Maps raw keys onto canonical (unprefixed, flat) keys. */
    protected abstract Map<String, Object> canonicalize(Map<String, Object> row);

    /** Canonical key holding the night start. */
    protected abstract String startColumn();

    /** Canonical key holding the night end. */
    protected abstract String endColumn();

    /** Whether numeric text is accepted as a number (tabular sources carry only text). */
    protected abstract boolean acceptsNumericText();

    @Override
    public NightSummary normalize(
            Map<String, Object> row,
            int rowIndex,
            String fallbackLabel,
            List<ProcessingWarningDTO> warnings) {
        Map<String, Object> canonical = canonicalize(row);

        String id = text(canonical.get(Columns.ID));
        if (id == null) {
            throw ValidationException.missingRequiredColumn(Columns.ID, rowIndex);
        }

        String timezone = text(canonical.get(Columns.TIMEZONE));
        if (timezone != null && !isValidZone(timezone)) {
            warn(warnings, id, Columns.TIMEZONE,
                    String.format("Unknown timezone '%s', UTC is used for local times", timezone));
        }

        String labId = text(canonical.get(Columns.LAB_ID));
        String label = labId != null ? labId : fallbackLabel;

        Instant start = parseInstant(canonical.get(startColumn()), id, startColumn(), warnings);
        Instant end = parseInstant(canonical.get(endColumn()), id, endColumn(), warnings);
        if (start != null && end != null && start.isAfter(end)) {
            warn(warnings, id, startColumn(),
                    String.format("Night starts at %s after its end %s", start, end));
        }

        Map<String, Double> metrics = new LinkedHashMap<>();
        for (String field : catalog.numericFields()) {
            metrics.put(field, parseNumber(canonical.get(field), id, field, warnings));
        }
        Double ahi = metrics.get(NightSummary.APNEA_HYPOPNEA_INDEX);
        if (ahi != null && ahi < 0) {
            LOG.debugf("Night %s: negative apnea-hypopnea index %.2f treated as missing", id, ahi);
            metrics.put(NightSummary.APNEA_HYPOPNEA_INDEX, null);
        }

        Map<String, Double> derived = new LinkedHashMap<>();
        catalog.derivedFields().forEach((derivedName, source) -> {
            Double raw = metrics.get(source);
            MetricUnit unit = catalog.unitOf(source);
            derived.put(derivedName, raw == null ? null : unit.convert(raw));
        });

        JsonNode nightEvents = parseNightEvents(
                canonical.get(MetricCatalog.NIGHT_EVENTS), id, warnings);

        return new NightSummary(id, timezone, start, end, label, metrics, derived, nightEvents);
    }

    /**
     * Moves prefixed keys onto their unprefixed names. An unprefixed key that already carries a
     * value is never overwritten by its prefixed alternate.
     */
    protected static Map<String, Object> stripPrefix(Map<String, Object> row, String prefix) {
        Map<String, Object> canonical = new LinkedHashMap<>();
        row.forEach((key, value) -> {
            if (!key.startsWith(prefix)) {
                canonical.put(key, value);
            }
        });
        row.forEach((key, value) -> {
            if (key.startsWith(prefix)) {
                String stripped = key.substring(prefix.length());
                if (isMissing(canonical.get(stripped))) {
                    canonical.put(stripped, value);
                }
            }
        });
        return canonical;
    }

    protected static boolean isMissing(Object value) {
        return value == null
                || (value instanceof String s && s.isBlank())
                || (value instanceof JsonNode node && (node.isNull() || node.isMissingNode()));
    }

    static String text(Object value) {
        if (isMissing(value)) {
            return null;
        }
        if (value instanceof Number number) {
            return formatNumber(number);
        }
        if (value instanceof JsonNode node) {
            return node.isNumber() ? formatNumber(node.numberValue()) : node.asText().trim();
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    private static String formatNumber(Number number) {
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return BigDecimal.valueOf(d).toBigInteger().toString();
            }
            return Double.toString(d);
        }
        return number.toString();
    }

    Double parseNumber(Object raw, String nightId, String field, List<ProcessingWarningDTO> warnings) {
        if (isMissing(raw)) {
            return null;
        }
        if (raw instanceof JsonNode node) {
            raw = node.isNumber() ? node.numberValue() : node.asText();
        }
        if (raw instanceof Number number) {
            double value = number.doubleValue();
            if (Double.isFinite(value)) {
                return value;
            }
        } else if (raw instanceof String text && acceptsNumericText()) {
            Double value = parseNumericText(text);
            if (value != null) {
                return value;
            }
        }
        warn(warnings, nightId, field, String.format("Non-numeric value '%s' ignored", raw));
        return null;
    }

    private static Double parseNumericText(String text) {
        try {
            double value = Double.parseDouble(text.trim());
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Accepts epoch seconds (number or numeric text), ISO instants, offset date-times, local
     * date-times (read as UTC, a space may separate date and time) and plain dates.
     */
    Instant parseInstant(Object raw, String nightId, String field, List<ProcessingWarningDTO> warnings) {
        if (isMissing(raw)) {
            warn(warnings, nightId, field, "Missing date, night excluded from time-ordered views");
            return null;
        }
        if (raw instanceof JsonNode node) {
            raw = node.isNumber() ? node.numberValue() : node.asText();
        }
        Instant parsed = raw instanceof Number number
                ? fromEpochSeconds(number.doubleValue())
                : parseDateText(raw.toString().trim());
        if (parsed == null) {
            warn(warnings, nightId, field, String.format(
                    "Unparseable date '%s', night excluded from time-ordered views", raw));
        }
        return parsed;
    }

    private static Instant fromEpochSeconds(double seconds) {
        if (!Double.isFinite(seconds)
                || seconds < Instant.MIN.getEpochSecond()
                || seconds >= Instant.MAX.getEpochSecond()) {
            return null;
        }
        long whole = (long) Math.floor(seconds);
        long nanos = Math.round((seconds - whole) * 1_000_000_000L);
        try {
            return Instant.ofEpochSecond(whole, nanos);
        } catch (DateTimeException | ArithmeticException e) {
            return null;
        }
    }

    private static Instant parseDateText(String text) {
        Double numeric = parseNumericText(text);
        if (numeric != null) {
            return fromEpochSeconds(numeric);
        }
        String iso = text.length() > 10 && text.charAt(10) == ' '
                ? text.substring(0, 10) + 'T' + text.substring(11)
                : text;
        try {
            if (iso.length() <= 10) {
                return LocalDate.parse(iso).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(
                    iso, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return zoned.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    JsonNode parseNightEvents(Object raw, String nightId, List<ProcessingWarningDTO> warnings) {
        if (isMissing(raw)) {
            return null;
        }
        if (raw instanceof JsonNode node) {
            return node.isTextual() ? parseNightEvents(node.asText(), nightId, warnings) : node;
        }
        if (raw instanceof String text) {
            try {
                JsonNode node = objectMapper.readTree(text);
                return node == null || node.isNull() ? null : node;
            } catch (JsonProcessingException e) {
                warn(warnings, nightId, MetricCatalog.NIGHT_EVENTS,
                        "Malformed night events ignored: " + e.getOriginalMessage());
                return null;
            }
        }
        try {
            return objectMapper.valueToTree(raw);
        } catch (IllegalArgumentException e) {
            warn(warnings, nightId, MetricCatalog.NIGHT_EVENTS,
                    "Unsupported night events value ignored: " + e.getMessage());
            return null;
        }
    }

    private static boolean isValidZone(String timezone) {
        try {
            ZoneId.of(timezone);
            return true;
        } catch (DateTimeException e) {
            return false;
        }
    }

    protected void warn(List<ProcessingWarningDTO> warnings, String nightId, String field, String message) {
        LOG.warnf("Night %s, field %s: %s", nightId, field, message);
        warnings.add(new ProcessingWarningDTO(
                ReportProperties.Stages.NORMALIZE, nightId, field, message));
    }
}
