/* (C)2026 */
package com.ammann.sleep.service;

import com.ammann.sleep.dto.MetricAggregateDTO;
import com.ammann.sleep.dto.WeekpartAggregateDTO;
import com.ammann.sleep.enumeration.DayCategory;
import com.ammann.sleep.enumeration.MetricUnit;
import com.ammann.sleep.enumeration.OsaSeverity;
import com.ammann.sleep.enumeration.SnoringSeverity;
import com.ammann.sleep.exception.ValidationException;
import com.ammann.sleep.model.NightSummary;
import com.ammann.sleep.properties.MetricCatalog;
import com.ammann.sleep.properties.ReportProperties;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Statistics engine over a set of nights.
 *
 * <p>Values are extracted per catalog field, non-numeric values are dropped and the rest are
 * converted to display units through the {@link MetricCatalog} (seconds to hours or minutes,
 * fractions to percent). Aggregates are the arithmetic mean, the population standard deviation
 * (divided by N), min and max. An empty set yields mean 0 and std 0 with min/max absent.
 */
@ApplicationScoped
public class NightStatisticsService {

    private static final Logger LOG = Logger.getLogger(NightStatisticsService.class);

    @ConfigProperty(name = ReportProperties.Config.TABULAR_PREFIX, defaultValue = "w_")
    String tabularPrefix = ReportProperties.DEFAULT_TABULAR_PREFIX;

    private final MetricCatalog catalog;

    @Inject
    public NightStatisticsService(MetricCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Aggregates one field.
     *
     * @param nights nights to aggregate, typically already filtered
     * @param field  catalog field, optionally carrying the tabular prefix
     * @return aggregate in display units, with severity for AHI and snoring
     * @throws ValidationException if the field is not a numeric catalog field
     */
    public MetricAggregateDTO aggregate(List<NightSummary> nights, String field) {
        String canonical = canonicalField(field);
        MetricUnit unit = catalog.unitOf(canonical);
        BasicStatistics stats = describe(extractValues(nights, canonical));

        return new MetricAggregateDTO(
                canonical,
                catalog.displayName(canonical),
                unit.getSymbol(),
                stats.count(),
                stats.mean(),
                stats.standardDeviation(),
                stats.min(),
                stats.max(),
                stats.count() == 0 ? null : severityLabel(canonical, stats.mean()));
    }

    /**
     * Aggregates every numeric catalog field that has at least one value.
     *
     * @return aggregates in catalog order
     */
    public List<MetricAggregateDTO> aggregateAll(List<NightSummary> nights) {
        List<MetricAggregateDTO> aggregates = new ArrayList<>();
        for (String field : catalog.numericFields()) {
            MetricAggregateDTO aggregate = aggregate(nights, field);
            if (!aggregate.isEmpty()) {
                aggregates.add(aggregate);
            }
        }
        LOG.debugf("Aggregated %d of %d fields over %d nights",
                aggregates.size(), catalog.numericFields().size(), nights.size());
        return aggregates;
    }

    /**
     * Aggregates one field separately for weekday and weekend nights.
     */
    public WeekpartAggregateDTO aggregateByWeekpart(
            List<NightSummary> nights, String field, boolean applyTimezone) {
        Map<DayCategory, List<NightSummary>> partitions = partitionByDayCategory(nights, applyTimezone);
        return new WeekpartAggregateDTO(
                canonicalField(field),
                aggregate(partitions.get(DayCategory.WEEKDAY), field),
                aggregate(partitions.get(DayCategory.WEEKEND), field));
    }

    /**
     * Splits nights by the local day of week of their end. Nights without a valid interval
     * belong to neither partition.
     */
    public Map<DayCategory, List<NightSummary>> partitionByDayCategory(
            List<NightSummary> nights, boolean applyTimezone) {
        Map<DayCategory, List<NightSummary>> partitions = new EnumMap<>(DayCategory.class);
        for (DayCategory category : DayCategory.values()) {
            partitions.put(category, new ArrayList<>());
        }
        nights.stream()
                .filter(NightSummary::hasValidInterval)
                .forEach(night -> partitions.get(dayCategory(night, applyTimezone)).add(night));
        return partitions;
    }

    public static DayCategory dayCategory(NightSummary night, boolean applyTimezone) {
        ZoneId zone = LocalTimeSupport.resolveZone(night.timezone(), applyTimezone);
        return DayCategory.of(LocalTimeSupport.localDate(night.endUtc(), zone).getDayOfWeek());
    }

    /**
     * Numeric values of a field in display units, in night order.
     */
    public List<Double> extractValues(List<NightSummary> nights, String field) {
        String canonical = canonicalField(field);
        MetricUnit unit = catalog.unitOf(canonical);
        return nights.stream()
                .map(night -> night.metric(canonical))
                .filter(Objects::nonNull)
                .map(unit::convert)
                .toList();
    }

    /**
     * Describes a list of values. Mean and std of an empty list are 0, min/max are null.
     */
    public static BasicStatistics describe(List<Double> values) {
        if (values == null || values.isEmpty()) {
            return new BasicStatistics(0, 0.0, 0.0, null, null);
        }
        var summary = values.stream().mapToDouble(Double::doubleValue).summaryStatistics();

        double mean = summary.getAverage();
        double variance = values.stream()
                .mapToDouble(x -> Math.pow(x - mean, 2))
                .average()
                .orElse(0.0);

        return new BasicStatistics(
                summary.getCount(),
                mean,
                Math.sqrt(variance),
                summary.getMin(),
                summary.getMax());
    }

    public static OsaSeverity classifyApnea(double ahi) {
        return OsaSeverity.fromAhi(ahi);
    }

    public static SnoringSeverity classifySnoring(double minutes) {
        return SnoringSeverity.fromMinutes(minutes);
    }

    /**
     * Resolves a requested field name to its catalog field, stripping the tabular prefix when
     * only the prefixed form is known.
     */
    String canonicalField(String field) {
        if (field != null && catalog.isNumeric(field)) {
            return field;
        }
        if (field != null && tabularPrefix != null && !tabularPrefix.isEmpty()
                && field.startsWith(tabularPrefix)) {
            String stripped = field.substring(tabularPrefix.length());
            if (catalog.isNumeric(stripped)) {
                return stripped;
            }
        }
        throw ValidationException.invalidParameter("field", field, "a numeric summary field");
    }

    private static String severityLabel(String field, double mean) {
        if (NightSummary.APNEA_HYPOPNEA_INDEX.equals(field)) {
            return classifyApnea(mean).getLabel();
        }
        if (NightSummary.SNORING.equals(field)) {
            return classifySnoring(mean).getLabel();
        }
        return null;
    }

    /**
     * Descriptive statistics in display units.
     *
     * @param count             number of values
     * @param mean              arithmetic mean, 0 when empty
     * @param standardDeviation population standard deviation, 0 when empty
     * @param min               smallest value, null when empty
     * @param max               largest value, null when empty
     */
    public record BasicStatistics(
            long count,
            double mean,
            double standardDeviation,
            Double min,
            Double max
    ) {}
}
