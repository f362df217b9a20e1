/* (C)2026 */
package com.ammann.sleep.service;

import com.ammann.sleep.dto.EpochBatchDTO;
import com.ammann.sleep.dto.ProcessingWarningDTO;
import com.ammann.sleep.enumeration.EpochMetric;
import com.ammann.sleep.enumeration.SleepState;
import com.ammann.sleep.model.EpochRecord;
import com.ammann.sleep.model.EpochSample;
import com.ammann.sleep.model.EpochSegment;
import com.ammann.sleep.model.NightSummary;
import com.ammann.sleep.properties.ReportProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.jboss.logging.Logger;

/**
 * Service that turns sparse per-metric epoch series into dense {@link EpochSample} rows.
 *
 * <p>Within a segment the first non-empty metric in {@link EpochMetric} order is the reference:
 * its epoch-seconds keys define the emitted timestamps (ascending) and every other metric is
 * looked up at the same key, null when absent. Samples are concatenated across nights without
 * deduplication.
 */
@ApplicationScoped
public class EpochFlatteningService {

    private static final Logger LOG = Logger.getLogger(EpochFlatteningService.class);

    @Inject MeterRegistry meterRegistry;

    /**
     * Flattens the epoch records of known nights.
     *
     * @param records epoch payloads, one per night
     * @param nights  normalized nights; records of other ids are skipped with a warning
     * @return dense samples plus warnings
     */
    public EpochBatchDTO flatten(List<EpochRecord> records, Collection<NightSummary> nights) {
        if (records == null || records.isEmpty()) {
            return EpochBatchDTO.empty();
        }
        Set<String> knownIds = nights.stream().map(NightSummary::id).collect(Collectors.toSet());

        List<EpochSample> samples = new ArrayList<>();
        List<ProcessingWarningDTO> warnings = new ArrayList<>();
        for (EpochRecord record : records) {
            if (record.nightId() == null || !knownIds.contains(record.nightId())) {
                warn(warnings, record.nightId(), "Epoch data for unknown night skipped");
                continue;
            }
            for (EpochSegment segment : record.series()) {
                samples.addAll(flattenSegment(record.nightId(), segment, warnings));
            }
        }

        LOG.infof(
                "Flattened %d epoch records into %d samples (%d warnings)",
                records.size(), samples.size(), warnings.size());
        recordWarnings(warnings.size());
        return new EpochBatchDTO(samples, warnings);
    }

    /**
     * Flattens one segment.
     *
     * @return samples in ascending timestamp order, empty when the segment has no data
     */
    List<EpochSample> flattenSegment(
            String nightId, EpochSegment segment, List<ProcessingWarningDTO> warnings) {
        Optional<EpochMetric> reference = referenceMetric(segment);
        if (reference.isEmpty()) {
            LOG.debugf("Night %s: segment without metric data skipped", nightId);
            return List.of();
        }
        Optional<SleepState> state = SleepState.fromCode(segment.state());
        if (state.isEmpty()) {
            warn(warnings, nightId, String.format(
                    "Segment with unknown sleep state %s skipped", segment.state()));
            return List.of();
        }

        TreeMap<Long, String> keysBySecond = new TreeMap<>();
        for (String key : segment.seriesOf(reference.get()).keySet()) {
            try {
                keysBySecond.put(Long.parseLong(key.trim()), key);
            } catch (NumberFormatException e) {
                warn(warnings, nightId, String.format("Non-integer epoch key '%s' skipped", key));
            }
        }

        List<EpochSample> samples = new ArrayList<>(keysBySecond.size());
        keysBySecond.forEach((second, key) -> {
            Map<EpochMetric, Double> values = new EnumMap<>(EpochMetric.class);
            for (EpochMetric metric : EpochMetric.values()) {
                Double value = segment.seriesOf(metric).get(key);
                if (value != null) {
                    values.put(metric, value);
                }
            }
            samples.add(EpochSample.of(
                    nightId, Instant.ofEpochSecond(second), state.get().getCode(), values));
        });
        return samples;
    }

    /** First metric, in declared order, with a non-empty series. */
    public static Optional<EpochMetric> referenceMetric(EpochSegment segment) {
        for (EpochMetric metric : EpochMetric.values()) {
            if (!segment.seriesOf(metric).isEmpty()) {
                return Optional.of(metric);
            }
        }
        return Optional.empty();
    }

    private void warn(List<ProcessingWarningDTO> warnings, String nightId, String message) {
        LOG.warnf("Night %s: %s", nightId, message);
        warnings.add(new ProcessingWarningDTO(
                ReportProperties.Stages.FLATTEN, nightId, null, message));
    }

    private void recordWarnings(int count) {
        if (meterRegistry == null || count == 0) {
            return;
        }

        Counter.builder("sleep_report_warnings_total")
                .description("Total number of recoverable row-level problems by pipeline stage")
                .tag("stage", ReportProperties.Stages.FLATTEN)
                .register(meterRegistry)
                .increment(count);
    }
}
