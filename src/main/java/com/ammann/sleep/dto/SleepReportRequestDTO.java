/* (C)2026 */
package com.ammann.sleep.dto;

import com.ammann.sleep.exception.ValidationException;
import com.ammann.sleep.model.EpochRecord;
import com.ammann.sleep.model.EpochSample;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Input of one report run.
 *
 * <p>Summary rows are mandatory and may come in any supported shape. Epoch data is optional and
 * is given either as vendor {@link EpochRecord}s (flattened by the pipeline) or as already dense
 * {@link EpochSample}s (read from an epoch export). Unset switches fall back to configuration.
 */
public class SleepReportRequestDTO {

    /** Subject or lab label used when a row carries none. */
    public String label;

    public List<Map<String, Object>> summaryRows = List.of();

    public List<EpochRecord> epochRecords;

    public List<EpochSample> epochSamples;

    /** Inclusive UTC day on or after which a night must end. */
    public LocalDate startDate;

    /** Inclusive UTC day on or before which a night must end. */
    public LocalDate endDate;

    public Boolean applyTimezone;

    public Boolean napFilterEnabled;

    public Double napFilterMinHours;

    public static SleepReportRequestDTO of(String label, List<Map<String, Object>> summaryRows) {
        SleepReportRequestDTO request = new SleepReportRequestDTO();
        request.label = label;
        request.summaryRows = summaryRows;
        return request;
    }

    /**
     * Validate the request parameters.
     *
     * @throws ValidationException if the parameters are inconsistent
     */
    public void validate() {
        if (summaryRows == null) {
            throw ValidationException.invalidParameter("summaryRows", null, "a list of rows");
        }
        if (epochRecords != null && epochSamples != null) {
            throw ValidationException.invalidParameter(
                    "epochSamples", "both epoch records and samples", "at most one epoch source");
        }
        if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
            throw ValidationException.invalidParameter(
                    "endDate", endDate, "a date on or after " + startDate);
        }
        if (napFilterMinHours != null
                && (napFilterMinHours.isNaN() || napFilterMinHours < 0.0)) {
            throw ValidationException.invalidParameter(
                    "napFilterMinHours", napFilterMinHours, "a non-negative number of hours");
        }
    }
}
