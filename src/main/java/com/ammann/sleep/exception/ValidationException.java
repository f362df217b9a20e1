package com.ammann.sleep.exception;

import java.util.Collection;
import java.util.TreeSet;

/**
 * Exception indicating that a whole input batch, or a caller-supplied parameter, does not meet
 * the constraints required to process it.
 *
 * <p>Thrown for fatal conditions only: the batch is aborted with a single descriptive cause.
 * Provides factory methods for common validation failure patterns.
 */
public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates validation exception for a column/key set that matches none of the known input shapes.
     */
    public static ValidationException unrecognizedInputShape(Collection<String> columns) {
        return new ValidationException(
                String.format("Unrecognized input shape: no start-date column among %s",
                        new TreeSet<>(columns)));
    }

    /**
     * Creates validation exception for a required column that is absent or blank.
     */
    public static ValidationException missingRequiredColumn(String column, int rowIndex) {
        return new ValidationException(
                String.format("Missing required column '%s' in row %d", column, rowIndex));
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }

    /**
     * Creates validation exception for a vendor response carrying a non-zero status code.
     */
    public static ValidationException vendorStatus(int status) {
        if (status == 293) {
            return new ValidationException(
                    "Vendor returned status 293: no sleep data in the requested range");
        }
        return new ValidationException(
                String.format("Vendor returned non-zero status %d", status));
    }
}
