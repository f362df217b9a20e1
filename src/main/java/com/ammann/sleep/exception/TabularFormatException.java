/* (C)2026 */
package com.ammann.sleep.exception;

/**
 * Raised when a tabular export cannot be written or a tabular import cannot be read at all.
 *
 * <p>Individual malformed cells are not fatal and are reported as warnings instead.
 */
public class TabularFormatException extends ApiException {

    public TabularFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
