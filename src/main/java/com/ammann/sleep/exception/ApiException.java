package com.ammann.sleep.exception;

/**
 * Base unchecked exception for errors that abort a report run.
 *
 * <p>Row-level problems are never thrown; they travel as warnings next to the result.
 */
public class ApiException extends RuntimeException
{
    public ApiException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
