package com.exohunt.error;

/**
 * Raised for non-positive periods, inverted period bounds, negative thresholds and similar caller errors.
 */
public class InvalidParameterException extends AnalysisException {

    public InvalidParameterException(String message) {
        super(ErrorKind.INVALID_PARAMETER, message);
    }

    public InvalidParameterException(String message, Throwable cause) {
        super(ErrorKind.INVALID_PARAMETER, message, cause);
    }
}
