package com.exohunt.error;

/**
 * Raised when too few valid points remain for the requested computation.
 */
public class InsufficientDataException extends AnalysisException {

    public InsufficientDataException(String message) {
        super(ErrorKind.INSUFFICIENT_DATA, message);
    }

    public InsufficientDataException(String message, Throwable cause) {
        super(ErrorKind.INSUFFICIENT_DATA, message, cause);
    }
}
