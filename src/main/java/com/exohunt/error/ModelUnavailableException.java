package com.exohunt.error;

/**
 * Raised when the classifier cannot be reached or returns malformed output.
 */
public class ModelUnavailableException extends AnalysisException {

    public ModelUnavailableException(String message) {
        super(ErrorKind.MODEL_UNAVAILABLE, message);
    }

    public ModelUnavailableException(String message, Throwable cause) {
        super(ErrorKind.MODEL_UNAVAILABLE, message, cause);
    }
}
