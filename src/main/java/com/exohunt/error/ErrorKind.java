package com.exohunt.error;

/**
 * Stable, user-visible error kinds.
 * The label is part of the public contract and must not change between releases.
 */
public enum ErrorKind {

    DATA_FORMAT("DataFormatError"),
    INSUFFICIENT_DATA("InsufficientDataError"),
    INVALID_PARAMETER("InvalidParameterError"),
    TIMEOUT("TimeoutError"),
    MISSING_FEATURE("MissingFeatureError"),
    MODEL_UNAVAILABLE("ModelUnavailableError"),
    /** A failure that is not one of the typed kinds above; reported instead of aborting sibling results. */
    INTERNAL("InternalError");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
