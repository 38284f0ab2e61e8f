package com.exohunt.model;

import com.exohunt.error.InvalidParameterException;

/**
 * Outcome of one analysis inside a combined request: either a value or an error.
 */
public record SubResult<T>(T value, AnalysisError error) {

    public SubResult {
        if ((value == null) == (error == null)) {
            throw new InvalidParameterException("Exactly one of value or error must be set");
        }
    }

    public static <T> SubResult<T> ok(T value) {
        return new SubResult<>(value, null);
    }

    public static <T> SubResult<T> failed(AnalysisError error) {
        return new SubResult<>(null, error);
    }

    public boolean isOk() {
        return error == null;
    }
}
