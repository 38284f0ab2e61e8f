package com.exohunt.error;

import com.exohunt.model.AnalysisError;

/**
 * Base class of every typed failure raised by the light-curve core.
 *
 * <p>Each subclass maps to exactly one {@link ErrorKind}. Callers that surface errors to users
 * should use {@link #toError()} so that only the kind and message leave the process.
 */
public abstract class AnalysisException extends RuntimeException {

    private final ErrorKind kind;

    protected AnalysisException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected AnalysisException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public AnalysisError toError() {
        return new AnalysisError(kind.getLabel(), getMessage());
    }
}
