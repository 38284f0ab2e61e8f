package com.exohunt.error;

import java.time.Duration;

/**
 * Raised when an external archive download exceeds its own timeout.
 * Kept separate from computation errors so callers can retry fetches independently.
 */
public class FetchTimeoutException extends AnalysisException {

    private final String target;
    private final Duration timeout;

    public FetchTimeoutException(String target, Duration timeout, Throwable cause) {
        super(ErrorKind.TIMEOUT, String.format("Fetching %s timed out after %d ms", target, timeout.toMillis()), cause);
        this.target = target;
        this.timeout = timeout;
    }

    public String getTarget() {
        return target;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
