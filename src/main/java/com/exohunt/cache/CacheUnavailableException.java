package com.exohunt.cache;

/**
 * Thrown by a {@link CacheStore} whose backing medium cannot be reached.
 */
public class CacheUnavailableException extends RuntimeException {

    public CacheUnavailableException(String message) {
        super(message);
    }

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
