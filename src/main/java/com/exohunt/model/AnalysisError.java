package com.exohunt.model;

/**
 * User-visible failure: a stable error kind plus a message. Never carries a stack trace.
 */
public record AnalysisError(String kind, String message) {
}
