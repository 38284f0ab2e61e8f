package com.exohunt.model;

/**
 * Output classes of the classifier, in the order of its probability vector.
 */
public enum Classification {
    FALSE_POSITIVE,
    CANDIDATE,
    CONFIRMED
}
