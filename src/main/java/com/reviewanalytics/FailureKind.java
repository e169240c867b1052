package com.reviewanalytics;

/**
 * Classification of a failed run, reported back to whoever triggered it.
 */
public enum FailureKind {
    /** Input location missing or unreadable. Nothing is written. */
    SOURCE_UNAVAILABLE,
    /** An artifact could not be staged or published under the output root. */
    WRITE_FAILURE
}
