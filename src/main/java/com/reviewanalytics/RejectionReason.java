package com.reviewanalytics;

/**
 * Why a raw record was dropped during cleaning. Order matches the order in
 * which the rules run: a record is tagged with the first rule it fails.
 */
public enum RejectionReason {
    INVALID_RATING,
    INVALID_DATE,
    MISSING_IDENTIFIER
}
