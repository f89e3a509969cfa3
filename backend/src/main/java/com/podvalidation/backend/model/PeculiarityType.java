package com.podvalidation.backend.model;

/**
 * Categories used to triage non-passing checks.
 */
public enum PeculiarityType {
    MISSING_REQUIRED_DOCUMENT,
    DOCUMENT_TYPE_UNKNOWN,
    LOW_CLASSIFICATION_CONFIDENCE,
    MISSING_STAMP,
    SIGNATURE_MISSING,
    MISSING_REQUIRED_FIELD,
    QUANTITY_MISMATCH,
    CROSS_DOCUMENT_MISMATCH,
    CONFLICTING_INFORMATION,
    DATA_UNAVAILABLE
}
