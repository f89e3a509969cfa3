package com.podvalidation.backend.model;

/**
 * Outcome of a single checklist check.
 */
public enum CheckStatus {
    PASSED,
    FAILED,
    WARNING
}
