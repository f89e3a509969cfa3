package com.podvalidation.backend.model;

/**
 * Stamp kinds reported by the external stamp detector.
 */
public enum StampType {
    DISPATCH,
    NO_PALLET,
    PALLET,
    WAREHOUSE,
    LOSCAM,
    SECURITY,
    OTHER
}
