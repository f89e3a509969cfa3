package com.podvalidation.backend.model;

/**
 * Signature roles reported by the external signature detector.
 */
public enum SignatureType {
    DRIVER,
    RECEIVER,
    CUSTOMER,
    SECURITY,
    WAREHOUSE_STAFF,
    CARRIER,
    STORE_MANAGER
}
