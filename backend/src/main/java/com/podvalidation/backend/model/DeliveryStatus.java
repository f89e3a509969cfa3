package com.podvalidation.backend.model;

/**
 * Lifecycle status of a delivery's validation.
 */
public enum DeliveryStatus {
    PENDING,
    COMPLETED,
    FAILED
}
