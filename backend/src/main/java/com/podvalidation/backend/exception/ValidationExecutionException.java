package com.podvalidation.backend.exception;

/**
 * A validator threw while evaluating a delivery. No result was persisted for the run.
 */
public class ValidationExecutionException extends RuntimeException {

    private final String deliveryId;

    public ValidationExecutionException(String deliveryId, String message, Throwable cause) {
        super(message, cause);
        this.deliveryId = deliveryId;
    }

    public String getDeliveryId() {
        return deliveryId;
    }
}
