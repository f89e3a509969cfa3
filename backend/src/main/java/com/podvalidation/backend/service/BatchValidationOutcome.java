package com.podvalidation.backend.service;

import com.podvalidation.backend.model.CheckStatus;

/**
 * Per-delivery result of a batch run; {@code error} is set when the run did not produce a result.
 */
public record BatchValidationOutcome(String deliveryId, boolean success, CheckStatus status, String error) {

    public static BatchValidationOutcome succeeded(String deliveryId, CheckStatus status) {
        return new BatchValidationOutcome(deliveryId, true, status, null);
    }

    public static BatchValidationOutcome failed(String deliveryId, String error) {
        return new BatchValidationOutcome(deliveryId, false, null, error);
    }
}
