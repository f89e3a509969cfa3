package com.podvalidation.backend.model;

public record CrossDocumentValidationRules(
        boolean enabled,
        boolean validateInvoiceRAR,
        int allowedDiscrepancyCount,
        boolean strictMode) {

    public CrossDocumentValidationRules {
        if (allowedDiscrepancyCount < 0) {
            throw new IllegalArgumentException("allowedDiscrepancyCount must not be negative");
        }
    }

    public static CrossDocumentValidationRules disabled() {
        return new CrossDocumentValidationRules(false, false, 0, false);
    }
}
