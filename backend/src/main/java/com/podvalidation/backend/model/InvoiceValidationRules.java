package com.podvalidation.backend.model;

import java.util.List;

/**
 * Invoice comparison settings. {@code compareFields} narrows the comparisons to the listed fields
 * ({@code poNumber}, {@code totalCases}, {@code items}); an empty list compares every field whose
 * flag is set.
 */
public record InvoiceValidationRules(
        boolean enabled,
        boolean requirePOMatch,
        boolean requireTotalCasesMatch,
        double allowedVariancePercent,
        boolean requireItemLevelMatch,
        List<String> compareFields) {

    public static final String FIELD_PO_NUMBER = "poNumber";
    public static final String FIELD_TOTAL_CASES = "totalCases";
    public static final String FIELD_ITEMS = "items";

    public InvoiceValidationRules {
        compareFields = compareFields == null ? List.of() : List.copyOf(compareFields);
        if (allowedVariancePercent < 0) {
            throw new IllegalArgumentException("allowedVariancePercent must not be negative");
        }
    }

    public static InvoiceValidationRules disabled() {
        return new InvoiceValidationRules(false, false, false, 0, false, List.of());
    }

    public boolean compares(String field) {
        return compareFields.isEmpty() || compareFields.contains(field);
    }
}
