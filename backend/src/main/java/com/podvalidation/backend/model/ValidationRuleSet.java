package com.podvalidation.backend.model;

/**
 * Immutable per-client checklist configuration with five independently toggleable sections.
 * A section left out of the configuration is treated as disabled.
 */
public record ValidationRuleSet(
        DocumentCompletenessRules documentCompleteness,
        PalletValidationRules palletValidation,
        ShipDocumentValidationRules shipDocumentValidation,
        InvoiceValidationRules invoiceValidation,
        CrossDocumentValidationRules crossDocumentValidation) {

    public ValidationRuleSet {
        if (documentCompleteness == null) {
            documentCompleteness = DocumentCompletenessRules.disabled();
        }
        if (palletValidation == null) {
            palletValidation = PalletValidationRules.disabled();
        }
        if (shipDocumentValidation == null) {
            shipDocumentValidation = ShipDocumentValidationRules.disabled();
        }
        if (invoiceValidation == null) {
            invoiceValidation = InvoiceValidationRules.disabled();
        }
        if (crossDocumentValidation == null) {
            crossDocumentValidation = CrossDocumentValidationRules.disabled();
        }
    }
}
