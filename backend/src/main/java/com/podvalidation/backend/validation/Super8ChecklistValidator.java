package com.podvalidation.backend.validation;

import com.podvalidation.backend.model.PalletScenario;
import com.podvalidation.backend.model.ShipDocumentValidationRules;
import org.springframework.stereotype.Component;

/**
 * Super8 checklist. The guard's security signature and the time-out entry are only written on
 * ship documents that release pallets, so both are required only with pallets.
 */
@Component
public class Super8ChecklistValidator extends AbstractChecklistValidator {

    public static final String CLIENT_IDENTIFIER = "SUPER8";

    public Super8ChecklistValidator(DocumentFieldExtractor fieldExtractor) {
        super(fieldExtractor);
    }

    @Override
    public String getClientIdentifier() {
        return CLIENT_IDENTIFIER;
    }

    @Override
    public String getName() {
        return "Super8 Checklist Validator";
    }

    @Override
    public String getVersion() {
        return "2.0.0";
    }

    @Override
    protected boolean requiresSecuritySignature(ShipDocumentValidationRules rules, PalletScenario scenario) {
        return rules.requireSecuritySignature() && scenario == PalletScenario.WITH_PALLETS;
    }

    @Override
    protected boolean requiresTimeOutField(ShipDocumentValidationRules rules, PalletScenario scenario) {
        return rules.requireTimeOutField() && scenario == PalletScenario.WITH_PALLETS;
    }
}
