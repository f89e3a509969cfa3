package com.podvalidation.backend.validation;

import org.springframework.stereotype.Component;

/**
 * Fallback validator for clients without a dedicated implementation.
 */
@Component
public class GenericChecklistValidator extends AbstractChecklistValidator {

    public static final String CLIENT_IDENTIFIER = "DEFAULT";

    public GenericChecklistValidator(DocumentFieldExtractor fieldExtractor) {
        super(fieldExtractor);
    }

    @Override
    public String getClientIdentifier() {
        return CLIENT_IDENTIFIER;
    }

    @Override
    public String getName() {
        return "Generic Checklist Validator";
    }

    @Override
    public String getVersion() {
        return "1.0.0";
    }
}
