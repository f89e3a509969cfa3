package com.podvalidation.backend.validation;

import com.podvalidation.backend.model.Delivery;
import com.podvalidation.backend.model.PodDocument;
import com.podvalidation.backend.model.ValidationResult;
import com.podvalidation.backend.model.ValidationRuleSet;

import java.util.List;

/**
 * Client-specific checklist evaluation. Implementations hold no per-call state; the rule set for
 * the run is passed in explicitly.
 */
public interface DeliveryValidator {

    /**
     * Upper-case client identifier this validator is registered under.
     */
    String getClientIdentifier();

    String getName();

    String getVersion();

    /**
     * @param documents every document referenced by the delivery
     */
    ValidationResult validate(Delivery delivery, List<PodDocument> documents, ValidationRuleSet ruleSet);
}
