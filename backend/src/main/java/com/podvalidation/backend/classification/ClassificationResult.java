package com.podvalidation.backend.classification;

import com.podvalidation.backend.model.AlternativeType;
import com.podvalidation.backend.model.DocumentType;

import java.util.List;

/**
 * Outcome of classifying one document: either produced by the keyword engine or decided by an
 * operator. Persistence code accepts the two variants through separate write paths, so an
 * automatic result can never be written over an override by accident.
 */
public sealed interface ClassificationResult permits AutomaticClassification, ManualOverride {

    DocumentType detectedType();

    double confidence();

    List<AlternativeType> alternativeTypes();

    List<String> matchedKeywords();

    boolean inferredFromContext();

    default boolean isManualOverride() {
        return this instanceof ManualOverride;
    }
}
