package com.podvalidation.backend.classification;

import com.podvalidation.backend.model.AlternativeType;
import com.podvalidation.backend.model.DocumentType;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Operator decision on a document's type. Keywords and alternatives of the automatic result it
 * replaced are kept for audit.
 */
public record ManualOverride(
        DocumentType detectedType,
        List<AlternativeType> alternativeTypes,
        List<String> matchedKeywords,
        String reason,
        String overrideBy,
        Instant overrideTimestamp) implements ClassificationResult {

    public static final double OVERRIDE_CONFIDENCE = 100.0;

    public ManualOverride {
        Objects.requireNonNull(detectedType, "detectedType");
        Objects.requireNonNull(overrideBy, "overrideBy");
        Objects.requireNonNull(overrideTimestamp, "overrideTimestamp");
        alternativeTypes = alternativeTypes == null ? List.of() : List.copyOf(alternativeTypes);
        matchedKeywords = matchedKeywords == null ? List.of() : List.copyOf(matchedKeywords);
    }

    @Override
    public double confidence() {
        return OVERRIDE_CONFIDENCE;
    }

    @Override
    public boolean inferredFromContext() {
        return false;
    }
}
