package com.podvalidation.backend.classification;

import com.podvalidation.backend.model.AlternativeType;
import com.podvalidation.backend.model.DocumentType;

import java.time.Instant;
import java.util.List;

public record AutomaticClassification(
        DocumentType detectedType,
        double confidence,
        List<AlternativeType> alternativeTypes,
        List<String> matchedKeywords,
        boolean inferredFromContext,
        Instant classifiedAt) implements ClassificationResult {

    public AutomaticClassification {
        alternativeTypes = alternativeTypes == null ? List.of() : List.copyOf(alternativeTypes);
        matchedKeywords = matchedKeywords == null ? List.of() : List.copyOf(matchedKeywords);
    }

    public static AutomaticClassification unknown(Instant classifiedAt) {
        return new AutomaticClassification(DocumentType.UNKNOWN, 0, List.of(), List.of(), false, classifiedAt);
    }
}
