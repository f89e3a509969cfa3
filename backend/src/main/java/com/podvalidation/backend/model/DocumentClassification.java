package com.podvalidation.backend.model;

import com.podvalidation.backend.classification.AutomaticClassification;
import com.podvalidation.backend.classification.ClassificationResult;
import com.podvalidation.backend.classification.ManualOverride;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Stored form of a {@link ClassificationResult}, embedded in {@link PodDocument}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentClassification {

    private DocumentType detectedType;
    private double confidence;

    @Builder.Default
    private List<AlternativeType> alternativeTypes = new ArrayList<>();

    @Builder.Default
    private List<String> matchedKeywords = new ArrayList<>();

    private boolean manualOverride;
    private String overrideReason;
    private String overrideBy;
    private Instant overrideTimestamp;

    private boolean inferredFromContext;
    private Instant classifiedAt;

    public static DocumentClassification from(ClassificationResult result) {
        DocumentClassificationBuilder builder = DocumentClassification.builder()
                .detectedType(result.detectedType())
                .confidence(result.confidence())
                .alternativeTypes(new ArrayList<>(result.alternativeTypes()))
                .matchedKeywords(new ArrayList<>(result.matchedKeywords()))
                .inferredFromContext(result.inferredFromContext());

        if (result instanceof ManualOverride override) {
            builder.manualOverride(true)
                    .overrideReason(override.reason())
                    .overrideBy(override.overrideBy())
                    .overrideTimestamp(override.overrideTimestamp())
                    .classifiedAt(override.overrideTimestamp());
        } else if (result instanceof AutomaticClassification automatic) {
            builder.classifiedAt(automatic.classifiedAt());
        }
        return builder.build();
    }

    public ClassificationResult toResult() {
        if (manualOverride) {
            return new ManualOverride(detectedType, alternativeTypes, matchedKeywords,
                    overrideReason, overrideBy, overrideTimestamp);
        }
        return new AutomaticClassification(detectedType, confidence, alternativeTypes, matchedKeywords,
                inferredFromContext, classifiedAt);
    }
}
