package com.podvalidation.backend.dto;

import com.podvalidation.backend.classification.AutomaticClassification;
import com.podvalidation.backend.classification.ClassificationResult;
import com.podvalidation.backend.classification.ManualOverride;
import com.podvalidation.backend.model.AlternativeType;
import com.podvalidation.backend.model.DocumentType;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Classification of one document")
public class ClassificationResponse {

    public static final String AUTOMATIC = "AUTOMATIC";
    public static final String MANUAL_OVERRIDE = "MANUAL_OVERRIDE";

    @Schema(description = "Document ID")
    private String documentId;

    @Schema(description = "AUTOMATIC or MANUAL_OVERRIDE")
    private String source;

    @Schema(description = "Detected document type")
    private DocumentType detectedType;

    @Schema(description = "Confidence (0-100)")
    private double confidence;

    @Schema(description = "Next-best candidates, best first")
    private List<AlternativeType> alternativeTypes;

    @Schema(description = "Keywords that contributed to the decision")
    private List<String> matchedKeywords;

    @Schema(description = "Whether an operator decided the type")
    private boolean manualOverride;

    private String overrideReason;
    private String overrideBy;
    private Instant overrideTimestamp;

    @Schema(description = "Whether the type was inferred from the delivery's other documents")
    private boolean inferredFromContext;

    private Instant classifiedAt;

    public static ClassificationResponse from(String documentId, ClassificationResult result) {
        ClassificationResponseBuilder builder = ClassificationResponse.builder()
                .documentId(documentId)
                .detectedType(result.detectedType())
                .confidence(result.confidence())
                .alternativeTypes(result.alternativeTypes())
                .matchedKeywords(result.matchedKeywords())
                .manualOverride(result.isManualOverride())
                .inferredFromContext(result.inferredFromContext());
        if (result instanceof ManualOverride override) {
            builder.source(MANUAL_OVERRIDE)
                    .overrideReason(override.reason())
                    .overrideBy(override.overrideBy())
                    .overrideTimestamp(override.overrideTimestamp())
                    .classifiedAt(override.overrideTimestamp());
        } else if (result instanceof AutomaticClassification automatic) {
            builder.source(AUTOMATIC).classifiedAt(automatic.classifiedAt());
        }
        return builder.build();
    }
}
