package com.podvalidation.backend.dto;

import com.podvalidation.backend.classification.TypeScore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Classification diagnostics for operator review")
public class DiagnosticsResponse {

    private String documentId;
    private ClassificationResponse classification;

    private Double ocrConfidence;

    @Schema(description = "GOOD, DEGRADED or POOR")
    private String ocrQuality;

    @Schema(description = "Detection threshold applied for this OCR quality")
    private double detectionThreshold;

    @Schema(description = "Keyword score per type, best first")
    private List<TypeScore> scores;

    private int textLength;
    private String textPreview;

    private List<String> suggestions;
}
