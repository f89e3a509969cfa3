package com.podvalidation.backend.dto;

import com.podvalidation.backend.model.DeliveryItem;
import com.podvalidation.backend.model.FileMetadata;
import com.podvalidation.backend.model.StampDetection;
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
@Schema(description = "Document details response")
public class DocumentResponse {

    @Schema(description = "Document ID")
    private String id;

    @Schema(description = "Owning delivery ID")
    private String deliveryId;

    private FileMetadata fileMetadata;

    @Schema(description = "OCR confidence (0-100)")
    private Double ocrConfidence;

    @Schema(description = "Length of the OCR text")
    private int textLength;

    private StampDetection stampDetection;
    private List<DeliveryItem> items;

    @Schema(description = "Current classification, absent until classified")
    private ClassificationResponse classification;

    private Instant createdAt;
    private Instant updatedAt;
}
