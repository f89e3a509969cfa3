package com.podvalidation.backend.dto;

import com.podvalidation.backend.model.DeliveryItem;
import com.podvalidation.backend.model.StampDetection;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * OCR output for one ingested file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to register an OCR-processed document")
public class RegisterDocumentRequest {

    @Schema(description = "Delivery the document belongs to")
    private String deliveryId;

    @NotBlank(message = "originalName is required")
    @Schema(description = "Original file name", example = "page-1.jpg")
    private String originalName;

    @Schema(description = "File size in bytes")
    private long size;

    @Schema(description = "MIME type", example = "image/jpeg")
    private String mimeType;

    @Schema(description = "OCR-extracted text")
    private String rawText;

    @DecimalMin(value = "0.0", message = "ocrConfidence must be between 0 and 100")
    @DecimalMax(value = "100.0", message = "ocrConfidence must be between 0 and 100")
    @Schema(description = "OCR confidence (0-100)")
    private Double ocrConfidence;

    @Schema(description = "Stamps and signatures detected on the page")
    private StampDetection stampDetection;

    @Builder.Default
    @Schema(description = "Normalized line items")
    private List<DeliveryItem> items = new ArrayList<>();
}
