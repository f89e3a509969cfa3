package com.podvalidation.backend.dto;

import com.podvalidation.backend.model.DeliveryDocumentRef;
import com.podvalidation.backend.model.DeliveryStatus;
import com.podvalidation.backend.model.ProcessingMetadata;
import com.podvalidation.backend.model.ValidationResult;
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
@Schema(description = "Delivery details response")
public class DeliveryResponse {

    @Schema(description = "Delivery ID")
    private String id;

    private String deliveryReference;
    private String clientIdentifier;

    @Schema(description = "Referenced documents with their cached types")
    private List<DeliveryDocumentRef> documents;

    @Schema(description = "Validation status")
    private DeliveryStatus status;

    @Schema(description = "Last validation result")
    private ValidationResult validationResult;

    @Schema(description = "Reason of the last failed validation run")
    private String errorMessage;

    private Instant lastValidatedAt;
    private ProcessingMetadata processingMetadata;
    private Instant createdAt;
    private Instant updatedAt;
}
