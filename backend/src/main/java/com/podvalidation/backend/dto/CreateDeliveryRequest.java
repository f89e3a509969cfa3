package com.podvalidation.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to register a delivery")
public class CreateDeliveryRequest {

    @NotBlank(message = "deliveryReference is required")
    @Schema(description = "Human-readable delivery reference", example = "DR-2024-0001")
    private String deliveryReference;

    @NotBlank(message = "clientIdentifier is required")
    @Schema(description = "Client whose checklist applies", example = "SUPER8")
    private String clientIdentifier;
}
