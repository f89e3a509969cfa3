package com.podvalidation.backend.dto;

import com.podvalidation.backend.model.DocumentType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Operator decision on a document's type")
public class ManualOverrideRequest {

    @NotNull(message = "documentType is required")
    @Schema(description = "Type to assign")
    private DocumentType documentType;

    @Schema(description = "Why the automatic classification was wrong")
    private String reason;

    @NotBlank(message = "overrideBy is required")
    @Schema(description = "Operator applying the override")
    private String overrideBy;
}
