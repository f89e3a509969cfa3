package com.podvalidation.backend.dto;

import com.podvalidation.backend.model.ValidationRuleSet;
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
@Schema(description = "Client rule set to store")
public class ClientConfigRequest {

    @NotBlank(message = "clientName is required")
    private String clientName;

    private String description;

    @NotNull(message = "validationRules is required")
    private ValidationRuleSet validationRules;

    @Schema(description = "Operator making the change")
    private String updatedBy;
}
