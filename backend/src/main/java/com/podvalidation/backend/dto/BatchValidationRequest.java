package com.podvalidation.backend.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchValidationRequest {

    @NotEmpty(message = "deliveryIds must not be empty")
    private List<String> deliveryIds;
}
