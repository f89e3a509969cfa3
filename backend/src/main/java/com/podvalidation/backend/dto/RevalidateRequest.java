package com.podvalidation.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RevalidateRequest {

    @Schema(description = "New client identifier; keeps the current one when empty")
    private String clientIdentifier;
}
