package com.podvalidation.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationCheck {
    private String name;
    private CheckStatus status;
    private String message;

    // Peculiarity category used when the check does not pass
    private PeculiarityType type;
    private String fieldPath;
    private Map<String, Object> details;
}
