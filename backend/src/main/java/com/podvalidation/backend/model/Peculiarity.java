package com.podvalidation.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Flattened non-passing check for quick operator triage.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Peculiarity {
    private PeculiarityType type;
    private Severity severity;
    private String description;
    private ChecklistSectionType section;
    private String fieldPath;
}
