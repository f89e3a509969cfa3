package com.podvalidation.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessingMetadata {
    private long processingTimeMs;
    private int documentsProcessed;
    private int documentsUnclassified;
    private int staleReferencesRepaired;
}
