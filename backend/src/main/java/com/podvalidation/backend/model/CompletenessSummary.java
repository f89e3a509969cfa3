package com.podvalidation.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompletenessSummary {

    @Builder.Default
    private List<DocumentType> requiredDocuments = new ArrayList<>();

    @Builder.Default
    private List<DocumentType> missingDocuments = new ArrayList<>();

    @Builder.Default
    private List<DocumentType> extraDocuments = new ArrayList<>();
}
