package com.podvalidation.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Full checklist report for one delivery, replaced as a whole by every validation run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationResult {

    private CheckStatus status;
    private String message;
    private ValidationSummary summary;

    private String validatorName;
    private String validatorVersion;
    private String clientIdentifier;

    // Scenario after AUTO_DETECT resolution
    private PalletScenario palletScenario;

    @Builder.Default
    private List<SectionResult> sections = new ArrayList<>();

    @Builder.Default
    private List<SkippedSection> skippedSections = new ArrayList<>();

    private CompletenessSummary documentCompleteness;

    @Builder.Default
    private List<Peculiarity> peculiarities = new ArrayList<>();

    private Instant validatedAt;

    public SectionResult section(ChecklistSectionType type) {
        return sections.stream()
                .filter(section -> section.getSection() == type)
                .findFirst()
                .orElse(null);
    }
}
