package com.podvalidation.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered checks produced by one enabled checklist section.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SectionResult {

    private ChecklistSectionType section;

    @Builder.Default
    private List<ValidationCheck> checks = new ArrayList<>();

    public CheckStatus status() {
        if (checks.stream().anyMatch(check -> check.getStatus() == CheckStatus.FAILED)) {
            return CheckStatus.FAILED;
        }
        if (checks.stream().anyMatch(check -> check.getStatus() == CheckStatus.WARNING)) {
            return CheckStatus.WARNING;
        }
        return CheckStatus.PASSED;
    }
}
