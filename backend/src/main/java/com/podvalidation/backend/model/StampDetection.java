package com.podvalidation.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Stamps and signatures found on a page by the external detectors.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StampDetection {

    @Builder.Default
    private List<StampInfo> stamps = new ArrayList<>();

    @Builder.Default
    private List<SignatureInfo> signatures = new ArrayList<>();

    public boolean hasStamp(StampType type) {
        return stamps != null && stamps.stream().anyMatch(stamp -> stamp.getType() == type);
    }

    public boolean hasSignature(SignatureType type) {
        return signatures != null && signatures.stream()
                .anyMatch(signature -> signature.getType() == type && signature.isPresent());
    }
}
