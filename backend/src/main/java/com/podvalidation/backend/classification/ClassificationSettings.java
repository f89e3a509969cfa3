package com.podvalidation.backend.classification;

/**
 * Thresholds for turning keyword scores into a decision.
 *
 * @param detectionThreshold     minimum confidence to accept a type with good OCR
 * @param degradedOcrBelow       OCR confidence under which {@code degradedThreshold} applies
 * @param degradedThreshold      detection threshold for degraded OCR
 * @param ocrFloor               OCR confidence under which {@code lowOcrThreshold} applies and
 *                               confidence is capped
 * @param lowOcrThreshold        detection threshold for poor OCR
 * @param lowOcrConfidenceCap    maximum confidence reported for poor OCR
 * @param maxScore               score mapped to 100% confidence
 * @param inferredConfidence     confidence reported for a type inferred from context
 */
public record ClassificationSettings(
        double detectionThreshold,
        double degradedOcrBelow,
        double degradedThreshold,
        double ocrFloor,
        double lowOcrThreshold,
        double lowOcrConfidenceCap,
        double maxScore,
        double inferredConfidence) {

    public static ClassificationSettings defaults() {
        return new ClassificationSettings(25, 75, 20, 60, 15, 50, 60, 40);
    }

    public double thresholdFor(Double ocrConfidence) {
        double ocr = effectiveOcr(ocrConfidence);
        if (ocr < ocrFloor) {
            return lowOcrThreshold;
        }
        if (ocr < degradedOcrBelow) {
            return degradedThreshold;
        }
        return detectionThreshold;
    }

    public boolean isBelowFloor(Double ocrConfidence) {
        return effectiveOcr(ocrConfidence) < ocrFloor;
    }

    public static double effectiveOcr(Double ocrConfidence) {
        return ocrConfidence == null ? 100.0 : ocrConfidence;
    }
}
