package com.podvalidation.backend.config;

import com.podvalidation.backend.classification.ClassificationSettings;
import com.podvalidation.backend.classification.DocumentClassifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClassificationConfig {

    @Value("${pod.classification.detection-threshold:25}")
    private double detectionThreshold;

    @Value("${pod.classification.degraded-ocr-below:75}")
    private double degradedOcrBelow;

    @Value("${pod.classification.degraded-threshold:20}")
    private double degradedThreshold;

    @Value("${pod.classification.ocr-floor:60}")
    private double ocrFloor;

    @Value("${pod.classification.low-ocr-threshold:15}")
    private double lowOcrThreshold;

    @Value("${pod.classification.low-ocr-confidence-cap:50}")
    private double lowOcrConfidenceCap;

    @Value("${pod.classification.max-score:60}")
    private double maxScore;

    @Value("${pod.classification.inferred-confidence:40}")
    private double inferredConfidence;

    @Bean
    public ClassificationSettings classificationSettings() {
        return new ClassificationSettings(detectionThreshold, degradedOcrBelow, degradedThreshold, ocrFloor,
                lowOcrThreshold, lowOcrConfidenceCap, maxScore, inferredConfidence);
    }

    @Bean
    public DocumentClassifier documentClassifier(ClassificationSettings classificationSettings) {
        return new DocumentClassifier(classificationSettings);
    }
}
