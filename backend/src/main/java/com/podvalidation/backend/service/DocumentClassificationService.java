package com.podvalidation.backend.service;

import com.podvalidation.backend.classification.AutomaticClassification;
import com.podvalidation.backend.classification.ClassificationContext;
import com.podvalidation.backend.classification.ClassificationResult;
import com.podvalidation.backend.classification.ClassificationSettings;
import com.podvalidation.backend.classification.DocumentClassifier;
import com.podvalidation.backend.classification.ManualOverride;
import com.podvalidation.backend.classification.TypeScore;
import com.podvalidation.backend.dto.ClassificationResponse;
import com.podvalidation.backend.dto.DiagnosticsResponse;
import com.podvalidation.backend.exception.NotFoundException;
import com.podvalidation.backend.model.Delivery;
import com.podvalidation.backend.model.DocumentClassification;
import com.podvalidation.backend.model.DocumentType;
import com.podvalidation.backend.model.PodDocument;
import com.podvalidation.backend.repository.DeliveryRepository;
import com.podvalidation.backend.repository.PodDocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Classifies stored documents and keeps the owning delivery's cached type in step.
 * <p>
 * Writes go to the document first and to the delivery second. A failure between the two leaves a
 * stale cache entry that {@link DeliveryConsistencyService} detects and repairs.
 */
@Service
public class DocumentClassificationService {

    private static final Logger log = LoggerFactory.getLogger(DocumentClassificationService.class);

    private final PodDocumentRepository podDocumentRepository;
    private final DeliveryRepository deliveryRepository;
    private final DocumentClassifier classifier;
    private final int textPreviewLength;

    public DocumentClassificationService(PodDocumentRepository podDocumentRepository,
            DeliveryRepository deliveryRepository,
            DocumentClassifier classifier,
            @Value("${pod.diagnostics.text-preview-length:500}") int textPreviewLength) {
        this.podDocumentRepository = podDocumentRepository;
        this.deliveryRepository = deliveryRepository;
        this.classifier = classifier;
        this.textPreviewLength = textPreviewLength;
    }

    public ClassificationResult classifyDocument(String documentId) {
        return classifyDocument(documentId, false);
    }

    /**
     * Runs automatic classification. A manual override is returned unchanged unless {@code force}
     * is set, in which case the automatic result replaces it.
     */
    public ClassificationResult classifyDocument(String documentId, boolean force) {
        PodDocument document = podDocumentRepository.findById(documentId)
                .orElseThrow(() -> NotFoundException.document(documentId));

        DocumentClassification existing = document.getClassification();
        if (!force && existing != null && existing.isManualOverride()) {
            log.info("[CLASSIFY] Document: {} | manual override kept | type: {} | by: {}",
                    documentId, existing.getDetectedType(), existing.getOverrideBy());
            return existing.toResult();
        }

        AutomaticClassification result = classifier.classify(
                document.getRawText(), document.getOcrConfidence(), contextFor(document));

        if (force) {
            podDocumentRepository.forceAutomaticClassification(documentId, result);
        } else if (!podDocumentRepository.writeAutomaticClassification(documentId, result)) {
            // overridden or removed since it was read
            PodDocument current = podDocumentRepository.findById(documentId)
                    .orElseThrow(() -> NotFoundException.document(documentId));
            log.info("[CLASSIFY] Document: {} | overridden concurrently, automatic result discarded", documentId);
            return current.getClassification().toResult();
        }

        log.info("[CLASSIFY] Document: {} | type: {} | confidence: {} | inferred: {} | keywords: {}",
                documentId, result.detectedType(), result.confidence(), result.inferredFromContext(),
                result.matchedKeywords().size());

        syncDeliveryReference(document, result.detectedType());
        return result;
    }

    public ClassificationResult applyManualOverride(String documentId, DocumentType type, String reason, String actor) {
        if (type == null) {
            throw new IllegalArgumentException("documentType is required");
        }
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("overrideBy is required");
        }
        PodDocument document = podDocumentRepository.findById(documentId)
                .orElseThrow(() -> NotFoundException.document(documentId));

        DocumentClassification previous = document.getClassification();
        ManualOverride override = new ManualOverride(
                type,
                previous != null ? previous.getAlternativeTypes() : List.of(),
                previous != null ? previous.getMatchedKeywords() : List.of(),
                reason == null || reason.isBlank() ? "Manual override" : reason,
                actor,
                Instant.now());

        if (!podDocumentRepository.writeManualOverride(documentId, override)) {
            throw NotFoundException.document(documentId);
        }
        log.info("[CLASSIFY] Document: {} | manual override | {} -> {} | by: {} | reason: {}",
                documentId, previous != null ? previous.getDetectedType() : null, type, actor, override.reason());

        syncDeliveryReference(document, type);
        return override;
    }

    /**
     * Classifies every document of a delivery in reference order.
     */
    public Map<String, ClassificationResult> classifyDelivery(String deliveryId, boolean force) {
        Delivery delivery = deliveryRepository.findById(deliveryId)
                .orElseThrow(() -> NotFoundException.delivery(deliveryId));

        Map<String, ClassificationResult> results = new LinkedHashMap<>();
        delivery.getDocuments().forEach(reference ->
                results.put(reference.getDocumentId(), classifyDocument(reference.getDocumentId(), force)));
        log.info("[CLASSIFY] Delivery: {} | classified {} document(s)", deliveryId, results.size());
        return results;
    }

    public DiagnosticsResponse diagnose(String documentId) {
        PodDocument document = podDocumentRepository.findById(documentId)
                .orElseThrow(() -> NotFoundException.document(documentId));

        ClassificationSettings settings = classifier.getSettings();
        String text = document.getRawText() == null ? "" : document.getRawText();
        double ocr = ClassificationSettings.effectiveOcr(document.getOcrConfidence());
        double threshold = settings.thresholdFor(document.getOcrConfidence());
        List<TypeScore> scores = classifier.score(text);
        DocumentClassification classification = document.getClassification();

        String quality = ocr < settings.ocrFloor() ? "POOR" : ocr < settings.degradedOcrBelow() ? "DEGRADED" : "GOOD";

        List<String> suggestions = new ArrayList<>();
        if (text.isBlank()) {
            suggestions.add("No OCR text available; re-run OCR or re-scan the page");
        } else if (text.length() < 100) {
            suggestions.add("Very little text was extracted; check image quality");
        }
        if (ocr < settings.ocrFloor()) {
            suggestions.add("OCR confidence is low; re-scan at higher resolution");
        }
        if (scores.isEmpty() || scores.get(0).score() == 0) {
            suggestions.add("No document keywords found; apply a manual override");
        } else if (classifier.toConfidence(scores.get(0).score()) < threshold) {
            suggestions.add("Best match " + scores.get(0).type() + " is below the detection threshold; "
                    + "review and apply a manual override if needed");
        }
        if (classification != null && classification.isInferredFromContext()) {
            suggestions.add("Type was inferred from the other documents of the delivery; please confirm");
        }

        return DiagnosticsResponse.builder()
                .documentId(documentId)
                .classification(classification != null
                        ? ClassificationResponse.from(documentId, classification.toResult())
                        : null)
                .ocrConfidence(document.getOcrConfidence())
                .ocrQuality(quality)
                .detectionThreshold(threshold)
                .scores(scores)
                .textLength(text.length())
                .textPreview(text.length() > textPreviewLength ? text.substring(0, textPreviewLength) : text)
                .suggestions(suggestions)
                .build();
    }

    private ClassificationContext contextFor(PodDocument document) {
        Optional<String> deliveryId = owningDeliveryId(document);
        if (deliveryId.isEmpty()) {
            return ClassificationContext.standalone();
        }
        List<DocumentType> siblingTypes = podDocumentRepository.findByDeliveryId(deliveryId.get()).stream()
                .filter(sibling -> !Objects.equals(sibling.getId(), document.getId()))
                .map(PodDocument::resolvedType)
                .toList();
        return ClassificationContext.of(siblingTypes);
    }

    private void syncDeliveryReference(PodDocument document, DocumentType type) {
        Optional<String> deliveryId = owningDeliveryId(document);
        if (deliveryId.isEmpty()) {
            return;
        }
        if (!deliveryRepository.updateDocumentType(deliveryId.get(), document.getId(), type)) {
            log.warn("[CLASSIFY] Document: {} | delivery {} does not reference it, cache not updated",
                    document.getId(), deliveryId.get());
        }
    }

    private Optional<String> owningDeliveryId(PodDocument document) {
        if (document.getDeliveryId() != null) {
            return Optional.of(document.getDeliveryId());
        }
        return deliveryRepository.findFirstByDocumentsDocumentId(document.getId()).map(Delivery::getId);
    }
}
