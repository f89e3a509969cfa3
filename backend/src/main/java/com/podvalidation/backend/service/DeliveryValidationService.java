package com.podvalidation.backend.service;

import com.podvalidation.backend.exception.ConfigurationException;
import com.podvalidation.backend.exception.NotFoundException;
import com.podvalidation.backend.exception.ValidationExecutionException;
import com.podvalidation.backend.model.Delivery;
import com.podvalidation.backend.model.DeliveryDocumentRef;
import com.podvalidation.backend.model.DocumentType;
import com.podvalidation.backend.model.PodDocument;
import com.podvalidation.backend.model.ProcessingMetadata;
import com.podvalidation.backend.model.ValidationResult;
import com.podvalidation.backend.model.ValidationRuleSet;
import com.podvalidation.backend.repository.DeliveryRepository;
import com.podvalidation.backend.repository.PodDocumentRepository;
import com.podvalidation.backend.validation.ClientRuleRegistry;
import com.podvalidation.backend.validation.DeliveryValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs a delivery's client checklist and persists the outcome.
 * <p>
 * A run either replaces the stored result, status and metadata in one update, or marks the
 * delivery FAILED with a reason and keeps the previous result.
 */
@Service
public class DeliveryValidationService {

    private static final Logger log = LoggerFactory.getLogger(DeliveryValidationService.class);

    private final DeliveryRepository deliveryRepository;
    private final PodDocumentRepository podDocumentRepository;
    private final ClientRuleRegistry ruleRegistry;
    private final DeliveryConsistencyService consistencyService;

    public DeliveryValidationService(DeliveryRepository deliveryRepository,
            PodDocumentRepository podDocumentRepository,
            ClientRuleRegistry ruleRegistry,
            DeliveryConsistencyService consistencyService) {
        this.deliveryRepository = deliveryRepository;
        this.podDocumentRepository = podDocumentRepository;
        this.ruleRegistry = ruleRegistry;
        this.consistencyService = consistencyService;
    }

    public ValidationResult runValidation(String deliveryId) {
        long started = System.currentTimeMillis();

        Delivery delivery = deliveryRepository.findById(deliveryId)
                .orElseThrow(() -> NotFoundException.delivery(deliveryId));
        List<PodDocument> documents = loadDocuments(delivery);

        int repaired = consistencyService.reconcile(delivery, documents).repaired().size();

        DeliveryValidator validator;
        ValidationRuleSet ruleSet;
        try {
            validator = ruleRegistry.getValidator(delivery.getClientIdentifier());
            ruleSet = ruleRegistry.getRuleSet(delivery.getClientIdentifier());
        } catch (ConfigurationException e) {
            log.error("[VALIDATION] Delivery: {} | client: {} | configuration error: {}",
                    deliveryId, delivery.getClientIdentifier(), e.getMessage());
            throw e;
        }

        log.info("[VALIDATION] Delivery: {} | client: {} | validator: {} v{} | documents: {}",
                deliveryId, delivery.getClientIdentifier(), validator.getName(), validator.getVersion(),
                documents.size());

        ValidationResult result;
        try {
            result = validator.validate(delivery, documents, ruleSet);
        } catch (RuntimeException e) {
            String message = validator.getName() + " failed: " + e.getMessage();
            log.error("[VALIDATION] Delivery: {} | {}", deliveryId, message, e);
            deliveryRepository.markValidationFailed(deliveryId, message);
            throw new ValidationExecutionException(deliveryId, message, e);
        }

        ProcessingMetadata metadata = ProcessingMetadata.builder()
                .processingTimeMs(System.currentTimeMillis() - started)
                .documentsProcessed(documents.size())
                .documentsUnclassified((int) documents.stream()
                        .filter(document -> document.resolvedType() == DocumentType.UNKNOWN)
                        .count())
                .staleReferencesRepaired(repaired)
                .build();
        deliveryRepository.replaceValidationResult(deliveryId, result, metadata);

        log.info("[VALIDATION] Delivery: {} | status: {} | checks: {} | peculiarities: {} | {}ms",
                deliveryId, result.getStatus(), result.getSummary().getTotalChecks(),
                result.getPeculiarities().size(), metadata.getProcessingTimeMs());
        return result;
    }

    /**
     * Re-run validation, optionally under a different client's checklist.
     */
    public ValidationResult revalidate(String deliveryId, String newClientIdentifier) {
        if (newClientIdentifier != null && !newClientIdentifier.isBlank()) {
            String client = ClientRuleRegistry.normalize(newClientIdentifier);
            if (!deliveryRepository.updateClientIdentifier(deliveryId, client)) {
                throw NotFoundException.delivery(deliveryId);
            }
            log.info("[VALIDATION] Delivery: {} | client changed to {}", deliveryId, client);
        }
        return runValidation(deliveryId);
    }

    /**
     * Validate several deliveries, continuing past individual failures.
     */
    public List<BatchValidationOutcome> validateBatch(List<String> deliveryIds) {
        List<BatchValidationOutcome> outcomes = new ArrayList<>();
        for (String deliveryId : deliveryIds) {
            try {
                outcomes.add(BatchValidationOutcome.succeeded(deliveryId, runValidation(deliveryId).getStatus()));
            } catch (NotFoundException | ConfigurationException | ValidationExecutionException e) {
                log.warn("[VALIDATION] Batch | delivery: {} | failed: {}", deliveryId, e.getMessage());
                outcomes.add(BatchValidationOutcome.failed(deliveryId, e.getMessage()));
            }
        }
        log.info("[VALIDATION] Batch | {} delivery(ies) | {} failed", outcomes.size(),
                outcomes.stream().filter(outcome -> !outcome.success()).count());
        return outcomes;
    }

    private List<PodDocument> loadDocuments(Delivery delivery) {
        List<String> ids = delivery.getDocuments().stream().map(DeliveryDocumentRef::getDocumentId).toList();
        Map<String, PodDocument> byId = podDocumentRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(PodDocument::getId, Function.identity()));
        List<String> missing = ids.stream().filter(id -> !byId.containsKey(id)).toList();
        if (!missing.isEmpty()) {
            throw new NotFoundException("Delivery " + delivery.getId() + " references missing document(s): "
                    + String.join(", ", missing));
        }
        // keep the delivery's document order
        return ids.stream().distinct().map(byId::get).toList();
    }
}
