package com.podvalidation.backend.service;

import com.podvalidation.backend.exception.NotFoundException;
import com.podvalidation.backend.model.Delivery;
import com.podvalidation.backend.model.DeliveryDocumentRef;
import com.podvalidation.backend.model.PodDocument;
import com.podvalidation.backend.repository.DeliveryRepository;
import com.podvalidation.backend.repository.PodDocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Detects and repairs delivery document references whose cached type no longer matches the
 * document's classification.
 */
@Service
public class DeliveryConsistencyService {

    private static final Logger log = LoggerFactory.getLogger(DeliveryConsistencyService.class);

    private final DeliveryRepository deliveryRepository;
    private final PodDocumentRepository podDocumentRepository;

    public DeliveryConsistencyService(DeliveryRepository deliveryRepository,
            PodDocumentRepository podDocumentRepository) {
        this.deliveryRepository = deliveryRepository;
        this.podDocumentRepository = podDocumentRepository;
    }

    public ConsistencyReport check(String deliveryId) {
        Delivery delivery = loadDelivery(deliveryId);
        List<PodDocument> documents = podDocumentRepository.findAllById(documentIds(delivery));
        return new ConsistencyReport(deliveryId, findStaleReferences(delivery, documents), List.of());
    }

    public ConsistencyReport reconcile(String deliveryId) {
        Delivery delivery = loadDelivery(deliveryId);
        List<PodDocument> documents = podDocumentRepository.findAllById(documentIds(delivery));
        return reconcile(delivery, documents);
    }

    /**
     * Rewrites stale cached types from the given documents and refreshes {@code delivery} in place.
     * References to missing documents are reported but cannot be repaired.
     */
    public ConsistencyReport reconcile(Delivery delivery, List<PodDocument> documents) {
        List<StaleReference> stale = findStaleReferences(delivery, documents);
        List<StaleReference> repaired = new ArrayList<>();
        for (StaleReference reference : stale) {
            if (reference.documentMissing()) {
                continue;
            }
            if (deliveryRepository.updateDocumentType(delivery.getId(), reference.documentId(),
                    reference.actualType())) {
                delivery.getDocuments().stream()
                        .filter(ref -> ref.getDocumentId().equals(reference.documentId()))
                        .forEach(ref -> ref.setDetectedType(reference.actualType()));
                repaired.add(reference);
                log.warn("[CONSISTENCY] Delivery: {} | document {} cached as {} but classified {} | repaired",
                        delivery.getId(), reference.documentId(), reference.cachedType(), reference.actualType());
            }
        }
        return new ConsistencyReport(delivery.getId(), stale, repaired);
    }

    public List<StaleReference> findStaleReferences(Delivery delivery, List<PodDocument> documents) {
        Map<String, PodDocument> byId = documents.stream()
                .collect(Collectors.toMap(PodDocument::getId, Function.identity(), (first, second) -> first));
        List<StaleReference> stale = new ArrayList<>();
        for (DeliveryDocumentRef reference : delivery.getDocuments()) {
            PodDocument document = byId.get(reference.getDocumentId());
            if (document == null) {
                stale.add(new StaleReference(reference.getDocumentId(), reference.getDetectedType(), null));
            } else if (document.resolvedType() != reference.getDetectedType()) {
                stale.add(new StaleReference(reference.getDocumentId(), reference.getDetectedType(),
                        document.resolvedType()));
            }
        }
        return stale;
    }

    private Delivery loadDelivery(String deliveryId) {
        return deliveryRepository.findById(deliveryId)
                .orElseThrow(() -> NotFoundException.delivery(deliveryId));
    }

    private static List<String> documentIds(Delivery delivery) {
        return delivery.getDocuments().stream().map(DeliveryDocumentRef::getDocumentId).toList();
    }
}
