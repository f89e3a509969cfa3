package com.podvalidation.backend.service;

import com.podvalidation.backend.dto.CreateDeliveryRequest;
import com.podvalidation.backend.exception.NotFoundException;
import com.podvalidation.backend.model.Delivery;
import com.podvalidation.backend.model.DeliveryDocumentRef;
import com.podvalidation.backend.model.DeliveryStatus;
import com.podvalidation.backend.model.PodDocument;
import com.podvalidation.backend.repository.DeliveryRepository;
import com.podvalidation.backend.repository.PodDocumentRepository;
import com.podvalidation.backend.validation.ClientRuleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class DeliveryService {

    private static final Logger log = LoggerFactory.getLogger(DeliveryService.class);

    private final DeliveryRepository deliveryRepository;
    private final PodDocumentRepository podDocumentRepository;

    public DeliveryService(DeliveryRepository deliveryRepository, PodDocumentRepository podDocumentRepository) {
        this.deliveryRepository = deliveryRepository;
        this.podDocumentRepository = podDocumentRepository;
    }

    /**
     * Register a delivery with no documents yet.
     */
    public Delivery createDelivery(CreateDeliveryRequest request) {
        String reference = request.getDeliveryReference().trim();
        if (deliveryRepository.existsByDeliveryReference(reference)) {
            throw new IllegalArgumentException("Delivery reference already exists: " + reference);
        }
        Delivery delivery = Delivery.builder()
                .deliveryReference(reference)
                .clientIdentifier(ClientRuleRegistry.normalize(request.getClientIdentifier()))
                .status(DeliveryStatus.PENDING)
                .build();
        delivery = deliveryRepository.save(delivery);
        log.info("[DELIVERY] Created: {} | reference: {} | client: {}",
                delivery.getId(), reference, delivery.getClientIdentifier());
        return delivery;
    }

    public Optional<Delivery> findById(String id) {
        return deliveryRepository.findById(id);
    }

    public Delivery getDelivery(String id) {
        return deliveryRepository.findById(id).orElseThrow(() -> NotFoundException.delivery(id));
    }

    public List<Delivery> findByClientIdentifier(String clientIdentifier) {
        return deliveryRepository.findByClientIdentifier(ClientRuleRegistry.normalize(clientIdentifier));
    }

    /**
     * Reference a document from a delivery. The cached type starts from the document's current
     * classification. Attaching the same document twice is a no-op.
     */
    public Delivery attachDocument(String deliveryId, String documentId) {
        getDelivery(deliveryId);
        PodDocument document = podDocumentRepository.findById(documentId)
                .orElseThrow(() -> NotFoundException.document(documentId));

        if (!podDocumentRepository.assignDelivery(documentId, deliveryId)) {
            throw new IllegalArgumentException("Document " + documentId + " already belongs to delivery "
                    + document.getDeliveryId());
        }

        DeliveryDocumentRef reference = DeliveryDocumentRef.builder()
                .documentId(documentId)
                .detectedType(document.resolvedType())
                .build();
        if (deliveryRepository.appendDocument(deliveryId, reference)) {
            log.info("[DELIVERY] Delivery: {} | attached document {} as {}",
                    deliveryId, documentId, reference.getDetectedType());
        }
        return getDelivery(deliveryId);
    }
}
