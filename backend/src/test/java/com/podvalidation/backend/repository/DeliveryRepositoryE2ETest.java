package com.podvalidation.backend.repository;

import com.podvalidation.backend.BaseE2ETest;
import com.podvalidation.backend.model.CheckStatus;
import com.podvalidation.backend.model.Delivery;
import com.podvalidation.backend.model.DeliveryDocumentRef;
import com.podvalidation.backend.model.DeliveryStatus;
import com.podvalidation.backend.model.DocumentType;
import com.podvalidation.backend.model.ProcessingMetadata;
import com.podvalidation.backend.model.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryRepositoryE2ETest extends BaseE2ETest {

    @Autowired
    private DeliveryRepository deliveryRepository;

    @BeforeEach
    void setUp() {
        deliveryRepository.deleteAll();
    }

    @Test
    void shouldAppendDocumentOnlyOnce() {
        // Given
        Delivery delivery = save("DR-1");
        DeliveryDocumentRef reference = ref("doc-1", DocumentType.INVOICE);

        // When
        boolean first = deliveryRepository.appendDocument(delivery.getId(), reference);
        boolean duplicate = deliveryRepository.appendDocument(delivery.getId(), reference);

        // Then
        assertTrue(first);
        assertFalse(duplicate);
        assertEquals(1, deliveryRepository.findById(delivery.getId()).orElseThrow().getDocuments().size());
        assertTrue(deliveryRepository.findFirstByDocumentsDocumentId("doc-1").isPresent());
    }

    @Test
    void shouldUpdateOnlyTheMatchingDocumentReference() {
        // Given
        Delivery delivery = save("DR-2");
        deliveryRepository.appendDocument(delivery.getId(), ref("doc-1", DocumentType.UNKNOWN));
        deliveryRepository.appendDocument(delivery.getId(), ref("doc-2", DocumentType.UNKNOWN));

        // When
        boolean updated = deliveryRepository.updateDocumentType(delivery.getId(), "doc-2", DocumentType.RAR);
        boolean unreferenced = deliveryRepository.updateDocumentType(delivery.getId(), "doc-9", DocumentType.RAR);

        // Then
        assertTrue(updated);
        assertFalse(unreferenced);
        List<DeliveryDocumentRef> documents = deliveryRepository.findById(delivery.getId()).orElseThrow().getDocuments();
        assertEquals(DocumentType.UNKNOWN, documents.get(0).getDetectedType());
        assertEquals(DocumentType.RAR, documents.get(1).getDetectedType());
    }

    @Test
    void shouldReplaceResultAndClearPreviousError() {
        // Given
        Delivery delivery = save("DR-3");
        deliveryRepository.markValidationFailed(delivery.getId(), "validator crashed");

        // When
        boolean replaced = deliveryRepository.replaceValidationResult(delivery.getId(),
                result(CheckStatus.PASSED), ProcessingMetadata.builder().documentsProcessed(3).build());

        // Then
        assertTrue(replaced);
        Delivery stored = deliveryRepository.findById(delivery.getId()).orElseThrow();
        assertEquals(DeliveryStatus.COMPLETED, stored.getStatus());
        assertNull(stored.getErrorMessage());
        assertEquals(CheckStatus.PASSED, stored.getValidationResult().getStatus());
        assertEquals(3, stored.getProcessingMetadata().getDocumentsProcessed());
        assertNotNull(stored.getLastValidatedAt());
    }

    @Test
    void shouldKeepPreviousResultWhenMarkedFailed() {
        // Given
        Delivery delivery = save("DR-4");
        deliveryRepository.replaceValidationResult(delivery.getId(), result(CheckStatus.WARNING),
                ProcessingMetadata.builder().documentsProcessed(2).build());

        // When
        boolean marked = deliveryRepository.markValidationFailed(delivery.getId(), "validator crashed");

        // Then
        assertTrue(marked);
        Delivery stored = deliveryRepository.findById(delivery.getId()).orElseThrow();
        assertEquals(DeliveryStatus.FAILED, stored.getStatus());
        assertEquals("validator crashed", stored.getErrorMessage());
        assertEquals(CheckStatus.WARNING, stored.getValidationResult().getStatus());
    }

    @Test
    void shouldUpdateClientIdentifier() {
        // Given
        Delivery delivery = save("DR-5");

        // When
        boolean updated = deliveryRepository.updateClientIdentifier(delivery.getId(), "SUPER8");

        // Then
        assertTrue(updated);
        assertFalse(deliveryRepository.updateClientIdentifier("missing", "SUPER8"));
        assertEquals(1, deliveryRepository.findByClientIdentifier("SUPER8").size());
    }

    private Delivery save(String reference) {
        return deliveryRepository.save(Delivery.builder()
                .deliveryReference(reference)
                .clientIdentifier("DEFAULT")
                .documents(new ArrayList<>())
                .build());
    }

    private static DeliveryDocumentRef ref(String documentId, DocumentType type) {
        return DeliveryDocumentRef.builder().documentId(documentId).detectedType(type).build();
    }

    private static ValidationResult result(CheckStatus status) {
        return ValidationResult.builder()
                .status(status)
                .message("checked")
                .validatorName("Generic Checklist Validator")
                .build();
    }
}
