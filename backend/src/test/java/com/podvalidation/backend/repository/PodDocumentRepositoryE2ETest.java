package com.podvalidation.backend.repository;

import com.podvalidation.backend.BaseE2ETest;
import com.podvalidation.backend.classification.AutomaticClassification;
import com.podvalidation.backend.classification.ManualOverride;
import com.podvalidation.backend.model.DocumentClassification;
import com.podvalidation.backend.model.DocumentType;
import com.podvalidation.backend.model.PodDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PodDocumentRepositoryE2ETest extends BaseE2ETest {

    @Autowired
    private PodDocumentRepository podDocumentRepository;

    @BeforeEach
    void setUp() {
        podDocumentRepository.deleteAll();
    }

    @Test
    void shouldWriteAutomaticClassificationOnUnclassifiedDocument() {
        // Given
        PodDocument document = podDocumentRepository.save(PodDocument.builder().rawText("Invoice").build());

        // When
        boolean written = podDocumentRepository.writeAutomaticClassification(document.getId(), automatic(DocumentType.INVOICE));

        // Then
        assertTrue(written);
        DocumentClassification stored = podDocumentRepository.findById(document.getId()).orElseThrow().getClassification();
        assertEquals(DocumentType.INVOICE, stored.getDetectedType());
        assertEquals(60.0, stored.getConfidence());
        assertFalse(stored.isManualOverride());
        assertNotNull(stored.getClassifiedAt());
    }

    @Test
    void shouldNotOverwriteManualOverrideWithAutomaticResult() {
        // Given
        PodDocument document = podDocumentRepository.save(PodDocument.builder().rawText("Invoice").build());
        podDocumentRepository.writeManualOverride(document.getId(), override(DocumentType.RAR));

        // When
        boolean written = podDocumentRepository.writeAutomaticClassification(document.getId(), automatic(DocumentType.INVOICE));

        // Then
        assertFalse(written);
        DocumentClassification stored = podDocumentRepository.findById(document.getId()).orElseThrow().getClassification();
        assertEquals(DocumentType.RAR, stored.getDetectedType());
        assertTrue(stored.isManualOverride());
        assertEquals("operator", stored.getOverrideBy());
        assertEquals("Wrong type", stored.getOverrideReason());
    }

    @Test
    void shouldReplaceManualOverrideWhenForced() {
        // Given
        PodDocument document = podDocumentRepository.save(PodDocument.builder().rawText("Invoice").build());
        podDocumentRepository.writeManualOverride(document.getId(), override(DocumentType.RAR));

        // When
        boolean written = podDocumentRepository.forceAutomaticClassification(document.getId(), automatic(DocumentType.INVOICE));

        // Then
        assertTrue(written);
        DocumentClassification stored = podDocumentRepository.findById(document.getId()).orElseThrow().getClassification();
        assertEquals(DocumentType.INVOICE, stored.getDetectedType());
        assertFalse(stored.isManualOverride());
        assertNull(stored.getOverrideBy());
    }

    @Test
    void shouldReportMissingDocumentOnWrite() {
        assertFalse(podDocumentRepository.writeAutomaticClassification("missing", automatic(DocumentType.INVOICE)));
        assertFalse(podDocumentRepository.writeManualOverride("missing", override(DocumentType.RAR)));
    }

    @Test
    void shouldAssignDeliveryOnlyOnce() {
        // Given
        PodDocument document = podDocumentRepository.save(PodDocument.builder().rawText("Invoice").build());

        // When
        boolean first = podDocumentRepository.assignDelivery(document.getId(), "delivery-1");
        boolean again = podDocumentRepository.assignDelivery(document.getId(), "delivery-1");
        boolean other = podDocumentRepository.assignDelivery(document.getId(), "delivery-2");

        // Then
        assertTrue(first);
        assertTrue(again);
        assertFalse(other);
        assertEquals("delivery-1", podDocumentRepository.findById(document.getId()).orElseThrow().getDeliveryId());
        assertEquals(1, podDocumentRepository.countByDeliveryId("delivery-1"));
    }

    private static AutomaticClassification automatic(DocumentType type) {
        return new AutomaticClassification(type, 60.0, List.of(), List.of("invoice"), false, Instant.now());
    }

    private static ManualOverride override(DocumentType type) {
        return new ManualOverride(type, List.of(), List.of(), "Wrong type", "operator", Instant.now());
    }
}
