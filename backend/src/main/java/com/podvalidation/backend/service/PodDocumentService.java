package com.podvalidation.backend.service;

import com.podvalidation.backend.dto.RegisterDocumentRequest;
import com.podvalidation.backend.exception.NotFoundException;
import com.podvalidation.backend.model.FileMetadata;
import com.podvalidation.backend.model.PodDocument;
import com.podvalidation.backend.repository.PodDocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Ingestion entry point for OCR-processed documents.
 */
@Service
public class PodDocumentService {

    private static final Logger log = LoggerFactory.getLogger(PodDocumentService.class);

    private final PodDocumentRepository podDocumentRepository;
    private final DeliveryService deliveryService;
    private final DocumentClassificationService classificationService;

    public PodDocumentService(PodDocumentRepository podDocumentRepository,
            DeliveryService deliveryService,
            DocumentClassificationService classificationService) {
        this.podDocumentRepository = podDocumentRepository;
        this.deliveryService = deliveryService;
        this.classificationService = classificationService;
    }

    /**
     * Store a document, attach it to its delivery and classify it once.
     */
    public PodDocument registerDocument(RegisterDocumentRequest request) {
        if (request.getDeliveryId() != null) {
            // fail before storing anything for an unknown delivery
            deliveryService.getDelivery(request.getDeliveryId());
        }

        PodDocument document = PodDocument.builder()
                .fileMetadata(FileMetadata.builder()
                        .originalName(request.getOriginalName())
                        .size(request.getSize())
                        .mimeType(request.getMimeType())
                        .build())
                .rawText(request.getRawText())
                .ocrConfidence(request.getOcrConfidence())
                .stampDetection(request.getStampDetection())
                .items(request.getItems() != null ? new ArrayList<>(request.getItems()) : new ArrayList<>())
                .build();
        document = podDocumentRepository.save(document);
        log.info("[INGEST] Document: {} | file: {} | ocr: {}",
                document.getId(), request.getOriginalName(), request.getOcrConfidence());

        if (request.getDeliveryId() != null) {
            deliveryService.attachDocument(request.getDeliveryId(), document.getId());
        }
        classificationService.classifyDocument(document.getId());

        return getDocument(document.getId());
    }

    public PodDocument getDocument(String id) {
        return podDocumentRepository.findById(id).orElseThrow(() -> NotFoundException.document(id));
    }

    public List<PodDocument> findByDeliveryId(String deliveryId) {
        return podDocumentRepository.findByDeliveryId(deliveryId);
    }
}
