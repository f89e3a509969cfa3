package com.podvalidation.backend.controller;

import com.podvalidation.backend.dto.ClassificationResponse;
import com.podvalidation.backend.dto.DiagnosticsResponse;
import com.podvalidation.backend.dto.DocumentResponse;
import com.podvalidation.backend.dto.ManualOverrideRequest;
import com.podvalidation.backend.dto.RegisterDocumentRequest;
import com.podvalidation.backend.model.PodDocument;
import com.podvalidation.backend.service.DocumentClassificationService;
import com.podvalidation.backend.service.PodDocumentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/documents")
@Tag(name = "Documents", description = "POD document ingestion and classification")
public class DocumentController {

    private final PodDocumentService podDocumentService;
    private final DocumentClassificationService classificationService;

    public DocumentController(PodDocumentService podDocumentService,
            DocumentClassificationService classificationService) {
        this.podDocumentService = podDocumentService;
        this.classificationService = classificationService;
    }

    @PostMapping
    @Operation(summary = "Register document", description = "Store OCR output for a file and classify it")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Document registered and classified"),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "404", description = "Delivery not found")
    })
    public ResponseEntity<DocumentResponse> registerDocument(@Valid @RequestBody RegisterDocumentRequest request) {
        PodDocument document = podDocumentService.registerDocument(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(toDocumentResponse(document));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get document", description = "Get a document with its current classification")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Document found"),
            @ApiResponse(responseCode = "404", description = "Document not found")
    })
    public ResponseEntity<DocumentResponse> getDocument(
            @Parameter(description = "Document ID") @PathVariable String id) {
        return ResponseEntity.ok(toDocumentResponse(podDocumentService.getDocument(id)));
    }

    @PostMapping("/{id}/classify")
    @Operation(summary = "Classify document",
            description = "Re-run automatic classification. Manual overrides are kept unless force is set")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Classification result"),
            @ApiResponse(responseCode = "404", description = "Document not found")
    })
    public ResponseEntity<ClassificationResponse> classifyDocument(
            @Parameter(description = "Document ID") @PathVariable String id,
            @Parameter(description = "Replace a manual override") @RequestParam(defaultValue = "false") boolean force) {
        return ResponseEntity.ok(ClassificationResponse.from(id, classificationService.classifyDocument(id, force)));
    }

    @PostMapping("/{id}/override")
    @Operation(summary = "Override classification", description = "Set the document type manually")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Override applied"),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "404", description = "Document not found")
    })
    public ResponseEntity<ClassificationResponse> overrideClassification(
            @Parameter(description = "Document ID") @PathVariable String id,
            @Valid @RequestBody ManualOverrideRequest request) {
        return ResponseEntity.ok(ClassificationResponse.from(id, classificationService.applyManualOverride(
                id, request.getDocumentType(), request.getReason(), request.getOverrideBy())));
    }

    @GetMapping("/{id}/diagnostics")
    @Operation(summary = "Classification diagnostics",
            description = "Keyword scores, threshold in force, OCR quality and suggestions for a document")
    public ResponseEntity<DiagnosticsResponse> diagnose(
            @Parameter(description = "Document ID") @PathVariable String id) {
        return ResponseEntity.ok(classificationService.diagnose(id));
    }

    private DocumentResponse toDocumentResponse(PodDocument document) {
        return DocumentResponse.builder()
                .id(document.getId())
                .deliveryId(document.getDeliveryId())
                .fileMetadata(document.getFileMetadata())
                .ocrConfidence(document.getOcrConfidence())
                .textLength(document.getRawText() == null ? 0 : document.getRawText().length())
                .stampDetection(document.getStampDetection())
                .items(document.getItems())
                .classification(document.getClassification() != null
                        ? ClassificationResponse.from(document.getId(), document.getClassification().toResult())
                        : null)
                .createdAt(document.getCreatedAt())
                .updatedAt(document.getUpdatedAt())
                .build();
    }
}
