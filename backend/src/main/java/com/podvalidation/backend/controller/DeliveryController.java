package com.podvalidation.backend.controller;

import com.podvalidation.backend.dto.BatchValidationRequest;
import com.podvalidation.backend.dto.ClassificationResponse;
import com.podvalidation.backend.dto.CreateDeliveryRequest;
import com.podvalidation.backend.dto.DeliveryResponse;
import com.podvalidation.backend.dto.RevalidateRequest;
import com.podvalidation.backend.model.Delivery;
import com.podvalidation.backend.model.ValidationResult;
import com.podvalidation.backend.service.BatchValidationOutcome;
import com.podvalidation.backend.service.ConsistencyReport;
import com.podvalidation.backend.service.DeliveryConsistencyService;
import com.podvalidation.backend.service.DeliveryService;
import com.podvalidation.backend.service.DeliveryValidationService;
import com.podvalidation.backend.service.DocumentClassificationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/deliveries")
@Tag(name = "Deliveries", description = "Delivery registration and checklist validation")
public class DeliveryController {

    private final DeliveryService deliveryService;
    private final DeliveryValidationService validationService;
    private final DocumentClassificationService classificationService;
    private final DeliveryConsistencyService consistencyService;

    public DeliveryController(DeliveryService deliveryService,
            DeliveryValidationService validationService,
            DocumentClassificationService classificationService,
            DeliveryConsistencyService consistencyService) {
        this.deliveryService = deliveryService;
        this.validationService = validationService;
        this.classificationService = classificationService;
        this.consistencyService = consistencyService;
    }

    @PostMapping
    @Operation(summary = "Create delivery", description = "Register a delivery for a client")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Delivery created"),
            @ApiResponse(responseCode = "400", description = "Invalid request or duplicate reference")
    })
    public ResponseEntity<DeliveryResponse> createDelivery(@Valid @RequestBody CreateDeliveryRequest request) {
        Delivery delivery = deliveryService.createDelivery(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(toDeliveryResponse(delivery));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get delivery", description = "Get a delivery with its last validation result")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Delivery found"),
            @ApiResponse(responseCode = "404", description = "Delivery not found")
    })
    public ResponseEntity<DeliveryResponse> getDelivery(
            @Parameter(description = "Delivery ID") @PathVariable String id) {
        return deliveryService.findById(id)
                .map(delivery -> ResponseEntity.ok(toDeliveryResponse(delivery)))
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/documents/{documentId}")
    @Operation(summary = "Attach document", description = "Reference an existing document from the delivery")
    public ResponseEntity<DeliveryResponse> attachDocument(
            @Parameter(description = "Delivery ID") @PathVariable String id,
            @Parameter(description = "Document ID") @PathVariable String documentId) {
        return ResponseEntity.ok(toDeliveryResponse(deliveryService.attachDocument(id, documentId)));
    }

    @PostMapping("/{id}/classify")
    @Operation(summary = "Classify delivery documents", description = "Re-run classification for every document")
    public ResponseEntity<List<ClassificationResponse>> classifyDelivery(
            @Parameter(description = "Delivery ID") @PathVariable String id,
            @RequestParam(defaultValue = "false") boolean force) {
        List<ClassificationResponse> results = classificationService.classifyDelivery(id, force).entrySet().stream()
                .map(entry -> ClassificationResponse.from(entry.getKey(), entry.getValue()))
                .toList();
        return ResponseEntity.ok(results);
    }

    @PostMapping("/{id}/validate")
    @Operation(summary = "Validate delivery", description = "Run the client's checklist over all documents")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Validation completed"),
            @ApiResponse(responseCode = "404", description = "Delivery or document not found"),
            @ApiResponse(responseCode = "500", description = "Configuration or validator error")
    })
    public ResponseEntity<ValidationResult> validateDelivery(
            @Parameter(description = "Delivery ID") @PathVariable String id) {
        return ResponseEntity.ok(validationService.runValidation(id));
    }

    @PostMapping("/{id}/revalidate")
    @Operation(summary = "Revalidate delivery", description = "Re-run validation, optionally for another client")
    public ResponseEntity<ValidationResult> revalidateDelivery(
            @Parameter(description = "Delivery ID") @PathVariable String id,
            @RequestBody(required = false) RevalidateRequest request) {
        String clientIdentifier = request != null ? request.getClientIdentifier() : null;
        return ResponseEntity.ok(validationService.revalidate(id, clientIdentifier));
    }

    @PostMapping("/validate-batch")
    @Operation(summary = "Validate deliveries", description = "Validate several deliveries, reporting each outcome")
    public ResponseEntity<List<BatchValidationOutcome>> validateBatch(
            @Valid @RequestBody BatchValidationRequest request) {
        return ResponseEntity.ok(validationService.validateBatch(request.getDeliveryIds()));
    }

    @GetMapping("/{id}/consistency")
    @Operation(summary = "Check document type cache",
            description = "List document references whose cached type differs from the document")
    public ResponseEntity<ConsistencyReport> checkConsistency(
            @Parameter(description = "Delivery ID") @PathVariable String id) {
        return ResponseEntity.ok(consistencyService.check(id));
    }

    @PostMapping("/{id}/reconcile")
    @Operation(summary = "Repair document type cache", description = "Rewrite stale cached document types")
    public ResponseEntity<ConsistencyReport> reconcile(
            @Parameter(description = "Delivery ID") @PathVariable String id) {
        return ResponseEntity.ok(consistencyService.reconcile(id));
    }

    private DeliveryResponse toDeliveryResponse(Delivery delivery) {
        return DeliveryResponse.builder()
                .id(delivery.getId())
                .deliveryReference(delivery.getDeliveryReference())
                .clientIdentifier(delivery.getClientIdentifier())
                .documents(delivery.getDocuments())
                .status(delivery.getStatus())
                .validationResult(delivery.getValidationResult())
                .errorMessage(delivery.getErrorMessage())
                .lastValidatedAt(delivery.getLastValidatedAt())
                .processingMetadata(delivery.getProcessingMetadata())
                .createdAt(delivery.getCreatedAt())
                .updatedAt(delivery.getUpdatedAt())
                .build();
    }
}
