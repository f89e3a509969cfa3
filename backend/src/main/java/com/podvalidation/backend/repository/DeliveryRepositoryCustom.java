package com.podvalidation.backend.repository;

import com.podvalidation.backend.model.DeliveryDocumentRef;
import com.podvalidation.backend.model.DocumentType;
import com.podvalidation.backend.model.ProcessingMetadata;
import com.podvalidation.backend.model.ValidationResult;

/**
 * Atomic partial updates on deliveries. Validation state is only ever written through
 * {@link #replaceValidationResult} and {@link #markValidationFailed}.
 */
public interface DeliveryRepositoryCustom {

    /**
     * Appends a document reference unless the delivery already lists the document.
     */
    boolean appendDocument(String deliveryId, DeliveryDocumentRef reference);

    /**
     * Refreshes the cached type of one document reference.
     *
     * @return false when the delivery does not reference the document
     */
    boolean updateDocumentType(String deliveryId, String documentId, DocumentType detectedType);

    boolean updateClientIdentifier(String deliveryId, String clientIdentifier);

    /**
     * Replaces the result, marks the delivery COMPLETED and clears any previous error in one update.
     */
    boolean replaceValidationResult(String deliveryId, ValidationResult result, ProcessingMetadata metadata);

    /**
     * Marks the delivery FAILED with a reason. The previous result is kept.
     */
    boolean markValidationFailed(String deliveryId, String errorMessage);
}
