package com.podvalidation.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A shipment made up of several POD documents.
 * <p>
 * {@code documents[i].detectedType} caches the referenced document's classified type. The document
 * record is the source of truth; a mismatch is repaired by the consistency check.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "deliveries")
public class Delivery {

    @Id
    private String id;

    @Indexed(unique = true)
    private String deliveryReference;

    @Indexed
    private String clientIdentifier;

    @Builder.Default
    private List<DeliveryDocumentRef> documents = new ArrayList<>();

    @Builder.Default
    private DeliveryStatus status = DeliveryStatus.PENDING;

    private ValidationResult validationResult;

    // Set when the last validation run failed
    private String errorMessage;

    private Instant lastValidatedAt;
    private ProcessingMetadata processingMetadata;

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;
}
