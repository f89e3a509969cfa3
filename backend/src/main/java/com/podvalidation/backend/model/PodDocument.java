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
 * One scanned page or file belonging to a delivery.
 * <p>
 * {@code rawText}, {@code ocrConfidence}, {@code stampDetection} and {@code items} are produced by
 * the OCR collaborator and never rewritten here. Only the classification path mutates
 * {@code classification}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "pods")
public class PodDocument {

    @Id
    private String id;

    @Indexed
    private String deliveryId;

    private FileMetadata fileMetadata;

    // OCR output
    private String rawText;
    private Double ocrConfidence;

    private StampDetection stampDetection;

    @Builder.Default
    private List<DeliveryItem> items = new ArrayList<>();

    private DocumentClassification classification;

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;

    public DocumentType resolvedType() {
        if (classification == null || classification.getDetectedType() == null) {
            return DocumentType.UNKNOWN;
        }
        return classification.getDetectedType();
    }

    public String displayName() {
        if (fileMetadata != null && fileMetadata.getOriginalName() != null) {
            return fileMetadata.getOriginalName();
        }
        return id;
    }
}
