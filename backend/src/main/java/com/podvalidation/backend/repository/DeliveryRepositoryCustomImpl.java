package com.podvalidation.backend.repository;

import com.podvalidation.backend.model.Delivery;
import com.podvalidation.backend.model.DeliveryDocumentRef;
import com.podvalidation.backend.model.DeliveryStatus;
import com.podvalidation.backend.model.DocumentType;
import com.podvalidation.backend.model.ProcessingMetadata;
import com.podvalidation.backend.model.ValidationResult;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;

public class DeliveryRepositoryCustomImpl implements DeliveryRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    public DeliveryRepositoryCustomImpl(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public boolean appendDocument(String deliveryId, DeliveryDocumentRef reference) {
        Query query = new Query(Criteria.where("_id").is(deliveryId)
                .and("documents.documentId").ne(reference.getDocumentId()));
        Update update = new Update()
                .push("documents", reference)
                .set("updatedAt", Instant.now());
        return mongoTemplate.updateFirst(query, update, Delivery.class).getModifiedCount() > 0;
    }

    @Override
    public boolean updateDocumentType(String deliveryId, String documentId, DocumentType detectedType) {
        Query query = new Query(Criteria.where("_id").is(deliveryId)
                .and("documents.documentId").is(documentId));
        Update update = new Update()
                .set("documents.$.detectedType", detectedType)
                .set("updatedAt", Instant.now());
        return mongoTemplate.updateFirst(query, update, Delivery.class).getMatchedCount() > 0;
    }

    @Override
    public boolean updateClientIdentifier(String deliveryId, String clientIdentifier) {
        Update update = new Update()
                .set("clientIdentifier", clientIdentifier)
                .set("updatedAt", Instant.now());
        return mongoTemplate.updateFirst(byId(deliveryId), update, Delivery.class).getMatchedCount() > 0;
    }

    @Override
    public boolean replaceValidationResult(String deliveryId, ValidationResult result, ProcessingMetadata metadata) {
        Instant now = Instant.now();
        Update update = new Update()
                .set("validationResult", result)
                .set("status", DeliveryStatus.COMPLETED)
                .set("processingMetadata", metadata)
                .set("lastValidatedAt", now)
                .set("updatedAt", now)
                .unset("errorMessage");
        return mongoTemplate.updateFirst(byId(deliveryId), update, Delivery.class).getMatchedCount() > 0;
    }

    @Override
    public boolean markValidationFailed(String deliveryId, String errorMessage) {
        Instant now = Instant.now();
        Update update = new Update()
                .set("status", DeliveryStatus.FAILED)
                .set("errorMessage", errorMessage)
                .set("lastValidatedAt", now)
                .set("updatedAt", now);
        return mongoTemplate.updateFirst(byId(deliveryId), update, Delivery.class).getMatchedCount() > 0;
    }

    private Query byId(String deliveryId) {
        return new Query(Criteria.where("_id").is(deliveryId));
    }
}
