package com.podvalidation.backend.repository;

import com.podvalidation.backend.classification.AutomaticClassification;
import com.podvalidation.backend.classification.ClassificationResult;
import com.podvalidation.backend.classification.ManualOverride;
import com.podvalidation.backend.model.DocumentClassification;
import com.podvalidation.backend.model.PodDocument;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;

public class PodDocumentRepositoryCustomImpl implements PodDocumentRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    public PodDocumentRepositoryCustomImpl(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public boolean writeAutomaticClassification(String documentId, AutomaticClassification result) {
        Query query = new Query(Criteria.where("_id").is(documentId)
                .and("classification.manualOverride").ne(true));
        return write(query, result);
    }

    @Override
    public boolean forceAutomaticClassification(String documentId, AutomaticClassification result) {
        return write(new Query(Criteria.where("_id").is(documentId)), result);
    }

    @Override
    public boolean writeManualOverride(String documentId, ManualOverride override) {
        return write(new Query(Criteria.where("_id").is(documentId)), override);
    }

    @Override
    public boolean assignDelivery(String documentId, String deliveryId) {
        Query query = new Query(Criteria.where("_id").is(documentId)
                .orOperator(Criteria.where("deliveryId").is(null), Criteria.where("deliveryId").is(deliveryId)));
        Update update = new Update()
                .set("deliveryId", deliveryId)
                .set("updatedAt", Instant.now());
        return mongoTemplate.updateFirst(query, update, PodDocument.class).getMatchedCount() > 0;
    }

    private boolean write(Query query, ClassificationResult result) {
        Update update = new Update()
                .set("classification", DocumentClassification.from(result))
                .set("updatedAt", Instant.now());
        return mongoTemplate.updateFirst(query, update, PodDocument.class).getMatchedCount() > 0;
    }
}
