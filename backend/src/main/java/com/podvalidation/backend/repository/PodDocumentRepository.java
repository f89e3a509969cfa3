package com.podvalidation.backend.repository;

import com.podvalidation.backend.model.PodDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PodDocumentRepository extends MongoRepository<PodDocument, String>, PodDocumentRepositoryCustom {

    List<PodDocument> findByDeliveryId(String deliveryId);

    long countByDeliveryId(String deliveryId);
}
