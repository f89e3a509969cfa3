package com.podvalidation.backend.repository;

import com.podvalidation.backend.model.Delivery;
import com.podvalidation.backend.model.DeliveryStatus;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DeliveryRepository extends MongoRepository<Delivery, String>, DeliveryRepositoryCustom {

    Optional<Delivery> findByDeliveryReference(String deliveryReference);

    boolean existsByDeliveryReference(String deliveryReference);

    Optional<Delivery> findFirstByDocumentsDocumentId(String documentId);

    List<Delivery> findByClientIdentifier(String clientIdentifier);

    List<Delivery> findByStatus(DeliveryStatus status);
}
