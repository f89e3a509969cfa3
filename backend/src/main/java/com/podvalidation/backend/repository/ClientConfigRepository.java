package com.podvalidation.backend.repository;

import com.podvalidation.backend.model.ClientConfig;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ClientConfigRepository extends MongoRepository<ClientConfig, String> {

    Optional<ClientConfig> findByClientId(String clientId);

    Optional<ClientConfig> findByClientIdAndActiveTrue(String clientId);

    List<ClientConfig> findByActiveTrue();
}
