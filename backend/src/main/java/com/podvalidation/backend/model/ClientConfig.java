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

/**
 * Stored client rule set. Active configurations take precedence over the bundled defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "client_configs")
public class ClientConfig {

    @Id
    private String id;

    @Indexed(unique = true)
    private String clientId;

    private String clientName;
    private String description;

    private ValidationRuleSet validationRules;

    @Builder.Default
    private boolean active = true;

    private String createdBy;
    private String updatedBy;

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;
}
