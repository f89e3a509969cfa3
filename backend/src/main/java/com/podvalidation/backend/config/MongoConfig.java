package com.podvalidation.backend.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;

/**
 * Enables {@code @CreatedDate}/{@code @LastModifiedDate} on documents saved through repositories.
 * Partial updates set {@code updatedAt} themselves.
 */
@Configuration
@EnableMongoAuditing
public class MongoConfig {
}
