package com.podvalidation.backend.model;

/**
 * A runner-up classification candidate kept for operator review.
 */
public record AlternativeType(DocumentType type, double confidence) {
}
