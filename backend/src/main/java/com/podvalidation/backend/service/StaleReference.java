package com.podvalidation.backend.service;

import com.podvalidation.backend.model.DocumentType;

/**
 * A delivery document reference whose cached type disagrees with the document record.
 *
 * @param actualType null when the referenced document no longer exists
 */
public record StaleReference(String documentId, DocumentType cachedType, DocumentType actualType) {

    public boolean documentMissing() {
        return actualType == null;
    }
}
