package com.podvalidation.backend.classification;

import com.podvalidation.backend.model.DocumentType;

import java.util.List;

/**
 * Types of the other documents in the same delivery. A standalone document has no context and is
 * never inferred.
 */
public record ClassificationContext(boolean known, List<DocumentType> siblingTypes) {

    public ClassificationContext {
        siblingTypes = siblingTypes == null ? List.of() : List.copyOf(siblingTypes);
    }

    public static ClassificationContext standalone() {
        return new ClassificationContext(false, List.of());
    }

    public static ClassificationContext of(List<DocumentType> siblingTypes) {
        return new ClassificationContext(true, siblingTypes);
    }
}
