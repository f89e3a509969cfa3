package com.podvalidation.backend.classification;

import com.podvalidation.backend.model.DocumentType;

import java.util.List;

/**
 * Keyword score of one type against one text.
 *
 * @param primaryHits exact primary keyword matches; fuzzy matches are not counted
 */
public record TypeScore(DocumentType type, double score, List<String> matchedKeywords, int primaryHits,
                        int priority) {

    public TypeScore {
        matchedKeywords = List.copyOf(matchedKeywords);
    }
}
