package com.podvalidation.backend.repository;

import com.podvalidation.backend.classification.AutomaticClassification;
import com.podvalidation.backend.classification.ManualOverride;

/**
 * Partial classification writes. Each method is a single-document update, so the classification
 * fields of a record always change together.
 */
public interface PodDocumentRepositoryCustom {

    /**
     * Writes an automatic result unless the record carries a manual override.
     *
     * @return false when the document is missing or overridden
     */
    boolean writeAutomaticClassification(String documentId, AutomaticClassification result);

    /**
     * Writes an automatic result, replacing any manual override.
     */
    boolean forceAutomaticClassification(String documentId, AutomaticClassification result);

    boolean writeManualOverride(String documentId, ManualOverride override);

    /**
     * Sets the owning delivery unless the document already belongs to another one.
     */
    boolean assignDelivery(String documentId, String deliveryId);
}
