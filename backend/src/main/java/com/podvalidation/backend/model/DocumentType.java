package com.podvalidation.backend.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Recognized proof-of-delivery document types.
 */
public enum DocumentType {
    INVOICE,
    RAR,
    PALLET_NOTIFICATION_LETTER,
    LOSCAM_DOCUMENT,
    CUSTOMER_PALLET_RECEIVING,
    SHIP_DOCUMENT,
    UNKNOWN;

    public static final Set<DocumentType> PALLET_DOCUMENTS = EnumSet.of(
            PALLET_NOTIFICATION_LETTER, LOSCAM_DOCUMENT, CUSTOMER_PALLET_RECEIVING);

    public boolean isPalletDocument() {
        return PALLET_DOCUMENTS.contains(this);
    }
}
