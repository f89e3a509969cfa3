package com.podvalidation.backend.model;

import java.util.EnumSet;
import java.util.Set;

public record DocumentCompletenessRules(
        boolean enabled,
        boolean requirePalletNotificationLetter,
        boolean requireLoscamDocument,
        boolean requireCustomerPalletReceiving,
        boolean requireShipDocument,
        boolean requireInvoice,
        boolean requireRAR,
        PalletScenario palletScenario) {

    public DocumentCompletenessRules {
        if (palletScenario == null) {
            palletScenario = PalletScenario.AUTO_DETECT;
        }
    }

    public static DocumentCompletenessRules disabled() {
        return new DocumentCompletenessRules(false, false, false, false, false, false, false,
                PalletScenario.AUTO_DETECT);
    }

    /**
     * Document types this configuration requires once the pallet scenario is known.
     */
    public Set<DocumentType> requiredTypes(PalletScenario resolvedScenario) {
        Set<DocumentType> required = EnumSet.noneOf(DocumentType.class);
        if (!enabled) {
            return required;
        }
        if (resolvedScenario == PalletScenario.WITH_PALLETS) {
            if (requirePalletNotificationLetter) {
                required.add(DocumentType.PALLET_NOTIFICATION_LETTER);
            }
            if (requireLoscamDocument) {
                required.add(DocumentType.LOSCAM_DOCUMENT);
            }
            if (requireCustomerPalletReceiving) {
                required.add(DocumentType.CUSTOMER_PALLET_RECEIVING);
            }
        }
        if (requireShipDocument) {
            required.add(DocumentType.SHIP_DOCUMENT);
        }
        if (requireInvoice) {
            required.add(DocumentType.INVOICE);
        }
        if (requireRAR) {
            required.add(DocumentType.RAR);
        }
        return required;
    }
}
