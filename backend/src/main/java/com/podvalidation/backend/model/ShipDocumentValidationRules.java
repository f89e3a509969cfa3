package com.podvalidation.backend.model;

public record ShipDocumentValidationRules(
        boolean enabled,
        boolean requireDispatchStamp,
        boolean requirePalletStamp,
        boolean requireNoPalletStamp,
        boolean requireSecuritySignature,
        boolean requireTimeOutField,
        boolean requireDriverSignature) {

    public static ShipDocumentValidationRules disabled() {
        return new ShipDocumentValidationRules(false, false, false, false, false, false, false);
    }
}
