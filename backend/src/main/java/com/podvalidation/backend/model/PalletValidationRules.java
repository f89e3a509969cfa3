package com.podvalidation.backend.model;

public record PalletValidationRules(
        boolean enabled,
        boolean requireWarehouseStamp,
        boolean requireWarehouseSignature,
        boolean requireCustomerSignature,
        boolean requireDriverSignature,
        boolean requireLoscamStamp) {

    public static PalletValidationRules disabled() {
        return new PalletValidationRules(false, false, false, false, false, false);
    }
}
