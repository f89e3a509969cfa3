package com.podvalidation.backend.model;

/**
 * Whether a delivery's paperwork is expected to include pallet documents.
 */
public enum PalletScenario {
    WITH_PALLETS,
    WITHOUT_PALLETS,
    AUTO_DETECT
}
