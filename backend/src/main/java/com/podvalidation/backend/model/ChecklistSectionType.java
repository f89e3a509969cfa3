package com.podvalidation.backend.model;

/**
 * Independently toggleable groups of checklist checks.
 */
public enum ChecklistSectionType {
    DOCUMENT_COMPLETENESS,
    PALLET,
    SHIP_DOCUMENT,
    INVOICE,
    CROSS_DOCUMENT
}
