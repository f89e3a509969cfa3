package com.podvalidation.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Normalized line item read from an invoice or receiving document.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryItem {
    private String itemCode;
    private String description;
    private Integer expectedQuantity;
    private Integer deliveredQuantity;

    /**
     * Delivered quantity when recorded, otherwise the expected one.
     */
    public Integer effectiveQuantity() {
        return deliveredQuantity != null ? deliveredQuantity : expectedQuantity;
    }
}
