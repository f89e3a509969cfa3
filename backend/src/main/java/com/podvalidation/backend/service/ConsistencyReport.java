package com.podvalidation.backend.service;

import java.util.List;

/**
 * @param repaired references rewritten by a reconcile run; empty for a read-only check
 */
public record ConsistencyReport(String deliveryId, List<StaleReference> staleReferences,
                                List<StaleReference> repaired) {

    public boolean consistent() {
        return staleReferences.isEmpty();
    }
}
