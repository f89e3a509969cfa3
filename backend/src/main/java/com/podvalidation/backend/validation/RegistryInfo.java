package com.podvalidation.backend.validation;

import java.util.List;

/**
 * Snapshot description of the client rule registry for operators.
 */
public record RegistryInfo(
        boolean initialized,
        String defaultClient,
        List<ValidatorInfo> validators,
        List<String> ruleSetClients) {

    public record ValidatorInfo(String clientIdentifier, String name, String version) {
    }
}
