package com.podvalidation.backend.validation;

import com.podvalidation.backend.model.CheckStatus;
import com.podvalidation.backend.model.PeculiarityType;
import com.podvalidation.backend.model.ValidationCheck;

import java.util.Map;

final class Checks {

    private Checks() {
    }

    static ValidationCheck passed(String name, String message) {
        return passed(name, message, null);
    }

    static ValidationCheck passed(String name, String message, Map<String, Object> details) {
        return ValidationCheck.builder()
                .name(name)
                .status(CheckStatus.PASSED)
                .message(message)
                .details(details)
                .build();
    }

    static ValidationCheck failed(String name, String message, PeculiarityType type, String fieldPath) {
        return of(name, CheckStatus.FAILED, message, type, fieldPath, null);
    }

    static ValidationCheck warning(String name, String message, PeculiarityType type, String fieldPath) {
        return of(name, CheckStatus.WARNING, message, type, fieldPath, null);
    }

    static ValidationCheck of(String name, CheckStatus status, String message, PeculiarityType type,
            String fieldPath, Map<String, Object> details) {
        return ValidationCheck.builder()
                .name(name)
                .status(status)
                .message(message)
                .type(type)
                .fieldPath(fieldPath)
                .details(details)
                .build();
    }
}
