package com.podvalidation.backend.model;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH
}
