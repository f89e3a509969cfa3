package com.podvalidation.backend.dto;

public record ErrorResponse(String code, String message) {
}
