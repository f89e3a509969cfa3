package com.podvalidation.backend.exception;

/**
 * A document, delivery or client configuration does not exist.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException document(String documentId) {
        return new NotFoundException("Document not found: " + documentId);
    }

    public static NotFoundException delivery(String deliveryId) {
        return new NotFoundException("Delivery not found: " + deliveryId);
    }
}
