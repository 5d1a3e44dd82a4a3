package com.satmobile.backend.modules.store.infrastructure;

/**
 * Transient failure reported by the document store (network, contention, timeouts).
 */
public class DocumentStoreException extends RuntimeException {

    public DocumentStoreException(String message) {
        super(message);
    }

    public DocumentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
