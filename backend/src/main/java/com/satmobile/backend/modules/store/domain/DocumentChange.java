package com.satmobile.backend.modules.store.domain;

import java.util.Map;
import java.util.Objects;

/**
 * Change event emitted by the store for one document. {@code before} is {@code null} for a
 * create, {@code after} is {@code null} for a delete.
 */
public record DocumentChange(DocumentPath path, Map<String, Object> before, Map<String, Object> after) {

    public enum Type {
        CREATE,
        UPDATE,
        DELETE
    }

    public DocumentChange {
        Objects.requireNonNull(path, "path");
        if (before == null && after == null) {
            throw new IllegalArgumentException("A change needs a before or an after image");
        }
    }

    public Type type() {
        if (before == null) {
            return Type.CREATE;
        }
        return after == null ? Type.DELETE : Type.UPDATE;
    }
}
