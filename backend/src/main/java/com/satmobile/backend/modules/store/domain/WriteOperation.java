package com.satmobile.backend.modules.store.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of a batched write.
 */
public record WriteOperation(Kind kind, DocumentPath path, Map<String, Object> data, String field, long delta) {

    public enum Kind {
        /** Set with merge: nested maps are merged, other fields overwritten, the rest kept. */
        MERGE,
        /** Set without merge: replaces the whole document. */
        REPLACE,
        DELETE,
        /** Atomic numeric increment of one field, creating the document if needed. */
        INCREMENT
    }

    public WriteOperation {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(path, "path");
        if ((kind == Kind.MERGE || kind == Kind.REPLACE) && data == null) {
            throw new IllegalArgumentException(kind + " needs a payload");
        }
        if (kind == Kind.INCREMENT && (field == null || field.isBlank())) {
            throw new IllegalArgumentException("INCREMENT needs a field");
        }
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : null;
    }

    public static WriteOperation merge(DocumentPath path, Map<String, Object> data) {
        return new WriteOperation(Kind.MERGE, path, data, null, 0L);
    }

    public static WriteOperation replace(DocumentPath path, Map<String, Object> data) {
        return new WriteOperation(Kind.REPLACE, path, data, null, 0L);
    }

    public static WriteOperation delete(DocumentPath path) {
        return new WriteOperation(Kind.DELETE, path, null, null, 0L);
    }

    public static WriteOperation increment(DocumentPath path, String field, long delta) {
        return new WriteOperation(Kind.INCREMENT, path, null, field, delta);
    }
}
