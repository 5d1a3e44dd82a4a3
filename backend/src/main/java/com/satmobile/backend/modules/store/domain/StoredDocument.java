package com.satmobile.backend.modules.store.domain;

import java.util.Map;
import java.util.Objects;

public record StoredDocument(DocumentPath path, Map<String, Object> data) {

    public StoredDocument {
        Objects.requireNonNull(path, "path");
        data = data != null ? data : Map.of();
    }

    public String id() {
        return path.id();
    }

    public String getString(String field) {
        return DocumentFields.text(data, field);
    }

    public boolean isTrue(String field) {
        return DocumentFields.isTrue(data, field);
    }

    public Boolean getBoolean(String field) {
        return DocumentFields.bool(data, field);
    }

    public long getLong(String field, long fallback) {
        return DocumentFields.longValue(data, field, fallback);
    }

    public Map<String, Object> getMap(String field) {
        return DocumentFields.map(data, field);
    }
}
