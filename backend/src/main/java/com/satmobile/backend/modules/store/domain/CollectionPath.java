package com.satmobile.backend.modules.store.domain;

import java.util.List;

/**
 * Slash separated path of a collection, e.g. {@code churches/c1/members}. Always has an odd
 * number of segments.
 */
public record CollectionPath(String value) {

    public CollectionPath {
        List<String> segments = PathSegments.split(value);
        if (segments.size() % 2 != 1) {
            throw new IllegalArgumentException("Collection path needs an odd number of segments: " + value);
        }
    }

    public static CollectionPath of(String... segments) {
        return new CollectionPath(String.join("/", segments));
    }

    public DocumentPath document(String id) {
        return new DocumentPath(value + "/" + id);
    }

    /** Last segment, the id used by collection group queries. */
    public String collectionId() {
        return value.substring(value.lastIndexOf('/') + 1);
    }

    @Override
    public String toString() {
        return value;
    }
}
