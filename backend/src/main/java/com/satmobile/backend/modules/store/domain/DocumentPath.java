package com.satmobile.backend.modules.store.domain;

import java.util.Arrays;
import java.util.List;

/**
 * Slash separated path of a document, e.g. {@code churches/c1/members/m1}. Always has an even
 * number of segments.
 */
public record DocumentPath(String value) {

    public DocumentPath {
        List<String> segments = PathSegments.split(value);
        if (segments.size() % 2 != 0) {
            throw new IllegalArgumentException("Document path needs an even number of segments: " + value);
        }
    }

    public static DocumentPath of(String... segments) {
        return new DocumentPath(String.join("/", segments));
    }

    public List<String> segments() {
        return Arrays.asList(value.split("/"));
    }

    public String segment(int index) {
        return segments().get(index);
    }

    public String id() {
        List<String> segments = segments();
        return segments.get(segments.size() - 1);
    }

    public CollectionPath parent() {
        return new CollectionPath(value.substring(0, value.lastIndexOf('/')));
    }

    @Override
    public String toString() {
        return value;
    }
}
