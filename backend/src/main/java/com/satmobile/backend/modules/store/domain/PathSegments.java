package com.satmobile.backend.modules.store.domain;

import java.util.Arrays;
import java.util.List;

final class PathSegments {

    private PathSegments() {
    }

    static List<String> split(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Path must not be blank");
        }
        if (value.startsWith("/") || value.endsWith("/")) {
            throw new IllegalArgumentException("Path must not start or end with '/': " + value);
        }
        List<String> segments = Arrays.asList(value.split("/"));
        if (segments.stream().anyMatch(String::isBlank)) {
            throw new IllegalArgumentException("Path contains an empty segment: " + value);
        }
        return segments;
    }
}
