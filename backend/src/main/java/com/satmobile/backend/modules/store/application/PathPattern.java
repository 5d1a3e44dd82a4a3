package com.satmobile.backend.modules.store.application;

import java.util.Arrays;
import java.util.List;

import com.satmobile.backend.modules.store.domain.DocumentPath;

/**
 * Document path pattern where a {@code *} segment matches exactly one path segment.
 */
public record PathPattern(String value) {

    private static final String WILDCARD = "*";

    public static PathPattern of(String value) {
        return new PathPattern(value);
    }

    public boolean matches(DocumentPath path) {
        List<String> expected = Arrays.asList(value.split("/"));
        List<String> actual = path.segments();
        if (expected.size() != actual.size()) {
            return false;
        }
        for (int i = 0; i < expected.size(); i++) {
            String segment = expected.get(i);
            if (!WILDCARD.equals(segment) && !segment.equals(actual.get(i))) {
                return false;
            }
        }
        return true;
    }
}
