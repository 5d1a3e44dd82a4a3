package com.satmobile.backend.modules.tenant.domain;

import com.satmobile.backend.modules.store.domain.StoredDocument;

/**
 * Read view of a {@code churches/{id}} document.
 */
public record Tenant(String id, String ownerId, long memberCount, String timezone) {

    public static Tenant from(StoredDocument document) {
        return new Tenant(
                document.id(),
                document.getString("ownerId"),
                document.getLong("memberCount", 0L),
                document.getString("settings.timezone")
        );
    }
}
