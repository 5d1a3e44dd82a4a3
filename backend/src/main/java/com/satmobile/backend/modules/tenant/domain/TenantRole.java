package com.satmobile.backend.modules.tenant.domain;

public enum TenantRole {
    /** Owned by a regular administrator; its members fan out to mirrors. */
    SOURCE,
    /** Category tenant of a ministry account; receives mirrored copies. */
    MIRROR,
    UNMAPPED
}
