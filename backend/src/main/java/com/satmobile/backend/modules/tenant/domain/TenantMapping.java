package com.satmobile.backend.modules.tenant.domain;

/**
 * Role of one tenant in mirror sync, derived from its owner's profile.
 *
 * @param category the owner's category label, {@code null} when it has none
 */
public record TenantMapping(String tenantId, TenantRole role, String ownerId, String category) {

    public static TenantMapping unmapped(String tenantId) {
        return new TenantMapping(tenantId, TenantRole.UNMAPPED, null, null);
    }

    public boolean isSource() {
        return role == TenantRole.SOURCE;
    }

    public boolean isMirror() {
        return role == TenantRole.MIRROR;
    }
}
