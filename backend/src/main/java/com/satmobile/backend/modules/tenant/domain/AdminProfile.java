package com.satmobile.backend.modules.tenant.domain;

import com.satmobile.backend.modules.store.domain.StoredDocument;

/**
 * Read view of a {@code users/{uid}} document.
 *
 * @param defaultChurchId  {@code contexts.defaultChurchId}, falling back to {@code churchId}
 * @param ministryChurchId {@code contexts.ministryChurchId}
 * @param ministryName     category the profile subscribes to ({@code preferences.ministryName})
 * @param superAdmin       legacy {@code superAdmin: true} flag
 */
public record AdminProfile(
        String id,
        String role,
        String churchId,
        String defaultChurchId,
        String ministryChurchId,
        boolean ministryAccount,
        String ministryName,
        long memberCount,
        boolean superAdmin
) {

    public static final String ROLE_ADMIN = "admin";
    public static final String ROLE_SUPER_ADMIN = "superadmin";
    public static final String ROLE_SUPER_ADMIN_ALIAS = "super-admin";

    public static AdminProfile from(StoredDocument document) {
        String churchId = document.getString("churchId");
        String defaultChurchId = document.getString("contexts.defaultChurchId");
        return new AdminProfile(
                document.id(),
                document.getString("role"),
                churchId,
                defaultChurchId != null ? defaultChurchId : churchId,
                document.getString("contexts.ministryChurchId"),
                document.isTrue("isMinistryAccount"),
                document.getString("preferences.ministryName"),
                document.getLong("memberCount", 0L),
                document.isTrue("superAdmin")
        );
    }

    public boolean isAdministrator() {
        return ROLE_ADMIN.equals(role);
    }

    public boolean isSuperAdmin() {
        return superAdmin || ROLE_SUPER_ADMIN.equals(role) || ROLE_SUPER_ADMIN_ALIAS.equals(role);
    }

    /** Tenant receiving mirrored records for this profile's category. */
    public String mirrorTenantId() {
        return ministryChurchId != null ? ministryChurchId : churchId;
    }

    public boolean administers(String tenantId) {
        return tenantId.equals(churchId) || tenantId.equals(defaultChurchId) || tenantId.equals(ministryChurchId);
    }

    /**
     * Whether this profile's {@code memberCount} covers the members of a tenant: the owner
     * always, other profiles only with the {@code admin} role and a link to the tenant.
     */
    public boolean countsMembersOf(String tenantId, String ownerId) {
        return id.equals(ownerId) || (isAdministrator() && administers(tenantId));
    }
}
