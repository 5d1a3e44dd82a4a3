package com.satmobile.backend.modules.tenant.domain;

import com.satmobile.backend.modules.store.domain.CollectionPath;
import com.satmobile.backend.modules.store.domain.DocumentPath;

/**
 * Document layout of the store. Every tenant ("church") owns its sub-collections; administrator
 * profiles live in the top-level {@code users} collection.
 */
public final class ChurchPaths {

    public static final String TENANTS = "churches";
    public static final String USERS = "users";
    public static final String MEMBERS = "members";
    public static final String PRAYERS = "prayers";
    public static final String PRAYER_SCHEDULES = "prayerSchedules";
    public static final String PRAYER_LOCKS = "prayerMarkingLocks";
    public static final String MINISTRY_EXCLUSIONS = "ministryExclusions";
    public static final String MINISTRY_OVERRIDES = "ministryMemberOverrides";
    public static final String ATTENDANCE = "attendance";
    public static final String NEW_BELIEVERS = "newBelievers";
    public static final String SUNDAY_CONFIRMATIONS = "sundayConfirmations";

    /** Pattern of every member record in every tenant. */
    public static final String MEMBER_PATTERN = TENANTS + "/*/" + MEMBERS + "/*";

    private ChurchPaths() {
    }

    public static CollectionPath tenants() {
        return CollectionPath.of(TENANTS);
    }

    public static DocumentPath tenant(String tenantId) {
        return DocumentPath.of(TENANTS, tenantId);
    }

    public static CollectionPath users() {
        return CollectionPath.of(USERS);
    }

    public static DocumentPath user(String uid) {
        return DocumentPath.of(USERS, uid);
    }

    public static CollectionPath members(String tenantId) {
        return CollectionPath.of(TENANTS, tenantId, MEMBERS);
    }

    public static DocumentPath member(String tenantId, String memberId) {
        return members(tenantId).document(memberId);
    }

    public static CollectionPath prayers(String tenantId) {
        return CollectionPath.of(TENANTS, tenantId, PRAYERS);
    }

    public static CollectionPath prayerSchedules(String tenantId) {
        return CollectionPath.of(TENANTS, tenantId, PRAYER_SCHEDULES);
    }

    public static DocumentPath prayerLock(String tenantId, String date) {
        return CollectionPath.of(TENANTS, tenantId, PRAYER_LOCKS).document(date);
    }

    public static CollectionPath ministryOverrides(String tenantId) {
        return CollectionPath.of(TENANTS, tenantId, MINISTRY_OVERRIDES);
    }

    public static DocumentPath ministryExclusion(String mirrorTenantId, String sourceTenantId, String memberId) {
        return CollectionPath.of(TENANTS, mirrorTenantId, MINISTRY_EXCLUSIONS).document(sourceTenantId + "_" + memberId);
    }

    public static CollectionPath records(String tenantId, String collectionId) {
        return CollectionPath.of(TENANTS, tenantId, collectionId);
    }

    /** Pattern of every document of {@code collectionId} in every tenant. */
    public static String recordPattern(String collectionId) {
        return TENANTS + "/*/" + collectionId + "/*";
    }

    /** Tenant id of a document nested under {@code churches/{tenantId}}. */
    public static String tenantIdOf(DocumentPath path) {
        if (path.segments().size() < 2 || !TENANTS.equals(path.segment(0))) {
            throw new IllegalArgumentException("Not a tenant document: " + path);
        }
        return path.segment(1);
    }
}
