package com.satmobile.backend.modules.prayer.domain;

/**
 * Result of one job tick for one tenant.
 *
 * @param date   tenant local date the tick evaluated, {@code null} when it failed before resolving it
 * @param marked records written as missed
 */
public record TenantTickResult(String tenantId, String date, MarkingOutcome outcome, int marked, String detail) {

    public static TenantTickResult of(String tenantId, String date, MarkingOutcome outcome) {
        return new TenantTickResult(tenantId, date, outcome, 0, null);
    }

    public static TenantTickResult marked(String tenantId, String date, int marked) {
        return new TenantTickResult(tenantId, date, MarkingOutcome.MARKED, marked, null);
    }

    public static TenantTickResult failed(String tenantId, String date, int marked, String detail) {
        return new TenantTickResult(tenantId, date, MarkingOutcome.FAILED, marked, detail);
    }
}
