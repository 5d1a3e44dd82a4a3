package com.satmobile.backend.modules.prayer.domain;

public enum MarkingOutcome {
    MARKED,
    /** No session on the tenant's local date. */
    SKIPPED_DAY,
    OUTSIDE_WINDOW,
    ALREADY_LOCKED,
    FAILED
}
