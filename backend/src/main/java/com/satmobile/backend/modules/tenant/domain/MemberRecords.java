package com.satmobile.backend.modules.tenant.domain;

import java.util.Map;

import com.satmobile.backend.modules.store.domain.DocumentFields;

/**
 * Rules over raw member record data. A missing record (deleted) is never active.
 */
public final class MemberRecords {

    public static final String IS_ACTIVE = "isActive";
    public static final String CATEGORY = "ministry";
    public static final String GROUP_ASSIGNMENT = "bacentaId";
    public static final String FROZEN = "frozen";

    private MemberRecords() {
    }

    /** Countable iff present and {@code isActive} is not explicitly {@code false}. */
    public static boolean isActive(Map<String, Object> data) {
        return data != null && !Boolean.FALSE.equals(DocumentFields.value(data, IS_ACTIVE));
    }

    /** Trimmed category label, {@code null} when missing or blank. */
    public static String category(Map<String, Object> data) {
        return DocumentFields.text(data, CATEGORY);
    }

    public static boolean isFrozen(Map<String, Object> data) {
        return DocumentFields.isTrue(data, FROZEN);
    }
}
