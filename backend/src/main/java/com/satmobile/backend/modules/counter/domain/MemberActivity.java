package com.satmobile.backend.modules.counter.domain;

import java.util.Map;

import com.satmobile.backend.modules.tenant.domain.MemberRecords;

/**
 * Counter delta of one member change.
 *
 * <pre>
 * create active        +1     update inactive to active  +1
 * create inactive       0     update active to inactive  -1
 * delete active        -1     other updates               0
 * delete inactive       0
 * </pre>
 */
public final class MemberActivity {

    private MemberActivity() {
    }

    public static int delta(Map<String, Object> before, Map<String, Object> after) {
        return weight(after) - weight(before);
    }

    private static int weight(Map<String, Object> data) {
        return MemberRecords.isActive(data) ? 1 : 0;
    }
}
