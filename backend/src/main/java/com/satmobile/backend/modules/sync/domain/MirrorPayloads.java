package com.satmobile.backend.modules.sync.domain;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.satmobile.backend.modules.tenant.domain.MemberRecords;

/**
 * Payload transformations between a source member record and its mirror copies.
 */
public final class MirrorPayloads {

    /** Fields a mirror tenant may change on the source record. */
    public static final List<String> REVERSE_FIELDS = List.of(
            "firstName",
            "lastName",
            "phoneNumber",
            "buildingAddress",
            "roomNumber",
            "profilePicture",
            "ministry",
            "birthday",
            "bornAgainStatus"
    );

    private MirrorPayloads() {
    }

    /** Copy for a mirror: provenance stripped, group assignment cleared. */
    public static Map<String, Object> forwardCopy(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>(source);
        copy.remove(ProvenanceTagger.FORWARD_MARKER);
        copy.remove(ProvenanceTagger.REVERSE_MARKER);
        copy.remove(ProvenanceTagger.ORIGIN);
        copy.put(MemberRecords.GROUP_ASSIGNMENT, "");
        return copy;
    }

    /** Whole-record copy for the source tenant, provenance stripped. */
    public static Map<String, Object> reverseRecordCopy(Map<String, Object> data) {
        Map<String, Object> copy = new LinkedHashMap<>(data);
        copy.remove(ProvenanceTagger.FORWARD_MARKER);
        copy.remove(ProvenanceTagger.REVERSE_MARKER);
        copy.remove(ProvenanceTagger.ORIGIN);
        return copy;
    }

    /** Allow-listed fields present in {@code after} whose value differs from {@code before}. */
    public static Map<String, Object> reverseChanges(Map<String, Object> before, Map<String, Object> after) {
        Map<String, Object> changes = new LinkedHashMap<>();
        for (String field : REVERSE_FIELDS) {
            if (!after.containsKey(field)) {
                continue;
            }
            Object previous = before != null ? before.get(field) : null;
            if (!Objects.equals(previous, after.get(field))) {
                changes.put(field, after.get(field));
            }
        }
        return changes;
    }
}
