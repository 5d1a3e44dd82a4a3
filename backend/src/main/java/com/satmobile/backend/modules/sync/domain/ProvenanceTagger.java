package com.satmobile.backend.modules.sync.domain;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.satmobile.backend.modules.store.domain.DocumentFields;

import org.springframework.stereotype.Component;

/**
 * Stamps engine writes with their origin and recognises them when they come back as change
 * events. A marker only counts when the write under inspection set it: a later user edit that
 * leaves the marker untouched is propagated as usual.
 *
 * <p>Marker layout stays readable by existing clients: mirror copies carry
 * {@code syncedFrom {churchId, tenantId, at}}, source records updated from a mirror carry
 * {@code syncMetadata {sourceChurchId, syncedAt, syncedBy, syncDirection}}.
 */
@Component
public class ProvenanceTagger {

    public static final String FORWARD_MARKER = "syncedFrom";
    public static final String REVERSE_MARKER = "syncMetadata";
    public static final String ORIGIN = "syncOrigin";
    public static final String LAST_UPDATED = "lastUpdated";
    public static final String REVERSE_DIRECTION = "ministry-to-normal";

    private static final String FORWARD_AT = FORWARD_MARKER + ".at";
    private static final String REVERSE_AT = REVERSE_MARKER + ".syncedAt";

    private final Clock clock;

    public ProvenanceTagger(Clock clock) {
        this.clock = clock;
    }

    public Map<String, Object> tagForward(Map<String, Object> payload, String sourceTenantId) {
        Map<String, Object> marker = new LinkedHashMap<>();
        marker.put("churchId", sourceTenantId);
        marker.put("tenantId", sourceTenantId);
        marker.put("at", now());
        Map<String, Object> tagged = new LinkedHashMap<>(payload);
        tagged.put(FORWARD_MARKER, marker);
        tagged.put(ORIGIN, "mirror");
        return tagged;
    }

    /**
     * Tags a write into {@code sourceTenantId} made on behalf of a mirror tenant.
     *
     * @param actorId owner of the mirror tenant, recorded as {@code syncedBy}
     */
    public Map<String, Object> tagReverse(
            Map<String, Object> payload,
            String sourceTenantId,
            String mirrorTenantId,
            String actorId
    ) {
        String now = now();
        Map<String, Object> marker = new LinkedHashMap<>();
        marker.put("sourceChurchId", sourceTenantId);
        marker.put("syncedAt", now);
        marker.put("syncedBy", actorId != null ? actorId : "");
        marker.put("syncDirection", REVERSE_DIRECTION);
        marker.put("mirrorChurchId", mirrorTenantId);
        Map<String, Object> tagged = new LinkedHashMap<>(payload);
        tagged.put(REVERSE_MARKER, marker);
        tagged.put(ORIGIN, "reverse");
        tagged.put(LAST_UPDATED, now);
        return tagged;
    }

    /**
     * Whether a change seen by the {@code direction} handler was produced by the opposite
     * direction and must not be propagated again.
     */
    public boolean shouldSkip(SyncDirection direction, Map<String, Object> before, Map<String, Object> after) {
        if (after == null) {
            return false;
        }
        String field = direction.opposite() == SyncDirection.FORWARD ? FORWARD_AT : REVERSE_AT;
        String stampedAt = DocumentFields.string(after, field);
        return stampedAt != null && !Objects.equals(stampedAt, DocumentFields.string(before, field));
    }

    /** Source tenant recorded by the forward marker, {@code null} when the record is not a mirror copy. */
    public static String forwardSource(Map<String, Object> data) {
        String tenantId = DocumentFields.text(data, FORWARD_MARKER + ".tenantId");
        return tenantId != null ? tenantId : DocumentFields.text(data, FORWARD_MARKER + ".churchId");
    }

    /** Mirror tenant whose edit produced the reverse marker, {@code null} when unknown. */
    public static String reverseOrigin(Map<String, Object> data) {
        return DocumentFields.text(data, REVERSE_MARKER + ".mirrorChurchId");
    }

    /** Whether the record was written by a mirror-to-source sync at some point. */
    public static boolean isReverseSynced(Map<String, Object> data) {
        return DocumentFields.text(data, REVERSE_MARKER + ".syncDirection") != null;
    }

    private String now() {
        return clock.instant().toString();
    }
}
