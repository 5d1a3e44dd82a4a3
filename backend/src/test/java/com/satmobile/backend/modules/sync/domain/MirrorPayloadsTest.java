package com.satmobile.backend.modules.sync.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MirrorPayloadsTest {

    @Test
    @DisplayName("mirror copy drops provenance and clears the group assignment")
    void forwardCopy() {
        Map<String, Object> source = new LinkedHashMap<>();
        source.put("firstName", "Ama");
        source.put("bacentaId", "b-7");
        source.put("syncMetadata", Map.of("tenantId", "m1"));
        source.put("syncOrigin", "reverse");

        Map<String, Object> copy = MirrorPayloads.forwardCopy(source);

        assertThat(copy).containsEntry("firstName", "Ama").containsEntry("bacentaId", "");
        assertThat(copy).doesNotContainKeys("syncMetadata", "syncOrigin", "syncedFrom");
        assertThat(source).containsEntry("bacentaId", "b-7");
    }

    @Test
    @DisplayName("only changed allow-listed fields flow back")
    void reverseChanges() {
        Map<String, Object> before = Map.of("firstName", "Ama", "lastName", "Mensah", "notes", "old", "bacentaId", "");
        Map<String, Object> after = Map.of("firstName", "Abena", "lastName", "Mensah", "notes", "new", "bacentaId", "b-9");

        assertThat(MirrorPayloads.reverseChanges(before, after)).isEqualTo(Map.of("firstName", "Abena"));
    }
}
