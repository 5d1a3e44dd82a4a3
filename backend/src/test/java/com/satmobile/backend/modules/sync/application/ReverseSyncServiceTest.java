package com.satmobile.backend.modules.sync.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.satmobile.backend.global.common.result.SyncResult;
import com.satmobile.backend.modules.store.domain.DocumentChange;
import com.satmobile.backend.modules.store.domain.DocumentFields;
import com.satmobile.backend.modules.tenant.domain.ChurchPaths;
import com.satmobile.backend.support.SyncEngineFixture;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ReverseSyncServiceTest {

    private SyncEngineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new SyncEngineFixture().withTriggers();
        fixture.sourceTenant("grace", "pastor-grace");
        fixture.mirrorTenant("choir-hq", "choir-lead", "Choir");
        fixture.member("grace", "m1", SyncEngineFixture.person("Ama", "Choir", true));
    }

    @Test
    @DisplayName("allow-listed edits on the mirror copy reach the source, other fields stay local")
    void propagatesAllowListedFields() {
        List<DocumentChange> sourceChanges = new ArrayList<>();
        fixture.store.subscribe(change -> {
            if (change.path().equals(ChurchPaths.member("grace", "m1"))) {
                sourceChanges.add(change);
            }
        });
        Map<String, Object> edit = new LinkedHashMap<>();
        edit.put("lastName", "Mensah");
        edit.put("notes", "sings alto");
        edit.put("bacentaId", "choir-cell-2");

        fixture.store.set(ChurchPaths.member("choir-hq", "m1"), edit, true);

        Map<String, Object> source = fixture.memberData("grace", "m1");
        assertThat(source).containsEntry("lastName", "Mensah").containsEntry("bacentaId", "bacenta-1");
        assertThat(source).doesNotContainKey("notes");
        assertThat(DocumentFields.string(source, "syncMetadata.syncDirection")).isEqualTo("ministry-to-normal");
        assertThat(DocumentFields.string(source, "syncMetadata.sourceChurchId")).isEqualTo("grace");
        assertThat(DocumentFields.string(source, "syncMetadata.syncedBy")).isEqualTo("choir-lead");
        assertThat(DocumentFields.string(source, "syncMetadata.mirrorChurchId")).isEqualTo("choir-hq");
        assertThat(source).containsKey("lastUpdated");
        assertThat(sourceChanges).hasSize(1);
        assertThat(fixture.memberData("choir-hq", "m1")).containsEntry("bacentaId", "choir-cell-2");
    }

    @Test
    @DisplayName("a later source edit still fans out after a reverse sync")
    void forwardAfterReverse() {
        fixture.store.set(ChurchPaths.member("choir-hq", "m1"), Map.of("lastName", "Mensah"), true);

        fixture.store.set(ChurchPaths.member("grace", "m1"), Map.of("phoneNumber", "555-0142"), true);

        assertThat(fixture.memberData("choir-hq", "m1"))
                .containsEntry("phoneNumber", "555-0142")
                .containsEntry("lastName", "Mensah");
    }

    @Test
    @DisplayName("a category change made on a mirror moves the copies and leaves nothing in the old mirror")
    void categoryChangedOnMirror() {
        fixture.mirrorTenant("ushers-hq", "ushers-lead", "Ushers");

        fixture.store.set(ChurchPaths.member("choir-hq", "m1"), Map.of("ministry", "Ushers"), true);

        assertThat(fixture.memberData("grace", "m1")).containsEntry("ministry", "Ushers");
        assertThat(fixture.memberData("choir-hq", "m1")).isNull();
        assertThat(fixture.memberData("ushers-hq", "m1"))
                .containsEntry("ministry", "Ushers")
                .containsEntry("firstName", "Ama");

        fixture.store.set(ChurchPaths.member("grace", "m1"), Map.of("phoneNumber", "555-0142"), true);
        fixture.mirrorBackfillService.backfill("grace");

        assertThat(fixture.memberData("choir-hq", "m1")).isNull();
        assertThat(fixture.memberData("ushers-hq", "m1")).containsEntry("phoneNumber", "555-0142");
        assertThat(fixture.counter(ChurchPaths.tenant("choir-hq"))).isZero();
        assertThat(fixture.counter(ChurchPaths.tenant("ushers-hq"))).isEqualTo(1L);
    }

    @Test
    @DisplayName("a mirror copy tagged with syncedFrom.churchId syncs back to its source")
    void churchIdTaggedCopy() {
        Map<String, Object> copy = new LinkedHashMap<>(SyncEngineFixture.person("Ama", "Choir", true));
        copy.put("bacentaId", "");
        copy.put("syncedFrom", Map.of("churchId", "grace", "at", "2025-01-10T08:00:00Z"));
        copy.put("syncOrigin", "default");
        fixture.store.set(ChurchPaths.member("choir-hq", "m1"), copy, false);

        fixture.store.set(ChurchPaths.member("choir-hq", "m1"), Map.of("phoneNumber", "555-0199"), true);

        assertThat(fixture.memberData("grace", "m1")).containsEntry("phoneNumber", "555-0199");
    }

    @Test
    @DisplayName("deleting the mirror copy never deletes the source")
    void neverDeletes() {
        fixture.store.delete(ChurchPaths.member("choir-hq", "m1"));

        assertThat(fixture.memberData("grace", "m1")).isNotNull();
    }

    @Test
    @DisplayName("a missing source record is skipped")
    void missingSource() {
        SyncEngineFixture manual = new SyncEngineFixture();
        manual.sourceTenant("grace", "pastor-grace");
        manual.mirrorTenant("choir-hq", "choir-lead", "Choir");
        Map<String, Object> before = new LinkedHashMap<>(SyncEngineFixture.person("Ama", "Choir", true));
        before.put("syncedFrom", Map.of("tenantId", "grace", "at", "2025-03-01T00:00:00Z"));
        Map<String, Object> after = new LinkedHashMap<>(before);
        after.put("firstName", "Abena");

        SyncResult result = manual.reverseSyncService.handle(
                new DocumentChange(ChurchPaths.member("choir-hq", "ghost"), before, after));

        assertThat(result.isSkipped()).isTrue();
        assertThat(result.detail()).isEqualTo("source record missing");
        assertThat(manual.memberData("grace", "ghost")).isNull();
    }
}
