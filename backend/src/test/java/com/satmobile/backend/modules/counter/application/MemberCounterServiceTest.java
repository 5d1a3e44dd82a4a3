package com.satmobile.backend.modules.counter.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.Map;

import com.satmobile.backend.global.common.result.SyncErrorKind;
import com.satmobile.backend.global.common.result.SyncResult;
import com.satmobile.backend.modules.store.domain.DocumentChange;
import com.satmobile.backend.modules.tenant.domain.ChurchPaths;
import com.satmobile.backend.support.SyncEngineFixture;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MemberCounterServiceTest {

    private SyncEngineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new SyncEngineFixture().withTriggers();
        fixture.sourceTenant("grace", "pastor-grace");
    }

    @Test
    @DisplayName("creating, deactivating and deleting members moves tenant and owner counters")
    void incrementalUpdates() {
        fixture.member("grace", "m1", SyncEngineFixture.person("Ama", null, true));
        fixture.member("grace", "m2", SyncEngineFixture.person("Kofi", null, true));
        fixture.member("grace", "m3", SyncEngineFixture.person("Yaw", null, false));

        assertThat(fixture.counter(ChurchPaths.tenant("grace"))).isEqualTo(2L);
        assertThat(fixture.counter(ChurchPaths.user("pastor-grace"))).isEqualTo(2L);

        fixture.store.set(ChurchPaths.member("grace", "m1"), Map.of("isActive", false), true);
        fixture.store.delete(ChurchPaths.member("grace", "m3"));

        assertThat(fixture.counter(ChurchPaths.tenant("grace"))).isEqualTo(1L);
        assertThat(fixture.counter(ChurchPaths.user("pastor-grace"))).isEqualTo(1L);
    }

    @Test
    @DisplayName("edits that keep countability write nothing")
    void unchangedCountability() {
        fixture.member("grace", "m1", SyncEngineFixture.person("Ama", null, true));
        fixture.store.resetCounters();

        fixture.store.set(ChurchPaths.member("grace", "m1"), Map.of("phoneNumber", "555-0199"), true);

        assertThat(fixture.store.committedSizes()).containsExactly(1);
        assertThat(fixture.counter(ChurchPaths.tenant("grace"))).isEqualTo(1L);
    }

    @Test
    @DisplayName("every administrator attached to the tenant is counted once")
    void secondAdministrator() {
        Map<String, Object> coAdmin = new LinkedHashMap<>();
        coAdmin.put("role", "admin");
        coAdmin.put("churchId", "elsewhere");
        coAdmin.put("contexts", Map.of("defaultChurchId", "grace"));
        fixture.store.set(ChurchPaths.user("co-admin"), coAdmin, false);
        fixture.store.set(ChurchPaths.user("member-user"), Map.of("role", "member", "churchId", "grace"), false);

        fixture.member("grace", "m1", SyncEngineFixture.person("Ama", null, true));

        assertThat(fixture.counter(ChurchPaths.user("pastor-grace"))).isEqualTo(1L);
        assertThat(fixture.counter(ChurchPaths.user("co-admin"))).isEqualTo(1L);
        assertThat(fixture.counter(ChurchPaths.user("member-user"))).isZero();
    }

    @Test
    @DisplayName("a failed administrator batch is reported as partial after the tenant counter moved")
    void partialFailure() {
        SyncEngineFixture manual = new SyncEngineFixture();
        manual.sourceTenant("grace", "pastor-grace");
        manual.store.failCommit(2);

        SyncResult result = manual.memberCounterService.handle(new DocumentChange(
                ChurchPaths.member("grace", "m1"), null, SyncEngineFixture.person("Ama", null, true)));

        assertThat(result.isFailed()).isTrue();
        assertThat(result.errorKind()).isEqualTo(SyncErrorKind.PARTIAL_BATCH);
        assertThat(result.writes()).isEqualTo(1);
        assertThat(manual.counter(ChurchPaths.tenant("grace"))).isEqualTo(1L);
        assertThat(manual.counter(ChurchPaths.user("pastor-grace"))).isZero();
    }
}
