package com.satmobile.backend.modules.counter.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import com.satmobile.backend.modules.counter.domain.CounterRecomputeSummary;
import com.satmobile.backend.modules.counter.domain.PurgeSummary;
import com.satmobile.backend.modules.tenant.domain.ChurchPaths;
import com.satmobile.backend.support.SyncEngineFixture;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CounterRecomputeServiceTest {

    private SyncEngineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new SyncEngineFixture().withTriggers();
        fixture.sourceTenant("grace", "pastor-grace");
        fixture.sourceTenant("hope", "pastor-hope");
        fixture.mirrorTenant("choir-hq", "choir-lead", "Choir");
    }

    @Test
    @DisplayName("recompute after a sequence of incremental updates changes nothing")
    void recomputeMatchesIncremental() {
        fixture.member("grace", "m1", SyncEngineFixture.person("Ama", "Choir", true));
        fixture.member("grace", "m2", SyncEngineFixture.person("Kofi", "Choir", true));
        fixture.member("hope", "m3", SyncEngineFixture.person("Esi", "Choir", true));
        fixture.store.set(ChurchPaths.member("grace", "m2"), Map.of("isActive", false), true);
        fixture.store.delete(ChurchPaths.member("hope", "m3"));
        fixture.member("hope", "m4", SyncEngineFixture.person("Yaw", null, false));
        fixture.store.set(ChurchPaths.member("hope", "m4"), Map.of("isActive", true), true);

        Map<String, Long> incremental = counters();
        CounterRecomputeSummary summary = fixture.counterRecomputeService.recomputeAll();

        assertThat(summary.isComplete()).isTrue();
        assertThat(summary.tenants()).isEqualTo(3);
        assertThat(counters()).isEqualTo(incremental);
        assertThat(incremental).containsEntry("grace", 1L).containsEntry("hope", 1L).containsEntry("choir-hq", 1L);
    }

    @Test
    @DisplayName("recompute repairs drifted counters")
    void repairsDrift() {
        fixture.member("grace", "m1", SyncEngineFixture.person("Ama", null, true));
        fixture.store.set(ChurchPaths.tenant("grace"), Map.of("memberCount", 42L), true);
        fixture.store.set(ChurchPaths.user("pastor-grace"), Map.of("memberCount", -3L), true);

        fixture.counterRecomputeService.recomputeAll();

        assertThat(fixture.counter(ChurchPaths.tenant("grace"))).isEqualTo(1L);
        assertThat(fixture.counter(ChurchPaths.user("pastor-grace"))).isEqualTo(1L);
    }

    @Test
    @DisplayName("an owner without the admin role counts only the tenants it owns, incrementally and on recompute")
    void ownerWithoutAdminRole() {
        fixture.store.set(ChurchPaths.user("volunteer"), Map.of(
                "role", "member",
                "churchId", "grace",
                "contexts", Map.of("defaultChurchId", "grace", "ministryChurchId", "hope")), false);
        fixture.store.set(ChurchPaths.tenant("solo"), Map.of("ownerId", "volunteer"), false);
        fixture.member("grace", "m1", SyncEngineFixture.person("Ama", null, true));
        fixture.member("hope", "m2", SyncEngineFixture.person("Kofi", null, true));
        fixture.member("solo", "m3", SyncEngineFixture.person("Esi", null, true));

        long incremental = fixture.counter(ChurchPaths.user("volunteer"));
        fixture.counterRecomputeService.recomputeAll();

        assertThat(incremental).isEqualTo(1L);
        assertThat(fixture.counter(ChurchPaths.user("volunteer"))).isEqualTo(1L);
        assertThat(fixture.counter(ChurchPaths.user("pastor-grace"))).isEqualTo(1L);
    }

    @Test
    @DisplayName("purge deletes inactive members everywhere and leaves exact counters")
    void purgeInactive() {
        fixture.member("grace", "m1", SyncEngineFixture.person("Ama", null, true));
        fixture.member("grace", "m2", SyncEngineFixture.person("Kofi", null, false));
        fixture.member("hope", "m3", SyncEngineFixture.person("Esi", null, false));
        fixture.store.set(ChurchPaths.tenant("hope"), Map.of("memberCount", 7L), true);

        PurgeSummary summary = fixture.counterRecomputeService.purgeInactive();

        assertThat(summary.isComplete()).isTrue();
        assertThat(summary.inactiveFound()).isEqualTo(2);
        assertThat(fixture.memberData("grace", "m2")).isNull();
        assertThat(fixture.memberData("hope", "m3")).isNull();
        assertThat(fixture.memberData("grace", "m1")).isNotNull();
        assertThat(fixture.counter(ChurchPaths.tenant("grace"))).isEqualTo(1L);
        assertThat(fixture.counter(ChurchPaths.tenant("hope"))).isZero();
    }

    private Map<String, Long> counters() {
        return Map.of(
                "grace", fixture.counter(ChurchPaths.tenant("grace")),
                "hope", fixture.counter(ChurchPaths.tenant("hope")),
                "choir-hq", fixture.counter(ChurchPaths.tenant("choir-hq")),
                "pastor-grace", fixture.counter(ChurchPaths.user("pastor-grace")),
                "pastor-hope", fixture.counter(ChurchPaths.user("pastor-hope")),
                "choir-lead", fixture.counter(ChurchPaths.user("choir-lead")));
    }
}
