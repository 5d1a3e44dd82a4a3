package com.satmobile.backend.modules.tenant.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import com.satmobile.backend.modules.tenant.domain.ChurchPaths;
import com.satmobile.backend.modules.tenant.domain.TenantRole;
import com.satmobile.backend.support.SyncEngineFixture;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TenantMappingResolverTest {

    private SyncEngineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new SyncEngineFixture();
        fixture.sourceTenant("grace", "pastor-grace");
        fixture.mirrorTenant("choir-hq", "choir-lead", "Choir");
    }

    @Test
    @DisplayName("tenants are classified through their owner profile")
    void classifies() {
        assertThat(fixture.mappingResolver.resolve("grace").role()).isEqualTo(TenantRole.SOURCE);
        assertThat(fixture.mappingResolver.resolve("choir-hq").role()).isEqualTo(TenantRole.MIRROR);
        assertThat(fixture.mappingResolver.resolve("choir-hq").category()).isEqualTo("Choir");
    }

    @Test
    @DisplayName("the ministry context of a regular administrator is a mirror")
    void ministryContextOfRegularAdmin() {
        fixture.store.set(ChurchPaths.user("pastor-grace"),
                Map.of("contexts", Map.of("ministryChurchId", "grace-ministry")), true);
        fixture.store.set(ChurchPaths.tenant("grace-ministry"), Map.of("ownerId", "pastor-grace"), false);

        assertThat(fixture.mappingResolver.resolve("grace-ministry").role()).isEqualTo(TenantRole.MIRROR);
        assertThat(fixture.mappingResolver.resolve("grace").role()).isEqualTo(TenantRole.SOURCE);
    }

    @Test
    @DisplayName("missing tenants, owners and unrelated tenants are unmapped")
    void unmapped() {
        fixture.store.set(ChurchPaths.tenant("lost"), Map.of("ownerId", "ghost"), false);
        fixture.store.set(ChurchPaths.tenant("side"), Map.of("ownerId", "pastor-grace"), false);

        assertThat(fixture.mappingResolver.resolve("absent").role()).isEqualTo(TenantRole.UNMAPPED);
        assertThat(fixture.mappingResolver.resolve("lost").role()).isEqualTo(TenantRole.UNMAPPED);
        assertThat(fixture.mappingResolver.resolve("side").role()).isEqualTo(TenantRole.UNMAPPED);
    }

    @Test
    @DisplayName("mirror set holds ministry accounts of the category only")
    void mirrorSet() {
        fixture.store.set(ChurchPaths.user("fan"), Map.of(
                "role", "admin",
                "isMinistryAccount", false,
                "churchId", "fan-church",
                "preferences", Map.of("ministryName", "Choir")), false);

        assertThat(fixture.mirrorSetResolver.resolveMirrorSet("Choir")).containsExactly("choir-hq");
        assertThat(fixture.mirrorSetResolver.resolveMirrorSet("Ushers")).isEmpty();
        assertThat(fixture.mirrorSetResolver.resolveMirrorSet(" ")).isEmpty();
    }
}
