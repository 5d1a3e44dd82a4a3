package com.satmobile.backend.support;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.satmobile.backend.global.config.PrayerMarkingProperties;
import com.satmobile.backend.global.config.SyncProperties;
import com.satmobile.backend.modules.counter.application.CounterRecomputeService;
import com.satmobile.backend.modules.counter.application.MemberCounterService;
import com.satmobile.backend.modules.prayer.application.MissedPrayerMarkingService;
import com.satmobile.backend.modules.prayer.infrastructure.PrayerDocumentRepository;
import com.satmobile.backend.modules.store.application.BatchWriter;
import com.satmobile.backend.modules.store.application.ChangeEventDispatcher;
import com.satmobile.backend.modules.store.domain.DocumentPath;
import com.satmobile.backend.modules.sync.application.AttendanceReverseSyncService;
import com.satmobile.backend.modules.sync.application.MirrorBackfillService;
import com.satmobile.backend.modules.sync.application.MirrorSyncService;
import com.satmobile.backend.modules.sync.application.MirrorWritePlanner;
import com.satmobile.backend.modules.sync.application.NewBelieverReverseSyncService;
import com.satmobile.backend.modules.sync.application.ReverseSyncService;
import com.satmobile.backend.modules.sync.application.SundayConfirmationReverseSyncService;
import com.satmobile.backend.modules.sync.domain.ProvenanceTagger;
import com.satmobile.backend.modules.tenant.application.MirrorSetResolver;
import com.satmobile.backend.modules.tenant.application.TenantMappingResolver;
import com.satmobile.backend.modules.tenant.domain.ChurchPaths;
import com.satmobile.backend.modules.tenant.infrastructure.AdminProfileRepository;
import com.satmobile.backend.modules.tenant.infrastructure.TenantDocumentRepository;

/**
 * Wires the engine by hand over a {@link FlakyDocumentStore}, with helpers to lay out tenants,
 * administrator profiles and members.
 */
public class SyncEngineFixture {

    public static final Instant START = Instant.parse("2025-03-04T12:00:00Z");

    public final FlakyDocumentStore store = new FlakyDocumentStore();
    public final SteppingClock clock = new SteppingClock(START);
    public final BatchWriter batchWriter;
    public final TenantDocumentRepository tenantRepository;
    public final AdminProfileRepository profileRepository;
    public final TenantMappingResolver mappingResolver;
    public final MirrorSetResolver mirrorSetResolver;
    public final ProvenanceTagger provenanceTagger;
    public final MirrorWritePlanner writePlanner;
    public final MemberCounterService memberCounterService;
    public final CounterRecomputeService counterRecomputeService;
    public final MirrorSyncService mirrorSyncService;
    public final ReverseSyncService reverseSyncService;
    public final AttendanceReverseSyncService attendanceReverseSyncService;
    public final NewBelieverReverseSyncService newBelieverReverseSyncService;
    public final SundayConfirmationReverseSyncService confirmationReverseSyncService;
    public final MirrorBackfillService mirrorBackfillService;
    public final MissedPrayerMarkingService missedPrayerMarkingService;
    public final ChangeEventDispatcher dispatcher;

    public SyncEngineFixture() {
        this(450);
    }

    public SyncEngineFixture(int batchLimit) {
        batchWriter = new BatchWriter(store, new SyncProperties(batchLimit));
        tenantRepository = new TenantDocumentRepository(store);
        profileRepository = new AdminProfileRepository(store);
        mappingResolver = new TenantMappingResolver(tenantRepository, profileRepository);
        mirrorSetResolver = new MirrorSetResolver(profileRepository);
        provenanceTagger = new ProvenanceTagger(clock);
        writePlanner = new MirrorWritePlanner(store, provenanceTagger);
        memberCounterService = new MemberCounterService(store, batchWriter, tenantRepository, profileRepository);
        counterRecomputeService = new CounterRecomputeService(batchWriter, tenantRepository, profileRepository);
        mirrorSyncService = new MirrorSyncService(mappingResolver, mirrorSetResolver, writePlanner, provenanceTagger, batchWriter);
        reverseSyncService = new ReverseSyncService(store, mappingResolver, provenanceTagger);
        attendanceReverseSyncService = new AttendanceReverseSyncService(store, mappingResolver, provenanceTagger);
        newBelieverReverseSyncService = new NewBelieverReverseSyncService(
                store, mappingResolver, provenanceTagger, profileRepository);
        confirmationReverseSyncService = new SundayConfirmationReverseSyncService(
                store, mappingResolver, provenanceTagger, profileRepository);
        mirrorBackfillService = new MirrorBackfillService(
                tenantRepository, mappingResolver, mirrorSetResolver, writePlanner, batchWriter);
        missedPrayerMarkingService = new MissedPrayerMarkingService(
                tenantRepository,
                new PrayerDocumentRepository(store),
                batchWriter,
                new PrayerMarkingProperties(true, "America/New_York", 5));
        dispatcher = new ChangeEventDispatcher(
                List.of(memberCounterService, mirrorSyncService, reverseSyncService, attendanceReverseSyncService,
                        newBelieverReverseSyncService, confirmationReverseSyncService),
                List.of(store));
    }

    /** Routes every committed change through the handlers, like the deployed triggers. */
    public SyncEngineFixture withTriggers() {
        dispatcher.start();
        return this;
    }

    /** Regular administrator owning {@code tenantId} as its default tenant. */
    public void sourceTenant(String tenantId, String ownerId) {
        Map<String, Object> profile = new LinkedHashMap<>();
        profile.put("role", "admin");
        profile.put("churchId", tenantId);
        profile.put("isMinistryAccount", false);
        profile.put("contexts", Map.of("defaultChurchId", tenantId));
        store.set(ChurchPaths.user(ownerId), profile, false);
        store.set(ChurchPaths.tenant(tenantId), tenantDocument(ownerId, null), false);
    }

    /** Ministry account of {@code category} owning mirror tenant {@code tenantId}. */
    public void mirrorTenant(String tenantId, String ownerId, String category) {
        Map<String, Object> profile = new LinkedHashMap<>();
        profile.put("role", "admin");
        profile.put("churchId", tenantId);
        profile.put("isMinistryAccount", true);
        profile.put("preferences", Map.of("ministryName", category));
        profile.put("contexts", Map.of("ministryChurchId", tenantId));
        store.set(ChurchPaths.user(ownerId), profile, false);
        store.set(ChurchPaths.tenant(tenantId), tenantDocument(ownerId, null), false);
    }

    public void tenantWithTimezone(String tenantId, String ownerId, String timezone) {
        store.set(ChurchPaths.tenant(tenantId), tenantDocument(ownerId, timezone), false);
    }

    public void member(String tenantId, String memberId, Map<String, Object> fields) {
        store.set(ChurchPaths.member(tenantId, memberId), fields, false);
    }

    public Map<String, Object> memberData(String tenantId, String memberId) {
        return store.get(ChurchPaths.member(tenantId, memberId)).map(document -> document.data()).orElse(null);
    }

    public long counter(DocumentPath path) {
        return store.get(path).map(document -> document.getLong("memberCount", 0L)).orElse(0L);
    }

    public static Map<String, Object> person(String firstName, String category, boolean active) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("firstName", firstName);
        fields.put("lastName", "Doe");
        fields.put("phoneNumber", "555-0100");
        if (category != null) {
            fields.put("ministry", category);
        }
        fields.put("bacentaId", "bacenta-1");
        fields.put("isActive", active);
        return fields;
    }

    private static Map<String, Object> tenantDocument(String ownerId, String timezone) {
        Map<String, Object> tenant = new LinkedHashMap<>();
        tenant.put("ownerId", ownerId);
        tenant.put("memberCount", 0L);
        if (timezone != null) {
            tenant.put("settings", Map.of("timezone", timezone));
        }
        return tenant;
    }
}
