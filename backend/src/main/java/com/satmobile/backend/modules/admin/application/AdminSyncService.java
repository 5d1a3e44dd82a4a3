package com.satmobile.backend.modules.admin.application;

import com.satmobile.backend.modules.counter.application.CounterRecomputeService;
import com.satmobile.backend.modules.counter.domain.CounterRecomputeSummary;
import com.satmobile.backend.modules.counter.domain.PurgeSummary;
import com.satmobile.backend.modules.sync.application.MirrorBackfillService;
import com.satmobile.backend.modules.sync.domain.MirrorSyncSummary;
import com.satmobile.backend.modules.tenant.domain.AdminProfile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Administrative maintenance operations. Every call verifies the caller before touching the store.
 */
@Service
public class AdminSyncService {

    private static final Logger log = LoggerFactory.getLogger(AdminSyncService.class);

    private final CallerRoleVerifier callerRoleVerifier;
    private final CounterRecomputeService counterRecomputeService;
    private final MirrorBackfillService mirrorBackfillService;

    public AdminSyncService(
            CallerRoleVerifier callerRoleVerifier,
            CounterRecomputeService counterRecomputeService,
            MirrorBackfillService mirrorBackfillService
    ) {
        this.callerRoleVerifier = callerRoleVerifier;
        this.counterRecomputeService = counterRecomputeService;
        this.mirrorBackfillService = mirrorBackfillService;
    }

    public CounterRecomputeSummary recomputeCounters(String callerId) {
        AdminProfile caller = callerRoleVerifier.requireAdministrator(callerId);
        log.info("Counter recompute requested by {}", caller.id());
        return counterRecomputeService.recomputeAll();
    }

    public PurgeSummary purgeInactiveMembers(String callerId) {
        AdminProfile caller = callerRoleVerifier.requireAdministrator(callerId);
        log.info("Inactive member purge requested by {}", caller.id());
        return counterRecomputeService.purgeInactive();
    }

    public MirrorSyncSummary backfillMirrors(String callerId, String tenantId) {
        AdminProfile caller = callerRoleVerifier.requireAdministrator(callerId);
        log.info("Mirror backfill of {} requested by {}", tenantId, caller.id());
        return mirrorBackfillService.backfill(tenantId);
    }

    public MirrorSyncSummary syncCategory(String callerId, String categoryLabel) {
        AdminProfile caller = callerRoleVerifier.requireAdministrator(callerId);
        log.info("Cross category sync of '{}' requested by {}", categoryLabel, caller.id());
        return mirrorBackfillService.crossCategorySync(categoryLabel);
    }
}
