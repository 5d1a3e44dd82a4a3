package com.satmobile.backend.modules.counter.application;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.satmobile.backend.modules.counter.domain.CounterRecomputeSummary;
import com.satmobile.backend.modules.counter.domain.PurgeSummary;
import com.satmobile.backend.modules.store.application.BatchWriteResult;
import com.satmobile.backend.modules.store.application.BatchWriter;
import com.satmobile.backend.modules.store.domain.WriteOperation;
import com.satmobile.backend.modules.tenant.domain.AdminProfile;
import com.satmobile.backend.modules.tenant.domain.ChurchPaths;
import com.satmobile.backend.modules.tenant.domain.MemberRecords;
import com.satmobile.backend.modules.tenant.domain.Tenant;
import com.satmobile.backend.modules.tenant.infrastructure.AdminProfileRepository;
import com.satmobile.backend.modules.tenant.infrastructure.TenantDocumentRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Full recount of member counters, used to repair drift left by failed incremental updates.
 */
@Service
public class CounterRecomputeService {

    private static final Logger log = LoggerFactory.getLogger(CounterRecomputeService.class);

    private final BatchWriter batchWriter;
    private final TenantDocumentRepository tenantRepository;
    private final AdminProfileRepository profileRepository;

    public CounterRecomputeService(
            BatchWriter batchWriter,
            TenantDocumentRepository tenantRepository,
            AdminProfileRepository profileRepository
    ) {
        this.batchWriter = batchWriter;
        this.tenantRepository = tenantRepository;
        this.profileRepository = profileRepository;
    }

    /**
     * Overwrites every tenant's counter with its active member count, and every administrator's
     * counter with the sum over the tenants it administers or owns.
     */
    public CounterRecomputeSummary recomputeAll() {
        List<Tenant> tenants = tenantRepository.findAll();
        Map<String, Long> activeByTenant = new LinkedHashMap<>();
        for (Tenant tenant : tenants) {
            activeByTenant.put(tenant.id(), tenantRepository.countActiveMembers(tenant.id()));
        }

        Map<String, AdminProfile> administrators = new LinkedHashMap<>();
        profileRepository.findAdministrators().forEach(admin -> administrators.put(admin.id(), admin));
        for (Tenant tenant : tenants) {
            if (tenant.ownerId() != null && !administrators.containsKey(tenant.ownerId())) {
                profileRepository.findById(tenant.ownerId()).ifPresent(owner -> administrators.put(owner.id(), owner));
            }
        }

        List<WriteOperation> writes = new ArrayList<>();
        activeByTenant.forEach((tenantId, active) ->
                writes.add(WriteOperation.merge(ChurchPaths.tenant(tenantId), Map.of(MemberCounterService.COUNTER_FIELD, active))));
        for (AdminProfile admin : administrators.values()) {
            long total = 0;
            for (Tenant tenant : tenants) {
                if (admin.countsMembersOf(tenant.id(), tenant.ownerId())) {
                    total += activeByTenant.get(tenant.id());
                }
            }
            writes.add(WriteOperation.merge(ChurchPaths.user(admin.id()), Map.of(MemberCounterService.COUNTER_FIELD, total)));
        }

        BatchWriteResult result = batchWriter.write(writes);
        CounterRecomputeSummary summary = new CounterRecomputeSummary(
                tenants.size(), administrators.size(), result.attempted(), result.committed());
        log.info("Recomputed member counters tenants={} administrators={} committed={}/{}",
                summary.tenants(), summary.administrators(), summary.committed(), summary.writes());
        return summary;
    }

    /**
     * Deletes every member with {@code isActive == false} in every tenant, then recomputes.
     */
    public PurgeSummary purgeInactive() {
        List<WriteOperation> deletes = new ArrayList<>();
        for (Tenant tenant : tenantRepository.findAll()) {
            tenantRepository.findMembers(tenant.id()).stream()
                    .filter(member -> !MemberRecords.isActive(member.data()))
                    .forEach(member -> deletes.add(WriteOperation.delete(member.path())));
        }
        BatchWriteResult result = batchWriter.write(deletes);
        if (!result.isComplete()) {
            log.warn("Purge stopped after {}/{} inactive members", result.committed(), result.attempted());
        }
        CounterRecomputeSummary recompute = recomputeAll();
        log.info("Purged {} inactive members", result.committed());
        return new PurgeSummary(result.attempted(), result.committed(), recompute);
    }
}
