package com.satmobile.backend.modules.sync.application;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.satmobile.backend.global.error.ProblemException;
import com.satmobile.backend.modules.store.application.BatchWriteResult;
import com.satmobile.backend.modules.store.application.BatchWriter;
import com.satmobile.backend.modules.store.domain.StoredDocument;
import com.satmobile.backend.modules.store.domain.WriteOperation;
import com.satmobile.backend.modules.sync.domain.MirrorSyncSummary;
import com.satmobile.backend.modules.tenant.application.MirrorSetResolver;
import com.satmobile.backend.modules.tenant.application.TenantMappingResolver;
import com.satmobile.backend.modules.tenant.domain.MemberRecords;
import com.satmobile.backend.modules.tenant.domain.Tenant;
import com.satmobile.backend.modules.tenant.infrastructure.TenantDocumentRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Bulk mirror upserts for records written before mirroring was set up, or missed by a failed
 * trigger. Re-running is harmless: copies are merged by member id.
 */
@Service
public class MirrorBackfillService {

    private static final Logger log = LoggerFactory.getLogger(MirrorBackfillService.class);

    private final TenantDocumentRepository tenantRepository;
    private final TenantMappingResolver mappingResolver;
    private final MirrorSetResolver mirrorSetResolver;
    private final MirrorWritePlanner writePlanner;
    private final BatchWriter batchWriter;

    public MirrorBackfillService(
            TenantDocumentRepository tenantRepository,
            TenantMappingResolver mappingResolver,
            MirrorSetResolver mirrorSetResolver,
            MirrorWritePlanner writePlanner,
            BatchWriter batchWriter
    ) {
        this.tenantRepository = tenantRepository;
        this.mappingResolver = mappingResolver;
        this.mirrorSetResolver = mirrorSetResolver;
        this.writePlanner = writePlanner;
        this.batchWriter = batchWriter;
    }

    /** Upserts every active, categorised member of one source tenant into its mirrors. */
    public MirrorSyncSummary backfill(String tenantId) {
        if (!mappingResolver.resolve(tenantId).isSource()) {
            throw new ProblemException(HttpStatus.CONFLICT, "sync.tenant_not_source",
                    "tenant " + tenantId + " is not a source tenant");
        }
        List<StoredDocument> members = tenantRepository.findMembers(tenantId);
        Map<String, Set<String>> mirrorsByCategory = new HashMap<>();
        List<WriteOperation> operations = new ArrayList<>();
        for (StoredDocument member : members) {
            String category = MemberRecords.category(member.data());
            if (category == null || !MemberRecords.isActive(member.data())) {
                continue;
            }
            Set<String> mirrors = mirrorsByCategory.computeIfAbsent(category, mirrorSetResolver::resolveMirrorSet);
            operations.addAll(writePlanner.upserts(tenantId, member.id(), member.data(), mirrors));
        }
        MirrorSyncSummary summary = write(members.size(), operations);
        log.info("Backfilled tenant {} scanned={} upserted={} failed={}",
                tenantId, summary.scanned(), summary.upserted(), summary.failedWrites());
        return summary;
    }

    /** Upserts the members of {@code categoryLabel} from every source tenant into that category's mirrors. */
    public MirrorSyncSummary crossCategorySync(String categoryLabel) {
        if (categoryLabel == null || categoryLabel.isBlank()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "sync.category_required");
        }
        String category = categoryLabel.trim();
        Set<String> mirrors = mirrorSetResolver.resolveMirrorSet(category);
        int scanned = 0;
        List<WriteOperation> operations = new ArrayList<>();
        if (!mirrors.isEmpty()) {
            for (Tenant tenant : tenantRepository.findAll()) {
                if (!mappingResolver.resolve(tenant.id()).isSource()) {
                    continue;
                }
                for (StoredDocument member : tenantRepository.findMembersByCategory(tenant.id(), category)) {
                    scanned++;
                    if (MemberRecords.isActive(member.data())) {
                        operations.addAll(writePlanner.upserts(tenant.id(), member.id(), member.data(), mirrors));
                    }
                }
            }
        }
        MirrorSyncSummary summary = write(scanned, operations);
        log.info("Cross category sync '{}' mirrors={} scanned={} upserted={} failed={}",
                category, mirrors.size(), summary.scanned(), summary.upserted(), summary.failedWrites());
        return summary;
    }

    private MirrorSyncSummary write(int scanned, List<WriteOperation> operations) {
        BatchWriteResult result = batchWriter.write(operations);
        return new MirrorSyncSummary(scanned, result.committed(), result.uncommitted());
    }
}
