package com.satmobile.backend.modules.sync.application;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.satmobile.backend.global.common.result.SyncErrorKind;
import com.satmobile.backend.global.common.result.SyncResult;
import com.satmobile.backend.modules.store.application.BatchWriteResult;
import com.satmobile.backend.modules.store.application.BatchWriter;
import com.satmobile.backend.modules.store.application.DocumentChangeHandler;
import com.satmobile.backend.modules.store.application.PathPattern;
import com.satmobile.backend.modules.store.domain.DocumentChange;
import com.satmobile.backend.modules.store.domain.WriteOperation;
import com.satmobile.backend.modules.store.infrastructure.DocumentStoreException;
import com.satmobile.backend.modules.sync.domain.ProvenanceTagger;
import com.satmobile.backend.modules.sync.domain.SyncDirection;
import com.satmobile.backend.modules.tenant.application.MirrorSetResolver;
import com.satmobile.backend.modules.tenant.application.TenantMappingResolver;
import com.satmobile.backend.modules.tenant.domain.ChurchPaths;
import com.satmobile.backend.modules.tenant.domain.MemberRecords;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Fans member writes in a source tenant out to the mirror tenants of the member's category.
 */
@Service
public class MirrorSyncService implements DocumentChangeHandler {

    private static final Logger log = LoggerFactory.getLogger(MirrorSyncService.class);

    private static final PathPattern PATTERN = PathPattern.of(ChurchPaths.MEMBER_PATTERN);

    private final TenantMappingResolver mappingResolver;
    private final MirrorSetResolver mirrorSetResolver;
    private final MirrorWritePlanner writePlanner;
    private final ProvenanceTagger provenanceTagger;
    private final BatchWriter batchWriter;

    public MirrorSyncService(
            TenantMappingResolver mappingResolver,
            MirrorSetResolver mirrorSetResolver,
            MirrorWritePlanner writePlanner,
            ProvenanceTagger provenanceTagger,
            BatchWriter batchWriter
    ) {
        this.mappingResolver = mappingResolver;
        this.mirrorSetResolver = mirrorSetResolver;
        this.writePlanner = writePlanner;
        this.provenanceTagger = provenanceTagger;
        this.batchWriter = batchWriter;
    }

    @Override
    public String name() {
        return "mirrorForward";
    }

    @Override
    public PathPattern pattern() {
        return PATTERN;
    }

    @Override
    public SyncResult handle(DocumentChange change) {
        String tenantId = ChurchPaths.tenantIdOf(change.path());
        String memberId = change.path().id();
        Map<String, Object> before = change.before();
        Map<String, Object> after = change.after();

        List<WriteOperation> operations;
        try {
            if (!mappingResolver.resolve(tenantId).isSource()) {
                return SyncResult.skipped("tenant is not a source");
            }
            Set<String> skipUpserts = Set.of();
            if (provenanceTagger.shouldSkip(SyncDirection.FORWARD, before, after)) {
                if (Objects.equals(MemberRecords.category(before), MemberRecords.category(after))) {
                    return SyncResult.skipped("write came from reverse sync");
                }
                // category changed on a mirror: move the copies, no write back to the editing mirror
                String origin = ProvenanceTagger.reverseOrigin(after);
                skipUpserts = origin != null ? Set.of(origin) : Set.of();
                log.info("Category of {} in tenant {} changed from mirror {}, reassigning mirrors", memberId, tenantId, origin);
            }
            operations = plan(tenantId, memberId, before, after, skipUpserts);
        } catch (DocumentStoreException ex) {
            return SyncResult.failed(SyncErrorKind.TRANSIENT_STORE, 0, ex.getMessage());
        }
        if (operations.isEmpty()) {
            return SyncResult.skipped("no mirror to update");
        }

        BatchWriteResult result = batchWriter.write(operations);
        if (!result.isComplete()) {
            return SyncResult.failed(SyncErrorKind.PARTIAL_BATCH, result.committed(),
                    "mirror writes committed " + result.committed() + "/" + result.attempted());
        }
        log.debug("Mirrored {} of tenant {} with {} writes", memberId, tenantId, result.committed());
        return SyncResult.applied(result.committed(), change.type().name().toLowerCase());
    }

    private List<WriteOperation> plan(
            String tenantId,
            String memberId,
            Map<String, Object> before,
            Map<String, Object> after,
            Set<String> skipUpserts
    ) {
        String previousCategory = MemberRecords.category(before);
        String currentCategory = MemberRecords.category(after);

        if (after == null) {
            return writePlanner.deletes(tenantId, memberId, mirrorSet(previousCategory));
        }
        if (currentCategory == null || !MemberRecords.isActive(after)) {
            String category = previousCategory != null ? previousCategory : currentCategory;
            return writePlanner.deletes(tenantId, memberId, mirrorSet(category));
        }

        Set<String> currentMirrors = mirrorSet(currentCategory);
        List<String> upsertTargets = currentMirrors.stream()
                .filter(mirror -> !skipUpserts.contains(mirror))
                .toList();
        List<WriteOperation> operations = new ArrayList<>(
                writePlanner.upserts(tenantId, memberId, after, upsertTargets));
        if (previousCategory != null && !previousCategory.equals(currentCategory)) {
            List<String> stale = mirrorSet(previousCategory).stream()
                    .filter(mirror -> !currentMirrors.contains(mirror))
                    .toList();
            operations.addAll(writePlanner.deletes(tenantId, memberId, stale));
        }
        return operations;
    }

    private Set<String> mirrorSet(String category) {
        return mirrorSetResolver.resolveMirrorSet(category);
    }
}
