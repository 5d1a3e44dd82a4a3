package com.satmobile.backend.modules.counter.application;

import java.util.List;

import com.satmobile.backend.global.common.result.SyncErrorKind;
import com.satmobile.backend.global.common.result.SyncResult;
import com.satmobile.backend.modules.counter.domain.MemberActivity;
import com.satmobile.backend.modules.store.application.BatchWriteResult;
import com.satmobile.backend.modules.store.application.BatchWriter;
import com.satmobile.backend.modules.store.application.DocumentChangeHandler;
import com.satmobile.backend.modules.store.application.PathPattern;
import com.satmobile.backend.modules.store.domain.DocumentChange;
import com.satmobile.backend.modules.store.domain.WriteOperation;
import com.satmobile.backend.modules.store.infrastructure.DocumentStore;
import com.satmobile.backend.modules.store.infrastructure.DocumentStoreException;
import com.satmobile.backend.modules.tenant.domain.AdminProfile;
import com.satmobile.backend.modules.tenant.domain.ChurchPaths;
import com.satmobile.backend.modules.tenant.domain.Tenant;
import com.satmobile.backend.modules.tenant.infrastructure.AdminProfileRepository;
import com.satmobile.backend.modules.tenant.infrastructure.TenantDocumentRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Keeps {@code memberCount} of the tenant and of its administrators in step with member
 * writes. Changes that do not flip countability write nothing.
 */
@Service
public class MemberCounterService implements DocumentChangeHandler {

    private static final Logger log = LoggerFactory.getLogger(MemberCounterService.class);

    static final String COUNTER_FIELD = "memberCount";

    private static final PathPattern PATTERN = PathPattern.of(ChurchPaths.MEMBER_PATTERN);

    private final DocumentStore documentStore;
    private final BatchWriter batchWriter;
    private final TenantDocumentRepository tenantRepository;
    private final AdminProfileRepository profileRepository;

    public MemberCounterService(
            DocumentStore documentStore,
            BatchWriter batchWriter,
            TenantDocumentRepository tenantRepository,
            AdminProfileRepository profileRepository
    ) {
        this.documentStore = documentStore;
        this.batchWriter = batchWriter;
        this.tenantRepository = tenantRepository;
        this.profileRepository = profileRepository;
    }

    @Override
    public String name() {
        return "memberCounter";
    }

    @Override
    public PathPattern pattern() {
        return PATTERN;
    }

    @Override
    public SyncResult handle(DocumentChange change) {
        int delta = MemberActivity.delta(change.before(), change.after());
        if (delta == 0) {
            return SyncResult.skipped("countability unchanged");
        }
        String tenantId = ChurchPaths.tenantIdOf(change.path());
        try {
            documentStore.increment(ChurchPaths.tenant(tenantId), COUNTER_FIELD, delta);
        } catch (DocumentStoreException ex) {
            return SyncResult.failed(SyncErrorKind.TRANSIENT_STORE, 0, "tenant counter: " + ex.getMessage());
        }

        List<AdminProfile> administrators;
        try {
            String ownerId = tenantRepository.findById(tenantId).map(Tenant::ownerId).orElse(null);
            administrators = profileRepository.findAdministratorsOf(tenantId, ownerId);
        } catch (DocumentStoreException ex) {
            return SyncResult.failed(SyncErrorKind.TRANSIENT_STORE, 1, "administrator lookup: " + ex.getMessage());
        }
        List<WriteOperation> increments = administrators.stream()
                .map(admin -> WriteOperation.increment(ChurchPaths.user(admin.id()), COUNTER_FIELD, delta))
                .toList();
        BatchWriteResult result = batchWriter.write(increments);
        if (!result.isComplete()) {
            return SyncResult.failed(SyncErrorKind.PARTIAL_BATCH, 1 + result.committed(),
                    "administrator counters committed " + result.committed() + "/" + result.attempted());
        }
        log.debug("memberCount {} on tenant {} and {} administrators", delta, tenantId, administrators.size());
        return SyncResult.applied(1 + result.committed(), "delta " + delta);
    }
}
