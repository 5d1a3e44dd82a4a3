package com.satmobile.backend.modules.sync.application;

import java.util.Map;

import com.satmobile.backend.global.common.result.SyncErrorKind;
import com.satmobile.backend.global.common.result.SyncResult;
import com.satmobile.backend.modules.store.application.DocumentChangeHandler;
import com.satmobile.backend.modules.store.application.PathPattern;
import com.satmobile.backend.modules.store.domain.DocumentChange;
import com.satmobile.backend.modules.store.domain.DocumentPath;
import com.satmobile.backend.modules.store.infrastructure.DocumentStore;
import com.satmobile.backend.modules.store.infrastructure.DocumentStoreException;
import com.satmobile.backend.modules.sync.domain.MirrorPayloads;
import com.satmobile.backend.modules.sync.domain.ProvenanceTagger;
import com.satmobile.backend.modules.sync.domain.SyncDirection;
import com.satmobile.backend.modules.tenant.application.TenantMappingResolver;
import com.satmobile.backend.modules.tenant.domain.ChurchPaths;
import com.satmobile.backend.modules.tenant.domain.TenantMapping;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Sends edits made on a mirror copy back to the source record, limited to
 * {@link MirrorPayloads#REVERSE_FIELDS}. Deletes are never propagated.
 */
@Service
public class ReverseSyncService implements DocumentChangeHandler {

    private static final Logger log = LoggerFactory.getLogger(ReverseSyncService.class);

    private static final PathPattern PATTERN = PathPattern.of(ChurchPaths.MEMBER_PATTERN);

    private final DocumentStore documentStore;
    private final TenantMappingResolver mappingResolver;
    private final ProvenanceTagger provenanceTagger;

    public ReverseSyncService(
            DocumentStore documentStore,
            TenantMappingResolver mappingResolver,
            ProvenanceTagger provenanceTagger
    ) {
        this.documentStore = documentStore;
        this.mappingResolver = mappingResolver;
        this.provenanceTagger = provenanceTagger;
    }

    @Override
    public String name() {
        return "mirrorReverse";
    }

    @Override
    public PathPattern pattern() {
        return PATTERN;
    }

    @Override
    public SyncResult handle(DocumentChange change) {
        Map<String, Object> after = change.after();
        if (after == null) {
            return SyncResult.skipped("deletes are not reverse synced");
        }
        String sourceTenantId = ProvenanceTagger.forwardSource(after);
        if (sourceTenantId == null) {
            return SyncResult.skipped("record is not a mirror copy");
        }
        if (provenanceTagger.shouldSkip(SyncDirection.REVERSE, change.before(), after)) {
            return SyncResult.skipped("write came from forward sync");
        }
        Map<String, Object> changes = MirrorPayloads.reverseChanges(change.before(), after);
        if (changes.isEmpty()) {
            return SyncResult.skipped("no reverse synced field changed");
        }

        String mirrorTenantId = ChurchPaths.tenantIdOf(change.path());
        DocumentPath sourcePath = ChurchPaths.member(sourceTenantId, change.path().id());
        try {
            TenantMapping mapping = mappingResolver.resolve(mirrorTenantId);
            if (!mapping.isMirror()) {
                return SyncResult.skipped("tenant is not a mirror");
            }
            if (!documentStore.exists(sourcePath)) {
                return SyncResult.skipped("source record missing");
            }
            documentStore.set(sourcePath,
                    provenanceTagger.tagReverse(changes, sourceTenantId, mirrorTenantId, mapping.ownerId()), true);
        } catch (DocumentStoreException ex) {
            return SyncResult.failed(SyncErrorKind.TRANSIENT_STORE, 0, ex.getMessage());
        }
        log.debug("Reverse synced {} to {}", changes.keySet(), sourcePath);
        return SyncResult.applied(1, String.join(",", changes.keySet()));
    }
}
