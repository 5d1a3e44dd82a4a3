package com.satmobile.backend.modules.sync.application;

import java.util.Map;
import java.util.Optional;

import com.satmobile.backend.global.common.result.SyncErrorKind;
import com.satmobile.backend.global.common.result.SyncResult;
import com.satmobile.backend.modules.store.application.DocumentChangeHandler;
import com.satmobile.backend.modules.store.application.PathPattern;
import com.satmobile.backend.modules.store.domain.DocumentChange;
import com.satmobile.backend.modules.store.domain.DocumentPath;
import com.satmobile.backend.modules.store.domain.StoredDocument;
import com.satmobile.backend.modules.store.infrastructure.DocumentStore;
import com.satmobile.backend.modules.store.infrastructure.DocumentStoreException;
import com.satmobile.backend.modules.sync.domain.MirrorPayloads;
import com.satmobile.backend.modules.sync.domain.ProvenanceTagger;
import com.satmobile.backend.modules.tenant.application.TenantMappingResolver;
import com.satmobile.backend.modules.tenant.domain.ChurchPaths;
import com.satmobile.backend.modules.tenant.domain.TenantMapping;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies records written in a mirror tenant to the same id in their source tenant, tagged
 * with the reverse marker. Subclasses decide which collection and how the source tenant is
 * found; records written in any other kind of tenant are ignored.
 */
public abstract class RecordReverseSyncHandler implements DocumentChangeHandler {

    private static final Logger log = LoggerFactory.getLogger(RecordReverseSyncHandler.class);

    static final String CREATED_DATE = "createdDate";

    protected final DocumentStore documentStore;
    private final TenantMappingResolver mappingResolver;
    private final ProvenanceTagger provenanceTagger;
    private final String collectionId;
    private final PathPattern pattern;

    protected RecordReverseSyncHandler(
            DocumentStore documentStore,
            TenantMappingResolver mappingResolver,
            ProvenanceTagger provenanceTagger,
            String collectionId
    ) {
        this.documentStore = documentStore;
        this.mappingResolver = mappingResolver;
        this.provenanceTagger = provenanceTagger;
        this.collectionId = collectionId;
        this.pattern = PathPattern.of(ChurchPaths.recordPattern(collectionId));
    }

    /** Source tenant of a record written in {@code mapping}'s mirror tenant, empty when there is none. */
    protected abstract Optional<String> sourceTenant(TenantMapping mapping, Map<String, Object> data);

    /** Whether deleting the mirror record also deletes a source record created by this handler. */
    protected boolean propagatesDeletes() {
        return false;
    }

    @Override
    public PathPattern pattern() {
        return pattern;
    }

    @Override
    public SyncResult handle(DocumentChange change) {
        String mirrorTenantId = ChurchPaths.tenantIdOf(change.path());
        String recordId = change.path().id();
        try {
            TenantMapping mapping = mappingResolver.resolve(mirrorTenantId);
            if (!mapping.isMirror()) {
                return SyncResult.skipped("tenant is not a mirror");
            }
            if (change.after() == null) {
                return deleteFromSource(mapping, recordId, change.before());
            }
            Optional<String> sourceTenantId = sourceTenant(mapping, change.after())
                    .filter(source -> !source.equals(mirrorTenantId));
            if (sourceTenantId.isEmpty()) {
                return SyncResult.skipped("no source tenant");
            }
            DocumentPath sourcePath = ChurchPaths.records(sourceTenantId.get(), collectionId).document(recordId);
            Map<String, Object> payload = provenanceTagger.tagReverse(
                    MirrorPayloads.reverseRecordCopy(change.after()),
                    sourceTenantId.get(),
                    mirrorTenantId,
                    mapping.ownerId());
            if (!documentStore.exists(sourcePath)) {
                payload.putIfAbsent(CREATED_DATE, payload.get(ProvenanceTagger.LAST_UPDATED));
            }
            documentStore.set(sourcePath, payload, true);
            log.debug("Reverse synced {} {} to {}", collectionId, recordId, sourcePath);
            return SyncResult.applied(1, collectionId);
        } catch (DocumentStoreException ex) {
            return SyncResult.failed(SyncErrorKind.TRANSIENT_STORE, 0, ex.getMessage());
        }
    }

    private SyncResult deleteFromSource(TenantMapping mapping, String recordId, Map<String, Object> before) {
        if (!propagatesDeletes() || before == null) {
            return SyncResult.skipped("deletes are not reverse synced");
        }
        Optional<String> sourceTenantId = sourceTenant(mapping, before)
                .filter(source -> !source.equals(mapping.tenantId()));
        if (sourceTenantId.isEmpty()) {
            return SyncResult.skipped("no source tenant");
        }
        DocumentPath sourcePath = ChurchPaths.records(sourceTenantId.get(), collectionId).document(recordId);
        Optional<StoredDocument> source = documentStore.get(sourcePath);
        if (source.isEmpty() || !ProvenanceTagger.isReverseSynced(source.get().data())) {
            return SyncResult.skipped("source record not created by reverse sync");
        }
        documentStore.delete(sourcePath);
        return SyncResult.applied(1, collectionId + " delete");
    }
}
