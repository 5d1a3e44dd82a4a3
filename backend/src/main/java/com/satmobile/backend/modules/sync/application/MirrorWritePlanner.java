package com.satmobile.backend.modules.sync.application;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import com.satmobile.backend.modules.store.domain.WriteOperation;
import com.satmobile.backend.modules.store.infrastructure.DocumentStore;
import com.satmobile.backend.modules.sync.domain.MirrorPayloads;
import com.satmobile.backend.modules.sync.domain.ProvenanceTagger;
import com.satmobile.backend.modules.tenant.domain.ChurchPaths;

import org.springframework.stereotype.Component;

/**
 * Builds the writes that bring mirror copies of one source member up to date.
 */
@Component
public class MirrorWritePlanner {

    private final DocumentStore documentStore;
    private final ProvenanceTagger provenanceTagger;

    public MirrorWritePlanner(DocumentStore documentStore, ProvenanceTagger provenanceTagger) {
        this.documentStore = documentStore;
        this.provenanceTagger = provenanceTagger;
    }

    /** Merges a tagged copy into every mirror that has not excluded the member. */
    public List<WriteOperation> upserts(
            String sourceTenantId,
            String memberId,
            Map<String, Object> source,
            Collection<String> mirrorTenantIds
    ) {
        Map<String, Object> payload = provenanceTagger.tagForward(MirrorPayloads.forwardCopy(source), sourceTenantId);
        List<WriteOperation> operations = new ArrayList<>();
        for (String mirrorTenantId : mirrorTenantIds) {
            if (mirrorTenantId.equals(sourceTenantId)) {
                continue;
            }
            if (documentStore.exists(ChurchPaths.ministryExclusion(mirrorTenantId, sourceTenantId, memberId))) {
                continue;
            }
            operations.add(WriteOperation.merge(ChurchPaths.member(mirrorTenantId, memberId), payload));
        }
        return operations;
    }

    public List<WriteOperation> deletes(String sourceTenantId, String memberId, Collection<String> mirrorTenantIds) {
        return mirrorTenantIds.stream()
                .filter(mirrorTenantId -> !mirrorTenantId.equals(sourceTenantId))
                .map(mirrorTenantId -> WriteOperation.delete(ChurchPaths.member(mirrorTenantId, memberId)))
                .toList();
    }
}
