package com.satmobile.backend.modules.sync.application;

import java.util.Map;
import java.util.Optional;

import com.satmobile.backend.modules.store.infrastructure.DocumentStore;
import com.satmobile.backend.modules.sync.domain.ProvenanceTagger;
import com.satmobile.backend.modules.tenant.application.TenantMappingResolver;
import com.satmobile.backend.modules.tenant.domain.ChurchPaths;
import com.satmobile.backend.modules.tenant.domain.TenantMapping;

import org.springframework.stereotype.Service;

/**
 * Attendance taken in a mirror tenant lands in the tenant the member was mirrored from.
 * Removing the mirror record removes the reverse-synced source record as well.
 */
@Service
public class AttendanceReverseSyncService extends RecordReverseSyncHandler {

    static final String MEMBER_ID = "memberId";

    public AttendanceReverseSyncService(
            DocumentStore documentStore,
            TenantMappingResolver mappingResolver,
            ProvenanceTagger provenanceTagger
    ) {
        super(documentStore, mappingResolver, provenanceTagger, ChurchPaths.ATTENDANCE);
    }

    @Override
    public String name() {
        return "attendanceReverse";
    }

    @Override
    protected Optional<String> sourceTenant(TenantMapping mapping, Map<String, Object> data) {
        if (!(data.get(MEMBER_ID) instanceof String memberId) || memberId.isBlank()) {
            return Optional.empty();
        }
        return documentStore.get(ChurchPaths.member(mapping.tenantId(), memberId))
                .map(copy -> ProvenanceTagger.forwardSource(copy.data()));
    }

    @Override
    protected boolean propagatesDeletes() {
        return true;
    }
}
