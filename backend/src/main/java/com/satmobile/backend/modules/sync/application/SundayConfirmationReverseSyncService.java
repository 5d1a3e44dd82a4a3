package com.satmobile.backend.modules.sync.application;

import com.satmobile.backend.modules.store.infrastructure.DocumentStore;
import com.satmobile.backend.modules.sync.domain.ProvenanceTagger;
import com.satmobile.backend.modules.tenant.application.TenantMappingResolver;
import com.satmobile.backend.modules.tenant.domain.ChurchPaths;
import com.satmobile.backend.modules.tenant.infrastructure.AdminProfileRepository;

import org.springframework.stereotype.Service;

/** Sunday confirmations recorded in a mirror tenant, copied to the owner's default tenant. */
@Service
public class SundayConfirmationReverseSyncService extends OwnerTenantReverseSyncHandler {

    public SundayConfirmationReverseSyncService(
            DocumentStore documentStore,
            TenantMappingResolver mappingResolver,
            ProvenanceTagger provenanceTagger,
            AdminProfileRepository profileRepository
    ) {
        super(documentStore, mappingResolver, provenanceTagger, profileRepository, ChurchPaths.SUNDAY_CONFIRMATIONS);
    }

    @Override
    public String name() {
        return "sundayConfirmationReverse";
    }
}
