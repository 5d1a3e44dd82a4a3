package com.satmobile.backend.modules.sync.application;

import java.util.Map;
import java.util.Optional;

import com.satmobile.backend.modules.store.infrastructure.DocumentStore;
import com.satmobile.backend.modules.sync.domain.ProvenanceTagger;
import com.satmobile.backend.modules.tenant.application.TenantMappingResolver;
import com.satmobile.backend.modules.tenant.domain.AdminProfile;
import com.satmobile.backend.modules.tenant.domain.TenantMapping;
import com.satmobile.backend.modules.tenant.infrastructure.AdminProfileRepository;

/**
 * Records created in a mirror tenant that belong to the mirror owner's default tenant.
 */
public abstract class OwnerTenantReverseSyncHandler extends RecordReverseSyncHandler {

    private final AdminProfileRepository profileRepository;

    protected OwnerTenantReverseSyncHandler(
            DocumentStore documentStore,
            TenantMappingResolver mappingResolver,
            ProvenanceTagger provenanceTagger,
            AdminProfileRepository profileRepository,
            String collectionId
    ) {
        super(documentStore, mappingResolver, provenanceTagger, collectionId);
        this.profileRepository = profileRepository;
    }

    @Override
    protected Optional<String> sourceTenant(TenantMapping mapping, Map<String, Object> data) {
        if (mapping.ownerId() == null) {
            return Optional.empty();
        }
        return profileRepository.findById(mapping.ownerId())
                .map(AdminProfile::defaultChurchId);
    }
}
