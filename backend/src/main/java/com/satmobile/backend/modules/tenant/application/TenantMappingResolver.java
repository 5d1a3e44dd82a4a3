package com.satmobile.backend.modules.tenant.application;

import java.util.Optional;

import com.satmobile.backend.modules.tenant.domain.AdminProfile;
import com.satmobile.backend.modules.tenant.domain.Tenant;
import com.satmobile.backend.modules.tenant.domain.TenantMapping;
import com.satmobile.backend.modules.tenant.domain.TenantRole;
import com.satmobile.backend.modules.tenant.infrastructure.AdminProfileRepository;
import com.satmobile.backend.modules.tenant.infrastructure.TenantDocumentRepository;

import org.springframework.stereotype.Service;

/**
 * Classifies a tenant through its owner's profile. A tenant is a mirror when its owner is a
 * ministry account or it is the owner's ministry context; it is a source when it is the
 * default tenant of a regular administrator. Missing tenant or owner documents yield
 * {@link TenantRole#UNMAPPED}.
 */
@Service
public class TenantMappingResolver {

    private final TenantDocumentRepository tenantRepository;
    private final AdminProfileRepository profileRepository;

    public TenantMappingResolver(TenantDocumentRepository tenantRepository, AdminProfileRepository profileRepository) {
        this.tenantRepository = tenantRepository;
        this.profileRepository = profileRepository;
    }

    public TenantMapping resolve(String tenantId) {
        Optional<Tenant> tenant = tenantRepository.findById(tenantId);
        if (tenant.isEmpty() || tenant.get().ownerId() == null) {
            return TenantMapping.unmapped(tenantId);
        }
        Optional<AdminProfile> owner = profileRepository.findById(tenant.get().ownerId());
        if (owner.isEmpty()) {
            return TenantMapping.unmapped(tenantId);
        }
        AdminProfile profile = owner.get();
        if (profile.ministryAccount() || tenantId.equals(profile.ministryChurchId())) {
            return new TenantMapping(tenantId, TenantRole.MIRROR, profile.id(), profile.ministryName());
        }
        if (tenantId.equals(profile.defaultChurchId())) {
            return new TenantMapping(tenantId, TenantRole.SOURCE, profile.id(), profile.ministryName());
        }
        return new TenantMapping(tenantId, TenantRole.UNMAPPED, profile.id(), profile.ministryName());
    }
}
