package com.satmobile.backend.modules.tenant.application;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import com.satmobile.backend.modules.tenant.domain.AdminProfile;
import com.satmobile.backend.modules.tenant.infrastructure.AdminProfileRepository;

import org.springframework.stereotype.Service;

/**
 * Resolves the tenants mirroring a category. Read from the store on every call; profile
 * changes take effect on the next event.
 */
@Service
public class MirrorSetResolver {

    private final AdminProfileRepository profileRepository;

    public MirrorSetResolver(AdminProfileRepository profileRepository) {
        this.profileRepository = profileRepository;
    }

    public Set<String> resolveMirrorSet(String category) {
        if (category == null || category.isBlank()) {
            return Set.of();
        }
        Set<String> tenants = new LinkedHashSet<>();
        profileRepository.findByMinistryName(category.trim()).stream()
                .filter(AdminProfile::ministryAccount)
                .map(AdminProfile::mirrorTenantId)
                .filter(Objects::nonNull)
                .forEach(tenants::add);
        return tenants;
    }
}
