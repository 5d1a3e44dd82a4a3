package com.satmobile.backend.modules.tenant.infrastructure;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.satmobile.backend.modules.store.infrastructure.DocumentStore;
import com.satmobile.backend.modules.tenant.domain.AdminProfile;
import com.satmobile.backend.modules.tenant.domain.ChurchPaths;

import org.springframework.stereotype.Repository;

@Repository
public class AdminProfileRepository {

    private final DocumentStore documentStore;

    public AdminProfileRepository(DocumentStore documentStore) {
        this.documentStore = documentStore;
    }

    public Optional<AdminProfile> findById(String uid) {
        if (uid == null || uid.isBlank()) {
            return Optional.empty();
        }
        return documentStore.get(ChurchPaths.user(uid)).map(AdminProfile::from);
    }

    /** Every profile whose role is {@code admin}. */
    public List<AdminProfile> findAdministrators() {
        return documentStore.query(ChurchPaths.users(), "role", AdminProfile.ROLE_ADMIN).stream()
                .map(AdminProfile::from)
                .toList();
    }

    /**
     * Profiles whose counter covers the tenant (see {@link AdminProfile#countsMembersOf}):
     * administrators attached through {@code churchId} or either context, plus the owner.
     * Each profile appears once.
     */
    public List<AdminProfile> findAdministratorsOf(String tenantId, String ownerId) {
        Map<String, AdminProfile> profiles = new LinkedHashMap<>();
        for (String field : List.of("churchId", "contexts.defaultChurchId", "contexts.ministryChurchId")) {
            documentStore.query(ChurchPaths.users(), field, tenantId).stream()
                    .map(AdminProfile::from)
                    .filter(profile -> profile.countsMembersOf(tenantId, ownerId))
                    .forEach(profile -> profiles.putIfAbsent(profile.id(), profile));
        }
        if (ownerId != null && !profiles.containsKey(ownerId)) {
            findById(ownerId).ifPresent(owner -> profiles.put(owner.id(), owner));
        }
        return List.copyOf(profiles.values());
    }

    /** Profiles whose preferred category equals {@code category}, ministry flag not checked. */
    public List<AdminProfile> findByMinistryName(String category) {
        return documentStore.query(ChurchPaths.users(), "preferences.ministryName", category).stream()
                .map(AdminProfile::from)
                .toList();
    }
}
