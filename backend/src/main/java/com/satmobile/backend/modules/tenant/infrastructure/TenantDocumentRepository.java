package com.satmobile.backend.modules.tenant.infrastructure;

import java.util.List;
import java.util.Optional;

import com.satmobile.backend.modules.store.domain.StoredDocument;
import com.satmobile.backend.modules.store.infrastructure.DocumentStore;
import com.satmobile.backend.modules.tenant.domain.ChurchPaths;
import com.satmobile.backend.modules.tenant.domain.MemberRecords;
import com.satmobile.backend.modules.tenant.domain.Tenant;

import org.springframework.stereotype.Repository;

@Repository
public class TenantDocumentRepository {

    private final DocumentStore documentStore;

    public TenantDocumentRepository(DocumentStore documentStore) {
        this.documentStore = documentStore;
    }

    public Optional<Tenant> findById(String tenantId) {
        return documentStore.get(ChurchPaths.tenant(tenantId)).map(Tenant::from);
    }

    public List<Tenant> findAll() {
        return documentStore.list(ChurchPaths.tenants()).stream()
                .map(Tenant::from)
                .toList();
    }

    public List<StoredDocument> findMembers(String tenantId) {
        return documentStore.list(ChurchPaths.members(tenantId));
    }

    /** Members whose {@code isActive} is not explicitly {@code false}. */
    public long countActiveMembers(String tenantId) {
        long all = documentStore.count(ChurchPaths.members(tenantId));
        return all - documentStore.count(ChurchPaths.members(tenantId), MemberRecords.IS_ACTIVE, false);
    }

    public List<StoredDocument> findMembersByCategory(String tenantId, String category) {
        return documentStore.query(ChurchPaths.members(tenantId), MemberRecords.CATEGORY, category);
    }

    public Optional<StoredDocument> findMember(String tenantId, String memberId) {
        return documentStore.get(ChurchPaths.member(tenantId, memberId));
    }
}
