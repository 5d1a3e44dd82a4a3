package com.satmobile.backend.modules.prayer.infrastructure;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.satmobile.backend.modules.prayer.domain.PrayerSchedule;
import com.satmobile.backend.modules.store.domain.DocumentPath;
import com.satmobile.backend.modules.store.domain.StoredDocument;
import com.satmobile.backend.modules.store.infrastructure.DocumentStore;
import com.satmobile.backend.modules.tenant.domain.ChurchPaths;

import org.springframework.stereotype.Repository;

@Repository
public class PrayerDocumentRepository {

    private final DocumentStore documentStore;

    public PrayerDocumentRepository(DocumentStore documentStore) {
        this.documentStore = documentStore;
    }

    public List<PrayerSchedule> findSchedules(String tenantId) {
        return documentStore.list(ChurchPaths.prayerSchedules(tenantId)).stream()
                .map(PrayerSchedule::from)
                .toList();
    }

    public boolean isLocked(String tenantId, String date) {
        return documentStore.exists(ChurchPaths.prayerLock(tenantId, date));
    }

    public void writeLock(String tenantId, String date, Map<String, Object> lock) {
        documentStore.set(ChurchPaths.prayerLock(tenantId, date), lock, false);
    }

    /** Status of every prayer record of {@code date}, by member id. */
    public Map<String, String> findStatusesByMember(String tenantId, String date) {
        Map<String, String> statuses = new HashMap<>();
        for (StoredDocument record : documentStore.query(ChurchPaths.prayers(tenantId), "date", date)) {
            String memberId = record.getString("memberId");
            if (memberId != null) {
                statuses.put(memberId, record.getString("status"));
            }
        }
        return statuses;
    }

    /** Member ids frozen through a mirror-side override. */
    public Set<String> findFrozenOverrideMemberIds(String tenantId) {
        Set<String> frozen = new HashSet<>();
        for (StoredDocument override : documentStore.list(ChurchPaths.ministryOverrides(tenantId))) {
            if (override.isTrue("frozen") && override.getString("memberId") != null) {
                frozen.add(override.getString("memberId"));
            }
        }
        return frozen;
    }

    public static DocumentPath recordPath(String tenantId, String memberId, String date) {
        return ChurchPaths.prayers(tenantId).document(memberId + "_" + date);
    }
}
