package com.satmobile.backend.modules.prayer.application;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.satmobile.backend.global.config.PrayerMarkingProperties;
import com.satmobile.backend.modules.prayer.domain.MarkingOutcome;
import com.satmobile.backend.modules.prayer.domain.MarkingRunSummary;
import com.satmobile.backend.modules.prayer.domain.PrayerSessionCalendar;
import com.satmobile.backend.modules.prayer.domain.PrayerStatus;
import com.satmobile.backend.modules.prayer.domain.TenantTickResult;
import com.satmobile.backend.modules.prayer.infrastructure.PrayerDocumentRepository;
import com.satmobile.backend.modules.store.application.BatchWriteResult;
import com.satmobile.backend.modules.store.application.BatchWriter;
import com.satmobile.backend.modules.store.domain.StoredDocument;
import com.satmobile.backend.modules.store.domain.WriteOperation;
import com.satmobile.backend.modules.tenant.domain.MemberRecords;
import com.satmobile.backend.modules.tenant.domain.Tenant;
import com.satmobile.backend.modules.tenant.infrastructure.TenantDocumentRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Marks members without a {@code Prayed} record as {@code Missed} once a tenant's morning
 * session is over. Runs at most once per tenant and local date: a lock document is written
 * after every record committed, and a tick that finds the lock does nothing.
 */
@Service
public class MissedPrayerMarkingService {

    private static final Logger log = LoggerFactory.getLogger(MissedPrayerMarkingService.class);

    static final String SYSTEM_RECORDER = "system";

    private final TenantDocumentRepository tenantRepository;
    private final PrayerDocumentRepository prayerRepository;
    private final BatchWriter batchWriter;
    private final PrayerMarkingProperties properties;
    private final ZoneId defaultZone;

    public MissedPrayerMarkingService(
            TenantDocumentRepository tenantRepository,
            PrayerDocumentRepository prayerRepository,
            BatchWriter batchWriter,
            PrayerMarkingProperties properties
    ) {
        this.tenantRepository = tenantRepository;
        this.prayerRepository = prayerRepository;
        this.batchWriter = batchWriter;
        this.properties = properties;
        this.defaultZone = ZoneId.of(properties.defaultTimezone());
    }

    public MarkingRunSummary markMissedPrayers(Instant now) {
        List<TenantTickResult> results = new ArrayList<>();
        for (Tenant tenant : tenantRepository.findAll()) {
            TenantTickResult result;
            try {
                result = markTenant(tenant, now);
            } catch (RuntimeException ex) {
                log.warn("[ALERT][Batch][prayer-missed] tenant={} detail={}", tenant.id(), ex.getMessage(), ex);
                result = TenantTickResult.failed(tenant.id(), null, 0, ex.getMessage());
            }
            results.add(result);
        }
        MarkingRunSummary summary = new MarkingRunSummary(results);
        if (summary.count(MarkingOutcome.MARKED) > 0 || summary.count(MarkingOutcome.FAILED) > 0) {
            log.info("Missed prayer marking marked={} outcomes={}", summary.totalMarked(), summary.countsByOutcome());
        }
        return summary;
    }

    TenantTickResult markTenant(Tenant tenant, Instant now) {
        ZoneId zone = zoneOf(tenant);
        LocalDateTime localNow = LocalDateTime.ofInstant(now, zone);
        LocalDate date = localNow.toLocalDate();
        String dateKey = date.toString();

        Optional<LocalTime> sessionEnd = PrayerSessionCalendar.sessionEnd(date, prayerRepository.findSchedules(tenant.id()));
        if (sessionEnd.isEmpty()) {
            return TenantTickResult.of(tenant.id(), dateKey, MarkingOutcome.SKIPPED_DAY);
        }
        if (!PrayerSessionCalendar.isInMarkingWindow(localNow, date, sessionEnd.get(), properties.windowMinutes())) {
            return TenantTickResult.of(tenant.id(), dateKey, MarkingOutcome.OUTSIDE_WINDOW);
        }
        if (prayerRepository.isLocked(tenant.id(), dateKey)) {
            return TenantTickResult.of(tenant.id(), dateKey, MarkingOutcome.ALREADY_LOCKED);
        }

        Set<String> frozenOverrides = prayerRepository.findFrozenOverrideMemberIds(tenant.id());
        Map<String, String> statuses = prayerRepository.findStatusesByMember(tenant.id(), dateKey);
        String recordedAt = now.toString();
        List<WriteOperation> writes = new ArrayList<>();
        for (StoredDocument member : tenantRepository.findMembers(tenant.id())) {
            if (!MemberRecords.isActive(member.data())
                    || MemberRecords.isFrozen(member.data())
                    || frozenOverrides.contains(member.id())
                    || PrayerStatus.isPrayed(statuses.get(member.id()))) {
                continue;
            }
            Map<String, Object> record = new LinkedHashMap<>();
            record.put("memberId", member.id());
            record.put("date", dateKey);
            record.put("status", PrayerStatus.MISSED.value());
            record.put("recordedAt", recordedAt);
            record.put("recordedBy", SYSTEM_RECORDER);
            writes.add(WriteOperation.merge(PrayerDocumentRepository.recordPath(tenant.id(), member.id(), dateKey), record));
        }

        BatchWriteResult result = batchWriter.write(writes);
        if (!result.isComplete()) {
            return TenantTickResult.failed(tenant.id(), dateKey, result.committed(),
                    "committed " + result.committed() + "/" + result.attempted() + ", lock not written");
        }
        Map<String, Object> lock = new LinkedHashMap<>();
        lock.put("date", dateKey);
        lock.put("timezone", zone.getId());
        lock.put("markedCount", result.committed());
        lock.put("lockedAt", recordedAt);
        prayerRepository.writeLock(tenant.id(), dateKey, lock);
        log.info("Marked {} missed prayers tenant={} date={} zone={}", result.committed(), tenant.id(), dateKey, zone);
        return TenantTickResult.marked(tenant.id(), dateKey, result.committed());
    }

    ZoneId zoneOf(Tenant tenant) {
        if (tenant.timezone() == null) {
            return defaultZone;
        }
        try {
            return ZoneId.of(tenant.timezone());
        } catch (DateTimeException ex) {
            log.debug("Tenant {} has invalid timezone '{}', using {}", tenant.id(), tenant.timezone(), defaultZone);
            return defaultZone;
        }
    }
}
