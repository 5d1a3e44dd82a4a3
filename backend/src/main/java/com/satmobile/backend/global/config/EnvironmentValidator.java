package com.satmobile.backend.global.config;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import com.satmobile.backend.modules.store.infrastructure.DocumentStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Checks the store and job settings once the application is up and refuses to keep running
 * with a configuration that would silently skip tenants or reject every batch.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private final StoreProperties storeProperties;
    private final SyncProperties syncProperties;
    private final PrayerMarkingProperties prayerMarkingProperties;

    public EnvironmentValidator(
            StoreProperties storeProperties,
            SyncProperties syncProperties,
            PrayerMarkingProperties prayerMarkingProperties
    ) {
        this.storeProperties = storeProperties;
        this.syncProperties = syncProperties;
        this.prayerMarkingProperties = prayerMarkingProperties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Configuration validated store={} batchLimit={} defaultTimezone={}",
                storeProperties.type(), syncProperties.batchLimit(), prayerMarkingProperties.defaultTimezone());
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();

        String type = storeProperties.type();
        if (!"memory".equalsIgnoreCase(type) && !"firestore".equalsIgnoreCase(type)) {
            problems.add("satmobile.store.type must be memory or firestore but was " + type);
        }
        if (storeProperties.isFirestore() && isBlank(storeProperties.projectId())) {
            problems.add("satmobile.store.project-id is required for the firestore store");
        }

        int batchLimit = syncProperties.batchLimit();
        if (batchLimit < 1 || batchLimit > DocumentStore.MAX_BATCH_OPERATIONS) {
            problems.add("satmobile.sync.batch-limit must be between 1 and " + DocumentStore.MAX_BATCH_OPERATIONS);
        }

        if (!isValidZone(prayerMarkingProperties.defaultTimezone())) {
            problems.add("satmobile.prayer.default-timezone is not a valid zone id: " + prayerMarkingProperties.defaultTimezone());
        }
        if (prayerMarkingProperties.windowMinutes() < 1) {
            problems.add("satmobile.prayer.window-minutes must be positive");
        }
        return problems;
    }

    private static boolean isValidZone(String zoneId) {
        if (isBlank(zoneId)) {
            return false;
        }
        try {
            ZoneId.of(zoneId);
            return true;
        } catch (DateTimeException ex) {
            return false;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
