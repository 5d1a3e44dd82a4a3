package com.satmobile.backend.modules.store.infrastructure;

import com.satmobile.backend.modules.store.domain.DocumentPath;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the document store as down when a single-document read fails.
 */
@Component("documentStore")
public class DocumentStoreHealthIndicator implements HealthIndicator {

    private static final DocumentPath HEALTH_DOCUMENT = DocumentPath.of("_health", "check");

    private final DocumentStore documentStore;

    public DocumentStoreHealthIndicator(DocumentStore documentStore) {
        this.documentStore = documentStore;
    }

    @Override
    public Health health() {
        try {
            documentStore.get(HEALTH_DOCUMENT);
            return Health.up()
                    .withDetail("store", documentStore.getClass().getSimpleName())
                    .build();
        } catch (DocumentStoreException ex) {
            return Health.down(ex)
                    .withDetail("store", documentStore.getClass().getSimpleName())
                    .build();
        }
    }
}
