package com.satmobile.backend.global.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param type         {@code memory} or {@code firestore}
 * @param projectId    Google Cloud project holding the Firestore database
 * @param emulatorHost host:port of a Firestore emulator, blank for the real service
 * @param seedFile     optional JSON document tree loaded into the in-memory store at startup
 */
@ConfigurationProperties(prefix = "satmobile.store")
public record StoreProperties(
        @DefaultValue("memory") String type,
        String projectId,
        String emulatorHost,
        String seedFile
) {

    public boolean isFirestore() {
        return "firestore".equalsIgnoreCase(type);
    }
}
