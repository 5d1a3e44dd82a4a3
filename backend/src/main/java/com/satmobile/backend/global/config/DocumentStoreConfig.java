package com.satmobile.backend.global.config;

import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.cloud.NoCredentials;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreOptions;
import com.satmobile.backend.modules.store.infrastructure.DocumentTreeSeeder;
import com.satmobile.backend.modules.store.infrastructure.FirestoreChangeListener;
import com.satmobile.backend.modules.store.infrastructure.FirestoreDocumentStore;
import com.satmobile.backend.modules.store.infrastructure.InMemoryDocumentStore;
import com.satmobile.backend.modules.tenant.domain.ChurchPaths;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.StringUtils;

/**
 * Selects the document store with {@code satmobile.store.type}: {@code memory} (default)
 * or {@code firestore}. Each variant provides the store and its change event source.
 */
@Configuration(proxyBeanMethods = false)
public class DocumentStoreConfig {

    /** Collection groups whose writes drive the triggers. */
    static final List<String> TRIGGER_COLLECTIONS = List.of(
            ChurchPaths.MEMBERS,
            ChurchPaths.ATTENDANCE,
            ChurchPaths.NEW_BELIEVERS,
            ChurchPaths.SUNDAY_CONFIRMATIONS
    );

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(value = "satmobile.store.type", havingValue = "firestore")
    static class FirestoreStoreConfig {

        @Bean
        public Firestore firestore(StoreProperties properties) {
            FirestoreOptions.Builder builder = FirestoreOptions.getDefaultInstance().toBuilder();
            if (StringUtils.hasText(properties.projectId())) {
                builder.setProjectId(properties.projectId());
            }
            if (StringUtils.hasText(properties.emulatorHost())) {
                builder.setHost(properties.emulatorHost())
                        .setCredentials(NoCredentials.getInstance());
            }
            return builder.build().getService();
        }

        @Bean
        public FirestoreDocumentStore firestoreDocumentStore(Firestore firestore) {
            return new FirestoreDocumentStore(firestore);
        }

        @Bean
        public FirestoreChangeListener firestoreChangeListener(Firestore firestore) {
            return new FirestoreChangeListener(firestore, TRIGGER_COLLECTIONS);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(value = "satmobile.store.type", havingValue = "memory", matchIfMissing = true)
    static class InMemoryStoreConfig {

        @Bean
        public InMemoryDocumentStore inMemoryDocumentStore(
                StoreProperties properties,
                ObjectMapper objectMapper,
                ResourceLoader resourceLoader
        ) {
            InMemoryDocumentStore store = new InMemoryDocumentStore();
            if (StringUtils.hasText(properties.seedFile())) {
                new DocumentTreeSeeder(objectMapper).seed(store, resourceLoader.getResource(properties.seedFile()));
            }
            return store;
        }
    }
}
