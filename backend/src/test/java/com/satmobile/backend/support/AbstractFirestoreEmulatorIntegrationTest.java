package com.satmobile.backend.support;

import com.google.cloud.NoCredentials;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreOptions;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.testcontainers.containers.FirestoreEmulatorContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/**
 * Shared Firestore emulator for adapter tests. Skipped when no Docker daemon is reachable.
 */
@Testcontainers(disabledWithoutDocker = true)
public abstract class AbstractFirestoreEmulatorIntegrationTest {

    protected static final String PROJECT_ID = "satmobile-test";

    @Container
    private static final FirestoreEmulatorContainer EMULATOR = new FirestoreEmulatorContainer(
            DockerImageName.parse("gcr.io/google.com/cloudsdktool/google-cloud-cli:441.0.0-emulators"));

    protected static Firestore firestore;

    @BeforeAll
    static void connectFirestore() {
        firestore = FirestoreOptions.getDefaultInstance().toBuilder()
                .setHost(EMULATOR.getEmulatorEndpoint())
                .setCredentials(NoCredentials.getInstance())
                .setProjectId(PROJECT_ID)
                .build()
                .getService();
    }

    @AfterAll
    static void closeFirestore() throws Exception {
        if (firestore != null) {
            firestore.close();
        }
    }
}
