package com.satmobile.backend.modules.store.infrastructure;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreException;
import com.google.cloud.firestore.ListenerRegistration;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import com.satmobile.backend.modules.store.domain.DocumentChange;
import com.satmobile.backend.modules.store.domain.DocumentPath;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;

/**
 * Turns Firestore snapshot listeners on collection groups into before/after change events.
 * The first snapshot of each group only primes the cache of last seen documents; changes
 * reported afterwards are published with the cached version as the before image.
 */
public class FirestoreChangeListener implements DocumentChangeSource, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(FirestoreChangeListener.class);

    private final Firestore firestore;
    private final List<String> collectionIds;
    private final Map<String, Map<String, Object>> lastSeen = new ConcurrentHashMap<>();
    private final Set<String> primedGroups = ConcurrentHashMap.newKeySet();
    private final List<ListenerRegistration> registrations = new CopyOnWriteArrayList<>();

    public FirestoreChangeListener(Firestore firestore, List<String> collectionIds) {
        this.firestore = Objects.requireNonNull(firestore, "firestore");
        this.collectionIds = List.copyOf(collectionIds);
    }

    @Override
    public void subscribe(Consumer<DocumentChange> listener) {
        for (String collectionId : collectionIds) {
            ListenerRegistration registration = firestore.collectionGroup(collectionId)
                    .addSnapshotListener((snapshot, error) -> onSnapshot(collectionId, snapshot, error, listener));
            registrations.add(registration);
            log.info("Listening for changes on collection group '{}'", collectionId);
        }
    }

    private void onSnapshot(String collectionId, QuerySnapshot snapshot, FirestoreException error,
                            Consumer<DocumentChange> listener) {
        if (error != null) {
            log.warn("Snapshot listener for '{}' failed: {}", collectionId, error.getMessage(), error);
            return;
        }
        if (snapshot == null) {
            return;
        }
        boolean priming = primedGroups.add(collectionId);
        for (com.google.cloud.firestore.DocumentChange change : snapshot.getDocumentChanges()) {
            QueryDocumentSnapshot document = change.getDocument();
            String path = document.getReference().getPath();
            Map<String, Object> before;
            Map<String, Object> after;
            if (change.getType() == com.google.cloud.firestore.DocumentChange.Type.REMOVED) {
                before = lastSeen.remove(path);
                after = null;
            } else {
                after = document.getData();
                before = lastSeen.put(path, after);
            }
            if (priming || (before == null && after == null)) {
                continue;
            }
            try {
                listener.accept(new DocumentChange(new DocumentPath(path), before, after));
            } catch (RuntimeException ex) {
                log.warn("Change listener failed for {}: {}", path, ex.getMessage(), ex);
            }
        }
        if (priming) {
            log.info("Primed {} documents of collection group '{}'", snapshot.size(), collectionId);
        }
    }

    @Override
    public void destroy() {
        registrations.forEach(ListenerRegistration::remove);
        registrations.clear();
    }
}
