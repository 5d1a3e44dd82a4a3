package com.satmobile.backend.modules.store.infrastructure;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

import com.google.api.core.ApiFuture;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.FieldValue;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import com.google.cloud.firestore.SetOptions;
import com.google.cloud.firestore.WriteBatch;
import com.satmobile.backend.modules.store.domain.CollectionPath;
import com.satmobile.backend.modules.store.domain.DocumentPath;
import com.satmobile.backend.modules.store.domain.StoredDocument;
import com.satmobile.backend.modules.store.domain.WriteOperation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DocumentStore} backed by Cloud Firestore. Blocking calls on the client futures;
 * execution failures surface as {@link DocumentStoreException}.
 */
public class FirestoreDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(FirestoreDocumentStore.class);

    private final Firestore firestore;

    public FirestoreDocumentStore(Firestore firestore) {
        this.firestore = Objects.requireNonNull(firestore, "firestore");
    }

    @Override
    public Optional<StoredDocument> get(DocumentPath path) {
        DocumentSnapshot snapshot = await(firestore.document(path.value()).get(), "get " + path);
        if (snapshot == null || !snapshot.exists()) {
            return Optional.empty();
        }
        return Optional.of(new StoredDocument(path, snapshot.getData()));
    }

    @Override
    public List<StoredDocument> list(CollectionPath collection) {
        return run(firestore.collection(collection.value()), "list " + collection);
    }

    @Override
    public List<StoredDocument> query(CollectionPath collection, String field, Object value) {
        return run(firestore.collection(collection.value()).whereEqualTo(field, value),
                "query " + collection + " where " + field);
    }

    @Override
    public long count(CollectionPath collection) {
        return await(firestore.collection(collection.value()).count().get(), "count " + collection).getCount();
    }

    @Override
    public long count(CollectionPath collection, String field, Object value) {
        return await(firestore.collection(collection.value()).whereEqualTo(field, value).count().get(),
                "count " + collection + " where " + field).getCount();
    }

    @Override
    public List<StoredDocument> queryGroup(String collectionId, String field, Object value) {
        return run(firestore.collectionGroup(collectionId).whereEqualTo(field, value),
                "group query " + collectionId + " where " + field);
    }

    @Override
    public void commit(List<WriteOperation> operations) {
        if (operations.isEmpty()) {
            return;
        }
        if (operations.size() > MAX_BATCH_OPERATIONS) {
            throw new IllegalArgumentException("Batch of " + operations.size()
                    + " operations exceeds the limit of " + MAX_BATCH_OPERATIONS);
        }
        WriteBatch batch = firestore.batch();
        for (WriteOperation operation : operations) {
            DocumentReference reference = firestore.document(operation.path().value());
            switch (operation.kind()) {
                case MERGE -> batch.set(reference, operation.data(), SetOptions.merge());
                case REPLACE -> batch.set(reference, operation.data());
                case DELETE -> batch.delete(reference);
                case INCREMENT -> batch.set(
                        reference,
                        nested(operation.field(), FieldValue.increment(operation.delta())),
                        SetOptions.merge()
                );
            }
        }
        await(batch.commit(), "commit of " + operations.size() + " operations");
        if (log.isDebugEnabled()) {
            log.debug("Committed Firestore batch of {} operations", operations.size());
        }
    }

    private List<StoredDocument> run(Query query, String description) {
        QuerySnapshot snapshot = await(query.get(), description);
        if (snapshot == null) {
            return List.of();
        }
        return snapshot.getDocuments().stream()
                .map(FirestoreDocumentStore::toStoredDocument)
                .toList();
    }

    static StoredDocument toStoredDocument(QueryDocumentSnapshot document) {
        return new StoredDocument(new DocumentPath(document.getReference().getPath()), document.getData());
    }

    private static Map<String, Object> nested(String dottedField, Object value) {
        String[] parts = dottedField.split("\\.");
        Map<String, Object> root = new LinkedHashMap<>();
        root.put(parts[parts.length - 1], value);
        for (int i = parts.length - 2; i >= 0; i--) {
            Map<String, Object> level = new LinkedHashMap<>();
            level.put(parts[i], root);
            root = level;
        }
        return root;
    }

    private static <T> T await(ApiFuture<T> future, String description) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new DocumentStoreException("Interrupted during Firestore " + description, ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            throw new DocumentStoreException("Firestore " + description + " failed: " + cause.getMessage(), cause);
        }
    }
}
