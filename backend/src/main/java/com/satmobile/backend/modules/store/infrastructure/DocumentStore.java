package com.satmobile.backend.modules.store.infrastructure;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.satmobile.backend.modules.store.domain.CollectionPath;
import com.satmobile.backend.modules.store.domain.DocumentPath;
import com.satmobile.backend.modules.store.domain.StoredDocument;
import com.satmobile.backend.modules.store.domain.WriteOperation;

/**
 * Port to the tenant document store. Offers per-document atomicity and one bounded batch
 * primitive; there are no transactions across documents beyond a single {@link #commit}.
 * Every method may throw {@link DocumentStoreException}.
 */
public interface DocumentStore {

    /** Hard ceiling of operations the provider accepts in one batch. */
    int MAX_BATCH_OPERATIONS = 500;

    Optional<StoredDocument> get(DocumentPath path);

    List<StoredDocument> list(CollectionPath collection);

    /** Equality query on one (possibly dotted) field of one collection. */
    List<StoredDocument> query(CollectionPath collection, String field, Object value);

    /** Equality query across every collection named {@code collectionId}, in any tenant. */
    List<StoredDocument> queryGroup(String collectionId, String field, Object value);

    /**
     * Commits up to {@link #MAX_BATCH_OPERATIONS} operations atomically.
     *
     * @throws IllegalArgumentException when the batch is larger than the ceiling
     */
    void commit(List<WriteOperation> operations);

    default long count(CollectionPath collection) {
        return list(collection).size();
    }

    /** Number of documents matching {@link #query}; adapters may answer with an aggregation. */
    default long count(CollectionPath collection, String field, Object value) {
        return query(collection, field, value).size();
    }

    default boolean exists(DocumentPath path) {
        return get(path).isPresent();
    }

    default void set(DocumentPath path, Map<String, Object> data, boolean merge) {
        commit(List.of(merge ? WriteOperation.merge(path, data) : WriteOperation.replace(path, data)));
    }

    default void delete(DocumentPath path) {
        commit(List.of(WriteOperation.delete(path)));
    }

    default void increment(DocumentPath path, String field, long delta) {
        commit(List.of(WriteOperation.increment(path, field, delta)));
    }
}
