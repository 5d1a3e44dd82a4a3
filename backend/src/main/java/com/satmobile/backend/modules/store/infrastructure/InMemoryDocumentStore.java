package com.satmobile.backend.modules.store.infrastructure;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import com.satmobile.backend.modules.store.domain.CollectionPath;
import com.satmobile.backend.modules.store.domain.DocumentChange;
import com.satmobile.backend.modules.store.domain.DocumentFields;
import com.satmobile.backend.modules.store.domain.DocumentPath;
import com.satmobile.backend.modules.store.domain.StoredDocument;
import com.satmobile.backend.modules.store.domain.WriteOperation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Document store kept in memory, used for local runs and tests. Mirrors the provider's
 * semantics: deep merges, increments that create missing documents, a 500 operation batch
 * ceiling and change events emitted after every committed batch.
 */
public class InMemoryDocumentStore implements DocumentStore, DocumentChangeSource {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    private final Map<String, Map<String, Object>> documents = new TreeMap<>();
    private final List<Consumer<DocumentChange>> listeners = new CopyOnWriteArrayList<>();
    private final Object lock = new Object();

    @Override
    public void subscribe(Consumer<DocumentChange> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public Optional<StoredDocument> get(DocumentPath path) {
        synchronized (lock) {
            Map<String, Object> data = documents.get(path.value());
            return data == null ? Optional.empty() : Optional.of(new StoredDocument(path, deepCopy(data)));
        }
    }

    @Override
    public List<StoredDocument> list(CollectionPath collection) {
        String prefix = collection.value() + "/";
        List<StoredDocument> result = new ArrayList<>();
        synchronized (lock) {
            documents.forEach((key, data) -> {
                if (key.startsWith(prefix) && key.indexOf('/', prefix.length()) < 0) {
                    result.add(new StoredDocument(new DocumentPath(key), deepCopy(data)));
                }
            });
        }
        return result;
    }

    @Override
    public List<StoredDocument> query(CollectionPath collection, String field, Object value) {
        return list(collection).stream()
                .filter(document -> valuesEqual(DocumentFields.value(document.data(), field), value))
                .toList();
    }

    @Override
    public List<StoredDocument> queryGroup(String collectionId, String field, Object value) {
        List<StoredDocument> result = new ArrayList<>();
        synchronized (lock) {
            documents.forEach((key, data) -> {
                DocumentPath path = new DocumentPath(key);
                List<String> segments = path.segments();
                if (segments.get(segments.size() - 2).equals(collectionId)
                        && valuesEqual(DocumentFields.value(data, field), value)) {
                    result.add(new StoredDocument(path, deepCopy(data)));
                }
            });
        }
        return result;
    }

    @Override
    public void commit(List<WriteOperation> operations) {
        if (operations.size() > MAX_BATCH_OPERATIONS) {
            throw new IllegalArgumentException("Batch of " + operations.size()
                    + " operations exceeds the limit of " + MAX_BATCH_OPERATIONS);
        }
        Map<String, Map<String, Object>> beforeImages = new LinkedHashMap<>();
        Map<String, Map<String, Object>> afterImages = new LinkedHashMap<>();
        synchronized (lock) {
            Map<String, Map<String, Object>> working = new LinkedHashMap<>();
            for (WriteOperation operation : operations) {
                String key = operation.path().value();
                if (!working.containsKey(key)) {
                    Map<String, Object> current = documents.get(key);
                    beforeImages.put(key, current == null ? null : deepCopy(current));
                    working.put(key, current == null ? null : deepCopy(current));
                }
                working.put(key, apply(working.get(key), operation));
            }
            working.forEach((key, data) -> {
                if (data == null) {
                    documents.remove(key);
                } else {
                    documents.put(key, data);
                }
                afterImages.put(key, data == null ? null : deepCopy(data));
            });
        }
        beforeImages.forEach((key, before) -> {
            Map<String, Object> after = afterImages.get(key);
            if (!Objects.equals(before, after)) {
                publish(new DocumentChange(new DocumentPath(key), before, after));
            }
        });
    }

    /** Number of stored documents, for diagnostics. */
    public int size() {
        synchronized (lock) {
            return documents.size();
        }
    }

    private void publish(DocumentChange change) {
        for (Consumer<DocumentChange> listener : listeners) {
            try {
                listener.accept(change);
            } catch (RuntimeException ex) {
                log.warn("Change listener failed for {}: {}", change.path(), ex.getMessage(), ex);
            }
        }
    }

    private static Map<String, Object> apply(Map<String, Object> current, WriteOperation operation) {
        return switch (operation.kind()) {
            case REPLACE -> deepCopy(operation.data());
            case DELETE -> null;
            case MERGE -> {
                Map<String, Object> target = current == null ? new LinkedHashMap<>() : current;
                mergeInto(target, operation.data());
                yield target;
            }
            case INCREMENT -> {
                Map<String, Object> target = current == null ? new LinkedHashMap<>() : current;
                incrementField(target, operation.field(), operation.delta());
                yield target;
            }
        };
    }

    private static void mergeInto(Map<String, Object> target, Map<String, Object> source) {
        source.forEach((key, value) -> {
            Map<String, Object> nested = DocumentFields.asMap(value);
            Map<String, Object> existing = DocumentFields.asMap(target.get(key));
            if (nested != null && existing != null) {
                Map<String, Object> copy = new LinkedHashMap<>(existing);
                mergeInto(copy, nested);
                target.put(key, copy);
            } else {
                target.put(key, copyValue(value));
            }
        });
    }

    private static void incrementField(Map<String, Object> target, String field, long delta) {
        String[] parts = field.split("\\.");
        Map<String, Object> current = target;
        for (int i = 0; i < parts.length - 1; i++) {
            Map<String, Object> next = DocumentFields.asMap(current.get(parts[i]));
            if (next == null) {
                next = new LinkedHashMap<>();
                current.put(parts[i], next);
            }
            current = next;
        }
        String leaf = parts[parts.length - 1];
        Object existing = current.get(leaf);
        long base = existing instanceof Number number ? number.longValue() : 0L;
        current.put(leaf, base + delta);
    }

    private static boolean valuesEqual(Object stored, Object expected) {
        if (stored instanceof Number left && expected instanceof Number right) {
            return left.doubleValue() == right.doubleValue();
        }
        return Objects.equals(stored, expected);
    }

    private static Map<String, Object> deepCopy(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, copyValue(value)));
        return copy;
    }

    private static Object copyValue(Object value) {
        Map<String, Object> map = DocumentFields.asMap(value);
        if (map != null) {
            return deepCopy(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(copyValue(item)));
            return copy;
        }
        return value;
    }
}
