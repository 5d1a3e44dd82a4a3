package com.satmobile.backend.modules.store.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.satmobile.backend.global.config.SyncProperties;
import com.satmobile.backend.modules.store.domain.CollectionPath;
import com.satmobile.backend.modules.store.domain.WriteOperation;
import com.satmobile.backend.modules.store.infrastructure.DocumentStoreException;
import com.satmobile.backend.support.FlakyDocumentStore;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BatchWriterTest {

    private static final CollectionPath ITEMS = CollectionPath.of("churches", "c1", "members");

    private FlakyDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new FlakyDocumentStore();
    }

    @Test
    @DisplayName("one operation over the limit is split into a full chunk and a single one")
    void splitsAtLimit() {
        BatchWriter writer = new BatchWriter(store, new SyncProperties(450));

        BatchWriteResult result = writer.write(operations(451));

        assertThat(result.isComplete()).isTrue();
        assertThat(result.chunks()).isEqualTo(2);
        assertThat(store.committedSizes()).containsExactly(450, 1);
        assertThat(store.list(ITEMS)).hasSize(451);
    }

    @Test
    @DisplayName("a failed chunk stops the run and leaves the committed prefix in place")
    void stopsAtFirstFailedChunk() {
        BatchWriter writer = new BatchWriter(store, new SyncProperties(3));
        store.failCommit(2);

        BatchWriteResult result = writer.write(operations(7));

        assertThat(result.isComplete()).isFalse();
        assertThat(result.attempted()).isEqualTo(7);
        assertThat(result.committed()).isEqualTo(3);
        assertThat(result.committedChunks()).isEqualTo(1);
        assertThat(result.uncommitted()).isEqualTo(4);
        assertThat(result.failure()).isInstanceOf(DocumentStoreException.class);
        assertThat(store.committedSizes()).containsExactly(3);
        assertThat(store.list(ITEMS)).extracting(document -> document.id())
                .containsExactlyInAnyOrder("m0", "m1", "m2");
    }

    @Test
    @DisplayName("no operations means no commit")
    void emptyInput() {
        BatchWriter writer = new BatchWriter(store, new SyncProperties(450));

        BatchWriteResult result = writer.write(List.of());

        assertThat(result.isComplete()).isTrue();
        assertThat(result.chunks()).isZero();
        assertThat(store.committedSizes()).isEmpty();
    }

    @Test
    @DisplayName("limits outside 1..500 are rejected")
    void rejectsInvalidLimit() {
        assertThatThrownBy(() -> new BatchWriter(store, new SyncProperties(501)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BatchWriter(store, new SyncProperties(0)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static List<WriteOperation> operations(int count) {
        List<WriteOperation> operations = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            operations.add(WriteOperation.replace(ITEMS.document("m" + i), Map.of("index", i)));
        }
        return operations;
    }
}
