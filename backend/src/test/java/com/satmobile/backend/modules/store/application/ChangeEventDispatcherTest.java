package com.satmobile.backend.modules.store.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.satmobile.backend.global.common.result.SyncErrorKind;
import com.satmobile.backend.global.common.result.SyncResult;
import com.satmobile.backend.modules.store.application.ChangeEventDispatcher.HandlerOutcome;
import com.satmobile.backend.modules.store.domain.DocumentChange;
import com.satmobile.backend.modules.store.domain.DocumentPath;
import com.satmobile.backend.modules.store.infrastructure.InMemoryDocumentStore;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ChangeEventDispatcherTest {

    @Test
    @DisplayName("a throwing handler is reported as failed and the next handler still runs")
    void isolatesHandlerFailures() {
        List<DocumentChange> seen = new ArrayList<>();
        DocumentChangeHandler failing = handler("failing", "churches/*/members/*", change -> {
            throw new IllegalStateException("boom");
        });
        DocumentChangeHandler recording = handler("recording", "churches/*/members/*", change -> {
            seen.add(change);
            return SyncResult.applied(0, "seen");
        });
        ChangeEventDispatcher dispatcher = new ChangeEventDispatcher(List.of(failing, recording), List.of());

        List<HandlerOutcome> outcomes = dispatcher.dispatch(
                new DocumentChange(DocumentPath.of("churches", "c1", "members", "m1"), null, Map.of("isActive", true)));

        assertThat(outcomes).hasSize(2);
        assertThat(outcomes.get(0).result().isFailed()).isTrue();
        assertThat(outcomes.get(0).result().errorKind()).isEqualTo(SyncErrorKind.TRANSIENT_STORE);
        assertThat(outcomes.get(1).result().status()).isEqualTo(SyncResult.Status.APPLIED);
        assertThat(seen).hasSize(1);
    }

    @Test
    @DisplayName("only handlers whose pattern matches the path are invoked")
    void routesByPattern() {
        DocumentChangeHandler members = handler("members", "churches/*/members/*", change -> SyncResult.skipped("x"));
        ChangeEventDispatcher dispatcher = new ChangeEventDispatcher(List.of(members), List.of());

        List<HandlerOutcome> outcomes = dispatcher.dispatch(
                new DocumentChange(DocumentPath.of("churches", "c1", "prayers", "p1"), null, Map.of()));

        assertThat(outcomes).isEmpty();
    }

    @Test
    @DisplayName("started dispatcher receives committed store writes")
    void subscribesToSources() {
        InMemoryDocumentStore store = new InMemoryDocumentStore();
        List<DocumentChange> seen = new ArrayList<>();
        DocumentChangeHandler recording = handler("recording", "churches/*/members/*", change -> {
            seen.add(change);
            return SyncResult.applied(0, "seen");
        });
        new ChangeEventDispatcher(List.of(recording), List.of(store)).start();

        DocumentPath path = DocumentPath.of("churches", "c1", "members", "m1");
        store.set(path, Map.of("firstName", "Ama"), false);
        store.set(path, Map.of("firstName", "Ama"), false);
        store.delete(path);

        assertThat(seen).extracting(DocumentChange::type)
                .containsExactly(DocumentChange.Type.CREATE, DocumentChange.Type.DELETE);
    }

    private static DocumentChangeHandler handler(String name, String pattern, Function<DocumentChange, SyncResult> body) {
        return new DocumentChangeHandler() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public PathPattern pattern() {
                return PathPattern.of(pattern);
            }

            @Override
            public SyncResult handle(DocumentChange change) {
                return body.apply(change);
            }
        };
    }
}
