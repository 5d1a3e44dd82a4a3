package com.satmobile.backend.modules.store.infrastructure;

import java.util.function.Consumer;

import com.satmobile.backend.modules.store.domain.DocumentChange;

/**
 * Stream of committed document changes, the equivalent of store-side triggers.
 */
public interface DocumentChangeSource {

    void subscribe(Consumer<DocumentChange> listener);
}
