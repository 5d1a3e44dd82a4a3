package com.satmobile.backend.modules.store.application;

import com.satmobile.backend.global.common.result.SyncResult;
import com.satmobile.backend.modules.store.domain.DocumentChange;

/**
 * Reaction to committed document changes. Handlers may be invoked more than once for the
 * same change and in any order relative to each other.
 */
public interface DocumentChangeHandler {

    String name();

    PathPattern pattern();

    SyncResult handle(DocumentChange change);
}
