package com.satmobile.backend.global.common.result;

public enum SyncErrorKind {
    /** Network or contention failure reported by the document store. */
    TRANSIENT_STORE,
    /** Some chunks of a batched write committed, the rest did not. */
    PARTIAL_BATCH,
    INVALID_INPUT,
    PERMISSION_DENIED
}
