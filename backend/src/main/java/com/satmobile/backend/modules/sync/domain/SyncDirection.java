package com.satmobile.backend.modules.sync.domain;

public enum SyncDirection {
    /** Source tenant to its category mirrors. */
    FORWARD,
    /** Mirror tenant back to the source record. */
    REVERSE;

    public SyncDirection opposite() {
        return this == FORWARD ? REVERSE : FORWARD;
    }
}
