package com.satmobile.backend.modules.sync.domain;

/**
 * @param scanned      member records examined
 * @param upserted     mirror copies written
 * @param failedWrites mirror writes that did not commit
 */
public record MirrorSyncSummary(int scanned, int upserted, int failedWrites) {

    public boolean isComplete() {
        return failedWrites == 0;
    }
}
