package com.satmobile.backend.global.common.result;

import java.util.Objects;

/**
 * Outcome of one trigger or job step. Handlers return this instead of throwing so the
 * caller can log the failure and keep processing other events.
 *
 * @param status   applied, skipped (nothing to do, including missing configuration) or failed
 * @param writes   number of document writes that were committed
 * @param detail   short human readable description for the logs
 * @param errorKind set only when {@code status == FAILED}
 */
public record SyncResult(Status status, int writes, String detail, SyncErrorKind errorKind) {

    public enum Status {
        APPLIED,
        SKIPPED,
        FAILED
    }

    public SyncResult {
        Objects.requireNonNull(status, "status");
        if (status == Status.FAILED && errorKind == null) {
            throw new IllegalArgumentException("failed results need an error kind");
        }
        if (writes < 0) {
            throw new IllegalArgumentException("writes must be >= 0");
        }
    }

    public static SyncResult applied(int writes, String detail) {
        return new SyncResult(Status.APPLIED, writes, detail, null);
    }

    public static SyncResult skipped(String reason) {
        return new SyncResult(Status.SKIPPED, 0, reason, null);
    }

    public static SyncResult failed(SyncErrorKind kind, int writes, String detail) {
        return new SyncResult(Status.FAILED, writes, detail, kind);
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }
}
