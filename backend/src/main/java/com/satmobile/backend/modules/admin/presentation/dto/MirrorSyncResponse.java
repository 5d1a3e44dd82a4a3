package com.satmobile.backend.modules.admin.presentation.dto;

import com.satmobile.backend.modules.sync.domain.MirrorSyncSummary;

public record MirrorSyncResponse(int scanned, int upserted, int failedWrites, boolean complete) {

    public static MirrorSyncResponse from(MirrorSyncSummary summary) {
        return new MirrorSyncResponse(summary.scanned(), summary.upserted(), summary.failedWrites(), summary.isComplete());
    }
}
