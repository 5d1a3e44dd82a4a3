package com.satmobile.backend.modules.admin.presentation.dto;

import com.satmobile.backend.modules.counter.domain.PurgeSummary;

public record PurgeInactiveResponse(
        int inactiveFound,
        int deleted,
        CounterRecomputeResponse recompute,
        boolean complete
) {

    public static PurgeInactiveResponse from(PurgeSummary summary) {
        return new PurgeInactiveResponse(
                summary.inactiveFound(),
                summary.deleted(),
                CounterRecomputeResponse.from(summary.recompute()),
                summary.isComplete()
        );
    }
}
