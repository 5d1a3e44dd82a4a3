package com.satmobile.backend.modules.admin.presentation.dto;

import com.satmobile.backend.modules.counter.domain.CounterRecomputeSummary;

public record CounterRecomputeResponse(
        int tenants,
        int administrators,
        int writes,
        int committed,
        boolean complete
) {

    public static CounterRecomputeResponse from(CounterRecomputeSummary summary) {
        return new CounterRecomputeResponse(
                summary.tenants(),
                summary.administrators(),
                summary.writes(),
                summary.committed(),
                summary.isComplete()
        );
    }
}
