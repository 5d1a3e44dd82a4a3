package com.satmobile.backend.modules.counter.domain;

/**
 * @param inactiveFound inactive member records found across all tenants
 * @param deleted       of those, records whose delete committed
 * @param recompute     counter recompute run after the purge
 */
public record PurgeSummary(int inactiveFound, int deleted, CounterRecomputeSummary recompute) {

    public boolean isComplete() {
        return deleted == inactiveFound && recompute.isComplete();
    }
}
