package com.satmobile.backend.modules.counter.domain;

/**
 * @param tenants        tenants whose active members were counted
 * @param administrators administrator profiles given a recomputed total
 * @param writes         counter writes attempted
 * @param committed      counter writes committed
 */
public record CounterRecomputeSummary(int tenants, int administrators, int writes, int committed) {

    public boolean isComplete() {
        return committed == writes;
    }
}
