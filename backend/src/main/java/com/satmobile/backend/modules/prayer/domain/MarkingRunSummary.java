package com.satmobile.backend.modules.prayer.domain;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record MarkingRunSummary(List<TenantTickResult> tenants) {

    public MarkingRunSummary {
        tenants = List.copyOf(tenants);
    }

    public int totalMarked() {
        return tenants.stream().mapToInt(TenantTickResult::marked).sum();
    }

    public long count(MarkingOutcome outcome) {
        return tenants.stream().filter(result -> result.outcome() == outcome).count();
    }

    public Map<MarkingOutcome, Long> countsByOutcome() {
        Map<MarkingOutcome, Long> counts = new EnumMap<>(MarkingOutcome.class);
        for (MarkingOutcome outcome : MarkingOutcome.values()) {
            counts.put(outcome, count(outcome));
        }
        return counts;
    }
}
