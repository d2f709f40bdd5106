package com.yuzhi.dts.iac.service.report;

import com.yuzhi.dts.iac.domain.ResourceKind;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

public class ApplyReport {

    private final Map<ResourceKind, ApplyTally> tallies = new EnumMap<>(ResourceKind.class);

    public ApplyTally tally(ResourceKind kind) {
        return tallies.computeIfAbsent(kind, ApplyTally::new);
    }

    public Collection<ApplyTally> getTallies() {
        return tallies.values();
    }

    public boolean hasFailures() {
        return tallies.values().stream().anyMatch(t -> t.getFailed() > 0);
    }

    public int totalSucceeded() {
        return tallies.values().stream().mapToInt(ApplyTally::getSucceeded).sum();
    }

    public int totalFailed() {
        return tallies.values().stream().mapToInt(ApplyTally::getFailed).sum();
    }
}
