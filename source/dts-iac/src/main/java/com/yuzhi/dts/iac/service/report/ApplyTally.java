package com.yuzhi.dts.iac.service.report;

import com.yuzhi.dts.iac.domain.ResourceKind;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome counters of one kind during apply.
 */
public class ApplyTally {

    private final ResourceKind kind;
    private int succeeded;
    private final List<String> failures = new ArrayList<>();

    public ApplyTally(ResourceKind kind) {
        this.kind = kind;
    }

    public void success() {
        succeeded++;
    }

    public void failure(String message) {
        failures.add(message);
    }

    public ResourceKind getKind() {
        return kind;
    }

    public int getSucceeded() {
        return succeeded;
    }

    public int getFailed() {
        return failures.size();
    }

    public List<String> getFailures() {
        return List.copyOf(failures);
    }
}
