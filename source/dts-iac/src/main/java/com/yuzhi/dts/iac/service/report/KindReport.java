package com.yuzhi.dts.iac.service.report;

import com.yuzhi.dts.iac.domain.ResourceKind;
import java.util.ArrayList;
import java.util.List;

/**
 * Planned change descriptions of one kind, or the reason the kind could not be planned. Errors are per entity
 * problems (for example an unresolvable parent folder) that did not stop the rest of the kind.
 */
public class KindReport {

    private final ResourceKind kind;
    private final List<String> changes = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private String fetchFailure;

    public KindReport(ResourceKind kind) {
        this.kind = kind;
    }

    public static KindReport failed(ResourceKind kind, String reason) {
        KindReport report = new KindReport(kind);
        report.fetchFailure = reason;
        return report;
    }

    public void addChange(String description) {
        changes.add(description);
    }

    public void addError(String error) {
        errors.add(error);
    }

    public ResourceKind getKind() {
        return kind;
    }

    public List<String> getChanges() {
        return List.copyOf(changes);
    }

    public List<String> getErrors() {
        return List.copyOf(errors);
    }

    public String getFetchFailure() {
        return fetchFailure;
    }

    public boolean isFailed() {
        return fetchFailure != null;
    }

    public boolean hasProblems() {
        return fetchFailure != null || !errors.isEmpty();
    }
}
