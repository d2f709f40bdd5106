package com.yuzhi.dts.iac.service.report;

import com.yuzhi.dts.iac.domain.DiffItem;
import com.yuzhi.dts.iac.domain.FieldChange;
import com.yuzhi.dts.iac.service.access.AccessChange;
import com.yuzhi.dts.iac.service.access.FolderPlan;
import java.util.Collection;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Human-readable rendering of planned changes and apply outcomes.
 */
@Component
public class ChangeReportFormatter {

    private static final String DETAIL = "\n    - ";

    public String describe(DiffItem item) {
        String subject = item.getKind().getDisplayName() + " '" + item.getName() + "'";
        String line = switch (item.getAction()) {
            case CREATE -> "[+] CREATE " + subject;
            case UPDATE -> "[~] UPDATE " + subject + ":" + DETAIL + String.join(DETAIL, changeLines(item));
            case DELETE -> "[-] DELETE " + subject;
        };
        if (item.hasUnresolvedSecrets()) {
            line += "\n    ! unresolved secrets: " + String.join(", ", item.getUnresolvedSecrets());
        }
        return line;
    }

    private static List<String> changeLines(DiffItem item) {
        return item.getChanges().stream().map(FieldChange::describe).toList();
    }

    public String describe(FolderPlan plan) {
        List<String> details = plan.changes().stream().map(AccessChange::describe).toList();
        String head;
        if (plan.isCreate()) {
            head = "[+] CREATE Folder '" + plan.name() + "' under '" + plan.parentName() + "'";
        } else {
            head = "[~] UPDATE Folder '" + plan.name() + "' access";
        }
        if (details.isEmpty()) {
            return head;
        }
        return head + ":" + DETAIL + String.join(DETAIL, details);
    }

    public String renderPlan(Collection<KindReport> reports) {
        StringBuilder out = new StringBuilder();
        for (KindReport report : reports) {
            String kind = report.getKind().getDisplayName();
            out.append("\n--- ").append(kind).append(" ---\n");
            if (report.isFailed()) {
                out.append("! Could not read live ").append(kind).append(" state: ").append(report.getFetchFailure()).append('\n');
                continue;
            }
            if (report.getChanges().isEmpty() && report.getErrors().isEmpty()) {
                out.append("No changes detected for ").append(kind).append(".\n");
            }
            report.getChanges().forEach(change -> out.append(change).append('\n'));
            report.getErrors().forEach(error -> out.append("! ").append(error).append('\n'));
        }
        return out.toString();
    }

    public String renderApply(ApplyReport report) {
        StringBuilder out = new StringBuilder("\n--- Apply summary ---\n");
        if (report.getTallies().isEmpty()) {
            out.append("Nothing to apply.\n");
            return out.toString();
        }
        for (ApplyTally tally : report.getTallies()) {
            out
                .append(tally.getKind().getDisplayName())
                .append(": ")
                .append(tally.getSucceeded())
                .append(" succeeded, ")
                .append(tally.getFailed())
                .append(" failed\n");
            tally.getFailures().forEach(failure -> out.append("    ! ").append(failure).append('\n'));
        }
        return out.toString();
    }
}
