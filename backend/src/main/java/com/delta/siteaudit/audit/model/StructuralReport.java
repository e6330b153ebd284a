package com.delta.siteaudit.audit.model;

import java.util.List;

public record StructuralReport(
    List<StructuralIssue> issues,
    int totalIssues,
    int highIssues,
    int mediumIssues,
    int lowIssues
) implements CheckPayload {

    public static StructuralReport of(List<StructuralIssue> issues) {
        int high = 0;
        int medium = 0;
        int low = 0;
        for (StructuralIssue issue : issues) {
            if (issue.severity() == IssueSeverity.HIGH) {
                high++;
            } else if (issue.severity() == IssueSeverity.MEDIUM) {
                medium++;
            } else {
                low++;
            }
        }
        return new StructuralReport(List.copyOf(issues), issues.size(), high, medium, low);
    }

    @Override
    public CheckKind kind() {
        return CheckKind.STRUCTURAL;
    }
}
