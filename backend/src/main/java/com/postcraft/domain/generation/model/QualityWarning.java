package com.postcraft.domain.generation.model;

import java.util.List;

/**
 * Non-fatal quality annotation for one copy field of the final result.
 */
public record QualityWarning(CopyField field, List<IssueKind> issues) {

    public QualityWarning {
        issues = List.copyOf(issues);
    }
}
