package com.postcraft.domain.generation.model;

import java.util.List;

/**
 * Result of output validation.
 *
 * @param valid       true if no issue was found
 * @param cleanedText best-effort cleaned text (truncated when over length, otherwise the input)
 * @param issues      issues found, in check order
 */
public record ValidationVerdict(
        boolean valid,
        String cleanedText,
        List<IssueKind> issues
) {
    public ValidationVerdict {
        issues = List.copyOf(issues);
    }

    public boolean has(IssueKind kind) {
        return issues.contains(kind);
    }
}
