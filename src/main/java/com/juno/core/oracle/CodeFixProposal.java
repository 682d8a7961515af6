package com.juno.core.oracle;

import java.util.List;

/**
 * Fixes proposed for a set of issues.
 *
 * @param narrative explanation of the approach
 * @param fixes     individual fixes, each with a runnable snippet
 */
public record CodeFixProposal(String narrative, List<CodeFix> fixes) {

    public CodeFixProposal {
        narrative = narrative == null ? "" : narrative;
        fixes = fixes == null ? List.of() : List.copyOf(fixes);
    }

    /**
     * @param description what the fix changes
     * @param code        snippet validated in the sandbox before the fix is accepted
     * @param issues      issues the fix addresses
     */
    public record CodeFix(String description, String code, List<String> issues) {
        public CodeFix {
            description = description == null ? "" : description;
            code = code == null ? "" : code;
            issues = issues == null ? List.of() : List.copyOf(issues);
        }
    }
}
