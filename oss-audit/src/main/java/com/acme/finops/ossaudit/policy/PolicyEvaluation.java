package com.acme.finops.ossaudit.policy;

import com.acme.finops.ossaudit.model.AuditIssue;
import com.acme.finops.ossaudit.model.AuditWarning;
import com.acme.finops.ossaudit.model.Verdict;

import java.util.List;

/**
 * @param issues     denied and unapproved entries, manifest order
 * @param verdict    failing only in strict mode with a denied, unsuppressed package
 * @param warnings   approved/denied list inconsistencies
 * @param denied     every denied coordinate found in the manifest, suppressed ones included
 * @param suppressed denied coordinates exempted for this run
 */
public record PolicyEvaluation(
    List<AuditIssue> issues,
    Verdict verdict,
    List<AuditWarning> warnings,
    List<String> denied,
    List<String> suppressed
) {
    public PolicyEvaluation {
        issues = List.copyOf(issues);
        warnings = List.copyOf(warnings);
        denied = List.copyOf(denied);
        suppressed = List.copyOf(suppressed);
    }
}
