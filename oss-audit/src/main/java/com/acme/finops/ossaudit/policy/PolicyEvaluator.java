package com.acme.finops.ossaudit.policy;

import com.acme.finops.ossaudit.model.AuditIssue;
import com.acme.finops.ossaudit.model.AuditWarning;
import com.acme.finops.ossaudit.model.IssueReason;
import com.acme.finops.ossaudit.model.PackageCoordinate;
import com.acme.finops.ossaudit.model.PackageRecord;
import com.acme.finops.ossaudit.model.Verdict;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Classifies manifest entries against the approved and denied lists.
 *
 * <ul>
 *   <li>denied, not suppressed: {@link IssueReason#DENIED}</li>
 *   <li>denied and suppressed: no issue</li>
 *   <li>neither denied nor approved: {@link IssueReason#UNAPPROVED}</li>
 *   <li>approved only: no issue</li>
 * </ul>
 *
 * A coordinate on both lists is treated as denied and reported as a list
 * inconsistency. Only strict mode turns denied packages into a failing verdict.
 */
public final class PolicyEvaluator {
    private static final Logger LOG = Logger.getLogger(PolicyEvaluator.class.getName());

    public PolicyEvaluation evaluate(List<PackageRecord> manifest, PolicyLists lists, boolean strict) {
        Objects.requireNonNull(manifest, "manifest");
        PolicyLists policy = lists == null ? PolicyLists.empty() : lists;

        List<AuditIssue> issues = new ArrayList<>();
        List<AuditWarning> warnings = new ArrayList<>();
        Set<String> denied = new LinkedHashSet<>();
        Set<String> suppressed = new LinkedHashSet<>();
        Set<String> unsuppressed = new LinkedHashSet<>();
        Set<String> inconsistent = new LinkedHashSet<>();

        for (PackageRecord record : manifest) {
            PackageCoordinate c = record.coordinate();
            boolean isDenied = policy.deniedMatch(c).isPresent();
            boolean isApproved = policy.approvedMatch(c).isPresent();

            if (isDenied && isApproved && inconsistent.add(c.toString())) {
                LOG.warning("Package " + c + " is on both the approved and the denied list, treating it as denied");
                warnings.add(new AuditWarning(
                    AuditWarning.Kind.LIST_INCONSISTENCY,
                    c.toString(),
                    "listed as both approved and denied; denied takes precedence"
                ));
            }

            if (isDenied) {
                denied.add(c.toString());
                if (policy.isSuppressed(c)) {
                    suppressed.add(c.toString());
                    continue;
                }
                unsuppressed.add(c.toString());
                issues.add(new AuditIssue(record, IssueReason.DENIED));
            } else if (!isApproved) {
                issues.add(new AuditIssue(record, IssueReason.UNAPPROVED));
            }
        }

        Verdict verdict = strict && !unsuppressed.isEmpty()
            ? new Verdict.Fail(new ArrayList<>(unsuppressed))
            : Verdict.pass();
        return new PolicyEvaluation(issues, verdict, warnings, new ArrayList<>(denied), new ArrayList<>(suppressed));
    }
}
