package com.acme.finops.ossaudit.policy;

import com.acme.finops.ossaudit.model.PackageCoordinate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Approved and denied package lists plus the per-run suppressions.
 *
 * <p>Lookup returns the most specific matching entry: an exact coordinate
 * beats {@code group:artifact}, which beats {@code group}, which beats any
 * wildcard entry. A list that was not provided is empty.</p>
 */
public final class PolicyLists {
    private static final PolicyLists EMPTY = new PolicyLists(List.of(), List.of(), List.of());

    private final Index approved;
    private final Index denied;
    private final Index suppress;
    private final Set<String> suppressed;

    public PolicyLists(Collection<PolicyEntry> approved, Collection<PolicyEntry> denied, Collection<String> suppress) {
        this.approved = new Index(approved);
        this.denied = new Index(denied);
        List<PolicyEntry> suppressEntries = new ArrayList<>();
        Set<String> names = new TreeSet<>();
        for (String s : suppress) {
            if (s != null && !s.isBlank()) {
                PolicyEntry e = PolicyEntry.of(s);
                suppressEntries.add(e);
                names.add(e.pattern());
            }
        }
        this.suppress = new Index(suppressEntries);
        this.suppressed = Set.copyOf(names);
    }

    public static PolicyLists empty() {
        return EMPTY;
    }

    public static PolicyLists of(Collection<String> approved, Collection<String> denied, Collection<String> suppress) {
        return new PolicyLists(entries(approved), entries(denied), suppress);
    }

    public Optional<PolicyEntry> approvedMatch(PackageCoordinate coordinate) {
        return approved.match(coordinate);
    }

    public Optional<PolicyEntry> deniedMatch(PackageCoordinate coordinate) {
        return denied.match(coordinate);
    }

    public boolean isSuppressed(PackageCoordinate coordinate) {
        return suppress.match(coordinate).isPresent();
    }

    /**
     * Metadata for a BOM entry. Denied wins when both lists match.
     */
    public Optional<PolicyEntry> reviewFor(PackageCoordinate coordinate) {
        Optional<PolicyEntry> d = deniedMatch(coordinate);
        return d.isPresent() ? d : approvedMatch(coordinate);
    }

    public Set<String> suppressed() {
        return suppressed;
    }

    private static List<PolicyEntry> entries(Collection<String> patterns) {
        List<PolicyEntry> out = new ArrayList<>(patterns.size());
        for (String p : patterns) {
            if (p != null && !p.isBlank()) {
                out.add(PolicyEntry.of(p));
            }
        }
        return out;
    }

    private static final class Index {
        private final Map<String, PolicyEntry> exact = new HashMap<>();
        private final List<PolicyEntry> wildcards = new ArrayList<>();

        private Index(Collection<PolicyEntry> entries) {
            for (PolicyEntry e : entries) {
                if (e.wildcard()) {
                    wildcards.add(e);
                } else {
                    exact.putIfAbsent(e.pattern(), e);
                }
            }
            wildcards.sort((a, b) -> Integer.compare(b.pattern().length(), a.pattern().length()));
        }

        Optional<PolicyEntry> match(PackageCoordinate coordinate) {
            String c = coordinate.toString();
            // Try the full coordinate first, then each shorter colon-delimited prefix.
            for (int end = c.length(); end > 0; end = c.lastIndexOf(':', end - 1)) {
                PolicyEntry e = exact.get(c.substring(0, end));
                if (e != null) {
                    return Optional.of(e);
                }
            }
            for (PolicyEntry e : wildcards) {
                if (e.matches(coordinate)) {
                    return Optional.of(e);
                }
            }
            return Optional.empty();
        }
    }
}
