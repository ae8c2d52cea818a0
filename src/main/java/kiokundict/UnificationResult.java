package kiokundict;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Output of {@link Unifier#unify}: entries sorted by key plus summary counts.
 */
public final class UnificationResult {
    private final List<UnifiedEntry> entries;
    private final MergeStatistics statistics;

    UnificationResult(List<UnifiedEntry> entries, MergeStatistics statistics) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
        this.statistics = statistics;
    }

    public List<UnifiedEntry> getEntries() {
        return entries;
    }

    public MergeStatistics getStatistics() {
        return statistics;
    }

    /**
     * @return only the entries present in both languages, same order
     */
    public List<UnifiedEntry> unifiedOnly() {
        return entries.stream().filter(UnifiedEntry::isUnified).collect(Collectors.toList());
    }
}
