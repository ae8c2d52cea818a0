package kiokundict;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Counts produced by one unification run.
 */
@JsonPropertyOrder({"totalChineseEntries", "totalJapaneseWords", "unifiedEntries",
        "chineseOnlyEntries", "japaneseOnlyEntries", "totalCombinedEntries", "sampleUnifiedKeys"})
public final class MergeStatistics {
    static final int MAX_SAMPLES = 20;

    private final int totalChineseEntries;
    private final int totalJapaneseWords;
    private final int unifiedEntries;
    private final int chineseOnlyEntries;
    private final int japaneseOnlyEntries;
    private final List<String> sampleUnifiedKeys;

    private MergeStatistics(int totalChineseEntries, int totalJapaneseWords, int unifiedEntries,
                            int chineseOnlyEntries, int japaneseOnlyEntries, List<String> sampleUnifiedKeys) {
        this.totalChineseEntries = totalChineseEntries;
        this.totalJapaneseWords = totalJapaneseWords;
        this.unifiedEntries = unifiedEntries;
        this.chineseOnlyEntries = chineseOnlyEntries;
        this.japaneseOnlyEntries = japaneseOnlyEntries;
        this.sampleUnifiedKeys = Collections.unmodifiableList(sampleUnifiedKeys);
    }

    /**
     * @param totalChinese  Chinese entries that went into the run
     * @param totalJapanese Japanese entries that went into the run
     * @param entries       unification output, sorted by word
     */
    static MergeStatistics compute(int totalChinese, int totalJapanese, List<UnifiedEntry> entries) {
        int unified = 0;
        int chineseOnly = 0;
        int japaneseOnly = 0;
        List<String> samples = new ArrayList<>();
        for (UnifiedEntry e : entries) {
            if (e.isUnified()) {
                unified++;
                if (samples.size() < MAX_SAMPLES) samples.add(e.getWord());
            } else if (e.getChineseEntry() != null) {
                chineseOnly++;
            } else {
                japaneseOnly++;
            }
        }
        return new MergeStatistics(totalChinese, totalJapanese, unified, chineseOnly, japaneseOnly, samples);
    }

    public int getTotalChineseEntries() {
        return totalChineseEntries;
    }

    public int getTotalJapaneseWords() {
        return totalJapaneseWords;
    }

    public int getUnifiedEntries() {
        return unifiedEntries;
    }

    public int getChineseOnlyEntries() {
        return chineseOnlyEntries;
    }

    public int getJapaneseOnlyEntries() {
        return japaneseOnlyEntries;
    }

    public int getTotalCombinedEntries() {
        return unifiedEntries + chineseOnlyEntries + japaneseOnlyEntries;
    }

    /**
     * @return up to 20 unified keys, lexicographically first
     */
    public List<String> getSampleUnifiedKeys() {
        return sampleUnifiedKeys;
    }

    @Override
    public String toString() {
        return String.format("combined=%d unified=%d chinese-only=%d japanese-only=%d (from %d Chinese, %d Japanese)",
                getTotalCombinedEntries(), unifiedEntries, chineseOnlyEntries, japaneseOnlyEntries,
                totalChineseEntries, totalJapaneseWords);
    }
}
