package kiokundict;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Classifies words into {@link Shard}s by counting Han code points.
 * <p>
 * Han means CJK Unified Ideographs and Extensions A through G. Every place that shards
 * (the build, the physical copy pass, verification) goes through {@link #shardFor(String)}.
 */
public final class Sharder {

    // Inclusive code point ranges: base block, Ext A, B, C, D, E, F, G
    private static final int[][] HAN_RANGES = {
            {0x4E00, 0x9FFF},
            {0x3400, 0x4DBF},
            {0x20000, 0x2A6DF},
            {0x2A700, 0x2B73F},
            {0x2B740, 0x2B81F},
            {0x2B820, 0x2CEAF},
            {0x2CEB0, 0x2EBEF},
            {0x30000, 0x3134F},
    };

    private Sharder() {
    }

    public static boolean isHan(int codePoint) {
        for (int[] r : HAN_RANGES) {
            if (codePoint >= r[0] && codePoint <= r[1]) return true;
        }
        return false;
    }

    /**
     * @return number of Han code points in {@code word}; surrogate pairs count once
     */
    public static int hanCount(String word) {
        return (int) word.codePoints().filter(Sharder::isHan).count();
    }

    public static Shard shardFor(String word) {
        switch (Math.min(hanCount(word), 3)) {
            case 0:
                return Shard.NON_HAN;
            case 1:
                return Shard.HAN_1CHAR;
            case 2:
                return Shard.HAN_2CHAR;
            default:
                return Shard.HAN_3PLUS;
        }
    }

    /**
     * Counts words per shard and checks that the partition is exhaustive.
     *
     * @param words every produced word
     * @return counts for all four shards (zero entries included)
     * @throws InvariantViolationException if the shard totals do not add up to the word count
     */
    public static Map<Shard, Integer> countByShard(Collection<String> words) {
        Map<Shard, Integer> counts = new EnumMap<>(Shard.class);
        for (Shard s : Shard.values()) counts.put(s, 0);
        for (String w : words) {
            counts.merge(shardFor(w), 1, Integer::sum);
        }
        verifyPartition(words.size(), counts);
        return counts;
    }

    /**
     * @throws InvariantViolationException if {@code counts} does not sum to {@code total}
     */
    public static void verifyPartition(long total, Map<Shard, Integer> counts) {
        long sum = 0;
        for (int c : counts.values()) sum += c;
        if (sum != total) {
            throw new InvariantViolationException("Shard counts " + counts + " sum to " + sum
                    + " but " + total + " words were produced");
        }
    }
}
