package kiokundict;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Merges Chinese and Japanese entries that share a matching key.
 *
 * <p>The key universe is the union of every Chinese traditional form and every Japanese
 * entry's rendered primary spelling (see {@link MatchKeys}). For each key the candidates
 * from both corpora are collected through the loaders' spelling indexes and one primary
 * entry per language is selected:</p>
 * <ul>
 *   <li>Chinese: common entries (HSK level or frequency data) first, then lower source
 *       priority, then input order.</li>
 *   <li>Japanese: entries with a common kanji or kana spelling first, then input order.</li>
 * </ul>
 * <p>The remaining candidates are only counted. Output is sorted by key.</p>
 *
 * <p>The mapping is passed in once and never changes, so a {@code Unifier} can be reused
 * and shared between threads.</p>
 */
public class Unifier {
    private static final Logger LOGGER = Logger.getLogger(Unifier.class.getName());

    private final CharacterMapping mapping;

    public Unifier(CharacterMapping mapping) {
        this.mapping = Objects.requireNonNull(mapping, "mapping");
    }

    /**
     * Unifies two loaded corpora.
     *
     * @param chinese  Chinese corpus with its spelling index
     * @param japanese Japanese corpus with its spelling index
     * @return one entry per distinct key, sorted by key, with merge statistics
     * @throws InvariantViolationException if a key ends up with no candidates or appears twice
     */
    public UnificationResult unify(LoadedCorpus<ChineseEntry> chinese, LoadedCorpus<JapaneseEntry> japanese) {
        Map<ChineseEntry, Integer> zhOrder = inputOrder(chinese.getEntries());
        Map<JapaneseEntry, Integer> jaOrder = inputOrder(japanese.getEntries());

        // key -> raw spellings that produce it, per language
        TreeMap<String, KeySpellings> universe = new TreeMap<>();
        for (ChineseEntry e : chinese.getEntries()) {
            universe.computeIfAbsent(MatchKeys.of(e), k -> new KeySpellings()).chinese.add(e.getTraditional());
        }
        for (JapaneseEntry e : japanese.getEntries()) {
            String key = MatchKeys.of(e, mapping);
            if (key == null) {
                throw new InvariantViolationException("Japanese entry " + e.getId() + " has no spelling");
            }
            universe.computeIfAbsent(key, k -> new KeySpellings()).japanese.add(e.getPrimarySpelling());
        }
        LOGGER.info("Unifying " + universe.size() + " distinct keys from " + chinese.size()
                + " Chinese and " + japanese.size() + " Japanese entries");

        List<UnifiedEntry> out = new ArrayList<>(universe.size());
        for (Map.Entry<String, KeySpellings> slot : universe.entrySet()) {
            String key = slot.getKey();

            List<ChineseEntry> zh = new ArrayList<>();
            for (String spelling : slot.getValue().chinese) {
                for (ChineseEntry e : chinese.lookup(spelling)) {
                    if (key.equals(MatchKeys.of(e)) && !containsIdentity(zh, e)) zh.add(e);
                }
            }
            List<JapaneseEntry> ja = new ArrayList<>();
            for (String spelling : slot.getValue().japanese) {
                for (JapaneseEntry e : japanese.lookup(spelling)) {
                    if (key.equals(MatchKeys.of(e, mapping)) && !containsIdentity(ja, e)) ja.add(e);
                }
            }
            if (zh.isEmpty() && ja.isEmpty()) {
                throw new InvariantViolationException("Key '" + key + "' has no Chinese or Japanese candidates");
            }

            ChineseEntry primaryZh = zh.isEmpty() ? null : selectChinese(zh, zhOrder);
            JapaneseEntry primaryJa = ja.isEmpty() ? null : selectJapanese(ja, jaOrder);
            out.add(new UnifiedEntry(key, primaryZh, primaryJa, zh.size(), ja.size()));
        }

        assertUniqueKeys(out);
        MergeStatistics stats = MergeStatistics.compute(chinese.size(), japanese.size(), out);
        LOGGER.info("Unification finished: " + stats);
        return new UnificationResult(out, stats);
    }

    static ChineseEntry selectChinese(List<ChineseEntry> candidates, Map<ChineseEntry, Integer> order) {
        Comparator<ChineseEntry> cmp = Comparator
                .comparing((ChineseEntry e) -> !e.isCommon())
                .thenComparingInt(ChineseEntry::sourcePriority)
                .thenComparingInt(order::get);
        return candidates.stream().min(cmp).orElseThrow();
    }

    static JapaneseEntry selectJapanese(List<JapaneseEntry> candidates, Map<JapaneseEntry, Integer> order) {
        Comparator<JapaneseEntry> cmp = Comparator
                .comparing((JapaneseEntry e) -> !e.isCommon())
                .thenComparingInt(order::get);
        return candidates.stream().min(cmp).orElseThrow();
    }

    private static <T> Map<T, Integer> inputOrder(List<T> entries) {
        Map<T, Integer> order = new IdentityHashMap<>(entries.size() * 2);
        for (int i = 0; i < entries.size(); i++) {
            order.put(entries.get(i), i);
        }
        return order;
    }

    private static <T> boolean containsIdentity(List<T> list, T item) {
        for (T t : list) {
            if (t == item) return true;
        }
        return false;
    }

    private static void assertUniqueKeys(List<UnifiedEntry> entries) {
        for (int i = 1; i < entries.size(); i++) {
            if (entries.get(i - 1).getWord().compareTo(entries.get(i).getWord()) >= 0) {
                throw new InvariantViolationException("Duplicate or unordered key '" + entries.get(i).getWord() + "'");
            }
        }
    }

    private static final class KeySpellings {
        final Set<String> chinese = new LinkedHashSet<>();
        final Set<String> japanese = new LinkedHashSet<>();
    }
}
