package kiokundict;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UnifierTest {

    private static final CharacterMapping MAPPING = CharacterMapping.of(Map.of("学生", "學生"));

    private static UnificationResult unify(CharacterMapping mapping, List<ChineseEntry> zh, List<JapaneseEntry> ja) {
        return new Unifier(mapping).unify(new ChineseCorpusLoader().fromEntries(zh),
                new JapaneseCorpusLoader().fromEntries(ja));
    }

    private static UnifiedEntry only(UnificationResult result, String word) {
        return result.getEntries().stream().filter(e -> e.getWord().equals(word)).findFirst().orElseThrow();
    }

    @Test
    void unify_shouldMergeSimplifiedChineseAndShinjitaiThroughMapping() {
        UnificationResult result = unify(MAPPING,
                List.of(Fixtures.chinese("学生", "學生", "student")),
                List.of(Fixtures.kanjiWord("1", "学生", "がくせい", true, "student")));

        assertEquals(1, result.getEntries().size());
        UnifiedEntry e = result.getEntries().get(0);
        assertEquals("學生", e.getWord());
        assertTrue(e.getMetadata().isUnified());
        assertEquals(1, e.getMetadata().getChineseCount());
        assertEquals(1, e.getMetadata().getJapaneseCount());
        assertEquals(UnifiedMetadata.KeySource.CHINESE, e.getMetadata().getKeySource());
    }

    @Test
    void unify_shouldKeyKanaOnlyWordByItsReading() {
        UnificationResult result = unify(MAPPING, List.of(),
                List.of(Fixtures.kanaWord("2", "がくせい", "student")));

        UnifiedEntry e = only(result, "がくせい");
        assertNull(e.getChineseEntry());
        assertFalse(e.isUnified());
        assertEquals(0, e.getMetadata().getChineseCount());
        assertEquals(UnifiedMetadata.KeySource.JAPANESE, e.getMetadata().getKeySource());
    }

    @Test
    void unify_shouldFallBackToRawKanjiWhenUnmapped() {
        UnificationResult result = unify(CharacterMapping.empty(),
                List.of(Fixtures.chinese("学生", "學生", "student")),
                List.of(Fixtures.kanjiWord("1", "学生", "がくせい", true, "student")));

        assertEquals(List.of("学生", "學生"),
                result.getEntries().stream().map(UnifiedEntry::getWord).collect(Collectors.toList()));
        assertTrue(result.getEntries().stream().noneMatch(UnifiedEntry::isUnified));
    }

    @Test
    void unify_shouldNotMatchThroughNonPrimaryKanji() {
        JapaneseEntry word = new JapaneseEntry("3",
                List.of(new JapaneseEntry.Spelling("学生", true), new JapaneseEntry.Spelling("學生", false)),
                List.of(new JapaneseEntry.Spelling("がくせい", true)), List.of());
        UnificationResult result = unify(CharacterMapping.empty(), List.of(Fixtures.chinese("学生", "學生", "x")),
                List.of(word));

        assertFalse(only(result, "學生").isUnified());
        assertSame(word, only(result, "学生").getJapaneseEntry());
    }

    @Test
    void unify_shouldPreferCommonChineseEntryThenSourcePriorityThenInputOrder() {
        ChineseEntry plain = Fixtures.chinese("行", "行", "row");
        ChineseEntry unicode = new ChineseEntry("行", "行", "walk", List.of(new ChineseEntry.Item(
                ChineseEntry.Source.UNICODE, "xíng", ChineseEntry.SimpTrad.BOTH, List.of("walk"))),
                ChineseEntry.Statistics.ofHskLevel(2));
        ChineseEntry cedict = new ChineseEntry("行", "行", "capable", List.of(new ChineseEntry.Item(
                ChineseEntry.Source.CEDICT, "xíng", ChineseEntry.SimpTrad.BOTH, List.of("capable"))),
                ChineseEntry.Statistics.ofHskLevel(3));

        UnifiedEntry e = only(unify(MAPPING, List.of(plain, unicode, cedict), List.of()), "行");

        assertSame(cedict, e.getChineseEntry());
        assertEquals(3, e.getMetadata().getChineseCount());
    }

    @Test
    void unify_shouldBreakTiesByInputOrder() {
        ChineseEntry first = Fixtures.chinese("会", "會", "meeting");
        ChineseEntry second = Fixtures.chinese("会", "會", "can");
        JapaneseEntry jaFirst = Fixtures.kanjiWord("10", "会", "かい", true, "meeting");
        JapaneseEntry jaSecond = Fixtures.kanjiWord("11", "会", "え", true, "understanding");

        UnifiedEntry e = only(unify(CharacterMapping.of(Map.of("会", "會")),
                List.of(first, second), List.of(jaFirst, jaSecond)), "會");

        assertSame(first, e.getChineseEntry());
        assertSame(jaFirst, e.getJapaneseEntry());
        assertEquals(2, e.getMetadata().getJapaneseCount());
    }

    @Test
    void unify_shouldPreferJapaneseEntryWithCommonSpelling() {
        JapaneseEntry rare = Fixtures.kanjiWord("20", "生", "なま", false, "raw");
        JapaneseEntry common = Fixtures.kanjiWord("21", "生", "せい", true, "life");

        UnifiedEntry e = only(unify(CharacterMapping.empty(), List.of(), List.of(rare, common)), "生");

        assertSame(common, e.getJapaneseEntry());
        assertEquals(2, e.getMetadata().getJapaneseCount());
    }

    @Test
    void unify_shouldProduceSortedUniqueKeysWithConsistentFlagsOnFixtures() {
        UnificationResult result = new Unifier(CharacterMapping.fromJson(Fixtures.path("mapping.json"))).unify(
                new ChineseCorpusLoader().load(Fixtures.path("chinese.jsonl")),
                new JapaneseCorpusLoader().load(Fixtures.path("jmdict.json")));

        List<String> words = result.getEntries().stream().map(UnifiedEntry::getWord).collect(Collectors.toList());
        assertEquals(List.of("T恤", "ぴかぴか", "國家", "學生", "的", "行", "黑"), words);
        for (UnifiedEntry e : result.getEntries()) {
            assertEquals(e.getChineseEntry() != null && e.getJapaneseEntry() != null, e.getMetadata().isUnified());
        }
        assertEquals("c6", only(result, "行").getChineseEntry().getId());
        assertEquals(2, only(result, "行").getMetadata().getChineseCount());

        MergeStatistics stats = result.getStatistics();
        assertEquals(6, stats.getTotalChineseEntries());
        assertEquals(5, stats.getTotalJapaneseWords());
        assertEquals(3, stats.getUnifiedEntries());
        assertEquals(2, stats.getChineseOnlyEntries());
        assertEquals(2, stats.getJapaneseOnlyEntries());
        assertEquals(7, stats.getTotalCombinedEntries());
        assertEquals(List.of("國家", "學生", "行"), stats.getSampleUnifiedKeys());
        assertEquals(List.of("國家", "學生", "行"),
                result.unifiedOnly().stream().map(UnifiedEntry::getWord).collect(Collectors.toList()));
    }

    @Test
    void unify_shouldBeDeterministic() {
        CharacterMapping mapping = CharacterMapping.fromJson(Fixtures.path("mapping.json"));
        LoadedCorpus<ChineseEntry> zh = new ChineseCorpusLoader().load(Fixtures.path("chinese.jsonl"));
        LoadedCorpus<JapaneseEntry> ja = new JapaneseCorpusLoader().load(Fixtures.path("jmdict.json"));

        assertEquals(new Unifier(mapping).unify(zh, ja).getEntries(), new Unifier(mapping).unify(zh, ja).getEntries());
    }

    @Test
    void unifiedEntry_shouldRejectEntryWithNeitherLanguage() {
        assertThrows(InvariantViolationException.class, () -> new UnifiedEntry("空", null, null, 0, 0));
    }

    @Test
    void unifiedEntry_shouldRejectCountsInconsistentWithEntries() {
        ChineseEntry zh = Fixtures.chinese("的", "的", "of");

        assertThrows(InvariantViolationException.class, () -> new UnifiedEntry("的", zh, null, 0, 0));
        assertThrows(InvariantViolationException.class, () -> new UnifiedEntry("的", zh, null, 1, 2));
    }

    @Test
    void matchKeys_shouldNormalizeToNfc() {
        String decomposed = "cafe\u0301";
        ChineseEntry zh = Fixtures.chinese(decomposed, decomposed, "coffee");

        assertEquals("caf\u00e9", MatchKeys.of(zh));
    }
}
