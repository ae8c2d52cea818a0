package kiokundict;

import java.util.ArrayList;
import java.util.List;

/**
 * Projects unified entries into flat {@link SearchIndexRow}s.
 *
 * <ul>
 *   <li>Chinese: one row per definition of each item, pronunciation = the item's pinyin,
 *       never common: the Chinese corpus has no per-spelling common flag.</li>
 *   <li>Japanese: one row per gloss of each sense, pronunciation = the first kana,
 *       common iff any kanji or kana spelling is flagged common.</li>
 * </ul>
 */
public final class SearchIndexFlattener {

    private SearchIndexFlattener() {
    }

    public static List<SearchIndexRow> flatten(UnifiedEntry entry) {
        List<SearchIndexRow> rows = new ArrayList<>();
        String word = entry.getWord();

        ChineseEntry zh = entry.getChineseEntry();
        if (zh != null) {
            for (ChineseEntry.Item item : zh.getItems()) {
                for (String definition : item.getDefinitions()) {
                    rows.add(new SearchIndexRow(word, SearchIndexRow.Language.CHINESE, definition,
                            item.getPinyin(), false));
                }
            }
        }

        JapaneseEntry ja = entry.getJapaneseEntry();
        if (ja != null) {
            boolean common = ja.isCommon();
            String reading = ja.getPrimaryReading();
            for (JapaneseEntry.Sense sense : ja.getSense()) {
                for (JapaneseEntry.Gloss gloss : sense.getGloss()) {
                    rows.add(new SearchIndexRow(word, SearchIndexRow.Language.JAPANESE, gloss.getText(),
                            reading, common));
                }
            }
        }
        return rows;
    }

    public static List<SearchIndexRow> flatten(List<UnifiedEntry> entries) {
        List<SearchIndexRow> rows = new ArrayList<>();
        for (UnifiedEntry e : entries) {
            rows.addAll(flatten(e));
        }
        return rows;
    }
}
