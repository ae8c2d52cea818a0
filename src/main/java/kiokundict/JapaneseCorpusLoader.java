package kiokundict;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Loads the JMdict corpus ({@code {"words": [...]}} document or JSON Lines). Every entry is
 * indexed under each of its kanji and kana spellings.
 */
public class JapaneseCorpusLoader extends CorpusLoader<JapaneseEntry> {

    @Override
    protected Class<JapaneseEntry> entryType() {
        return JapaneseEntry.class;
    }

    @Override
    protected String documentArrayField() {
        return "words";
    }

    @Override
    protected Collection<String> spellings(JapaneseEntry entry) {
        List<String> out = new ArrayList<>(entry.getKanji().size() + entry.getKana().size());
        for (JapaneseEntry.Spelling k : entry.getKanji()) {
            out.add(k.getText());
        }
        for (JapaneseEntry.Spelling k : entry.getKana()) {
            out.add(k.getText());
        }
        return out;
    }

    @Override
    protected String validate(JapaneseEntry entry) {
        String primary = entry.getPrimarySpelling();
        if (primary == null || primary.isEmpty()) return "word " + entry.getId() + " has neither kanji nor kana";
        return null;
    }
}
