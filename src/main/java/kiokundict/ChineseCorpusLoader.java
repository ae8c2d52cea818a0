package kiokundict;

import java.util.Arrays;
import java.util.Collection;

/**
 * Loads the Chinese corpus. Every entry is indexed under both its simplified and its
 * traditional form.
 */
public class ChineseCorpusLoader extends CorpusLoader<ChineseEntry> {

    @Override
    protected Class<ChineseEntry> entryType() {
        return ChineseEntry.class;
    }

    @Override
    protected String documentArrayField() {
        return "entries";
    }

    @Override
    protected Collection<String> spellings(ChineseEntry entry) {
        return Arrays.asList(entry.getSimplified(), entry.getTraditional());
    }

    @Override
    protected String validate(ChineseEntry entry) {
        if (entry.getTraditional().isEmpty()) return "empty traditional form";
        return null;
    }
}
