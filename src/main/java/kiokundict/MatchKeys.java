package kiokundict;

import java.text.Normalizer;

/**
 * Derives the cross-script matching key of a headword.
 * <p>
 * Keys are NFC-normalized; case is preserved because keys double as artifact filenames.
 */
public final class MatchKeys {

    private MatchKeys() {
    }

    /**
     * @param entry a Chinese entry
     * @return its traditional form, normalized
     */
    public static String of(ChineseEntry entry) {
        return normalize(entry.getTraditional());
    }

    /**
     * The Traditional-Chinese rendering of the entry's first kanji spelling, or the raw
     * spelling when the mapping has no entry for it. Kana-only entries are keyed by their
     * first kana.
     *
     * @param entry   a Japanese entry
     * @param mapping kanji → traditional mapping
     * @return the normalized key, or {@code null} when the entry has no spelling
     */
    public static String of(JapaneseEntry entry, CharacterMapping mapping) {
        if (!entry.getKanji().isEmpty()) {
            return normalize(mapping.render(entry.getKanji().get(0).getText()));
        }
        String primary = entry.getPrimarySpelling();
        return primary == null ? null : normalize(primary);
    }

    public static String normalize(String s) {
        return Normalizer.normalize(s, Normalizer.Form.NFC);
    }
}
