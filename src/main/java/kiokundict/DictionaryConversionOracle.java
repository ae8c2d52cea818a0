package kiokundict;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * In-process Japanese Shinjitai → Traditional Chinese converter driven by the OpenCC
 * {@code jp2t} dictionaries, for hosts without a native OpenCC installation.
 *
 * <p>Conversion is greedy longest-match-first from left to right. At each position the
 * dictionaries are consulted in priority order (phrases, characters, variant reversals)
 * and the first hit for the longest candidate wins; characters without a match are copied
 * unchanged.</p>
 */
public class DictionaryConversionOracle implements ConversionOracle {
    private static final Logger LOGGER = Logger.getLogger(DictionaryConversionOracle.class.getName());

    /**
     * The dictionary files of OpenCC's jp2t configuration, highest priority first.
     */
    public static final List<String> JP2T_FILES = Collections.unmodifiableList(Arrays.asList(
            "JPShinjitaiPhrases.txt",
            "JPShinjitaiCharacters.txt",
            "JPVariantsRev.txt"));

    private final List<ConversionTable> tables;
    private final int maxLength;

    /**
     * @param tables conversion tables, highest priority first
     */
    public DictionaryConversionOracle(List<ConversionTable> tables) {
        this.tables = Collections.unmodifiableList(new ArrayList<>(tables));
        int max = 0;
        for (ConversionTable t : tables) {
            max = Math.max(max, t.getMaxLength());
        }
        this.maxLength = max;
    }

    /**
     * Loads the jp2t dictionaries from a directory, or from the classpath under the same path.
     *
     * @param dictDir directory holding {@link #JP2T_FILES}
     * @return a ready oracle
     */
    public static DictionaryConversionOracle fromDicts(String dictDir) {
        List<ConversionTable> tables = new ArrayList<>();
        int ambiguous = 0;
        for (String file : JP2T_FILES) {
            ConversionTable table = ConversionTable.load(dictDir, file);
            ambiguous += table.ambiguousKeyCount();
            tables.add(table);
        }
        LOGGER.info("Loaded jp2t dictionaries from " + dictDir + " (" + ambiguous
                + " keys with alternative targets; the first target is used)");
        return new DictionaryConversionOracle(tables);
    }

    @Override
    public List<String> convertBatch(List<String> lines) {
        List<String> out = new ArrayList<>(lines.size());
        for (String line : lines) {
            out.add(convert(line));
        }
        return out;
    }

    /**
     * Converts one string.
     *
     * @param text Japanese text
     * @return the Traditional Chinese rendering; unmatched characters are kept
     */
    public String convert(String text) {
        int textLen = text.length();
        StringBuilder sb = new StringBuilder(textLen + (textLen >> 4));

        int i = 0;
        while (i < textLen) {
            int bestLen = 0;
            String bestMatch = null;
            int maxScanLen = Math.min(maxLength, textLen - i);

            for (int len = maxScanLen; len > 0 && bestMatch == null; len--) {
                String word = text.substring(i, i + len);
                for (ConversionTable table : tables) {
                    if (table.getMaxLength() < len || table.getMinLength() > len) continue;
                    String value = table.get(word);
                    if (value != null) {
                        bestMatch = value;
                        bestLen = len;
                        break;
                    }
                }
            }

            if (bestMatch != null) {
                sb.append(bestMatch);
                i += bestLen;
            } else {
                // keep surrogate pairs together
                int cp = text.codePointAt(i);
                sb.appendCodePoint(cp);
                i += Character.charCount(cp);
            }
        }
        return sb.toString();
    }
}
