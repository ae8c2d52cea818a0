package kiokundict;

import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DictionaryConversionOracleTest {

    private static final DictionaryConversionOracle ORACLE = DictionaryConversionOracle.fromDicts("fixtures/dicts");

    @Test
    void parse_shouldSkipCommentsAndUseFirstTarget() throws Exception {
        String text = "\uFEFF# header\n// note\n\n気\t氣 気\n国家\t國家\nbroken line\n";

        ConversionTable table = ConversionTable.parse(new BufferedReader(new StringReader(text)), "test");

        assertEquals(2, table.size());
        assertEquals("氣", table.get("気"));
        assertEquals("國家", table.get("国家"));
        assertNull(table.get("broken line"));
        assertEquals(1, table.getMinLength());
        assertEquals(2, table.getMaxLength());
    }

    @Test
    void parse_shouldKeepAlternativeTargetsInListedOrder() throws Exception {
        String text = "気\t氣 気\n国\t國\n";

        ConversionTable table = ConversionTable.parse(new BufferedReader(new StringReader(text)), "test");

        assertEquals(List.of("氣", "気"), table.candidates("気"));
        assertEquals(List.of("國"), table.candidates("国"));
        assertTrue(table.candidates("猫").isEmpty());
        assertEquals(1, table.ambiguousKeyCount());
    }

    @Test
    void parse_shouldLetLaterDefinitionWinAndCountRejectedLines() throws Exception {
        String text = "黒\t黑\n\t空鍵\n無値\t  \nno tab here\n黒\t黒 黑\n";

        ConversionTable table = ConversionTable.parse(new BufferedReader(new StringReader(text)), "jp2t.txt");

        assertEquals(1, table.size());
        assertEquals("黒", table.get("黒"));
        assertEquals(List.of("黒", "黑"), table.candidates("黒"));
        assertEquals(3, table.getRejectedLines());
        assertEquals("jp2t.txt", table.getOrigin());
    }

    @Test
    void parse_shouldStripByteOrderMarkFromFirstKey() throws Exception {
        ConversionTable table = ConversionTable.parse(
                new BufferedReader(new StringReader("\uFEFF学\t學\n")), "test");

        assertEquals("學", table.get("学"));
    }

    @Test
    void fromDicts_shouldFallBackToClasspath() {
        assertEquals("學生", ORACLE.convert("学生"));
    }

    @Test
    void convert_shouldPreferLongestPhraseMatch() {
        assertEquals("一攫千金", ORACLE.convert("一獲千金"));
        assertEquals("穫", ORACLE.convert("獲"));
    }

    @Test
    void convert_shouldKeepUnmappedTextAndSurrogatePairs() {
        assertEquals("叱る", ORACLE.convert("𠮟る"));
        assertEquals("𠀀がくせい", ORACLE.convert("𠀀がくせい"));
        assertEquals("", ORACLE.convert(""));
    }

    @Test
    void convertBatch_shouldReturnOneLinePerInput() {
        assertEquals(List.of("國會", "黑", "猫"), ORACLE.convertBatch(List.of("国会", "黒", "猫")));
    }

    @Test
    void fromDicts_shouldFailForMissingDirectory() {
        assertThrows(PipelineIOException.class, () -> DictionaryConversionOracle.fromDicts("no/such/dicts"));
    }
}
