package kiokundict;

import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SharderTest {

    @Test
    void shardFor_shouldClassifyByHanCount() {
        assertEquals(Shard.HAN_1CHAR, Sharder.shardFor("的"));
        assertEquals(Shard.NON_HAN, Sharder.shardFor("abc"));
        assertEquals(Shard.HAN_2CHAR, Sharder.shardFor("学生"));
        assertEquals(Shard.HAN_3PLUS, Sharder.shardFor("図書館"));
        assertEquals(Shard.NON_HAN, Sharder.shardFor("がくせい"));
        assertEquals(Shard.NON_HAN, Sharder.shardFor(""));
    }

    @Test
    void shardFor_shouldCountOnlyHanCodePointsInMixedWords() {
        assertEquals(Shard.HAN_1CHAR, Sharder.shardFor("T恤"));
        assertEquals(Shard.HAN_2CHAR, Sharder.shardFor("食べ物"));
        assertEquals(Shard.HAN_2CHAR, Sharder.shardFor("学生です"));
    }

    @Test
    void hanCount_shouldCountSupplementaryIdeographsOnce() {
        // U+20000 (Ext B) and U+30000 (Ext G)
        assertEquals(1, Sharder.hanCount("𠀀"));
        assertEquals(2, Sharder.hanCount("𠀀𰀀"));
        assertEquals(Shard.HAN_2CHAR, Sharder.shardFor("𠀀𰀀"));
    }

    @Test
    void isHan_shouldCoverRangeBoundaries() {
        assertTrue(Sharder.isHan(0x4E00));
        assertTrue(Sharder.isHan(0x9FFF));
        assertTrue(Sharder.isHan(0x3400));
        assertTrue(Sharder.isHan(0x4DBF));
        assertTrue(Sharder.isHan(0x2EBEF));
        assertTrue(Sharder.isHan(0x3134F));
        assertFalse(Sharder.isHan(0x3400 - 1));
        assertFalse(Sharder.isHan(0x2A6E0));
        assertFalse(Sharder.isHan(0x31350));
        assertFalse(Sharder.isHan('々'));
        assertFalse(Sharder.isHan('〇'));
    }

    @Test
    void shardFor_shouldBePure() {
        for (int i = 0; i < 3; i++) {
            assertEquals(Shard.HAN_2CHAR, Sharder.shardFor("國家"));
        }
    }

    @Test
    void countByShard_shouldPartitionEveryWord() {
        Map<Shard, Integer> counts = Sharder.countByShard(List.of("的", "abc", "学生", "國家", "図書館", "ぴかぴか"));

        assertEquals(2, counts.get(Shard.NON_HAN));
        assertEquals(1, counts.get(Shard.HAN_1CHAR));
        assertEquals(2, counts.get(Shard.HAN_2CHAR));
        assertEquals(1, counts.get(Shard.HAN_3PLUS));
    }

    @Test
    void verifyPartition_shouldRejectMismatchedTotals() {
        Map<Shard, Integer> counts = new EnumMap<>(Shard.class);
        counts.put(Shard.NON_HAN, 3);
        counts.put(Shard.HAN_1CHAR, 1);

        assertThrows(InvariantViolationException.class, () -> Sharder.verifyPartition(5, counts));
    }

    @Test
    void shard_shouldExposeLabelsAndDirectoryNames() {
        assertEquals("output_han-3plus", Shard.HAN_3PLUS.directoryName());
        assertEquals(Shard.NON_HAN, Shard.fromLabel("non-han"));
        assertThrows(IllegalArgumentException.class, () -> Shard.fromLabel("han-4char"));
    }
}
