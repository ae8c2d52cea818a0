package kiokundict;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CorpusLoaderTest {

    @TempDir
    Path tmp;

    @Test
    void chineseLoader_shouldSkipMalformedLinesAndKeepTheRest() {
        LoadedCorpus<ChineseEntry> corpus = new ChineseCorpusLoader().load(Fixtures.path("chinese.jsonl"));

        assertEquals(6, corpus.size());
        assertEquals(2, corpus.getMalformedCount());
        assertEquals("學生", corpus.getEntries().get(0).getTraditional());
        assertEquals("T恤", corpus.getEntries().get(5).getTraditional());
    }

    @Test
    void chineseLoader_shouldIndexSimplifiedAndTraditionalForms() {
        LoadedCorpus<ChineseEntry> corpus = new ChineseCorpusLoader().load(Fixtures.path("chinese.jsonl"));

        ChineseEntry student = corpus.lookup("学生").get(0);
        assertSame(student, corpus.lookup("學生").get(0));
        assertEquals(1, corpus.lookup("学生").size());
        assertTrue(corpus.lookup("学").isEmpty());
    }

    @Test
    void chineseLoader_shouldKeepHomographsInInsertionOrder() {
        LoadedCorpus<ChineseEntry> corpus = new ChineseCorpusLoader().load(Fixtures.path("chinese.jsonl"));

        List<ChineseEntry> row = corpus.lookup("行");
        assertEquals(2, row.size());
        assertEquals("c5", row.get(0).getId());
        assertEquals("c6", row.get(1).getId());
    }

    @Test
    void chineseLoader_shouldParseNestedItemsAndStatistics() {
        ChineseEntry student = new ChineseCorpusLoader().load(Fixtures.path("chinese.jsonl")).lookup("學生").get(0);

        assertEquals(ChineseEntry.Source.CEDICT, student.getItems().get(0).getSource());
        assertEquals(ChineseEntry.SimpTrad.BOTH, student.getItems().get(0).getSimpTrad());
        assertEquals(List.of("student", "schoolchild"), student.getItems().get(0).getDefinitions());
        assertEquals(Integer.valueOf(1), student.getStatistics().getHskLevel());
        assertTrue(student.isCommon());
    }

    @Test
    void japaneseLoader_shouldReadWordsDocumentAndSkipBadRecords() {
        LoadedCorpus<JapaneseEntry> corpus = new JapaneseCorpusLoader().load(Fixtures.path("jmdict.json"));

        assertEquals(5, corpus.size());
        assertEquals(2, corpus.getMalformedCount());
        assertEquals("1206900", corpus.getEntries().get(0).getId());
    }

    @Test
    void japaneseLoader_shouldIndexEveryKanjiAndKanaSpelling() {
        LoadedCorpus<JapaneseEntry> corpus = new JapaneseCorpusLoader().load(Fixtures.path("jmdict.json"));

        assertSame(corpus.lookup("学生").get(0), corpus.lookup("がくせい").get(0));
        assertEquals("2000001", corpus.lookup("ぴかぴか").get(0).getId());
        assertEquals("1579110", corpus.lookup("ぎょう").get(0).getId());
    }

    @Test
    void japaneseLoader_shouldReadJsonLines() throws Exception {
        String lines = "{\"id\":\"1\",\"kanji\":[{\"text\":\"学生\",\"common\":true}],\"kana\":[{\"text\":\"がくせい\"}]}\n"
                + "not json\n"
                + "{\"id\":\"2\",\"kanji\":[],\"kana\":[{\"text\":\"がくせい\"}]}\n";

        LoadedCorpus<JapaneseEntry> corpus = new JapaneseCorpusLoader()
                .loadLines(new BufferedReader(new StringReader(lines)), null);

        assertEquals(2, corpus.size());
        assertEquals(1, corpus.getMalformedCount());
        assertEquals(2, corpus.lookup("がくせい").size());
        assertEquals("1", corpus.lookup("がくせい").get(0).getId());
    }

    @Test
    void japaneseLoader_shouldAcceptTopLevelArray() throws Exception {
        Path doc = tmp.resolve("words.json");
        Files.writeString(doc, "[{\"id\":\"1\",\"kana\":[{\"text\":\"ぴかぴか\"}]}, {\"kanji\":[]}]");

        LoadedCorpus<JapaneseEntry> corpus = new JapaneseCorpusLoader().load(doc);

        assertEquals(1, corpus.size());
        assertEquals(1, corpus.getMalformedCount());
    }

    @Test
    void load_shouldCountEveryMalformedRecordPastLoggingLimit() throws Exception {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < CorpusLoader.MAX_LOGGED_MALFORMED + 5; i++) sb.append("{broken\n");
        sb.append("{\"simp\":\"的\",\"trad\":\"的\"}\n");
        Path file = tmp.resolve("noisy.jsonl");
        Files.writeString(file, sb.toString());

        LoadedCorpus<ChineseEntry> corpus = new ChineseCorpusLoader().load(file);

        assertEquals(1, corpus.size());
        assertEquals(CorpusLoader.MAX_LOGGED_MALFORMED + 5, corpus.getMalformedCount());
    }

    @Test
    void load_shouldSkipLineWithInvalidUtf8AndKeepItsNeighbours() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        bytes.write("{\"simp\":\"学生\",\"trad\":\"學生\"}\n".getBytes(StandardCharsets.UTF_8));
        bytes.write("{\"simp\":\"".getBytes(StandardCharsets.UTF_8));
        bytes.write(new byte[]{(byte) 0xC3, 0x28});
        bytes.write("\",\"trad\":\"x\"}\r\n".getBytes(StandardCharsets.UTF_8));
        bytes.write("{\"simp\":\"的\",\"trad\":\"的\"}".getBytes(StandardCharsets.UTF_8));
        Path file = tmp.resolve("zh.jsonl");
        Files.write(file, bytes.toByteArray());

        LoadedCorpus<ChineseEntry> corpus = new ChineseCorpusLoader().load(file);

        assertEquals(2, corpus.size());
        assertEquals(1, corpus.getMalformedCount());
        assertEquals(1, corpus.lookup("學生").size());
        assertEquals(1, corpus.lookup("的").size());
    }

    @Test
    void chineseLoader_shouldRejectRecordWithNullDefinition() throws Exception {
        String lines = "{\"simp\":\"学生\",\"trad\":\"學生\",\"items\":[{\"pinyin\":\"xué sheng\","
                + "\"definitions\":[\"student\",null]}]}\n"
                + "{\"simp\":\"的\",\"trad\":\"的\",\"items\":[{\"definitions\":[\"of\"]}]}\n";

        LoadedCorpus<ChineseEntry> corpus = new ChineseCorpusLoader()
                .loadLines(new BufferedReader(new StringReader(lines)), null);

        assertEquals(1, corpus.size());
        assertEquals(1, corpus.getMalformedCount());
        assertTrue(corpus.lookup("學生").isEmpty());
    }

    @Test
    void japaneseLoader_shouldRejectWordWithNullGloss() throws Exception {
        Path doc = tmp.resolve("jmdict.json");
        Files.writeString(doc, "{\"words\": ["
                + "{\"id\":\"1\",\"kanji\":[{\"text\":\"学生\"}],\"sense\":[{\"gloss\":[{\"text\":\"student\"},null]}]},"
                + "{\"id\":\"2\",\"kana\":[{\"text\":\"ぴかぴか\"}],\"sense\":[{\"gloss\":[{\"text\":\"glittering\"}]}]}"
                + "]}");

        LoadedCorpus<JapaneseEntry> corpus = new JapaneseCorpusLoader().load(doc);

        assertEquals(1, corpus.size());
        assertEquals(1, corpus.getMalformedCount());
        assertEquals(1, SearchIndexFlattener.flatten(
                new UnifiedEntry("ぴかぴか", null, corpus.getEntries().get(0), 0, 1)).size());
    }

    @Test
    void load_shouldFailWithPathForMissingFile() {
        Path missing = tmp.resolve("absent.jsonl");

        PipelineIOException e = assertThrows(PipelineIOException.class, () -> new ChineseCorpusLoader().load(missing));
        assertEquals(missing, e.getPath());
    }

    @Test
    void load_shouldFailForDocumentThatIsNotJson() throws Exception {
        Path doc = tmp.resolve("broken.json");
        Files.writeString(doc, "{\"words\": [ {\"id\": ");

        assertThrows(PipelineIOException.class, () -> new JapaneseCorpusLoader().load(doc));
    }
}
