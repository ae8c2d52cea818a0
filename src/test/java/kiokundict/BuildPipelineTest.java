package kiokundict;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BuildPipelineTest {

    @TempDir
    Path tmp;

    @Test
    void run_shouldBuildArtifactsIndexAndMarker() throws Exception {
        BuildConfig config = Fixtures.config(tmp);
        List<String> stages = new ArrayList<>();

        BuildReport report = new BuildPipeline(config)
                .setListener(new PipelineListener() {
                    @Override
                    public void stageStarted(String stage) {
                        stages.add(stage);
                    }
                })
                .run();

        assertEquals(List.of("mapping", "load", "unify", "emit", "verify"), stages);
        assertEquals(7, report.getStatistics().getTotalCombinedEntries());
        assertEquals(3, report.getStatistics().getUnifiedEntries());
        assertEquals(7, report.getArtifacts().getFileCount());
        assertEquals(7, report.getVerifiedArtifacts());
        assertEquals(14, report.getSearchIndexRows());
        assertEquals(4, report.getMalformedRecords());
        assertEquals(Map.of(Shard.NON_HAN, 1, Shard.HAN_1CHAR, 4, Shard.HAN_2CHAR, 2, Shard.HAN_3PLUS, 0),
                report.getShardCounts());

        Path out = config.outputDirPath();
        assertTrue(Files.exists(out.resolve(ArtifactStore.COMPLETION_MARKER)));
        assertTrue(BuildPipeline.isComplete(out, ".json"));
        assertEquals(report.getMarker(), CompletionMarker.read(out));

        List<String> csv = Files.readAllLines(config.searchIndexPath(), StandardCharsets.UTF_8);
        assertEquals("word,language,definition,pronunciation,is_common", csv.get(0));
        assertEquals(15, csv.size());

        Optional<UnifiedEntry> student = new ArtifactStore(out, ".json").read("學生");
        assertTrue(student.isPresent());
        assertTrue(student.get().isUnified());
    }

    @Test
    void run_shouldBeDeterministicAcrossRuns() throws Exception {
        BuildConfig config = Fixtures.config(tmp);

        CompletionMarker first = new BuildPipeline(config).run().getMarker();
        byte[] index = Files.readAllBytes(config.searchIndexPath());
        CompletionMarker second = new BuildPipeline(config).run().getMarker();

        assertEquals(first, second);
        assertEquals(new String(index, StandardCharsets.UTF_8),
                Files.readString(config.searchIndexPath()));
    }

    @Test
    void run_shouldRemoveArtifactsOfPreviousRun() throws Exception {
        BuildConfig config = Fixtures.config(tmp);
        new BuildPipeline(config).run();
        Path leftover = config.outputDirPath().resolve("舊詞.json");
        Files.write(leftover, new byte[]{1, 2, 3});

        BuildReport report = new BuildPipeline(config).run();

        assertFalse(Files.exists(leftover));
        assertEquals(7, report.getMarker().getArtifacts());
    }

    @Test
    void run_shouldKeepOnlyUnifiedEntriesWhenAsked() throws Exception {
        BuildConfig config = Fixtures.config(tmp);
        config.setUnifiedOnly(true);

        BuildReport report = new BuildPipeline(config).run();

        assertEquals(3, report.getArtifacts().getFileCount());
        assertEquals(10, report.getSearchIndexRows());
        assertEquals(7, report.getStatistics().getTotalCombinedEntries());
        ArtifactStore store = new ArtifactStore(config.outputDirPath(), ".json");
        assertTrue(store.lookup("國家").isPresent());
        assertFalse(store.lookup("的").isPresent());
    }

    @Test
    void run_shouldDistributeIntoShardDirectories() throws Exception {
        BuildConfig config = Fixtures.config(tmp);
        config.setShardOutput(true);

        BuildReport report = new BuildPipeline(config).run();

        Path out = config.outputDirPath();
        assertTrue(Files.exists(out.resolve("output_han-1char").resolve("的.json")));
        assertTrue(Files.exists(out.resolve("output_han-2char").resolve("學生.json")));
        assertTrue(Files.exists(out.resolve("output_non-han").resolve("ぴかぴか.json")));
        assertEquals(report.getShardCounts(), new ShardDistributor(new ArtifactStore(out, ".json")).verify());
        assertTrue(BuildPipeline.isComplete(out, ".json"));
    }

    @Test
    void run_shouldWriteSqlIndex() throws Exception {
        BuildConfig config = Fixtures.config(tmp);
        config.setSearchIndexFormat(SearchIndexFormat.SQL);
        config.setSearchIndexFile(tmp.resolve("index/search_index.sql").toString());
        config.setSqlBatchSize(5);

        new BuildPipeline(config).run();

        String sql = Files.readString(config.searchIndexPath());
        assertEquals(3, sql.split("INSERT INTO dictionary_search ", -1).length - 1);
        assertTrue(sql.contains("'國家', 'chinese', 'nation, \"state\"'"));
    }

    @Test
    void run_shouldLeaveNoMarkerWhenACorpusIsMissing() throws Exception {
        BuildConfig config = Fixtures.config(tmp);
        new BuildPipeline(config).run();
        config.setChineseCorpus(tmp.resolve("missing.jsonl").toString());

        assertThrows(PipelineIOException.class, () -> new BuildPipeline(config).run());

        assertFalse(Files.exists(config.outputDirPath().resolve(ArtifactStore.COMPLETION_MARKER)));
        assertFalse(BuildPipeline.isComplete(config.outputDirPath(), ".json"));
    }

    @Test
    void run_shouldMatchRawSpellingsWithoutMapping() throws Exception {
        BuildConfig config = Fixtures.config(tmp);
        config.setMappingFile(tmp.resolve("no-mapping.json").toString());

        BuildReport report = new BuildPipeline(config).run();

        assertEquals(1, report.getStatistics().getUnifiedEntries());
        assertEquals(List.of("行"), report.getStatistics().getSampleUnifiedKeys());
    }

    @Test
    void isComplete_shouldDetectTamperedArtifact() throws Exception {
        BuildConfig config = Fixtures.config(tmp);
        new BuildPipeline(config).run();
        Path out = config.outputDirPath();

        Files.write(out.resolve("的.json"), new byte[]{0});

        assertFalse(BuildPipeline.isComplete(out, ".json"));
        assertFalse(BuildPipeline.isComplete(tmp.resolve("never-built"), ".json"));
    }

    @Test
    void run_shouldRejectMappingStoredAmongArtifacts() throws Exception {
        BuildConfig config = Fixtures.config(tmp);
        Path out = config.outputDirPath();
        Files.createDirectories(out);
        Path mapping = Files.copy(config.mappingFilePath(), out.resolve("j2c_mapping.json"));
        config.setMappingFile(mapping.toString());

        PipelineIOException e = assertThrows(PipelineIOException.class, () -> new BuildPipeline(config).run());

        assertEquals(mapping, e.getPath());
        assertTrue(e.getMessage().contains("character mapping"));
        assertTrue(Files.exists(mapping));
    }

    @Test
    void inCleanupScope_shouldMatchOnlyArtifactNamedFilesInRootOrShardDirectories() {
        Path out = tmp.resolve("out");

        assertTrue(BuildPipeline.inCleanupScope(out, out.resolve("corpus.json"), ".json"));
        assertTrue(BuildPipeline.inCleanupScope(out, out.resolve("output_han-1char").resolve("m.json"), ".json"));
        assertTrue(BuildPipeline.inCleanupScope(out, tmp.resolve("out/./x/../corpus.json"), ".json"));
        assertFalse(BuildPipeline.inCleanupScope(out, out.resolve("corpus.jsonl"), ".json"));
        assertFalse(BuildPipeline.inCleanupScope(out, out.resolve("sub").resolve("corpus.json"), ".json"));
        assertFalse(BuildPipeline.inCleanupScope(out, tmp.resolve("mapping.json"), ".json"));
    }

    @Test
    void run_shouldRemoveShardDirectoriesWhenRebuildingFlat() throws Exception {
        BuildConfig config = Fixtures.config(tmp);
        config.setShardOutput(true);
        new BuildPipeline(config).run();
        Path out = config.outputDirPath();
        assertTrue(Files.isDirectory(out.resolve("output_han-1char")));

        config.setShardOutput(false);
        config.setUnifiedOnly(true);
        BuildReport report = new BuildPipeline(config).run();

        for (Shard shard : Shard.values()) {
            assertFalse(Files.exists(out.resolve(shard.directoryName())), shard.directoryName());
        }
        ArtifactStore store = new ArtifactStore(out, ".json");
        assertFalse(store.lookup("的").isPresent());
        assertTrue(store.lookup("國家").isPresent());
        assertEquals(3, report.getMarker().getArtifacts());
        assertNull(new OutputVerifier(store).verify(100));
    }

    @Test
    void run_shouldKeepShardDirectoryHoldingForeignFiles() throws Exception {
        BuildConfig config = Fixtures.config(tmp);
        config.setShardOutput(true);
        new BuildPipeline(config).run();
        Path notes = config.outputDirPath().resolve("output_han-1char").resolve("notes.txt");
        Files.writeString(notes, "keep me");

        config.setShardOutput(false);
        new BuildPipeline(config).run();

        assertTrue(Files.exists(notes));
        assertFalse(Files.exists(notes.resolveSibling("的.json")));
        assertTrue(BuildPipeline.isComplete(config.outputDirPath(), ".json"));
    }
}
