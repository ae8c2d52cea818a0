package kiokundict;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutputVerifierTest {

    @TempDir
    Path tmp;

    private ArtifactStore build(boolean sharded) throws Exception {
        BuildConfig config = Fixtures.config(tmp);
        config.setShardOutput(sharded);
        new BuildPipeline(config).run();
        return new ArtifactStore(config.outputDirPath(), config.getArtifactSuffix());
    }

    @Test
    void verify_shouldAcceptFreshFlatOutput() throws Exception {
        ArtifactStore store = build(false);

        assertNull(new OutputVerifier(store).verify(100));
    }

    @Test
    void verify_shouldReportShardCountsForShardedOutput() throws Exception {
        ArtifactStore store = build(true);

        Map<Shard, Integer> counts = new OutputVerifier(store).verify(3);

        assertEquals(4, counts.get(Shard.HAN_1CHAR));
        assertEquals(0, counts.get(Shard.HAN_3PLUS));
    }

    @Test
    void verify_shouldRejectDirectoryWithoutMarker() throws Exception {
        ArtifactStore store = build(false);
        Files.delete(store.getRoot().resolve(ArtifactStore.COMPLETION_MARKER));

        InvariantViolationException ex = assertThrows(InvariantViolationException.class,
                () -> new OutputVerifier(store).verify(10));
        assertTrue(ex.getMessage().contains(ArtifactStore.COMPLETION_MARKER));
    }

    @Test
    void verify_shouldRejectAddedArtifact() throws Exception {
        ArtifactStore store = build(false);
        Files.copy(store.getRoot().resolve("的.json"), store.getRoot().resolve("的的.json"));

        assertThrows(InvariantViolationException.class, () -> new OutputVerifier(store).verify(10));
    }

    @Test
    void verify_shouldRejectRenamedArtifactEvenWhenMarkerIsRewritten() throws Exception {
        ArtifactStore store = build(false);
        Path root = store.getRoot();
        Files.move(root.resolve("黑.json"), root.resolve("黒.json"));
        CompletionMarker.compute(store.listArtifacts()).write(root);

        InvariantViolationException ex = assertThrows(InvariantViolationException.class,
                () -> new OutputVerifier(store).verify(100));
        assertTrue(ex.getMessage().contains("黑"));
    }

    @Test
    void verify_shouldRejectMisplacedShardFile() throws Exception {
        ArtifactStore store = build(true);
        Path root = store.getRoot();
        Files.move(root.resolve("output_han-1char/的.json"), root.resolve("output_han-3plus/的.json"));

        assertThrows(InvariantViolationException.class, () -> new OutputVerifier(store).verify(0));
    }
}
