package kiokundict;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Re-checks an existing output directory without rebuilding it: completion marker, artifact
 * round-trip and, when shard directories hold artifacts, the shard partition.
 */
public class OutputVerifier {
    private static final Logger LOGGER = Logger.getLogger(OutputVerifier.class.getName());

    private final ArtifactStore store;

    public OutputVerifier(ArtifactStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * @param sampleSize number of artifacts to inflate and parse
     * @return shard counts found on disk, or {@code null} if the output is not sharded
     * @throws InvariantViolationException if any check fails
     */
    public Map<Shard, Integer> verify(int sampleSize) {
        Path root = store.getRoot();
        List<Path> files = store.listArtifacts();

        CompletionMarker marker = CompletionMarker.read(root);
        if (marker == null) {
            throw new InvariantViolationException(root + " has no " + ArtifactStore.COMPLETION_MARKER
                    + "; the build that produced it did not finish");
        }
        CompletionMarker actual = CompletionMarker.compute(files);
        if (!marker.equals(actual)) {
            throw new InvariantViolationException("Artifacts in " + root + " changed since the build: marker says "
                    + marker + ", found " + actual);
        }

        List<Path> sample = ArtifactCompressor.sample(files, sampleSize);
        for (Path file : sample) {
            UnifiedEntry entry;
            try {
                entry = ArtifactCodec.parse(ArtifactStore.readInflated(file));
            } catch (IOException | PipelineIOException e) {
                throw new InvariantViolationException("Artifact " + file + " does not decode: " + e.getMessage());
            }
            String expectedName = ArtifactNames.fileName(entry.getWord(), store.getSuffix());
            if (!expectedName.equals(file.getFileName().toString())) {
                throw new InvariantViolationException("Artifact " + file + " holds word '" + entry.getWord() + "'");
            }
        }
        LOGGER.info("Decoded " + sample.size() + " of " + files.size() + " artifacts");

        boolean sharded = false;
        for (Shard shard : Shard.values()) {
            sharded |= !store.listArtifacts(root.resolve(shard.directoryName())).isEmpty();
        }
        return sharded ? new ShardDistributor(store).verify() : null;
    }
}
