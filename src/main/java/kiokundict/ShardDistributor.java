package kiokundict;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Copies artifacts from the output root into the four {@code output_<shard>} directories.
 *
 * <p>Files are copied, never moved: the unsharded set stays in place for verification.
 * Shard directories are emptied of artifacts before copying so that re-runs reproduce the
 * same layout.</p>
 */
public class ShardDistributor {
    private static final Logger LOGGER = Logger.getLogger(ShardDistributor.class.getName());

    private final ArtifactStore store;

    public ShardDistributor(ArtifactStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Copies every artifact to its shard directory and verifies the result.
     *
     * @return files per shard
     * @throws PipelineIOException         if copying fails
     * @throws InvariantViolationException if verification fails
     */
    public Map<Shard, Integer> distribute() {
        Path root = store.getRoot();
        List<Path> artifacts = store.listArtifacts();
        Map<Shard, Integer> expected = emptyCounts();

        for (Shard shard : Shard.values()) {
            Path dir = root.resolve(shard.directoryName());
            try {
                for (Path stale : store.listArtifacts(dir)) {
                    Files.delete(stale);
                }
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new PipelineIOException("prepare shard directory", dir, e);
            }
        }

        for (Path file : artifacts) {
            Shard shard = shardOf(file);
            Path target = root.resolve(shard.directoryName()).resolve(file.getFileName().toString());
            try {
                Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                throw new PipelineIOException("copy artifact to " + shard.directoryName(), file, e);
            }
            expected.merge(shard, 1, Integer::sum);
        }
        LOGGER.info("Copied " + artifacts.size() + " artifacts into shards " + expected);

        verify(artifacts.size(), expected);
        return expected;
    }

    /**
     * Checks the shard directories against the unsharded root: every file sits in the shard
     * its name classifies to, and per-shard counts add up to the root's artifact count.
     *
     * @return files per shard as found on disk
     * @throws InvariantViolationException on any mismatch
     */
    public Map<Shard, Integer> verify() {
        return verify(store.listArtifacts().size(), null);
    }

    private Map<Shard, Integer> verify(int total, Map<Shard, Integer> expected) {
        Map<Shard, Integer> found = emptyCounts();
        for (Shard shard : Shard.values()) {
            List<Path> files = store.listArtifacts(store.getRoot().resolve(shard.directoryName()));
            for (Path file : files) {
                Shard actual = shardOf(file);
                if (actual != shard) {
                    throw new InvariantViolationException(file + " is in " + shard + " but classifies as " + actual);
                }
            }
            found.put(shard, files.size());
        }
        if (expected != null && !expected.equals(found)) {
            throw new InvariantViolationException("Shard directories hold " + found + " but " + expected + " were copied");
        }
        Sharder.verifyPartition(total, found);
        LOGGER.info("Shard verification passed: " + found);
        return found;
    }

    private Shard shardOf(Path file) {
        return Sharder.shardFor(ArtifactNames.stem(file.getFileName().toString(), store.getSuffix()));
    }

    private static Map<Shard, Integer> emptyCounts() {
        Map<Shard, Integer> counts = new EnumMap<>(Shard.class);
        for (Shard s : Shard.values()) counts.put(s, 0);
        return counts;
    }
}
