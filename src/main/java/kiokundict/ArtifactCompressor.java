package kiokundict;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.IntConsumer;
import java.util.logging.Logger;
import java.util.zip.DataFormatException;

/**
 * Writes one raw-deflate compressed file per {@link UnifiedEntry} into an output directory.
 */
public class ArtifactCompressor {
    private static final Logger LOGGER = Logger.getLogger(ArtifactCompressor.class.getName());

    private final Path outputDir;
    private final String suffix;
    private final int level;

    /**
     * @param outputDir directory that receives the artifacts; created if missing
     * @param suffix    filename suffix, e.g. {@code .json}
     * @param level     deflate level 0-9
     */
    public ArtifactCompressor(Path outputDir, String suffix, int level) {
        if (level < 0 || level > 9) {
            throw new IllegalArgumentException("Compression level must be 0-9: " + level);
        }
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
        this.suffix = Objects.requireNonNull(suffix, "suffix");
        this.level = level;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public String getSuffix() {
        return suffix;
    }

    /**
     * Resolves every filename first and fails if two words share one, so a collision never
     * leaves a half-written directory behind.
     *
     * @throws InvariantViolationException on a filename collision
     * @throws PipelineIOException         if a filename cannot be represented on this platform
     */
    public Map<String, String> assignFileNames(List<UnifiedEntry> entries) {
        Map<String, String> byFile = new HashMap<>();
        for (UnifiedEntry e : entries) {
            String name = ArtifactNames.fileName(e.getWord(), suffix);
            ArtifactNames.resolve(outputDir, name);
            String previous = byFile.putIfAbsent(name, e.getWord());
            if (previous != null) {
                throw new InvariantViolationException("Words '" + previous + "' and '" + e.getWord()
                        + "' both map to artifact file " + name);
            }
        }
        return byFile;
    }

    /**
     * Compresses and writes all entries in parallel. Existing files with the same name are
     * overwritten.
     *
     * @param entries  entries to write
     * @param progress called with the number of files written so far; may be {@code null}
     * @return counts and sizes
     * @throws PipelineIOException if the directory or a file cannot be written
     */
    public ArtifactWriteReport writeAll(List<UnifiedEntry> entries, IntConsumer progress) {
        assignFileNames(entries);
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new PipelineIOException("create output directory", outputDir, e);
        }

        AtomicInteger written = new AtomicInteger();
        AtomicLong rawBytes = new AtomicLong();
        AtomicLong compressedBytes = new AtomicLong();
        entries.parallelStream().forEach(entry -> {
            byte[] json = ArtifactCodec.serialize(entry);
            byte[] packed = ArtifactCodec.deflate(json, level);
            Path target = ArtifactNames.resolve(outputDir, ArtifactNames.fileName(entry.getWord(), suffix));
            try {
                Files.write(target, packed);
            } catch (IOException e) {
                throw new PipelineIOException("write artifact", target, e);
            }
            rawBytes.addAndGet(json.length);
            compressedBytes.addAndGet(packed.length);
            int n = written.incrementAndGet();
            if (progress != null) progress.accept(n);
        });

        ArtifactWriteReport report = new ArtifactWriteReport(written.get(), rawBytes.get(), compressedBytes.get());
        LOGGER.info("Wrote " + report + " to " + outputDir);
        return report;
    }

    /**
     * Reads back an evenly spaced sample of written artifacts and checks that each inflates
     * and parses to the entry that produced it.
     *
     * @param entries    the entries that were written, in build order
     * @param sampleSize maximum number of entries to check
     * @return number of entries checked
     * @throws InvariantViolationException on any mismatch or undecodable artifact
     */
    public int verifySample(List<UnifiedEntry> entries, int sampleSize) {
        List<UnifiedEntry> sample = sample(entries, sampleSize);
        for (UnifiedEntry expected : sample) {
            Path file = ArtifactNames.resolve(outputDir, ArtifactNames.fileName(expected.getWord(), suffix));
            UnifiedEntry actual;
            try {
                actual = ArtifactCodec.decode(Files.readAllBytes(file));
            } catch (IOException | DataFormatException e) {
                throw new InvariantViolationException("Round-trip failed for " + file + ": " + e.getMessage());
            }
            if (!expected.equals(actual)) {
                throw new InvariantViolationException("Round-trip mismatch for " + file
                        + ": expected " + expected + " but read " + actual);
            }
        }
        LOGGER.info("Round-trip verified " + sample.size() + " artifacts");
        return sample.size();
    }

    static <T> List<T> sample(List<T> items, int sampleSize) {
        if (sampleSize <= 0 || items.isEmpty()) return new ArrayList<>();
        if (items.size() <= sampleSize) return new ArrayList<>(items);
        List<T> out = new ArrayList<>(sampleSize);
        double step = (double) items.size() / sampleSize;
        for (int i = 0; i < sampleSize; i++) {
            out.add(items.get((int) (i * step)));
        }
        return out;
    }
}
