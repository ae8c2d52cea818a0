package kiokundict;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.DataFormatException;

/**
 * Read side of the artifact directory: resolves a word to its file and inflates it.
 * <p>
 * Lookup checks the unsharded root first and then the word's shard directory
 * ({@code output_<shard>}), so it works both before and after the shard copy pass.
 */
public class ArtifactStore {
    /**
     * Name of the completion marker written at the end of a successful build.
     */
    public static final String COMPLETION_MARKER = ".build-complete";

    private final Path root;
    private final String suffix;

    public ArtifactStore(Path root, String suffix) {
        this.root = Objects.requireNonNull(root, "root");
        this.suffix = Objects.requireNonNull(suffix, "suffix");
    }

    public Path getRoot() {
        return root;
    }

    public String getSuffix() {
        return suffix;
    }

    /**
     * @param word lookup string, already percent-decoded
     * @return the artifact path, or empty if no artifact exists for the word
     * @throws PipelineIOException if the word cannot be expressed as a file name here
     */
    public Optional<Path> resolve(String word) {
        String name = ArtifactNames.fileName(word, suffix);
        Path flat = ArtifactNames.resolve(root, name);
        if (Files.isRegularFile(flat)) return Optional.of(flat);
        Path sharded = ArtifactNames.resolve(root.resolve(Sharder.shardFor(word).directoryName()), name);
        if (Files.isRegularFile(sharded)) return Optional.of(sharded);
        return Optional.empty();
    }

    /**
     * @param word lookup string
     * @return the decompressed JSON text, or empty when absent
     * @throws PipelineIOException if the file exists but cannot be read or inflated
     */
    public Optional<String> lookup(String word) {
        Optional<Path> path = resolve(word);
        if (path.isEmpty()) return Optional.empty();
        return Optional.of(new String(readInflated(path.get()), StandardCharsets.UTF_8));
    }

    /**
     * @param word lookup string
     * @return the parsed entry, or empty when absent
     */
    public Optional<UnifiedEntry> read(String word) {
        Optional<Path> path = resolve(word);
        if (path.isEmpty()) return Optional.empty();
        try {
            return Optional.of(ArtifactCodec.parse(readInflated(path.get())));
        } catch (IOException e) {
            throw new PipelineIOException("parse artifact", path.get(), e);
        }
    }

    /**
     * @return artifact files directly under {@code dir}, sorted by filename
     */
    public List<Path> listArtifacts(Path dir) {
        if (!Files.isDirectory(dir)) return List.of();
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> !p.getFileName().toString().equals(COMPLETION_MARKER))
                    .filter(p -> ArtifactNames.stem(p.getFileName().toString(), suffix) != null)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new PipelineIOException("list artifacts in", dir, e);
        }
    }

    /**
     * @return artifact files in the unsharded root, sorted by filename
     */
    public List<Path> listArtifacts() {
        return listArtifacts(root);
    }

    static byte[] readInflated(Path path) {
        try {
            return ArtifactCodec.inflate(Files.readAllBytes(path));
        } catch (IOException e) {
            throw new PipelineIOException("read artifact", path, e);
        } catch (DataFormatException e) {
            throw new PipelineIOException("inflate artifact", path, new IOException(e.getMessage(), e));
        }
    }
}
