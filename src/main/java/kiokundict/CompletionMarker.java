package kiokundict;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/**
 * Contents of the {@code .build-complete} file: the artifact count and a SHA-256 digest
 * over every artifact's filename and compressed bytes, in filename order.
 * <p>
 * An output directory without this file, or whose artifacts no longer match it, is the
 * leftover of a failed or interrupted run.
 */
@JsonPropertyOrder({"artifacts", "sha256"})
public final class CompletionMarker {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final int artifacts;
    private final String sha256;

    @JsonCreator
    public CompletionMarker(@JsonProperty("artifacts") int artifacts,
                            @JsonProperty("sha256") String sha256) {
        this.artifacts = artifacts;
        this.sha256 = Objects.requireNonNull(sha256, "sha256");
    }

    public int getArtifacts() {
        return artifacts;
    }

    public String getSha256() {
        return sha256;
    }

    /**
     * Digests the given artifact files.
     *
     * @param files artifacts, already sorted by filename
     */
    public static CompletionMarker compute(List<Path> files) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        for (Path file : files) {
            byte[] name = file.getFileName().toString().getBytes(StandardCharsets.UTF_8);
            byte[] body;
            try {
                body = Files.readAllBytes(file);
            } catch (IOException e) {
                throw new PipelineIOException("digest artifact", file, e);
            }
            digest.update(ByteBuffer.allocate(4).putInt(name.length).array());
            digest.update(name);
            digest.update(ByteBuffer.allocate(8).putLong(body.length).array());
            digest.update(body);
        }
        return new CompletionMarker(files.size(), HexFormat.of().formatHex(digest.digest()));
    }

    /**
     * @return the marker in {@code dir}, or {@code null} if there is none
     */
    public static CompletionMarker read(Path dir) {
        Path file = dir.resolve(ArtifactStore.COMPLETION_MARKER);
        if (!Files.isRegularFile(file)) return null;
        try {
            return MAPPER.readValue(file.toFile(), CompletionMarker.class);
        } catch (IOException e) {
            throw new PipelineIOException("read completion marker", file, e);
        }
    }

    public void write(Path dir) {
        Path file = dir.resolve(ArtifactStore.COMPLETION_MARKER);
        Path tmp = dir.resolve(ArtifactStore.COMPLETION_MARKER + ".tmp");
        try {
            Files.write(tmp, MAPPER.writeValueAsBytes(this));
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new PipelineIOException("write completion marker", file, e);
        }
    }

    public static void delete(Path dir) {
        Path file = dir.resolve(ArtifactStore.COMPLETION_MARKER);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new PipelineIOException("remove completion marker", file, e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompletionMarker)) return false;
        CompletionMarker that = (CompletionMarker) o;
        return artifacts == that.artifacts && sha256.equals(that.sha256);
    }

    @Override
    public int hashCode() {
        return Objects.hash(artifacts, sha256);
    }

    @Override
    public String toString() {
        return artifacts + " artifacts, sha256=" + sha256;
    }
}
