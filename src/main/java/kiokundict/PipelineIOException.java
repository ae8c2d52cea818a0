package kiokundict;

import java.io.IOException;
import java.nio.file.Path;

/**
 * An I/O failure at a stage boundary, always reported together with the offending path.
 */
public class PipelineIOException extends DictionaryPipelineException {
    private final Path path;

    public PipelineIOException(String action, Path path, IOException cause) {
        super("Failed to " + action + ": " + path + " (" + cause.getMessage() + ")", cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
