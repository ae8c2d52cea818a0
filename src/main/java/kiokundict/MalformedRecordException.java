package kiokundict;

import java.nio.file.Path;

/**
 * A single corpus record could not be parsed.
 *
 * <p>Loaders catch this, log it and carry on with the next record; it never aborts a load.</p>
 */
public class MalformedRecordException extends DictionaryPipelineException {
    private final Path source;
    private final long recordNumber;

    public MalformedRecordException(Path source, long recordNumber, String message, Throwable cause) {
        super(source + " record " + recordNumber + ": " + message, cause);
        this.source = source;
        this.recordNumber = recordNumber;
    }

    public Path getSource() {
        return source;
    }

    public long getRecordNumber() {
        return recordNumber;
    }
}
