package kiokundict;

/**
 * An internal consistency check failed: duplicate match key, an entry with neither
 * language, shard counts that do not add up, a round-trip mismatch or a filename
 * collision. Indicates a bug; the run halts instead of emitting an inconsistent corpus.
 */
public class InvariantViolationException extends DictionaryPipelineException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
