package kiokundict;

/**
 * Base type for every failure the dictionary build pipeline reports.
 *
 * <p>All subclasses are unchecked. A stage that throws one of them must not be followed
 * by the next stage; the command-line front end maps them to a non-zero exit status.</p>
 */
public class DictionaryPipelineException extends RuntimeException {

    /**
     * @param message human-readable diagnostic
     */
    public DictionaryPipelineException(String message) {
        super(message);
    }

    /**
     * @param message human-readable diagnostic
     * @param cause   underlying failure
     */
    public DictionaryPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
