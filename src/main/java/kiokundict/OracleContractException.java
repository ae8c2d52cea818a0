package kiokundict;

/**
 * The script-conversion oracle broke its one-line-out-per-line-in contract, or could not
 * be run at all. Fatal for the mapping build in progress: nothing is written.
 */
public class OracleContractException extends DictionaryPipelineException {
    private final int expectedLines;
    private final int actualLines;

    public OracleContractException(int expectedLines, int actualLines) {
        super("Conversion oracle returned " + actualLines + " lines for a batch of " + expectedLines);
        this.expectedLines = expectedLines;
        this.actualLines = actualLines;
    }

    public OracleContractException(String message, Throwable cause) {
        super(message, cause);
        this.expectedLines = -1;
        this.actualLines = -1;
    }

    public OracleContractException(String message) {
        this(message, null);
    }

    /**
     * @return number of input lines in the batch, or -1 when the oracle failed before answering
     */
    public int getExpectedLines() {
        return expectedLines;
    }

    /**
     * @return number of lines the oracle returned, or -1 when it failed before answering
     */
    public int getActualLines() {
        return actualLines;
    }
}
