package kiokundict;

import java.util.List;

/**
 * Best-effort Japanese → Traditional Chinese script converter treated as a black box.
 *
 * <p>The contract is line-oriented: the whole batch is handed over in one call and the
 * oracle must answer with exactly one output line per input line, in input order.
 * Implementations return whatever the converter produced; checking the line count is
 * the caller's job (see {@link ScriptMapper}).</p>
 */
@FunctionalInterface
public interface ConversionOracle {

    /**
     * Converts a batch of single-line strings.
     *
     * @param lines inputs, none of which contains a line break
     * @return the converter's output lines
     * @throws OracleContractException if the converter could not be run or failed
     */
    List<String> convertBatch(List<String> lines);
}
