package kiokundict;

/**
 * Outcome of {@link ScriptMapper#generateAndMerge}: how many spellings were converted, how
 * many conversions the oracle produced and how much the stored mapping grew.
 */
public final class MappingMergeResult {
    private final int inputCount;
    private final int generatedCount;
    private final int previousSize;
    private final CharacterMapping merged;

    MappingMergeResult(int inputCount, int generatedCount, int previousSize, CharacterMapping merged) {
        this.inputCount = inputCount;
        this.generatedCount = generatedCount;
        this.previousSize = previousSize;
        this.merged = merged;
    }

    public int getInputCount() {
        return inputCount;
    }

    public int getGeneratedCount() {
        return generatedCount;
    }

    public int getPreviousSize() {
        return previousSize;
    }

    public int getAddedCount() {
        return merged.size() - previousSize;
    }

    public CharacterMapping getMerged() {
        return merged;
    }

    /**
     * @return share of input spellings the oracle changed, in percent
     */
    public double getConversionRate() {
        return inputCount == 0 ? 0.0 : generatedCount * 100.0 / inputCount;
    }

    @Override
    public String toString() {
        return String.format("spellings=%d conversions=%d (%.1f%%) added=%d total=%d (was %d)",
                inputCount, generatedCount, getConversionRate(), getAddedCount(), merged.size(), previousSize);
    }
}
