package kiokundict;

/**
 * The four disjoint output partitions, keyed by the number of Han code points in a word.
 */
public enum Shard {
    NON_HAN("non-han"),
    HAN_1CHAR("han-1char"),
    HAN_2CHAR("han-2char"),
    HAN_3PLUS("han-3plus");

    private final String label;

    Shard(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @return the physical directory name, e.g. {@code output_han-2char}
     */
    public String directoryName() {
        return "output_" + label;
    }

    public static Shard fromLabel(String label) {
        for (Shard s : values()) {
            if (s.label.equals(label)) return s;
        }
        throw new IllegalArgumentException("Unknown shard: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
