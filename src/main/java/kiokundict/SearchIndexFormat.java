package kiokundict;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Serialized forms of the search index.
 */
public enum SearchIndexFormat {
    /**
     * RFC 4180 CSV with a header row.
     */
    @JsonProperty("csv") CSV,
    /**
     * Batched {@code INSERT} statements.
     */
    @JsonProperty("sql") SQL;

    public static SearchIndexFormat parse(String name) {
        for (SearchIndexFormat f : values()) {
            if (f.name().equalsIgnoreCase(name)) return f;
        }
        throw new IllegalArgumentException("Unknown search index format: " + name + " (expected csv or sql)");
    }
}
