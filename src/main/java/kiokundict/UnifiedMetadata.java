package kiokundict;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Per-key unification facts: how many candidates each language had and which corpus
 * supplied the key.
 */
@JsonPropertyOrder({"chinese_count", "japanese_count", "is_unified", "key_source"})
public final class UnifiedMetadata {

    public enum KeySource {
        @JsonProperty("chinese") CHINESE,
        @JsonProperty("japanese") JAPANESE
    }

    private final int chineseCount;
    private final int japaneseCount;
    private final boolean unified;
    private final KeySource keySource;

    @JsonCreator
    public UnifiedMetadata(@JsonProperty("chinese_count") int chineseCount,
                           @JsonProperty("japanese_count") int japaneseCount,
                           @JsonProperty("is_unified") boolean unified,
                           @JsonProperty("key_source") KeySource keySource) {
        this.chineseCount = chineseCount;
        this.japaneseCount = japaneseCount;
        this.unified = unified;
        this.keySource = keySource;
    }

    @JsonProperty("chinese_count")
    public int getChineseCount() {
        return chineseCount;
    }

    @JsonProperty("japanese_count")
    public int getJapaneseCount() {
        return japaneseCount;
    }

    @JsonProperty("is_unified")
    public boolean isUnified() {
        return unified;
    }

    @JsonProperty("key_source")
    public KeySource getKeySource() {
        return keySource;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnifiedMetadata)) return false;
        UnifiedMetadata that = (UnifiedMetadata) o;
        return chineseCount == that.chineseCount && japaneseCount == that.japaneseCount
                && unified == that.unified && keySource == that.keySource;
    }

    @Override
    public int hashCode() {
        return Objects.hash(chineseCount, japaneseCount, unified, keySource);
    }

    @Override
    public String toString() {
        return "{zh=" + chineseCount + ", ja=" + japaneseCount + ", unified=" + unified + ", key=" + keySource + "}";
    }
}
