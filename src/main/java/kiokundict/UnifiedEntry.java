package kiokundict;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * The merged record for one matching key: at most one primary Chinese entry, at most one
 * primary Japanese entry, and the metadata describing how they were chosen.
 *
 * <p>{@code metadata.is_unified} is derived from the presence of both entries and cannot be
 * set independently. Deserialization rejects documents where the stored flag disagrees.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"word", "chinese_entry", "japanese_entry", "metadata"})
public final class UnifiedEntry {
    private final String word;
    private final ChineseEntry chineseEntry;
    private final JapaneseEntry japaneseEntry;
    private final UnifiedMetadata metadata;

    /**
     * @param word          matching key
     * @param chineseEntry  primary Chinese entry, or {@code null}
     * @param japaneseEntry primary Japanese entry, or {@code null}
     * @param chineseCount  number of Chinese candidates considered
     * @param japaneseCount number of Japanese candidates considered
     * @throws InvariantViolationException if neither entry is present or a count disagrees
     *                                     with the presence of its entry
     */
    public UnifiedEntry(String word, ChineseEntry chineseEntry, JapaneseEntry japaneseEntry,
                        int chineseCount, int japaneseCount) {
        this(word, chineseEntry, japaneseEntry, new UnifiedMetadata(chineseCount, japaneseCount,
                chineseEntry != null && japaneseEntry != null,
                chineseEntry != null ? UnifiedMetadata.KeySource.CHINESE : UnifiedMetadata.KeySource.JAPANESE));
    }

    @JsonCreator
    UnifiedEntry(@JsonProperty(value = "word", required = true) String word,
                 @JsonProperty("chinese_entry") ChineseEntry chineseEntry,
                 @JsonProperty("japanese_entry") JapaneseEntry japaneseEntry,
                 @JsonProperty(value = "metadata", required = true) UnifiedMetadata metadata) {
        this.word = Objects.requireNonNull(word, "word");
        this.chineseEntry = chineseEntry;
        this.japaneseEntry = japaneseEntry;
        this.metadata = Objects.requireNonNull(metadata, "metadata");

        if (chineseEntry == null && japaneseEntry == null) {
            throw new InvariantViolationException("Unified entry '" + word + "' has neither a Chinese nor a Japanese entry");
        }
        if (metadata.isUnified() != (chineseEntry != null && japaneseEntry != null)) {
            throw new InvariantViolationException("Unified entry '" + word + "' has is_unified="
                    + metadata.isUnified() + " inconsistent with its entries");
        }
        if ((chineseEntry != null) != (metadata.getChineseCount() > 0)
                || (japaneseEntry != null) != (metadata.getJapaneseCount() > 0)) {
            throw new InvariantViolationException("Unified entry '" + word + "' has candidate counts "
                    + metadata + " inconsistent with its entries");
        }
    }

    @JsonProperty("word")
    public String getWord() {
        return word;
    }

    @JsonProperty("chinese_entry")
    public ChineseEntry getChineseEntry() {
        return chineseEntry;
    }

    @JsonProperty("japanese_entry")
    public JapaneseEntry getJapaneseEntry() {
        return japaneseEntry;
    }

    @JsonProperty("metadata")
    public UnifiedMetadata getMetadata() {
        return metadata;
    }

    @JsonIgnore
    public boolean isUnified() {
        return metadata.isUnified();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnifiedEntry)) return false;
        UnifiedEntry that = (UnifiedEntry) o;
        return word.equals(that.word) && Objects.equals(chineseEntry, that.chineseEntry)
                && Objects.equals(japaneseEntry, that.japaneseEntry) && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(word, chineseEntry, japaneseEntry, metadata);
    }

    @Override
    public String toString() {
        return "UnifiedEntry{" + word + " " + metadata + "}";
    }
}
