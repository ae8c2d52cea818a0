package kiokundict;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One headword of the Chinese corpus, identified by its simplified/traditional pair.
 *
 * <p>Bound directly from a JSON Lines record such as:</p>
 * <pre>{@code
 * {"_id":"…","simp":"学生","trad":"學生","gloss":"student",
 *  "items":[{"source":"cedict","pinyin":"xué sheng","simpTrad":"both","definitions":["student"]}],
 *  "statistics":{"hskLevel":1}}
 * }</pre>
 *
 * <p>Instances are immutable once loaded.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"_id", "simp", "trad", "gloss", "pinyinSearchString", "items", "statistics"})
public final class ChineseEntry {

    /**
     * Origin of a pronunciation item. Declaration order is the source priority used when
     * several entries compete for the same match key.
     */
    public enum Source {
        @JsonProperty("cedict") CEDICT,
        @JsonProperty("dong-chinese") DONG_CHINESE,
        @JsonProperty("unicode") UNICODE
    }

    /**
     * Which script(s) a pronunciation item applies to.
     */
    public enum SimpTrad {
        @JsonProperty("simp") SIMPLIFIED_ONLY,
        @JsonProperty("trad") TRADITIONAL_ONLY,
        @JsonProperty("both") BOTH
    }

    private final String id;
    private final String simplified;
    private final String traditional;
    private final String gloss;
    private final String pinyinSearchString;
    private final List<Item> items;
    private final Statistics statistics;

    @JsonCreator
    public ChineseEntry(@JsonProperty("_id") String id,
                        @JsonProperty(value = "simp", required = true) String simplified,
                        @JsonProperty(value = "trad", required = true) String traditional,
                        @JsonProperty("gloss") String gloss,
                        @JsonProperty("pinyinSearchString") String pinyinSearchString,
                        @JsonProperty("items") List<Item> items,
                        @JsonProperty("statistics") Statistics statistics) {
        this.id = id;
        this.simplified = Objects.requireNonNull(simplified, "simp");
        this.traditional = Objects.requireNonNull(traditional, "trad");
        this.gloss = gloss;
        this.pinyinSearchString = pinyinSearchString;
        this.items = immutableCopy(items);
        this.statistics = statistics;
    }

    /**
     * Convenience constructor for entries without an id or search string.
     */
    public ChineseEntry(String simplified, String traditional, String gloss,
                        List<Item> items, Statistics statistics) {
        this(null, simplified, traditional, gloss, null, items, statistics);
    }

    @JsonProperty("_id")
    public String getId() {
        return id;
    }

    @JsonProperty("simp")
    public String getSimplified() {
        return simplified;
    }

    @JsonProperty("trad")
    public String getTraditional() {
        return traditional;
    }

    @JsonProperty("gloss")
    public String getGloss() {
        return gloss;
    }

    @JsonProperty("pinyinSearchString")
    public String getPinyinSearchString() {
        return pinyinSearchString;
    }

    @JsonProperty("items")
    public List<Item> getItems() {
        return items;
    }

    @JsonProperty("statistics")
    public Statistics getStatistics() {
        return statistics;
    }

    /**
     * An entry is preferred as primary when it carries an HSK level or any frequency data.
     *
     * @return {@code true} if the entry has commonness signals
     */
    @JsonIgnore
    public boolean isCommon() {
        return statistics != null && (statistics.getHskLevel() != null || statistics.hasFrequency());
    }

    /**
     * @return the best (lowest ordinal) source among this entry's items, or
     * {@code Source.values().length} when no item names a source
     */
    public int sourcePriority() {
        int best = Source.values().length;
        for (Item item : items) {
            if (item.getSource() != null && item.getSource().ordinal() < best) {
                best = item.getSource().ordinal();
            }
        }
        return best;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChineseEntry)) return false;
        ChineseEntry that = (ChineseEntry) o;
        return Objects.equals(id, that.id)
                && simplified.equals(that.simplified)
                && traditional.equals(that.traditional)
                && Objects.equals(gloss, that.gloss)
                && Objects.equals(pinyinSearchString, that.pinyinSearchString)
                && items.equals(that.items)
                && Objects.equals(statistics, that.statistics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, simplified, traditional, gloss, pinyinSearchString, items, statistics);
    }

    @Override
    public String toString() {
        return "<ChineseEntry " + simplified + "/" + traditional + " with " + items.size() + " items>";
    }

    /**
     * Copies a bound list; an absent list becomes empty, a {@code null} element is rejected so
     * the loader counts the record as malformed.
     */
    static <T> List<T> immutableCopy(List<T> list) {
        if (list == null) return Collections.emptyList();
        List<T> copy = new ArrayList<>(list.size());
        for (T item : list) {
            copy.add(Objects.requireNonNull(item, "null list element"));
        }
        return Collections.unmodifiableList(copy);
    }

    /**
     * One pronunciation with its definitions.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"source", "pinyin", "simpTrad", "definitions"})
    public static final class Item {
        private final Source source;
        private final String pinyin;
        private final SimpTrad simpTrad;
        private final List<String> definitions;

        @JsonCreator
        public Item(@JsonProperty("source") Source source,
                    @JsonProperty("pinyin") String pinyin,
                    @JsonProperty("simpTrad") SimpTrad simpTrad,
                    @JsonProperty("definitions") List<String> definitions) {
            this.source = source;
            this.pinyin = pinyin;
            this.simpTrad = simpTrad;
            this.definitions = immutableCopy(definitions);
        }

        public Source getSource() {
            return source;
        }

        public String getPinyin() {
            return pinyin;
        }

        public SimpTrad getSimpTrad() {
            return simpTrad;
        }

        public List<String> getDefinitions() {
            return definitions;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Item)) return false;
            Item item = (Item) o;
            return source == item.source
                    && Objects.equals(pinyin, item.pinyin)
                    && simpTrad == item.simpTrad
                    && definitions.equals(item.definitions);
        }

        @Override
        public int hashCode() {
            return Objects.hash(source, pinyin, simpTrad, definitions);
        }
    }

    /**
     * Learner statistics. Every field is optional.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"hskLevel", "movieWordRank", "bookWordRank", "pinyinFrequency"})
    public static final class Statistics {
        private final Integer hskLevel;
        private final Integer movieWordRank;
        private final Integer bookWordRank;
        private final Integer pinyinFrequency;

        @JsonCreator
        public Statistics(@JsonProperty("hskLevel") Integer hskLevel,
                          @JsonProperty("movieWordRank") Integer movieWordRank,
                          @JsonProperty("bookWordRank") Integer bookWordRank,
                          @JsonProperty("pinyinFrequency") Integer pinyinFrequency) {
            this.hskLevel = hskLevel;
            this.movieWordRank = movieWordRank;
            this.bookWordRank = bookWordRank;
            this.pinyinFrequency = pinyinFrequency;
        }

        public static Statistics ofHskLevel(int hskLevel) {
            return new Statistics(hskLevel, null, null, null);
        }

        public Integer getHskLevel() {
            return hskLevel;
        }

        public Integer getMovieWordRank() {
            return movieWordRank;
        }

        public Integer getBookWordRank() {
            return bookWordRank;
        }

        public Integer getPinyinFrequency() {
            return pinyinFrequency;
        }

        /**
         * @return {@code true} if any corpus frequency figure is present
         */
        public boolean hasFrequency() {
            return movieWordRank != null || bookWordRank != null || pinyinFrequency != null;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Statistics)) return false;
            Statistics that = (Statistics) o;
            return Objects.equals(hskLevel, that.hskLevel)
                    && Objects.equals(movieWordRank, that.movieWordRank)
                    && Objects.equals(bookWordRank, that.bookWordRank)
                    && Objects.equals(pinyinFrequency, that.pinyinFrequency);
        }

        @Override
        public int hashCode() {
            return Objects.hash(hskLevel, movieWordRank, bookWordRank, pinyinFrequency);
        }
    }
}
