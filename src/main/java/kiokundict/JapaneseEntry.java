package kiokundict;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

import static kiokundict.ChineseEntry.immutableCopy;

/**
 * One JMdict word: a source-assigned id, its kanji and kana spellings and its senses.
 *
 * <p>Instances are immutable once loaded.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "kanji", "kana", "sense"})
public final class JapaneseEntry {
    private final String id;
    private final List<Spelling> kanji;
    private final List<Spelling> kana;
    private final List<Sense> sense;

    @JsonCreator
    public JapaneseEntry(@JsonProperty(value = "id", required = true) String id,
                         @JsonProperty("kanji") List<Spelling> kanji,
                         @JsonProperty("kana") List<Spelling> kana,
                         @JsonProperty("sense") List<Sense> sense) {
        this.id = Objects.requireNonNull(id, "id");
        this.kanji = immutableCopy(kanji);
        this.kana = immutableCopy(kana);
        this.sense = immutableCopy(sense);
    }

    public String getId() {
        return id;
    }

    public List<Spelling> getKanji() {
        return kanji;
    }

    public List<Spelling> getKana() {
        return kana;
    }

    public List<Sense> getSense() {
        return sense;
    }

    /**
     * @return the first kanji spelling, or the first kana spelling for kana-only words,
     * or {@code null} when the entry has no spelling at all
     */
    @JsonIgnore
    public String getPrimarySpelling() {
        if (!kanji.isEmpty()) return kanji.get(0).getText();
        if (!kana.isEmpty()) return kana.get(0).getText();
        return null;
    }

    /**
     * @return the first kana reading, or an empty string
     */
    @JsonIgnore
    public String getPrimaryReading() {
        return kana.isEmpty() ? "" : kana.get(0).getText();
    }

    /**
     * @return {@code true} if any kanji or kana spelling is flagged common
     */
    @JsonIgnore
    public boolean isCommon() {
        for (Spelling s : kanji) {
            if (s.isCommon()) return true;
        }
        for (Spelling s : kana) {
            if (s.isCommon()) return true;
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JapaneseEntry)) return false;
        JapaneseEntry that = (JapaneseEntry) o;
        return id.equals(that.id) && kanji.equals(that.kanji) && kana.equals(that.kana) && sense.equals(that.sense);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kanji, kana, sense);
    }

    @Override
    public String toString() {
        return "<JapaneseEntry " + id + " " + getPrimarySpelling() + ">";
    }

    /**
     * A kanji or kana spelling. {@code appliesToKanji} is only meaningful for kana.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"text", "common", "tags", "appliesToKanji"})
    public static final class Spelling {
        private final String text;
        private final boolean common;
        private final List<String> tags;
        private final List<String> appliesToKanji;

        @JsonCreator
        public Spelling(@JsonProperty(value = "text", required = true) String text,
                        @JsonProperty("common") boolean common,
                        @JsonProperty("tags") List<String> tags,
                        @JsonProperty("appliesToKanji") List<String> appliesToKanji) {
            this.text = Objects.requireNonNull(text, "text");
            this.common = common;
            this.tags = immutableCopy(tags);
            this.appliesToKanji = immutableCopy(appliesToKanji);
        }

        public Spelling(String text, boolean common) {
            this(text, common, null, null);
        }

        public String getText() {
            return text;
        }

        public boolean isCommon() {
            return common;
        }

        public List<String> getTags() {
            return tags;
        }

        public List<String> getAppliesToKanji() {
            return appliesToKanji;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Spelling)) return false;
            Spelling that = (Spelling) o;
            return common == that.common && text.equals(that.text)
                    && tags.equals(that.tags) && appliesToKanji.equals(that.appliesToKanji);
        }

        @Override
        public int hashCode() {
            return Objects.hash(text, common, tags, appliesToKanji);
        }
    }

    /**
     * One sense: its glosses plus part-of-speech and usage tags.
     * Part-of-speech tags are a set; duplicates are dropped, first occurrence kept.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"partOfSpeech", "field", "misc", "info", "gloss"})
    public static final class Sense {
        private final List<String> partOfSpeech;
        private final List<String> field;
        private final List<String> misc;
        private final List<String> info;
        private final List<Gloss> gloss;

        @JsonCreator
        public Sense(@JsonProperty("partOfSpeech") List<String> partOfSpeech,
                     @JsonProperty("field") List<String> field,
                     @JsonProperty("misc") List<String> misc,
                     @JsonProperty("info") List<String> info,
                     @JsonProperty("gloss") List<Gloss> gloss) {
            this.partOfSpeech = partOfSpeech == null ? immutableCopy(null)
                    : immutableCopy(new ArrayList<>(new LinkedHashSet<>(partOfSpeech)));
            this.field = immutableCopy(field);
            this.misc = immutableCopy(misc);
            this.info = immutableCopy(info);
            this.gloss = immutableCopy(gloss);
        }

        public Sense(List<String> partOfSpeech, List<Gloss> gloss) {
            this(partOfSpeech, null, null, null, gloss);
        }

        public List<String> getPartOfSpeech() {
            return partOfSpeech;
        }

        public List<String> getField() {
            return field;
        }

        public List<String> getMisc() {
            return misc;
        }

        public List<String> getInfo() {
            return info;
        }

        public List<Gloss> getGloss() {
            return gloss;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Sense)) return false;
            Sense that = (Sense) o;
            return partOfSpeech.equals(that.partOfSpeech) && field.equals(that.field)
                    && misc.equals(that.misc) && info.equals(that.info) && gloss.equals(that.gloss);
        }

        @Override
        public int hashCode() {
            return Objects.hash(partOfSpeech, field, misc, info, gloss);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"lang", "text"})
    public static final class Gloss {
        private final String lang;
        private final String text;

        @JsonCreator
        public Gloss(@JsonProperty("lang") String lang,
                     @JsonProperty(value = "text", required = true) String text) {
            this.lang = lang;
            this.text = Objects.requireNonNull(text, "text");
        }

        public String getLang() {
            return lang;
        }

        public String getText() {
            return text;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Gloss)) return false;
            Gloss that = (Gloss) o;
            return Objects.equals(lang, that.lang) && text.equals(that.text);
        }

        @Override
        public int hashCode() {
            return Objects.hash(lang, text);
        }
    }
}
