package kiokundict;

import java.util.Objects;

/**
 * One row of the relational search table.
 */
public final class SearchIndexRow {

    public enum Language {
        CHINESE("chinese"),
        JAPANESE("japanese");

        private final String column;

        Language(String column) {
            this.column = column;
        }

        public String getColumn() {
            return column;
        }
    }

    private final String word;
    private final Language language;
    private final String definition;
    private final String pronunciation;
    private final boolean common;

    public SearchIndexRow(String word, Language language, String definition, String pronunciation, boolean common) {
        this.word = Objects.requireNonNull(word, "word");
        this.language = Objects.requireNonNull(language, "language");
        this.definition = Objects.requireNonNull(definition, "definition");
        this.pronunciation = pronunciation == null ? "" : pronunciation;
        this.common = common;
    }

    public String getWord() {
        return word;
    }

    public Language getLanguage() {
        return language;
    }

    public String getDefinition() {
        return definition;
    }

    public String getPronunciation() {
        return pronunciation;
    }

    public boolean isCommon() {
        return common;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SearchIndexRow)) return false;
        SearchIndexRow that = (SearchIndexRow) o;
        return common == that.common && word.equals(that.word) && language == that.language
                && definition.equals(that.definition) && pronunciation.equals(that.pronunciation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(word, language, definition, pronunciation, common);
    }

    @Override
    public String toString() {
        return word + "|" + language.getColumn() + "|" + definition + "|" + pronunciation + "|" + (common ? 1 : 0);
    }
}
