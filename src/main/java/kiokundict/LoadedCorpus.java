package kiokundict;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entities parsed from one source corpus, plus an index from every spelling variant to the
 * entries that carry it.
 *
 * <p>Homographs are kept: {@link #lookup(String)} returns all owners of a spelling in
 * insertion order.</p>
 *
 * @param <T> entry type
 */
public final class LoadedCorpus<T> {
    private final Path source;
    private final List<T> entries;
    private final Map<String, List<T>> index;
    private final long malformedCount;

    LoadedCorpus(Path source, List<T> entries, Map<String, List<T>> index, long malformedCount) {
        this.source = source;
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
        Map<String, List<T>> frozen = new LinkedHashMap<>();
        for (Map.Entry<String, List<T>> e : index.entrySet()) {
            frozen.put(e.getKey(), Collections.unmodifiableList(new ArrayList<>(e.getValue())));
        }
        this.index = Collections.unmodifiableMap(frozen);
        this.malformedCount = malformedCount;
    }

    /**
     * @return where the corpus was read from, or {@code null} for in-memory corpora
     */
    public Path getSource() {
        return source;
    }

    public List<T> getEntries() {
        return entries;
    }

    /**
     * @param spelling a simplified/traditional form, or a kanji/kana text
     * @return every entry carrying that spelling, in insertion order; empty if none
     */
    public List<T> lookup(String spelling) {
        List<T> owners = index.get(spelling);
        return owners != null ? owners : Collections.emptyList();
    }

    /**
     * @return the spelling index, keys in first-seen order
     */
    public Map<String, List<T>> getIndex() {
        return index;
    }

    public int size() {
        return entries.size();
    }

    /**
     * @return number of records skipped because they could not be parsed
     */
    public long getMalformedCount() {
        return malformedCount;
    }

    @Override
    public String toString() {
        return "<LoadedCorpus " + source + ": " + entries.size() + " entries, "
                + index.size() + " spellings, " + malformedCount + " malformed>";
    }
}
