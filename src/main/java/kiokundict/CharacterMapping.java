package kiokundict;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Read-only mapping from a Japanese kanji spelling (word or single character) to its
 * Traditional Chinese rendering.
 *
 * <p>Identity mappings are never stored: a spelling that is absent renders to itself.
 * Instances are immutable; {@link #merge(CharacterMapping)} builds a new instance in which
 * every key of {@code this} keeps its value and only previously-absent keys are added.</p>
 *
 * <p>The on-disk form is a JSON object with keys sorted, e.g.
 * {@code {"国家": "國家", "学生": "學生"}}.</p>
 */
public final class CharacterMapping {
    private static final Logger LOGGER = Logger.getLogger(CharacterMapping.class.getName());
    private static final CharacterMapping EMPTY = new CharacterMapping(new TreeMap<>());

    private final SortedMap<String, String> entries;

    private CharacterMapping(TreeMap<String, String> entries) {
        this.entries = Collections.unmodifiableSortedMap(entries);
    }

    /**
     * @return the mapping with no entries
     */
    public static CharacterMapping empty() {
        return EMPTY;
    }

    /**
     * Creates a mapping from the given pairs, dropping identity pairs.
     *
     * @param pairs kanji → traditional pairs
     * @return a new mapping
     */
    public static CharacterMapping of(Map<String, String> pairs) {
        TreeMap<String, String> copy = new TreeMap<>();
        for (Map.Entry<String, String> e : pairs.entrySet()) {
            String key = Objects.requireNonNull(e.getKey(), "mapping key");
            String value = Objects.requireNonNull(e.getValue(), "mapping value for " + key);
            if (!key.equals(value)) {
                copy.put(key, value);
            }
        }
        return new CharacterMapping(copy);
    }

    /**
     * Returns a new mapping containing every entry of this mapping plus those entries of
     * {@code additions} whose key is not yet present. Existing values are never replaced.
     *
     * @param additions candidate entries, typically a freshly generated batch
     * @return the merged mapping; {@code this} is left untouched
     */
    public CharacterMapping merge(CharacterMapping additions) {
        if (additions.isEmpty()) return this;
        TreeMap<String, String> merged = new TreeMap<>(entries);
        for (Map.Entry<String, String> e : additions.entries.entrySet()) {
            merged.putIfAbsent(e.getKey(), e.getValue());
        }
        return new CharacterMapping(merged);
    }

    /**
     * @param kanji a Japanese spelling
     * @return the Traditional Chinese rendering, or {@code null} if there is none
     */
    public String get(String kanji) {
        return entries.get(kanji);
    }

    /**
     * @param kanji a Japanese spelling
     * @return the Traditional Chinese rendering, or {@code kanji} itself when unmapped
     */
    public String render(String kanji) {
        String value = entries.get(kanji);
        return value != null ? value : kanji;
    }

    public boolean containsKey(String kanji) {
        return entries.containsKey(kanji);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * @return an unmodifiable, key-sorted view of the entries
     */
    public SortedMap<String, String> asMap() {
        return entries;
    }

    /**
     * Loads a mapping from its JSON form.
     *
     * @param path JSON object file
     * @return the parsed mapping
     * @throws PipelineIOException if the file is missing or unreadable
     */
    public static CharacterMapping fromJson(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            CharacterMapping mapping = fromJson(in);
            LOGGER.info("Loaded " + mapping.size() + " character mappings from " + path);
            return mapping;
        } catch (IOException e) {
            throw new PipelineIOException("read character mapping", path, e);
        }
    }

    /**
     * Loads a mapping from a JSON stream, e.g. a classpath resource.
     *
     * @param in JSON object stream
     * @return the parsed mapping
     * @throws IOException if the stream cannot be read or parsed
     */
    public static CharacterMapping fromJson(InputStream in) throws IOException {
        Map<String, String> raw = new ObjectMapper().readValue(in, new TypeReference<Map<String, String>>() {
        });
        return of(raw);
    }

    /**
     * Loads the mapping at {@code path} if the file exists, otherwise returns the empty mapping.
     */
    public static CharacterMapping fromJsonIfExists(Path path) {
        return Files.exists(path) ? fromJson(path) : empty();
    }

    /**
     * Writes this mapping as pretty-printed JSON with sorted keys. The file is written to a
     * sibling temporary file first and moved into place, so a reader never sees a partial file.
     *
     * @param path destination file
     * @throws PipelineIOException if writing fails
     */
    public void writeJson(Path path) {
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        Path parent = path.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            Files.createDirectories(parent);
            tmp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
            try (OutputStream out = Files.newOutputStream(tmp)) {
                mapper.writeValue(out, entries);
            }
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new PipelineIOException("write character mapping", path, e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOGGER.warning("Could not remove temporary file " + tmp + ": " + e.getMessage());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CharacterMapping)) return false;
        return entries.equals(((CharacterMapping) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "<CharacterMapping with " + entries.size() + " entries>";
    }
}
