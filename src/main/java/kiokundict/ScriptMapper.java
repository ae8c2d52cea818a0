package kiokundict;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.BiConsumer;
import java.util.logging.Logger;

/**
 * Builds and maintains the kanji → Traditional Chinese {@link CharacterMapping}.
 *
 * <p>A batch of spellings is converted in a single oracle call and outputs are matched to
 * inputs by position. Only spellings the oracle actually changed are kept. If the oracle
 * answers with a different number of lines than it was given, the build fails with
 * {@link OracleContractException} before anything is merged or written.</p>
 */
public class ScriptMapper {
    private static final Logger LOGGER = Logger.getLogger(ScriptMapper.class.getName());

    private final ConversionOracle oracle;

    public ScriptMapper(ConversionOracle oracle) {
        this.oracle = Objects.requireNonNull(oracle, "oracle");
    }

    /**
     * Converts every spelling in one oracle call.
     *
     * @param spellings kanji words or single characters; duplicates, empty strings and
     *                  strings containing line breaks are ignored
     * @return the non-identity conversions
     * @throws OracleContractException if the oracle fails or returns the wrong number of lines
     */
    public CharacterMapping buildMapping(Collection<String> spellings) {
        List<String> batch = new ArrayList<>(normalizeBatch(spellings));
        if (batch.isEmpty()) {
            LOGGER.info("Nothing to convert");
            return CharacterMapping.empty();
        }

        List<String> converted = oracle.convertBatch(batch);
        if (converted == null || converted.size() != batch.size()) {
            throw new OracleContractException(batch.size(), converted == null ? 0 : converted.size());
        }

        Map<String, String> pairs = new LinkedHashMap<>();
        for (int i = 0; i < batch.size(); i++) {
            String original = batch.get(i);
            String rendered = converted.get(i);
            if (!original.equals(rendered)) {
                pairs.put(original, rendered);
            }
        }
        LOGGER.info("Generated " + pairs.size() + " conversions out of " + batch.size() + " spellings");
        return CharacterMapping.of(pairs);
    }

    /**
     * Generates conversions for {@code spellings} and merges them into the mapping stored at
     * {@code mappingFile} (if any). Existing entries always win. The file is only written once
     * the whole batch has been converted and merged successfully.
     *
     * @param spellings   spellings to convert
     * @param mappingFile existing mapping to extend; created if absent
     * @return a summary of the merge
     */
    public MappingMergeResult generateAndMerge(Collection<String> spellings, Path mappingFile) {
        CharacterMapping generated = buildMapping(spellings);
        CharacterMapping existing = CharacterMapping.fromJsonIfExists(mappingFile);
        CharacterMapping merged = existing.merge(generated);
        merged.writeJson(mappingFile);

        MappingMergeResult result = new MappingMergeResult(
                normalizeBatch(spellings).size(), generated.size(), existing.size(), merged);
        LOGGER.info("Added " + result.getAddedCount() + " mappings; total " + merged.size()
                + " (was " + existing.size() + ")");
        return result;
    }

    private static SortedSet<String> normalizeBatch(Collection<String> spellings) {
        SortedSet<String> unique = new TreeSet<>();
        for (String s : spellings) {
            if (s == null || s.isEmpty()) continue;
            if (s.indexOf('\n') >= 0 || s.indexOf('\r') >= 0) {
                LOGGER.warning("Skipping spelling containing a line break: " + s.replace("\n", "\\n"));
                continue;
            }
            unique.add(s);
        }
        return unique;
    }

    /**
     * Collects every distinct kanji spelling ({@code words[].kanji[].text}) from a JMdict
     * JSON document.
     *
     * @param jmdict JMdict document path
     * @return sorted, distinct spellings
     */
    public static SortedSet<String> extractJmdictKanji(Path jmdict) {
        SortedSet<String> out = new TreeSet<>();
        streamArray(jmdict, "words", (index, word) -> {
            for (JsonNode kanji : word.path("kanji")) {
                String text = kanji.path("text").asText("");
                if (!text.isEmpty()) out.add(text);
            }
        });
        LOGGER.info("Found " + out.size() + " unique kanji strings in " + jmdict);
        return out;
    }

    /**
     * Collects every character literal ({@code characters[].literal}) from a KANJIDIC2 JSON
     * document.
     *
     * @param kanjidic KANJIDIC2 document path
     * @return sorted, distinct characters
     */
    public static SortedSet<String> extractKanjidicLiterals(Path kanjidic) {
        SortedSet<String> out = new TreeSet<>();
        streamArray(kanjidic, "characters", (index, character) -> {
            String literal = character.path("literal").asText("");
            if (!literal.isEmpty()) out.add(literal);
        });
        LOGGER.info("Found " + out.size() + " unique kanji characters in " + kanjidic);
        return out;
    }

    /**
     * Streams the elements of the top-level array field {@code arrayField} one tree at a time,
     * so multi-hundred-megabyte documents are never materialized whole.
     */
    static void streamArray(Path document, String arrayField, BiConsumer<Long, JsonNode> consumer) {
        ObjectMapper mapper = new ObjectMapper();
        JsonFactory factory = mapper.getFactory();
        try (InputStream in = Files.newInputStream(document);
             JsonParser parser = factory.createParser(in)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new IOException("Expected a JSON object at the top level");
            }
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String field = parser.getCurrentName();
                JsonToken value = parser.nextToken();
                if (arrayField.equals(field) && value == JsonToken.START_ARRAY) {
                    long index = 0;
                    while (parser.nextToken() != JsonToken.END_ARRAY) {
                        JsonNode node = mapper.readTree(parser);
                        consumer.accept(index++, node);
                    }
                    return;
                }
                parser.skipChildren();
            }
            throw new IOException("No \"" + arrayField + "\" array found");
        } catch (IOException e) {
            throw new PipelineIOException("read " + arrayField + " from", document, e);
        }
    }
}
