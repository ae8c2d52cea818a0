package kiokundict;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Parses a dictionary dump into entities and builds the spelling index.
 *
 * <p>Two serialized forms are accepted:</p>
 * <ul>
 *   <li><b>JSON Lines</b> ({@code *.jsonl}): one record per line. A line that fails to parse,
 *       including one that is not valid UTF-8, is logged and skipped; loading continues with
 *       the next line.</li>
 *   <li><b>Whole document</b>: either a top-level array of records or an object holding the
 *       records under {@link #documentArrayField()}. Records are bound one at a time, so a
 *       record that does not fit the schema is skipped; a document that is not valid JSON
 *       at all cannot be resynchronized and fails the load.</li>
 * </ul>
 *
 * @param <T> entry type
 */
public abstract class CorpusLoader<T> {
    private static final Logger LOGGER = Logger.getLogger(CorpusLoader.class.getName());

    /**
     * Malformed records beyond this many are counted but not logged individually.
     */
    static final int MAX_LOGGED_MALFORMED = 20;

    /**
     * Progress is logged every this many records.
     */
    private static final int PROGRESS_INTERVAL = 10_000;

    protected final ObjectMapper mapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

    /**
     * @return the entity class records are bound to
     */
    protected abstract Class<T> entryType();

    /**
     * @return the field of a whole-document object that holds the records
     */
    protected abstract String documentArrayField();

    /**
     * @param entry a bound entry
     * @return every spelling under which the entry must be findable
     */
    protected abstract Collection<String> spellings(T entry);

    /**
     * Checks constraints the JSON binding cannot express.
     *
     * @param entry a bound entry
     * @return an error message, or {@code null} if the entry is acceptable
     */
    protected String validate(T entry) {
        return null;
    }

    /**
     * Loads a corpus file, choosing the format from its extension.
     *
     * @param path corpus file
     * @return the parsed corpus
     * @throws PipelineIOException if the file is missing, unreadable or not JSON at all
     */
    public LoadedCorpus<T> load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new PipelineIOException("open corpus", path,
                    new FileNotFoundException("No such corpus file"));
        }
        String name = path.getFileName().toString().toLowerCase();
        Accumulator acc = new Accumulator(path);
        try {
            if (name.endsWith(".jsonl") || name.endsWith(".ndjson")) {
                try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
                    readLineBytes(in, acc);
                }
            } else {
                try (InputStream in = Files.newInputStream(path)) {
                    readDocument(in, acc);
                }
            }
        } catch (IOException e) {
            throw new PipelineIOException("read corpus", path, e);
        }
        return acc.finish();
    }

    /**
     * Loads JSON Lines records from a reader.
     *
     * @param reader record source
     * @param label  name used in diagnostics; may be {@code null}
     * @return the parsed corpus
     * @throws IOException if reading fails
     */
    public LoadedCorpus<T> loadLines(BufferedReader reader, Path label) throws IOException {
        Accumulator acc = new Accumulator(label);
        readLines(reader, acc);
        return acc.finish();
    }

    /**
     * Builds a corpus from entities that are already in memory.
     */
    public LoadedCorpus<T> fromEntries(List<T> entries) {
        Accumulator acc = new Accumulator(null);
        for (T entry : entries) {
            acc.accept(entry, acc.seen + 1);
        }
        return acc.finish();
    }

    private void readLines(BufferedReader br, Accumulator acc) throws IOException {
        long lineNo = 0;
        for (String line; (line = br.readLine()) != null; ) {
            lineNo++;
            if (line.trim().isEmpty()) continue;
            try {
                acc.accept(mapper.readValue(line, entryType()), lineNo);
            } catch (JsonProcessingException | RuntimeException e) {
                acc.malformed(lineNo, e);
            }
        }
    }

    /**
     * Splits on LF without decoding, so each line's bytes reach Jackson's own UTF-8 decoder
     * and an encoding error stays confined to its line.
     */
    private void readLineBytes(InputStream in, Accumulator acc) throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream(4096);
        long lineNo = 0;
        for (int b; (b = in.read()) != -1; ) {
            if (b == '\n') {
                parseLine(line.toByteArray(), ++lineNo, acc);
                line.reset();
            } else {
                line.write(b);
            }
        }
        if (line.size() > 0) {
            parseLine(line.toByteArray(), ++lineNo, acc);
        }
    }

    private void parseLine(byte[] bytes, long lineNo, Accumulator acc) {
        if (isBlank(bytes)) return;
        try {
            acc.accept(mapper.readValue(bytes, entryType()), lineNo);
        } catch (IOException | RuntimeException e) {
            acc.malformed(lineNo, e);
        }
    }

    private static boolean isBlank(byte[] bytes) {
        for (byte b : bytes) {
            if (b != ' ' && b != '\t' && b != '\r') return false;
        }
        return true;
    }

    private void readDocument(InputStream in, Accumulator acc) throws IOException {
        try (JsonParser parser = mapper.getFactory().createParser(in)) {
            JsonToken first = parser.nextToken();
            if (first == JsonToken.START_ARRAY) {
                readArray(parser, acc);
                return;
            }
            if (first != JsonToken.START_OBJECT) {
                throw new IOException("Expected a JSON array or object at the top level");
            }
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String field = parser.getCurrentName();
                JsonToken value = parser.nextToken();
                if (documentArrayField().equals(field) && value == JsonToken.START_ARRAY) {
                    readArray(parser, acc);
                    return;
                }
                parser.skipChildren();
            }
            throw new IOException("No \"" + documentArrayField() + "\" array found");
        }
    }

    private void readArray(JsonParser parser, Accumulator acc) throws IOException {
        long recordNo = 0;
        while (parser.nextToken() != JsonToken.END_ARRAY) {
            recordNo++;
            JsonNode node = mapper.readTree(parser);
            try {
                acc.accept(mapper.treeToValue(node, entryType()), recordNo);
            } catch (JsonProcessingException | RuntimeException e) {
                acc.malformed(recordNo, e);
            }
        }
    }

    /**
     * Collects entries and index for one load.
     */
    private final class Accumulator {
        private final Path source;
        private final List<T> entries = new ArrayList<>();
        private final Map<String, List<T>> index = new LinkedHashMap<>();
        private long malformed;
        private long seen;

        Accumulator(Path source) {
            this.source = source;
        }

        void accept(T entry, long recordNo) {
            seen++;
            String problem = validate(entry);
            if (problem != null) {
                malformed(recordNo, new IllegalArgumentException(problem));
                return;
            }
            entries.add(entry);
            for (String spelling : new LinkedHashSet<>(spellings(entry))) {
                index.computeIfAbsent(spelling, k -> new ArrayList<>()).add(entry);
            }
            if (entries.size() % PROGRESS_INTERVAL == 0) {
                LOGGER.info("Loaded " + entries.size() + " " + entryType().getSimpleName() + " records...");
            }
        }

        void malformed(long recordNo, Exception cause) {
            malformed++;
            MalformedRecordException ex = new MalformedRecordException(source, recordNo,
                    firstLine(cause.getMessage()), cause);
            if (malformed <= MAX_LOGGED_MALFORMED) {
                LOGGER.log(Level.WARNING, "Skipping malformed record: " + ex.getMessage());
            } else if (malformed == MAX_LOGGED_MALFORMED + 1) {
                LOGGER.warning("Further malformed records in " + source + " are counted but not logged");
            }
        }

        LoadedCorpus<T> finish() {
            LOGGER.info("Loaded " + entries.size() + " " + entryType().getSimpleName()
                    + " records from " + source + " (" + malformed + " malformed)");
            return new LoadedCorpus<>(source, entries, index, malformed);
        }
    }

    private static String firstLine(String message) {
        if (message == null) return "unparseable record";
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }
}
