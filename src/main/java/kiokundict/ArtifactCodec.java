package kiokundict;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * Canonical serialization and raw-deflate compression of {@link UnifiedEntry} artifacts.
 *
 * <p>The compressed form is a bare deflate stream (RFC 1951) with no zlib or gzip wrapper,
 * which is what the serving side inflates. The serialized form is compact UTF-8 JSON with
 * fixed property order and map keys sorted, so equal entries always produce equal bytes.</p>
 */
public final class ArtifactCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.INDENT_OUTPUT);

    private ArtifactCodec() {
    }

    public static byte[] serialize(UnifiedEntry entry) {
        try {
            return MAPPER.writeValueAsBytes(entry);
        } catch (JsonProcessingException e) {
            throw new DictionaryPipelineException("Failed to serialize entry '" + entry.getWord() + "'", e);
        }
    }

    public static UnifiedEntry parse(byte[] json) throws IOException {
        return MAPPER.readValue(json, UnifiedEntry.class);
    }

    /**
     * @param data  uncompressed bytes
     * @param level 0-9
     * @return raw deflate stream
     */
    public static byte[] deflate(byte[] data, int level) {
        Deflater deflater = new Deflater(level, true);
        try {
            deflater.setInput(data);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, data.length / 2));
            byte[] buf = new byte[8192];
            while (!deflater.finished()) {
                int n = deflater.deflate(buf);
                out.write(buf, 0, n);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    /**
     * @param compressed raw deflate stream
     * @return inflated bytes
     * @throws DataFormatException if the stream is corrupt, truncated or zlib/gzip wrapped
     */
    public static byte[] inflate(byte[] compressed) throws DataFormatException {
        Inflater inflater = new Inflater(true);
        try {
            // nowrap mode wants one extra dummy byte after the stream
            inflater.setInput(Arrays.copyOf(compressed, compressed.length + 1));
            ByteArrayOutputStream out = new ByteArrayOutputStream(compressed.length * 4);
            byte[] buf = new byte[8192];
            while (!inflater.finished()) {
                int n = inflater.inflate(buf);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new DataFormatException("Truncated deflate stream");
                }
                out.write(buf, 0, n);
            }
            return out.toByteArray();
        } finally {
            inflater.end();
        }
    }

    public static byte[] encode(UnifiedEntry entry, int level) {
        return deflate(serialize(entry), level);
    }

    public static UnifiedEntry decode(byte[] compressed) throws IOException, DataFormatException {
        return parse(inflate(compressed));
    }
}
