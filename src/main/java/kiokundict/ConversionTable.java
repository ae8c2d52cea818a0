package kiokundict;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * One OpenCC-format conversion dictionary: every source phrase with its ranked targets,
 * plus the shortest and longest key length.
 *
 * <p>File format rules:</p>
 * <ul>
 *   <li>Each line contains a source phrase, a TAB, and one or more space-separated targets.
 *       The first target is the conversion; the rest are kept as alternatives
 *       (jp2t lists e.g. {@code 気<TAB>氣 気}).</li>
 *   <li>Blank lines and lines starting with {@code #} or {@code //} are ignored.</li>
 *   <li>A leading BOM ({@code U+FEFF}) on the first line is stripped.</li>
 *   <li>A key defined twice keeps its later definition; both lines are reported.</li>
 * </ul>
 *
 * <p>Key lengths are measured in UTF-16 code units, so a surrogate pair counts as two.</p>
 */
public final class ConversionTable {
    private static final Logger LOGGER = Logger.getLogger(ConversionTable.class.getName());

    private final String origin;
    private final Map<String, List<String>> targets;
    private final int maxLength;
    private final int minLength;
    private final int rejectedLines;

    private ConversionTable(String origin, Map<String, List<String>> targets, int rejectedLines) {
        this.origin = origin;
        this.rejectedLines = rejectedLines;
        this.targets = Collections.unmodifiableMap(new HashMap<>(targets));
        int max = 0;
        int min = targets.isEmpty() ? 0 : Integer.MAX_VALUE;
        for (String key : targets.keySet()) {
            max = Math.max(max, key.length());
            min = Math.min(min, key.length());
        }
        this.maxLength = max;
        this.minLength = min;
    }

    /**
     * @return the preferred target for {@code key}, or {@code null} if the key is not defined
     */
    public String get(String key) {
        List<String> t = targets.get(key);
        return t == null ? null : t.get(0);
    }

    /**
     * @return every target listed for {@code key}, preferred first; empty if undefined
     */
    public List<String> candidates(String key) {
        List<String> t = targets.get(key);
        return t == null ? Collections.emptyList() : t;
    }

    /**
     * @return number of keys that list more than one target
     */
    public int ambiguousKeyCount() {
        int n = 0;
        for (List<String> t : targets.values()) {
            if (t.size() > 1) n++;
        }
        return n;
    }

    public String getOrigin() {
        return origin;
    }

    public int getMaxLength() {
        return maxLength;
    }

    public int getMinLength() {
        return minLength;
    }

    public int size() {
        return targets.size();
    }

    /**
     * @return number of non-comment lines skipped because they lacked a key or a target
     */
    public int getRejectedLines() {
        return rejectedLines;
    }

    /**
     * Loads {@code basePath/filename} from the filesystem, falling back to the classpath
     * resource {@code /basePath/filename}.
     *
     * @throws PipelineIOException if neither location provides the file
     */
    public static ConversionTable load(String basePath, String filename) {
        Path fsPath = Paths.get(basePath, filename);
        try {
            if (Files.exists(fsPath)) {
                try (BufferedReader br = Files.newBufferedReader(fsPath, StandardCharsets.UTF_8)) {
                    return parse(br, fsPath.toString());
                }
            }
            String resPath = "/" + basePath + "/" + filename;
            try (InputStream in = ConversionTable.class.getResourceAsStream(resPath)) {
                if (in == null) {
                    throw new FileNotFoundException("Missing resource: " + resPath
                            + " (also checked FS: " + fsPath.toAbsolutePath() + ")");
                }
                try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                    return parse(br, "classpath:" + resPath);
                }
            }
        } catch (IOException e) {
            throw new PipelineIOException("load conversion dictionary", fsPath, e);
        }
    }

    static ConversionTable parse(BufferedReader br, String origin) throws IOException {
        Map<String, List<String>> targets = new HashMap<>();
        Map<String, Integer> definedAt = new HashMap<>();
        int lineNo = 0;
        int rejected = 0;

        for (String raw; (raw = br.readLine()) != null; ) {
            lineNo++;
            String line = (lineNo == 1 && raw.startsWith("\uFEFF") ? raw.substring(1) : raw).trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith("//")) continue;

            String[] columns = line.split("\t", 2);
            String key = columns[0].trim();
            List<String> values = columns.length < 2 ? List.of() : tokens(columns[1]);
            if (key.isEmpty() || values.isEmpty()) {
                LOGGER.warning(origin + ":" + lineNo + ": expected '<source>\\t<target> [alternatives...]', got '"
                        + raw + "'");
                rejected++;
                continue;
            }

            Integer previous = definedAt.put(key, lineNo);
            if (previous != null) {
                LOGGER.warning(origin + ":" + lineNo + ": '" + key + "' redefined (first at line " + previous
                        + "); keeping this definition");
            }
            targets.put(key, Collections.unmodifiableList(values));
        }

        ConversionTable table = new ConversionTable(origin, targets, rejected);
        LOGGER.fine(origin + ": " + table.size() + " keys, " + table.ambiguousKeyCount() + " with alternatives, "
                + rejected + " lines rejected");
        return table;
    }

    private static List<String> tokens(String column) {
        String trimmed = column.trim();
        if (trimmed.isEmpty()) return List.of();
        return new ArrayList<>(Arrays.asList(trimmed.split("[ \t]+")));
    }

    @Override
    public String toString() {
        return "<ConversionTable " + origin + ": " + targets.size() + " keys, lengths "
                + minLength + "-" + maxLength + ">";
    }
}
