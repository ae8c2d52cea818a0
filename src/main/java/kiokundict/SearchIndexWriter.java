package kiokundict;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.logging.Logger;

/**
 * Writes search-index rows in a bulk-load format.
 *
 * <p>Every text value goes through the format's escaping; a definition containing the
 * delimiter, a quote or a line break must never split or corrupt a row.</p>
 */
public abstract class SearchIndexWriter {
    private static final Logger LOGGER = Logger.getLogger(SearchIndexWriter.class.getName());

    static final String[] COLUMNS = {"word", "language", "definition", "pronunciation", "is_common"};

    /**
     * Writes all rows to {@code out}.
     */
    public abstract void write(List<SearchIndexRow> rows, Writer out) throws IOException;

    /**
     * Writes all rows to {@code path}, replacing the previous file only after the new one is
     * complete.
     *
     * @throws PipelineIOException if the file cannot be written
     */
    public void writeTo(List<SearchIndexRow> rows, Path path) {
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (BufferedWriter w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                write(rows, w);
            }
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new PipelineIOException("write search index", path, e);
        }
        LOGGER.info("Wrote " + rows.size() + " search index rows to " + path);
    }

    public static SearchIndexWriter forFormat(SearchIndexFormat format, String table, int batchSize) {
        switch (format) {
            case CSV:
                return new Csv();
            case SQL:
                return new Sql(table, batchSize);
            default:
                throw new IllegalArgumentException("Unsupported format: " + format);
        }
    }

    /**
     * Quotes a field when it contains a comma, quote, CR or LF; embedded quotes are doubled.
     */
    public static String escapeCsv(String field) {
        if (field.indexOf(',') < 0 && field.indexOf('"') < 0
                && field.indexOf('\n') < 0 && field.indexOf('\r') < 0) {
            return field;
        }
        return '"' + field.replace("\"", "\"\"") + '"';
    }

    /**
     * @return {@code field} as a single-quoted SQL string literal with quotes doubled
     */
    public static String quoteSql(String field) {
        return '\'' + field.replace("'", "''") + '\'';
    }

    static final class Csv extends SearchIndexWriter {
        @Override
        public void write(List<SearchIndexRow> rows, Writer out) throws IOException {
            out.write(String.join(",", COLUMNS));
            out.write('\n');
            for (SearchIndexRow r : rows) {
                out.write(escapeCsv(r.getWord()));
                out.write(',');
                out.write(r.getLanguage().getColumn());
                out.write(',');
                out.write(escapeCsv(r.getDefinition()));
                out.write(',');
                out.write(escapeCsv(r.getPronunciation()));
                out.write(',');
                out.write(r.isCommon() ? '1' : '0');
                out.write('\n');
            }
        }
    }

    static final class Sql extends SearchIndexWriter {
        private final String table;
        private final int batchSize;

        Sql(String table, int batchSize) {
            if (!table.matches("[A-Za-z_][A-Za-z0-9_]*")) {
                throw new IllegalArgumentException("Invalid SQL table name: " + table);
            }
            if (batchSize < 1) {
                throw new IllegalArgumentException("SQL batch size must be positive: " + batchSize);
            }
            this.table = table;
            this.batchSize = batchSize;
        }

        @Override
        public void write(List<SearchIndexRow> rows, Writer out) throws IOException {
            String head = "INSERT INTO " + table + " (" + String.join(", ", COLUMNS) + ") VALUES\n";
            for (int start = 0; start < rows.size(); start += batchSize) {
                int end = Math.min(start + batchSize, rows.size());
                out.write(head);
                for (int i = start; i < end; i++) {
                    SearchIndexRow r = rows.get(i);
                    out.write("(" + quoteSql(r.getWord()) + ", " + quoteSql(r.getLanguage().getColumn()) + ", "
                            + quoteSql(r.getDefinition()) + ", " + quoteSql(r.getPronunciation()) + ", "
                            + (r.isCommon() ? 1 : 0) + ")");
                    out.write(i + 1 < end ? ",\n" : ";\n");
                }
            }
        }
    }
}
