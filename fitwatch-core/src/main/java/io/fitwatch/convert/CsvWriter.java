package io.fitwatch.convert;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal RFC 4180 CSV writer bound to a fixed {@link CsvHeader}.
 *
 * <p>The header row is written on construction and cannot change afterwards. Rows are
 * maps keyed by column name; keys outside the header are ignored and absent keys yield
 * empty cells. Lines end with {@code \r\n}.
 *
 * <p>Not thread-safe.
 */
public final class CsvWriter implements Closeable {
    private static final String LINE_END = "\r\n";

    private final Writer out;
    private final List<String> columns;
    private int rowsWritten;

    public CsvWriter(Writer out, CsvHeader header) throws IOException {
        this.out = Objects.requireNonNull(out, "out");
        this.columns = Objects.requireNonNull(header, "header").columns();
        writeLine(columns.toArray());
    }

    /**
     * Creates or truncates {@code path} and writes the header row.
     */
    public static CsvWriter open(Path path, CsvHeader header) throws IOException {
        BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
        try {
            return new CsvWriter(writer, header);
        } catch (IOException | RuntimeException e) {
            writer.close();
            throw e;
        }
    }

    public void writeRow(Map<String, ?> row) throws IOException {
        Object[] cells = new Object[columns.size()];
        for (int i = 0; i < cells.length; i++) {
            cells[i] = row.get(columns.get(i));
        }
        writeLine(cells);
        rowsWritten++;
    }

    public int rowsWritten() {
        return rowsWritten;
    }

    @Override
    public void close() throws IOException {
        out.close();
    }

    private void writeLine(Object[] cells) throws IOException {
        for (int i = 0; i < cells.length; i++) {
            if (i > 0) {
                out.write(',');
            }
            out.write(escape(render(cells[i])));
        }
        out.write(LINE_END);
    }

    static String render(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Object[] array) {
            return Arrays.toString(array);
        }
        if (value instanceof byte[] bytes) {
            return Arrays.toString(bytes);
        }
        return value.toString();
    }

    static String escape(String cell) {
        boolean quote = false;
        for (int i = 0; i < cell.length(); i++) {
            char c = cell.charAt(i);
            if (c == ',' || c == '"' || c == '\r' || c == '\n') {
                quote = true;
                break;
            }
        }
        if (!quote) {
            return cell;
        }
        return '"' + cell.replace("\"", "\"\"") + '"';
    }
}
