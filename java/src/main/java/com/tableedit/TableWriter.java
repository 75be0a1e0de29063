package com.tableedit;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.extern.java.Log;

/**
 * Writes a table as delimited text for editing by hand.
 * <p>
 * Layout: header comments, header row, separator row of dashes, data rows, footer
 * comments. A cell is quoted only if it contains the delimiter, a newline, a carriage
 * return or the quote character; quotes inside it are doubled. This is the exact
 * inverse of {@link FieldTokenizer}.
 */
@Log
public class TableWriter {

    private final WriteOptions options;

    public TableWriter() {
        this(WriteOptions.defaults());
    }

    public TableWriter(WriteOptions options) {
        this.options = options;
    }

    public String write(TableSource table) {
        StringWriter out = new StringWriter();
        try {
            write(table, out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    public void write(TableSource table, Path path) throws IOException {
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(table, out);
        }
    }

    public void write(TableSource table, Writer out) throws IOException {
        DelimitedFormat format = options.format();
        String delim = format.delimiter();
        List<String> columns = table.columns();
        List<Row> rows = table.rows();
        int ncols = columns.size();

        for (String line : options.headerComments()) {
            writeComment(out, line);
        }

        List<String> headerCells = new ArrayList<>(ncols);
        for (String col : columns) {
            headerCells.add(escapeCell(col));
        }

        List<List<String>> rowCells = new ArrayList<>(rows.size());
        for (Row row : rows) {
            List<String> cells = new ArrayList<>(ncols);
            for (String col : columns) {
                cells.add(escapeCell(row.get(col)));
            }
            rowCells.add(cells);
        }

        int[] widths = new int[ncols];
        if (options.alignColumns() && options.writeHeader() && !rowCells.isEmpty() && !isSpaceDelimiter(delim)) {
            for (int i = 0; i < ncols; i++) {
                int max = DisplayWidth.of(headerCells.get(i));
                for (List<String> cells : rowCells) {
                    max = Math.max(max, DisplayWidth.of(cells.get(i)));
                }
                widths[i] = max;
            }
            pad(headerCells, widths);
            for (List<String> cells : rowCells) {
                pad(cells, widths);
            }
        }

        if (options.writeHeader()) {
            out.write(String.join(delim, headerCells));
            out.write('\n');
            if (options.headerSeparator()) {
                List<String> sep = new ArrayList<>(ncols);
                for (int width : widths) {
                    sep.add(width > 0 ? "-".repeat(width) : "-");
                }
                out.write(String.join(delim, sep));
                out.write('\n');
            }
        }

        for (List<String> cells : rowCells) {
            out.write(String.join(delim, cells));
            out.write('\n');
        }

        for (String line : options.effectiveFooter()) {
            writeComment(out, line);
        }
        out.flush();
        log.fine(() -> "Wrote " + rows.size() + " rows x " + ncols + " columns");
    }

    /**
     * Space padding would read back as extra delimiters.
     */
    private static boolean isSpaceDelimiter(String delim) {
        return delim.chars().allMatch(ch -> ch == ' ');
    }

    /**
     * Quotes {@code value} if the configured format requires it.
     */
    public String escapeCell(String value) {
        DelimitedFormat format = options.format();
        char q = format.quoteChar();
        boolean needQuote = value.contains(format.delimiter())
                || value.indexOf('\n') >= 0
                || value.indexOf('\r') >= 0
                || value.indexOf(q) >= 0;
        if (!needQuote) {
            return value;
        }
        String quote = String.valueOf(q);
        return quote + value.replace(quote, quote + quote) + quote;
    }

    private void writeComment(Writer out, String line) throws IOException {
        out.write(options.format().commentPrefix());
        if (!line.isEmpty()) {
            out.write(' ');
            out.write(line);
        }
        out.write('\n');
    }

    private static void pad(List<String> cells, int[] widths) {
        for (int i = 0; i < widths.length; i++) {
            cells.set(i, DisplayWidth.rightPad(cells.get(i), widths[i]));
        }
    }
}
