package com.tableedit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.extern.java.Log;

/**
 * Parses delimited text back into a table.
 * <p>
 * Comment lines (comment prefix after leading whitespace) and blank lines are skipped
 * everywhere. The first other line is the header and fixes the column count. A data
 * line with the wrong field count is reported and skipped; parsing goes on. A line
 * whose fields are all empty or all dashes is the header separator and is dropped.
 */
@Log
public class TableParser {

    static final String NO_HEADER = "No header line found (only comments or empty lines)";

    private final DelimitedFormat format;

    public TableParser() {
        this(DelimitedFormat.DEFAULT);
    }

    public TableParser(DelimitedFormat format) {
        this.format = format;
    }

    public ParseResult parse(Path file) throws IOException {
        log.fine(() -> "Parsing " + file);
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    public ParseResult parse(String text) {
        LineSplitter.LogicalLines logical = LineSplitter.split(text, format.quoteChar());
        if (logical.hasUnterminatedQuote()) {
            log.warning(() -> "Quoted field opened on line " + logical.unterminatedQuoteLine()
                    + " is never closed; the rest of the document is read as one line");
        }
        List<String> lines = logical.lines();

        int headerIdx = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (!isSkippable(lines.get(i))) {
                headerIdx = i;
                break;
            }
        }
        if (headerIdx < 0) {
            return new ParseResult(List.of(), List.of(),
                    List.of(ParseError.at(ErrorKind.DOCUMENT, 1, 1, NO_HEADER)));
        }

        List<String> columns = new ArrayList<>();
        for (String col : FieldTokenizer.splitFields(lines.get(headerIdx), format)) {
            columns.add(col.strip());
        }
        int ncols = columns.size();

        List<Row> rows = new ArrayList<>();
        List<ParseError> errors = new ArrayList<>();
        for (int i = headerIdx + 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (isSkippable(line)) {
                continue;
            }
            int lineNum = i + 1;
            List<String> parts = FieldTokenizer.splitFields(line, format);
            if (parts.size() != ncols) {
                errors.add(ParseError.at(ErrorKind.ROW_SHAPE, lineNum, 1,
                        "Expected " + ncols + " columns, got " + parts.size()));
                continue;
            }
            if (isSeparator(parts)) {
                continue;
            }
            List<String> values = new ArrayList<>(ncols);
            for (String part : parts) {
                values.add(part.strip());
            }
            rows.add(Row.of(columns, values));
        }

        log.fine(() -> "Parsed " + rows.size() + " rows, " + errors.size() + " errors, columns " + columns);
        return new ParseResult(columns, rows, errors);
    }

    private boolean isSkippable(String line) {
        String stripped = line.stripLeading();
        return stripped.isEmpty() || stripped.startsWith(format.commentPrefix());
    }

    private static boolean isSeparator(List<String> parts) {
        for (String part : parts) {
            String s = part.strip();
            for (int i = 0; i < s.length(); i++) {
                if (s.charAt(i) != '-') {
                    return false;
                }
            }
        }
        return true;
    }
}
