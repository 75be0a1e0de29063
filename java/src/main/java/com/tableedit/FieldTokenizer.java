package com.tableedit;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits one logical line into fields, honoring quoting and doubled-quote escapes.
 */
public final class FieldTokenizer {

    private FieldTokenizer() {}

    /**
     * The delimiter is matched literally at the cursor and may be longer than one
     * character. Inside quotes it has no meaning. The last field is always emitted:
     * a line without delimiters is one field, a trailing delimiter adds an empty field.
     */
    public static List<String> splitFields(String line, String delimiter, char quoteChar) {
        if (delimiter == null || delimiter.isEmpty()) {
            throw new IllegalArgumentException("Delimiter must not be empty");
        }
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuote = false;

        int n = line.length();
        int i = 0;
        while (i < n) {
            char c = line.charAt(i);
            if (inQuote) {
                if (c == quoteChar) {
                    if (i + 1 < n && line.charAt(i + 1) == quoteChar) {
                        current.append(quoteChar);
                        i += 2;
                        continue;
                    }
                    inQuote = false;
                } else {
                    current.append(c);
                }
                i++;
            } else if (c == quoteChar) {
                inQuote = true;
                i++;
            } else if (line.startsWith(delimiter, i)) {
                fields.add(current.toString());
                current.setLength(0);
                i += delimiter.length();
            } else {
                current.append(c);
                i++;
            }
        }
        fields.add(current.toString());
        return fields;
    }

    public static List<String> splitFields(String line, DelimitedFormat format) {
        return splitFields(line, format.delimiter(), format.quoteChar());
    }
}
