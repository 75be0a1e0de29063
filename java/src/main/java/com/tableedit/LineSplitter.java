package com.tableedit;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits document text into logical lines. A newline inside a quoted field is content,
 * not a line break. Quote characters are kept so {@link FieldTokenizer} can see them.
 */
public final class LineSplitter {

    /**
     * Logical lines of a document. {@code unterminatedQuoteLine} is the 1-based logical
     * line on which a quoted region was opened and never closed, or 0.
     */
    public record LogicalLines(List<String> lines, int unterminatedQuoteLine) {

        public boolean hasUnterminatedQuote() {
            return unterminatedQuoteLine > 0;
        }
    }

    private LineSplitter() {}

    public static List<String> splitLogicalLines(String content, char quoteChar) {
        return split(content, quoteChar).lines();
    }

    /**
     * Strips every {@code \r}, then splits on newlines outside quotes. The last buffer is
     * always emitted, so text ending in a newline yields a trailing empty line.
     */
    public static LogicalLines split(String content, char quoteChar) {
        String text = content.replace("\r", "");
        List<String> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuote = false;
        int quoteOpenedOn = 0;

        int n = text.length();
        int i = 0;
        while (i < n) {
            char c = text.charAt(i);
            if (inQuote) {
                if (c == quoteChar) {
                    if (i + 1 < n && text.charAt(i + 1) == quoteChar) {
                        // escaped quote, both characters pass through
                        current.append(quoteChar).append(quoteChar);
                        i += 2;
                        continue;
                    }
                    current.append(quoteChar);
                    inQuote = false;
                } else {
                    current.append(c);
                }
            } else if (c == quoteChar) {
                current.append(quoteChar);
                inQuote = true;
                quoteOpenedOn = lines.size() + 1;
            } else if (c == '\n') {
                lines.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
            i++;
        }
        lines.add(current.toString());
        return new LogicalLines(lines, inQuote ? quoteOpenedOn : 0);
    }
}
