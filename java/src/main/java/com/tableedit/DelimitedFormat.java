package com.tableedit;

/**
 * Delimiter, comment prefix and quote character shared by the writer and the parser.
 * Defaults: tab, {@code #}, {@code "}.
 */
public record DelimitedFormat(String delimiter, String commentPrefix, char quoteChar) {

    public static final String DEFAULT_DELIMITER = "\t";
    public static final String DEFAULT_COMMENT_PREFIX = "#";
    public static final char DEFAULT_QUOTE = '"';

    public static final DelimitedFormat DEFAULT =
            new DelimitedFormat(DEFAULT_DELIMITER, DEFAULT_COMMENT_PREFIX, DEFAULT_QUOTE);

    public DelimitedFormat {
        if (delimiter == null || delimiter.isEmpty()) {
            throw new IllegalArgumentException("Delimiter must not be empty");
        }
        if (delimiter.indexOf(quoteChar) >= 0 || delimiter.indexOf('\n') >= 0) {
            throw new IllegalArgumentException(
                    "Delimiter must not contain the quote character or a newline: " + delimiter);
        }
        if (commentPrefix == null || commentPrefix.isEmpty()) {
            throw new IllegalArgumentException("Comment prefix must not be empty");
        }
    }

    public DelimitedFormat withDelimiter(String delimiter) {
        return new DelimitedFormat(delimiter, commentPrefix, quoteChar);
    }

    public DelimitedFormat withCommentPrefix(String commentPrefix) {
        return new DelimitedFormat(delimiter, commentPrefix, quoteChar);
    }

    public DelimitedFormat withQuoteChar(char quoteChar) {
        return new DelimitedFormat(delimiter, commentPrefix, quoteChar);
    }
}
