package com.tableedit;

import java.util.List;

/**
 * Serializer settings. {@code footerComments} of {@code null} means "no explicit footer":
 * the default footer is then written if {@code defaultFooter} is set.
 */
public record WriteOptions(
        DelimitedFormat format,
        List<String> headerComments,
        List<String> footerComments,
        boolean defaultFooter,
        boolean writeHeader,
        boolean headerSeparator,
        boolean alignColumns) {

    public WriteOptions {
        if (format == null) {
            format = DelimitedFormat.DEFAULT;
        }
        headerComments = headerComments == null ? List.of() : List.copyOf(headerComments);
        footerComments = footerComments == null ? null : List.copyOf(footerComments);
    }

    public static WriteOptions defaults() {
        return new WriteOptions(DelimitedFormat.DEFAULT, List.of(), null, true, true, true, true);
    }

    /**
     * Plain output: no comments, no separator line, no padding.
     */
    public static WriteOptions plain(DelimitedFormat format) {
        return new WriteOptions(format, List.of(), null, false, true, false, false);
    }

    public WriteOptions withFormat(DelimitedFormat format) {
        return new WriteOptions(format, headerComments, footerComments, defaultFooter, writeHeader,
                headerSeparator, alignColumns);
    }

    public WriteOptions withHeaderComments(List<String> headerComments) {
        return new WriteOptions(format, headerComments, footerComments, defaultFooter, writeHeader,
                headerSeparator, alignColumns);
    }

    public WriteOptions withFooterComments(List<String> footerComments) {
        return new WriteOptions(format, headerComments, footerComments, defaultFooter, writeHeader,
                headerSeparator, alignColumns);
    }

    public WriteOptions withDefaultFooter(boolean defaultFooter) {
        return new WriteOptions(format, headerComments, footerComments, defaultFooter, writeHeader,
                headerSeparator, alignColumns);
    }

    public WriteOptions withWriteHeader(boolean writeHeader) {
        return new WriteOptions(format, headerComments, footerComments, defaultFooter, writeHeader,
                headerSeparator, alignColumns);
    }

    public WriteOptions withHeaderSeparator(boolean headerSeparator) {
        return new WriteOptions(format, headerComments, footerComments, defaultFooter, writeHeader,
                headerSeparator, alignColumns);
    }

    public WriteOptions withAlignColumns(boolean alignColumns) {
        return new WriteOptions(format, headerComments, footerComments, defaultFooter, writeHeader,
                headerSeparator, alignColumns);
    }

    /**
     * Footer lines to write, without the comment prefix.
     */
    List<String> effectiveFooter() {
        if (footerComments != null) {
            return footerComments;
        }
        if (!defaultFooter) {
            return List.of();
        }
        return List.of(
                "",
                "Empty fields: leave cell empty, or use \"\" inside quoted fields.",
                "Lines starting with " + format.commentPrefix() + " are ignored. Edit data rows above.");
    }
}
