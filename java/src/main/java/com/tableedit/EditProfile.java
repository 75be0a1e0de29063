package com.tableedit;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named set of edit settings as read from YAML. Unset values fall back to the defaults
 * of {@link DelimitedFormat} and {@link WriteOptions}.
 */
public class EditProfile {
    private String delimiter;
    private String commentPrefix;
    private String quoteChar;
    private List<String> headerComments;
    private List<String> footerComments;
    private boolean defaultFooter = true;
    private boolean writeHeader = true;
    private boolean headerSeparator = true;
    private boolean alignColumns = true;
    private List<String> requiredColumns;
    private List<String> keyColumns;
    private Map<String, String> columnTypes;
    private String returnMode;
    private String editor;

    public EditProfile() {
    }

    public String delimiter() {
        return delimiter;
    }

    public void setDelimiter(String delimiter) {
        this.delimiter = delimiter;
    }

    public String commentPrefix() {
        return commentPrefix;
    }

    public void setCommentPrefix(String commentPrefix) {
        this.commentPrefix = commentPrefix;
    }

    public String quoteChar() {
        return quoteChar;
    }

    public void setQuoteChar(String quoteChar) {
        this.quoteChar = quoteChar;
    }

    public List<String> headerComments() {
        return headerComments;
    }

    public void setHeaderComments(List<String> headerComments) {
        this.headerComments = headerComments;
    }

    public List<String> footerComments() {
        return footerComments;
    }

    public void setFooterComments(List<String> footerComments) {
        this.footerComments = footerComments;
    }

    public boolean defaultFooter() {
        return defaultFooter;
    }

    public void setDefaultFooter(boolean defaultFooter) {
        this.defaultFooter = defaultFooter;
    }

    public boolean writeHeader() {
        return writeHeader;
    }

    public void setWriteHeader(boolean writeHeader) {
        this.writeHeader = writeHeader;
    }

    public boolean headerSeparator() {
        return headerSeparator;
    }

    public void setHeaderSeparator(boolean headerSeparator) {
        this.headerSeparator = headerSeparator;
    }

    public boolean alignColumns() {
        return alignColumns;
    }

    public void setAlignColumns(boolean alignColumns) {
        this.alignColumns = alignColumns;
    }

    public List<String> requiredColumns() {
        return requiredColumns;
    }

    public void setRequiredColumns(List<String> requiredColumns) {
        this.requiredColumns = requiredColumns;
    }

    public List<String> keyColumns() {
        return keyColumns;
    }

    public void setKeyColumns(List<String> keyColumns) {
        this.keyColumns = keyColumns;
    }

    public Map<String, String> columnTypes() {
        return columnTypes;
    }

    public void setColumnTypes(Map<String, String> columnTypes) {
        this.columnTypes = columnTypes;
    }

    public String returnMode() {
        return returnMode;
    }

    public void setReturnMode(String returnMode) {
        this.returnMode = returnMode;
    }

    public String editor() {
        return editor;
    }

    public void setEditor(String editor) {
        this.editor = editor;
    }

    public DelimitedFormat toFormat() {
        DelimitedFormat format = DelimitedFormat.DEFAULT;
        if (delimiter != null) {
            format = format.withDelimiter(delimiter);
        }
        if (commentPrefix != null) {
            format = format.withCommentPrefix(commentPrefix);
        }
        if (quoteChar != null) {
            if (quoteChar.length() != 1) {
                throw new IllegalArgumentException("Quote character must be a single character: " + quoteChar);
            }
            format = format.withQuoteChar(quoteChar.charAt(0));
        }
        return format;
    }

    public WriteOptions toWriteOptions() {
        return new WriteOptions(toFormat(), headerComments, footerComments, defaultFooter, writeHeader,
                headerSeparator, alignColumns);
    }

    public ValidationRules toRules() {
        Map<String, ColumnType> types = null;
        if (columnTypes != null) {
            types = new LinkedHashMap<>();
            for (Map.Entry<String, String> entry : columnTypes.entrySet()) {
                types.put(entry.getKey(), ColumnType.named(entry.getValue()));
            }
        }
        return new ValidationRules(requiredColumns, keyColumns, types);
    }

    /**
     * Everything but the original table and the destination, which are per run.
     */
    public EditOptions toEditOptions() {
        ReturnMode mode = returnMode == null ? ReturnMode.FULL : ReturnMode.parse(returnMode);
        return new EditOptions(toWriteOptions(), toRules(), null, mode, null);
    }
}
