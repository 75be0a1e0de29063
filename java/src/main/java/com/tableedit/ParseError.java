package com.tableedit;

/**
 * A single parse or validation error.
 * <p>
 * {@code line} is 1-based, or 0 for errors that concern the whole call rather than the
 * document. The column is either positional ({@code columnIndex}, 1-based) or named
 * ({@code columnName}); exactly one of the two is set.
 */
public record ParseError(
        ErrorKind kind,
        int line,
        int columnIndex,
        String columnName,
        String message) {

    public static ParseError at(ErrorKind kind, int line, int columnIndex, String message) {
        return new ParseError(kind, line, columnIndex, null, message);
    }

    public static ParseError at(ErrorKind kind, int line, String columnName, String message) {
        return new ParseError(kind, line, 0, columnName, message);
    }

    public boolean isColumnScoped() {
        return columnName != null;
    }

    /**
     * The column as shown to a user: the name if the error is column-scoped, else the index.
     */
    public String column() {
        return columnName != null ? columnName : Integer.toString(columnIndex);
    }

    @Override
    public String toString() {
        return "line " + line + ", column " + column() + ": " + message;
    }
}
