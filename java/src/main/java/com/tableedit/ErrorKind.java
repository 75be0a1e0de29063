package com.tableedit;

/**
 * Classifies a {@link ParseError} by the stage and scope that produced it.
 */
public enum ErrorKind {
    /** No header line found; the whole parse produced nothing. */
    DOCUMENT,
    /** A data line's field count does not match the header. The line was skipped. */
    ROW_SHAPE,
    /** Required column missing, duplicate key or a value that fails its column type. */
    VALIDATION,
    /** A return mode was requested without the inputs it needs. */
    CONFIGURATION
}
