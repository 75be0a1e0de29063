package com.tableedit;

import java.util.List;

/**
 * Anything that yields ordered column names and an ordered sequence of string rows.
 * See {@link TableSources} for adapters over common in-memory shapes.
 */
public interface TableSource {

    List<String> columns();

    List<Row> rows();
}
