package com.saludsync.reps.dto;

import java.util.Iterator;
import java.util.List;

/**
 * A parsed export. Rows are buffered, so the table can be iterated any number of times.
 */
public final class RepsTable implements Iterable<RawRow> {

    private final String fileName;
    private final List<String> headers;
    private final List<RawRow> rows;

    public RepsTable(String fileName, List<String> headers, List<RawRow> rows) {
        this.fileName = fileName;
        this.headers = List.copyOf(headers);
        this.rows = List.copyOf(rows);
    }

    public String getFileName() { return fileName; }
    public List<String> getHeaders() { return headers; }
    public int size() { return rows.size(); }

    public List<RawRow> rows() { return rows; }

    @Override
    public Iterator<RawRow> iterator() {
        return rows.iterator();
    }
}
