package com.saludsync.reps.dto;

import com.saludsync.reps.util.RepsColumns;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One untrusted data row from a REPS export, keyed by normalized header.
 * Nothing here is validated; {@code RowValidator} turns it into canonical data.
 */
public final class RawRow {

    private final int rowIndex;
    private final Map<String, String> cells;

    public RawRow(int rowIndex, Map<String, String> cells) {
        this.rowIndex = rowIndex;
        this.cells = Collections.unmodifiableMap(new LinkedHashMap<>(cells));
    }

    /** 1-based position among the data rows (the promoted header row is not counted). */
    public int getRowIndex() { return rowIndex; }

    public Map<String, String> getCells() { return cells; }

    /**
     * Raw value of a canonical column, resolved through its header aliases. The first non-blank alias wins;
     * null when none of the aliases is a column of this file.
     */
    public String get(String canonical) {
        String present = null;
        for (String alias : RepsColumns.aliasesOf(canonical)) {
            if (!cells.containsKey(alias)) continue;
            String v = cells.get(alias);
            if (v != null && !v.isBlank()) return v;
            if (present == null) present = v == null ? "" : v;
        }
        return present;
    }

    public boolean isBlank() {
        return cells.values().stream().allMatch(v -> v == null || v.isBlank());
    }

    @Override
    public String toString() {
        return "RawRow{" + rowIndex + ", " + cells + "}";
    }
}
