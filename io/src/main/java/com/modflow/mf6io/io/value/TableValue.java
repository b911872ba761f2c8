package com.modflow.mf6io.io.value;

import java.util.ArrayList;
import java.util.List;

/** Rows of a list-input parameter ({@code recarray}), one {@link RecordValue} per input line. */
public final class TableValue {
    private final List<String> columns;
    private final List<RecordValue> rows;

    public TableValue(List<String> columns, List<RecordValue> rows) {
        this.columns = List.copyOf(columns);
        this.rows = List.copyOf(rows);
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<RecordValue> getRows() {
        return rows;
    }

    public RecordValue row(int index) {
        return rows.get(index);
    }

    public int size() {
        return rows.size();
    }

    /** Values of one column, with {@code null} where a row omits it. */
    public List<Object> column(String name) {
        List<Object> values = new ArrayList<>(rows.size());
        for (RecordValue row : rows) {
            values.add(row.get(name));
        }
        return values;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof TableValue)) {
            return false;
        }
        TableValue other = (TableValue) obj;
        return columns.equals(other.columns) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return 31 * columns.hashCode() + rows.hashCode();
    }

    @Override
    public String toString() {
        return "TableValue" + columns + " " + rows.size() + " rows";
    }
}
