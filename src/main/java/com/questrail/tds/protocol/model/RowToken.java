package com.questrail.tds.protocol.model;

import java.util.List;

/**
 * ROW ($D1) and NBCROW ($D2) tokens: one row of a result set, in column order.
 *
 * <p>Both wire forms decode to this record. {@link #nullBitmapCompressed()}
 * reports which form it came from.</p>
 */
public record RowToken(List<ColumnValue> columns, boolean nullBitmapCompressed) implements TdsToken
{
    public RowToken
    {
        columns = List.copyOf(columns);
    }

    public Object value(int index)
    {
        return columns.get(index).value();
    }

    public Object value(String colName)
    {
        for (ColumnValue column : columns) {
            if (column.metadata().colName().equals(colName)) {
                return column.value();
            }
        }
        throw new IllegalArgumentException("No column named " + colName);
    }
}
