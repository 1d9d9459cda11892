package com.questrail.tds.protocol.model;

import java.util.Objects;

/**
 * A decoded value paired with the metadata it was decoded against.
 *
 * <p>{@code value} is {@code null} for SQL NULL. Otherwise its Java type
 * follows the column's {@link DataType}: {@code Integer}/{@code Long} for
 * integers, {@code Boolean} for bits, {@code Float}/{@code Double} for REAL/FLOAT,
 * {@code Double} for decimals,
 * {@code BigDecimal} for money, {@code java.time} values for temporal types,
 * {@code String} for character data and GUIDs, {@code byte[]} for binary.</p>
 */
public record ColumnValue(ColumnMetadata metadata, Object value)
{
    public ColumnValue
    {
        Objects.requireNonNull(metadata, "metadata");
    }

    public boolean isNull()
    {
        return value == null;
    }
}
