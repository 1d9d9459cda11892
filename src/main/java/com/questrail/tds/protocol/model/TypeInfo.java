package com.questrail.tds.protocol.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Decoded TYPE_INFO block of a column or return value.
 *
 * @param type       the SQL data type
 * @param dataLength declared maximum length; {@link DataType#MAX_LENGTH} marks a
 *                   partially-length-prefixed ({@code max}) type
 * @param precision  decimal precision, 0 when not applicable
 * @param scale      decimal or fractional-seconds scale, 0 when not applicable
 * @param collation  collation of character types
 */
public record TypeInfo(
        DataType type,
        int dataLength,
        int precision,
        int scale,
        Optional<Collation> collation
) {
    public TypeInfo {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(collation, "collation");
    }

    public static TypeInfo of(DataType type)
    {
        return new TypeInfo(type, type.fixedLength(), 0, 0, Optional.empty());
    }

    /**
     * @return true if values are sent as a partially-length-prefixed byte stream
     */
    public boolean partiallyLengthPrefixed()
    {
        return type.shape() == DataType.Shape.USHORT_LENGTH && dataLength == DataType.MAX_LENGTH;
    }
}
