package com.questrail.tds.protocol.model;

import java.util.Optional;

/**
 * SQL data types whose TYPE_INFO and values this library can decode.
 *
 * <p>
 * Each type declares the {@link Shape} of its TYPE_INFO block, which drives
 * how much metadata follows the type byte in COLMETADATA and RETURNVALUE
 * tokens, and how the value length is encoded in ROW data.
 * </p>
 *
 * <p>
 * Types that exist on the wire but are not listed here (TEXT, NTEXT, IMAGE,
 * XML, UDT, SQL_VARIANT, legacy DECIMAL/NUMERIC) are reported as unsupported
 * when met.
 * </p>
 */
public enum DataType
{
    NULL(0x1F, Shape.FIXED, 0, false),
    TINYINT(0x30, Shape.FIXED, 1, false),
    BIT(0x32, Shape.FIXED, 1, false),
    SMALLINT(0x34, Shape.FIXED, 2, false),
    INT(0x38, Shape.FIXED, 4, false),
    SMALLDATETIME(0x3A, Shape.FIXED, 4, false),
    REAL(0x3B, Shape.FIXED, 4, false),
    MONEY(0x3C, Shape.FIXED, 8, false),
    DATETIME(0x3D, Shape.FIXED, 8, false),
    FLOAT(0x3E, Shape.FIXED, 8, false),
    SMALLMONEY(0x7A, Shape.FIXED, 4, false),
    BIGINT(0x7F, Shape.FIXED, 8, false),

    UNIQUEIDENTIFIER(0x24, Shape.BYTE_LENGTH, 0, false),
    INTN(0x26, Shape.BYTE_LENGTH, 0, false),
    BITN(0x68, Shape.BYTE_LENGTH, 0, false),
    FLOATN(0x6D, Shape.BYTE_LENGTH, 0, false),
    MONEYN(0x6E, Shape.BYTE_LENGTH, 0, false),
    DATETIMEN(0x6F, Shape.BYTE_LENGTH, 0, false),

    DECIMALN(0x6A, Shape.DECIMAL, 0, false),
    NUMERICN(0x6C, Shape.DECIMAL, 0, false),

    DATEN(0x28, Shape.DATE, 3, false),
    TIMEN(0x29, Shape.SCALED, 0, false),
    DATETIME2N(0x2A, Shape.SCALED, 0, false),
    DATETIMEOFFSETN(0x2B, Shape.SCALED, 0, false),

    BIGVARBINARY(0xA5, Shape.USHORT_LENGTH, 0, false),
    BIGVARCHAR(0xA7, Shape.USHORT_LENGTH, 0, true),
    BIGBINARY(0xAD, Shape.USHORT_LENGTH, 0, false),
    BIGCHAR(0xAF, Shape.USHORT_LENGTH, 0, true),
    NVARCHAR(0xE7, Shape.USHORT_LENGTH, 0, true),
    NCHAR(0xEF, Shape.USHORT_LENGTH, 0, true);

    /**
     * Layout of the TYPE_INFO block that follows the type byte.
     */
    public enum Shape
    {
        /** Nothing follows; the value width is implied by the type. */
        FIXED,
        /** One length byte follows. */
        BYTE_LENGTH,
        /** Length, precision and scale bytes follow. */
        DECIMAL,
        /** Nothing follows; the value carries its own length byte. */
        DATE,
        /** One scale byte follows. */
        SCALED,
        /** A 16-bit length follows, then a collation for character types. */
        USHORT_LENGTH
    }

    /** Wire marker for a USHORT_LENGTH type declared with {@code max}. */
    public static final int MAX_LENGTH = 0xFFFF;

    private final int id;
    private final Shape shape;
    private final int fixedLength;
    private final boolean collated;

    DataType(int id, Shape shape, int fixedLength, boolean collated)
    {
        this.id = id;
        this.shape = shape;
        this.fixedLength = fixedLength;
        this.collated = collated;
    }

    public int id()
    {
        return id;
    }

    public Shape shape()
    {
        return shape;
    }

    /**
     * @return the implied value width for {@link Shape#FIXED} and {@link Shape#DATE} types, else 0
     */
    public int fixedLength()
    {
        return fixedLength;
    }

    /**
     * @return true if a five-byte collation follows the length in TYPE_INFO
     */
    public boolean collated()
    {
        return collated;
    }

    public boolean unicode()
    {
        return this == NVARCHAR || this == NCHAR;
    }

    public static Optional<DataType> fromId(int id)
    {
        for (DataType type : values()) {
            if (type.id == id) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
