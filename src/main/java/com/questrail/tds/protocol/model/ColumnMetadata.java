package com.questrail.tds.protocol.model;

import java.util.Objects;

/**
 * One column descriptor from a COLMETADATA token.
 *
 * <p>
 * Row decoders use {@link #typeInfo()} to interpret each value; the flag
 * accessors expose the COLMETADATA flags word.
 * </p>
 */
public record ColumnMetadata(
        long userType,
        int flags,
        TypeInfo typeInfo,
        String colName
) {
    public static final int FLAG_NULLABLE = 0x0001;
    public static final int FLAG_CASE_SENSITIVE = 0x0002;
    public static final int FLAG_UPDATEABLE_MASK = 0x000C;
    public static final int FLAG_IDENTITY = 0x0010;
    public static final int FLAG_COMPUTED = 0x0020;
    public static final int FLAG_FIXED_LEN_CLR_TYPE = 0x0100;
    public static final int FLAG_SPARSE_COLUMN_SET = 0x0400;
    public static final int FLAG_ENCRYPTED = 0x0800;
    public static final int FLAG_HIDDEN = 0x2000;
    public static final int FLAG_KEY = 0x4000;
    public static final int FLAG_NULLABLE_UNKNOWN = 0x8000;

    public ColumnMetadata {
        Objects.requireNonNull(typeInfo, "typeInfo");
        Objects.requireNonNull(colName, "colName");
    }

    public DataType type()
    {
        return typeInfo.type();
    }

    public boolean nullable()
    {
        return (flags & FLAG_NULLABLE) != 0;
    }

    public boolean caseSensitive()
    {
        return (flags & FLAG_CASE_SENSITIVE) != 0;
    }

    /**
     * @return 0 read-only, 1 read/write, 2 unknown
     */
    public int updateable()
    {
        return (flags & FLAG_UPDATEABLE_MASK) >>> 2;
    }

    public boolean identity()
    {
        return (flags & FLAG_IDENTITY) != 0;
    }

    public boolean computed()
    {
        return (flags & FLAG_COMPUTED) != 0;
    }

    public boolean hidden()
    {
        return (flags & FLAG_HIDDEN) != 0;
    }

    public boolean key()
    {
        return (flags & FLAG_KEY) != 0;
    }
}
