package com.questrail.tds.protocol.model;

/**
 * Five-byte SQL collation attached to character TYPE_INFO and to
 * SQL_COLLATION environment changes.
 *
 * <p>Layout: bits 0-19 LCID, bits 20-27 comparison flags, bits 28-31
 * version, then one sort id byte.</p>
 */
public record Collation(int lcid, int flags, int version, int sortId)
{
    public static final int LENGTH = 5;

    public static Collation fromBytes(byte[] raw)
    {
        if (raw.length != LENGTH) {
            throw new IllegalArgumentException("Collation must be " + LENGTH + " bytes (was " + raw.length + ")");
        }
        int word = (raw[0] & 0xFF)
                | (raw[1] & 0xFF) << 8
                | (raw[2] & 0xFF) << 16
                | (raw[3] & 0xFF) << 24;

        return new Collation(
                word & 0x000FFFFF,
                (word >>> 20) & 0xFF,
                (word >>> 28) & 0x0F,
                raw[4] & 0xFF
        );
    }
}
