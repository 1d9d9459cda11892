package com.questrail.tds.protocol.model;

import java.util.Optional;

/**
 * TdsTokenType
 * -----------------------------------------------------------------------------
 * One-byte tag values that identify the token kinds this library decodes.
 *
 * <p>The tag is the first byte of every token on the wire. Tags not listed
 * here are rejected by the dispatch loop as a fatal protocol error.</p>
 */
public enum TdsTokenType
{
    RETURNSTATUS(0x79),
    COLMETADATA(0x81),
    ORDER(0xA9),
    ERROR(0xAA),
    INFO(0xAB),
    RETURNVALUE(0xAC),
    LOGINACK(0xAD),
    FEATUREEXTACK(0xAE),
    ROW(0xD1),
    NBCROW(0xD2),
    ENVCHANGE(0xE3),
    SSPI(0xED),
    FEDAUTHINFO(0xEE),
    DONE(0xFD),
    DONEPROC(0xFE),
    DONEINPROC(0xFF);

    private static final TdsTokenType[] BY_TAG = new TdsTokenType[256];

    static {
        for (TdsTokenType type : values()) {
            BY_TAG[type.tag] = type;
        }
    }

    private final int tag;

    TdsTokenType(int tag)
    {
        this.tag = tag;
    }

    /**
     * @return the unsigned tag byte value
     */
    public int tag()
    {
        return tag;
    }

    public static Optional<TdsTokenType> fromTag(int tag)
    {
        if (tag < 0 || tag > 0xFF) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_TAG[tag]);
    }
}
