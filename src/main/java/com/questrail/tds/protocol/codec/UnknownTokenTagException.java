package com.questrail.tds.protocol.codec;

/**
 * Raised when the dispatch loop reads a tag byte that has no registered
 * token decoder. Fatal for the parser instance that raised it.
 */
public final class UnknownTokenTagException extends TdsDecodeException
{
    private final int tag;

    public UnknownTokenTagException(int tag) {
        super("Unknown token type: 0x" + Integer.toHexString(tag));
        this.tag = tag;
    }

    /**
     * @return the unsigned tag byte that was not recognised
     */
    public int tag() {
        return tag;
    }
}
