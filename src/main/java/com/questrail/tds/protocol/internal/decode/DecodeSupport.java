package com.questrail.tds.protocol.internal.decode;

import com.questrail.tds.protocol.codec.TdsDecodeException;
import com.questrail.tds.protocol.codec.TdsTokenReader;
import com.questrail.tds.protocol.config.TdsTokenParserOptions;

import java.util.function.LongConsumer;

/**
 * Small helpers shared by the token decoders.
 */
final class DecodeSupport
{
    private DecodeSupport() {}

    /**
     * Narrows an unsigned 32-bit wire length to an {@code int}, rejecting
     * values over the configured field bound.
     */
    static int checkedLength(long length, TdsTokenParserOptions options, String field)
    {
        if (length < 0 || length > options.maxFieldLength()) {
            throw new TdsDecodeException(field + " length " + length
                    + " exceeds the configured maximum of " + options.maxFieldLength());
        }
        return (int) length;
    }

    /**
     * Column user type: 16 bits before TDS 7.2, 32 bits from 7.2 on.
     */
    static void readUserType(TdsTokenReader reader, TdsTokenParserOptions options, LongConsumer callback)
    {
        if (options.tdsVersion().atLeast72()) {
            reader.readUInt32LE(callback);
        }
        else {
            reader.readUInt16LE(callback::accept);
        }
    }
}
