package com.questrail.tds.protocol.codec;

import java.util.Objects;

/**
 * TdsChunk
 * -----------------------------------------------------------------------------
 * One unit of transport input delivered to a {@link TdsTokenStreamParser}.
 *
 * <p>A chunk is either raw bytes or the end-of-message marker, never both.
 * Keeping the two cases as distinct types means a byte array can never be
 * mistaken for a message boundary.</p>
 */
public sealed interface TdsChunk
{
    static Bytes bytes(byte[] data)
    {
        return new Bytes(data);
    }

    static EndOfMessage endOfMessage()
    {
        return EndOfMessage.INSTANCE;
    }

    /**
     * Raw bytes received from the transport.
     *
     * <p>Ownership of {@code data} passes to the parser: callers must not
     * modify the array after handing it over.</p>
     */
    record Bytes(byte[] data) implements TdsChunk
    {
        public Bytes
        {
            Objects.requireNonNull(data, "data");
        }

        @Override
        public String toString()
        {
            return "Bytes[" + data.length + "]";
        }
    }

    /**
     * Transport-level message boundary. Carries no payload.
     */
    record EndOfMessage() implements TdsChunk
    {
        static final EndOfMessage INSTANCE = new EndOfMessage();
    }
}
