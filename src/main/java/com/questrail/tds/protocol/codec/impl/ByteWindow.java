package com.questrail.tds.protocol.codec.impl;

import java.util.Arrays;

/**
 * ByteWindow
 * -----------------------------------------------------------------------------
 * Bytes received but not yet consumed, plus a cursor at the next unread byte.
 *
 * <p>Invariant: {@code 0 <= position <= length}. The cursor only moves forward
 * except when {@link #append(byte[])} replaces the backing array.</p>
 *
 * <p>Every append is a compaction point: consumed bytes are never carried into
 * the new array, so retained memory is bounded by the largest unconsumed
 * tail.</p>
 *
 * <p>Getters take an offset relative to the cursor and do not move it; callers
 * check {@link #available()} first and advance with {@link #skip(int)}.</p>
 */
final class ByteWindow
{
    private static final byte[] EMPTY = new byte[0];

    private byte[] bytes = EMPTY;
    private int position;

    void append(byte[] chunk)
    {
        if (position == bytes.length) {
            // fully drained: take the chunk as-is
            bytes = chunk;
        }
        else {
            int tail = bytes.length - position;
            byte[] joined = Arrays.copyOfRange(bytes, position, position + tail + chunk.length);
            System.arraycopy(chunk, 0, joined, tail, chunk.length);
            bytes = joined;
        }
        position = 0;
    }

    int available()
    {
        return bytes.length - position;
    }

    int position()
    {
        return position;
    }

    int length()
    {
        return bytes.length;
    }

    /**
     * Exposes the backing array for identity checks in tests.
     */
    byte[] backingArray()
    {
        return bytes;
    }

    void skip(int count)
    {
        if (count < 0 || count > available()) {
            throw new IllegalArgumentException("Cannot skip " + count + " bytes with " + available() + " available");
        }
        position += count;
    }

    byte[] copy(int offset, int length)
    {
        return Arrays.copyOfRange(bytes, position + offset, position + offset + length);
    }

    int int8(int offset)
    {
        return bytes[position + offset];
    }

    int uint8(int offset)
    {
        return bytes[position + offset] & 0xFF;
    }

    int int16LE(int offset)
    {
        return (short) uint16LE(offset);
    }

    int int16BE(int offset)
    {
        return (short) uint16BE(offset);
    }

    int uint16LE(int offset)
    {
        return uint8(offset) | uint8(offset + 1) << 8;
    }

    int uint16BE(int offset)
    {
        return uint8(offset) << 8 | uint8(offset + 1);
    }

    int int32LE(int offset)
    {
        return uint8(offset)
                | uint8(offset + 1) << 8
                | uint8(offset + 2) << 16
                | uint8(offset + 3) << 24;
    }

    int int32BE(int offset)
    {
        return uint8(offset) << 24
                | uint8(offset + 1) << 16
                | uint8(offset + 2) << 8
                | uint8(offset + 3);
    }

    long uint32LE(int offset)
    {
        return int32LE(offset) & 0xFFFFFFFFL;
    }

    long uint32BE(int offset)
    {
        return int32BE(offset) & 0xFFFFFFFFL;
    }

    long int64LE(int offset)
    {
        return uint32LE(offset) | (long) int32LE(offset + 4) << 32;
    }
}
