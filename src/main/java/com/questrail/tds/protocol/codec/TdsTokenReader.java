package com.questrail.tds.protocol.codec;

import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * TdsTokenReader
 * -----------------------------------------------------------------------------
 * Field-level read operations available to token decoders.
 *
 * <h2>Continuation-passing contract</h2>
 * <p>Every read delivers its value to a callback instead of returning it.
 * If enough bytes are buffered the callback runs within the same
 * {@code write} call; otherwise the reader parks a continuation and the callback runs later, when
 * a subsequent chunk supplies the missing bytes. Either way the stack does not
 * grow with the number of reads a token needs, so lists may be read by
 * chaining one read per element.</p>
 *
 * <p>Consequently a decoder must issue each read as the <em>last</em> action
 * of its current step: any statement placed after a read call may execute
 * before the value has been delivered, and a second read issued from within
 * the same read callback is rejected with {@link IllegalStateException}.</p>
 *
 * <p>Running out of bytes never throws. Reads throw {@link TdsDecodeException}
 * only when asked for a length that is negative or larger than the configured
 * field bound.</p>
 *
 * <h2>Wide integers</h2>
 * <p>{@link #readInt64LE}, {@link #readUInt64LE} and the
 * {@code readUNumeric*} family deliver {@code double} values assembled from
 * 32-bit words. Results above 2<sup>53</sup> in magnitude are rounded to the
 * nearest representable double; this is the accepted representation, not an
 * error. {@link #readLongLE} is available where an exact value is required.</p>
 */
public interface TdsTokenReader
{
    /**
     * Runs {@code onReady} once at least {@code length} unread bytes are buffered.
     */
    void awaitData(int length, Runnable onReady);

    void readInt8(IntConsumer callback);

    void readUInt8(IntConsumer callback);

    void readInt16LE(IntConsumer callback);

    void readInt16BE(IntConsumer callback);

    void readUInt16LE(IntConsumer callback);

    void readUInt16BE(IntConsumer callback);

    void readInt32LE(IntConsumer callback);

    void readInt32BE(IntConsumer callback);

    void readUInt32LE(LongConsumer callback);

    void readUInt32BE(LongConsumer callback);

    /**
     * Signed 64-bit little-endian integer as {@code 2^32 * high + low}, with the
     * high word signed and the low word unsigned.
     */
    void readInt64LE(DoubleConsumer callback);

    void readInt64BE(DoubleConsumer callback);

    void readUInt64LE(DoubleConsumer callback);

    void readUInt64BE(DoubleConsumer callback);

    /**
     * Exact signed 64-bit little-endian integer.
     */
    void readLongLE(LongConsumer callback);

    /**
     * Single-precision float, widened to {@code double} without loss.
     */
    void readFloatLE(DoubleConsumer callback);

    void readFloatBE(DoubleConsumer callback);

    void readDoubleLE(DoubleConsumer callback);

    void readDoubleBE(DoubleConsumer callback);

    void readUInt24LE(IntConsumer callback);

    void readUInt40LE(LongConsumer callback);

    void readUNumeric64LE(DoubleConsumer callback);

    void readUNumeric96LE(DoubleConsumer callback);

    void readUNumeric128LE(DoubleConsumer callback);

    /**
     * Reads {@code length} raw bytes. The delivered array is a copy.
     */
    void readBuffer(int length, Consumer<byte[]> callback);

    /**
     * B_VARBYTE: one length byte, then that many bytes.
     */
    void readBVarByte(Consumer<byte[]> callback);

    /**
     * US_VARBYTE: a 16-bit little-endian length, then that many bytes.
     */
    void readUsVarByte(Consumer<byte[]> callback);

    /**
     * B_VARCHAR: one length byte counting characters, then two bytes per
     * character of UTF-16LE text.
     */
    void readBVarChar(Consumer<String> callback);

    /**
     * US_VARCHAR: a 16-bit little-endian character count, then two bytes per
     * character of UTF-16LE text.
     */
    void readUsVarChar(Consumer<String> callback);
}
