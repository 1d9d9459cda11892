package com.questrail.tds.protocol.codec.impl;

import com.questrail.tds.protocol.codec.ColumnMetadataContext;
import com.questrail.tds.protocol.codec.TdsChunk;
import com.questrail.tds.protocol.codec.TdsDecodeException;
import com.questrail.tds.protocol.codec.TdsTokenDecoderRegistry;
import com.questrail.tds.protocol.codec.TdsTokenReader;
import com.questrail.tds.protocol.codec.TdsTokenStreamListener;
import com.questrail.tds.protocol.codec.TdsTokenStreamParser;
import com.questrail.tds.protocol.config.TdsTokenParserOptions;
import com.questrail.tds.protocol.internal.decode.StandardTokenDecoders;
import com.questrail.tds.protocol.internal.time.WallClock;
import com.questrail.tds.protocol.model.ColMetadataToken;
import com.questrail.tds.protocol.model.EndOfMessageToken;
import com.questrail.tds.protocol.model.TdsToken;
import com.questrail.tds.protocol.observability.NullObservabilitySink;
import com.questrail.tds.protocol.observability.TdsErrorEvent;
import com.questrail.tds.protocol.observability.TdsObservabilitySink;
import com.questrail.tds.protocol.observability.TdsResumeEvent;
import com.questrail.tds.protocol.observability.TdsSuspensionEvent;
import com.questrail.tds.protocol.observability.TdsTokenEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * DefaultTdsTokenStreamParser
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link TdsTokenStreamParser}, and the
 * {@link TdsTokenReader} its token decoders read through.
 *
 * <p>On each byte chunk the parser performs the following steps, in order:</p>
 * <ol>
 *   <li>Append the chunk to the {@link ByteWindow}, dropping consumed bytes</li>
 *   <li>If a read is parked, run its continuation (which may park again)</li>
 *   <li>If nothing is parked, dispatch tokens until the window is empty or a
 *       read parks</li>
 * </ol>
 *
 * <p><strong>Suspension.</strong> A read that finds too few bytes stores a
 * continuation that repeats the same availability check, sets the suspended
 * flag and returns. The flag unwinds the whole decoder call chain: every read
 * is a tail call, so nothing runs after it, and the dispatch loop stops at its
 * next check. At most one continuation is ever stored.</p>
 *
 * <p><strong>Ready reads.</strong> A read whose bytes are already buffered
 * does not run its continuation inline. The continuation is handed to a
 * trampoline loop that runs it after the current one returns, so the stack
 * depth stays constant however many fields a token holds.</p>
 *
 * <p><strong>End of message.</strong> The marker bypasses the window and the
 * dispatch loop entirely and yields an {@link EndOfMessageToken} at once, even
 * while a read is parked.</p>
 *
 * <p><strong>Failure.</strong> The first {@link TdsDecodeException} (unknown
 * tag, out-of-bounds length, malformed field) is reported once to the listener
 * and the sink; all later input is discarded. Any other exception escaping a
 * decoder (a broken decoder contract, a bug) also fails the parser before it
 * propagates to the caller, so no later chunk is dispatched from the middle of
 * an abandoned token.</p>
 */
public final class DefaultTdsTokenStreamParser implements TdsTokenStreamParser, TdsTokenReader
{
    private static final Logger log = LoggerFactory.getLogger(DefaultTdsTokenStreamParser.class);

    private static final double TWO_TO_32 = 0x100000000L;

    private final TdsTokenDecoderRegistry registry;
    private final TdsTokenParserOptions options;
    private final TdsTokenStreamListener listener;
    private final TdsObservabilitySink sink;
    private final WallClock clock;

    private final ByteWindow window = new ByteWindow();

    private ColumnMetadataContext columns;
    private boolean suspended;
    private Runnable next;
    private boolean failed;

    private boolean trampolining;
    private Runnable ready;

    /**
     * Creates a parser with the standard token decoders and default options.
     */
    public DefaultTdsTokenStreamParser(TdsTokenStreamListener listener)
    {
        this(builder().withListener(listener));
    }

    private DefaultTdsTokenStreamParser(Builder builder)
    {
        this.registry = Objects.requireNonNull(builder.registry, "registry");
        this.options = Objects.requireNonNull(builder.options, "options");
        this.listener = Objects.requireNonNull(builder.listener, "listener");
        this.sink = Objects.requireNonNull(builder.sink, "sink");
        this.clock = Objects.requireNonNull(builder.clock, "clock");
        this.columns = Objects.requireNonNull(builder.columns, "columns");
    }

    public static Builder builder()
    {
        return new Builder();
    }

    // ========================================================================
    // Chunk input
    // ========================================================================

    @Override
    public void write(TdsChunk chunk)
    {
        Objects.requireNonNull(chunk, "chunk");

        if (failed) {
            log.debug("Discarding {} after fatal decode failure", chunk);
            return;
        }

        if (chunk instanceof TdsChunk.EndOfMessage) {
            listener.onToken(EndOfMessageToken.INSTANCE);
            return;
        }

        window.append(((TdsChunk.Bytes) chunk).data());

        try {
            if (suspended) {
                resume();
            }
            if (!suspended) {
                parseTokens();
            }
        }
        catch (TdsDecodeException e) {
            fail(e);
        }
        catch (RuntimeException | Error e) {
            abandon(e);
            throw e;
        }
    }

    @Override
    public boolean isSuspended()
    {
        return suspended;
    }

    @Override
    public boolean isFailed()
    {
        return failed;
    }

    @Override
    public int bufferedBytes()
    {
        return window.available();
    }

    @Override
    public ColumnMetadataContext columnMetadata()
    {
        return columns;
    }

    ByteWindow window()
    {
        return window;
    }

    // ========================================================================
    // Dispatch loop
    // ========================================================================

    private void parseTokens()
    {
        while (!suspended && window.available() >= 1) {
            final int tag = window.uint8(0);
            window.skip(1);

            registry.decoderFor(tag).decode(this, columns, options, new Completion(tag));
        }
    }

    private void complete(TdsToken token)
    {
        if (token instanceof ColMetadataToken metadata) {
            columns = ColumnMetadataContext.of(metadata.columns());
        }

        sink.onTokenDecoded(new TdsTokenEvent(clock.now(), token, window.available()));
        listener.onToken(token);
    }

    private void fail(TdsDecodeException e)
    {
        stop();

        sink.onError(new TdsErrorEvent(clock.now(), e.getMessage(), e));
        listener.onError(e);
    }

    private void abandon(Throwable cause)
    {
        stop();

        log.error("Token decoding aborted with {} bytes buffered", window.available(), cause);
        sink.onError(new TdsErrorEvent(clock.now(), String.valueOf(cause), cause));
    }

    private void stop()
    {
        failed = true;
        suspended = false;
        next = null;
        ready = null;
    }

    /**
     * Completion callback handed to one token decoder invocation.
     */
    private final class Completion implements Consumer<TdsToken>
    {
        private final int tag;
        private boolean completed;

        Completion(int tag)
        {
            this.tag = tag;
        }

        @Override
        public void accept(TdsToken token)
        {
            Objects.requireNonNull(token, "token");
            if (completed) {
                throw new IllegalStateException("Decoder for tag 0x" + Integer.toHexString(tag) + " completed twice");
            }
            completed = true;
            complete(token);
        }
    }

    // ========================================================================
    // Suspension engine
    // ========================================================================

    @Override
    public void awaitData(int length, Runnable onReady)
    {
        if (length < 0) {
            throw new TdsDecodeException("Negative read length: " + length);
        }

        if (window.available() < length) {
            suspend(length, () -> awaitData(length, onReady));
        }
        else if (trampolining) {
            if (ready != null) {
                throw new IllegalStateException("A ready read is already pending");
            }
            ready = onReady;
        }
        else {
            trampoline(onReady);
        }
    }

    private void trampoline(Runnable first)
    {
        trampolining = true;
        try {
            Runnable task = first;
            while (task != null) {
                ready = null;
                task.run();
                task = ready;
            }
        }
        finally {
            trampolining = false;
            ready = null;
        }
    }

    private void suspend(int required, Runnable continuation)
    {
        if (suspended || ready != null) {
            throw new IllegalStateException("A read is already pending");
        }
        suspended = true;
        next = continuation;

        sink.onSuspended(new TdsSuspensionEvent(clock.now(), required, window.available()));
    }

    private void resume()
    {
        final Runnable continuation = next;
        suspended = false;
        next = null;

        sink.onResumed(new TdsResumeEvent(clock.now(), window.available()));
        continuation.run();
    }

    // ========================================================================
    // Fixed-width readers
    // ========================================================================

    @Override
    public void readInt8(IntConsumer callback)
    {
        awaitData(1, () -> {
            final int data = window.int8(0);
            window.skip(1);
            callback.accept(data);
        });
    }

    @Override
    public void readUInt8(IntConsumer callback)
    {
        awaitData(1, () -> {
            final int data = window.uint8(0);
            window.skip(1);
            callback.accept(data);
        });
    }

    @Override
    public void readInt16LE(IntConsumer callback)
    {
        awaitData(2, () -> {
            final int data = window.int16LE(0);
            window.skip(2);
            callback.accept(data);
        });
    }

    @Override
    public void readInt16BE(IntConsumer callback)
    {
        awaitData(2, () -> {
            final int data = window.int16BE(0);
            window.skip(2);
            callback.accept(data);
        });
    }

    @Override
    public void readUInt16LE(IntConsumer callback)
    {
        awaitData(2, () -> {
            final int data = window.uint16LE(0);
            window.skip(2);
            callback.accept(data);
        });
    }

    @Override
    public void readUInt16BE(IntConsumer callback)
    {
        awaitData(2, () -> {
            final int data = window.uint16BE(0);
            window.skip(2);
            callback.accept(data);
        });
    }

    @Override
    public void readInt32LE(IntConsumer callback)
    {
        awaitData(4, () -> {
            final int data = window.int32LE(0);
            window.skip(4);
            callback.accept(data);
        });
    }

    @Override
    public void readInt32BE(IntConsumer callback)
    {
        awaitData(4, () -> {
            final int data = window.int32BE(0);
            window.skip(4);
            callback.accept(data);
        });
    }

    @Override
    public void readUInt32LE(LongConsumer callback)
    {
        awaitData(4, () -> {
            final long data = window.uint32LE(0);
            window.skip(4);
            callback.accept(data);
        });
    }

    @Override
    public void readUInt32BE(LongConsumer callback)
    {
        awaitData(4, () -> {
            final long data = window.uint32BE(0);
            window.skip(4);
            callback.accept(data);
        });
    }

    @Override
    public void readInt64LE(DoubleConsumer callback)
    {
        awaitData(8, () -> {
            final double data = TWO_TO_32 * window.int32LE(4) + window.uint32LE(0);
            window.skip(8);
            callback.accept(data);
        });
    }

    @Override
    public void readInt64BE(DoubleConsumer callback)
    {
        awaitData(8, () -> {
            final double data = TWO_TO_32 * window.int32BE(0) + window.uint32BE(4);
            window.skip(8);
            callback.accept(data);
        });
    }

    @Override
    public void readUInt64LE(DoubleConsumer callback)
    {
        awaitData(8, () -> {
            final double data = TWO_TO_32 * window.uint32LE(4) + window.uint32LE(0);
            window.skip(8);
            callback.accept(data);
        });
    }

    @Override
    public void readUInt64BE(DoubleConsumer callback)
    {
        awaitData(8, () -> {
            final double data = TWO_TO_32 * window.uint32BE(0) + window.uint32BE(4);
            window.skip(8);
            callback.accept(data);
        });
    }

    @Override
    public void readLongLE(LongConsumer callback)
    {
        awaitData(8, () -> {
            final long data = window.int64LE(0);
            window.skip(8);
            callback.accept(data);
        });
    }

    @Override
    public void readFloatLE(DoubleConsumer callback)
    {
        awaitData(4, () -> {
            final float data = Float.intBitsToFloat(window.int32LE(0));
            window.skip(4);
            callback.accept(data);
        });
    }

    @Override
    public void readFloatBE(DoubleConsumer callback)
    {
        awaitData(4, () -> {
            final float data = Float.intBitsToFloat(window.int32BE(0));
            window.skip(4);
            callback.accept(data);
        });
    }

    @Override
    public void readDoubleLE(DoubleConsumer callback)
    {
        awaitData(8, () -> {
            final double data = Double.longBitsToDouble(window.int64LE(0));
            window.skip(8);
            callback.accept(data);
        });
    }

    @Override
    public void readDoubleBE(DoubleConsumer callback)
    {
        awaitData(8, () -> {
            final long bits = (long) window.int32BE(0) << 32 | window.uint32BE(4);
            window.skip(8);
            callback.accept(Double.longBitsToDouble(bits));
        });
    }

    // ========================================================================
    // Composite little-endian integers
    // ========================================================================

    @Override
    public void readUInt24LE(IntConsumer callback)
    {
        awaitData(3, () -> {
            final int low = window.uint16LE(0);
            final int high = window.uint8(2);
            window.skip(3);
            callback.accept(low | high << 16);
        });
    }

    @Override
    public void readUInt40LE(LongConsumer callback)
    {
        awaitData(5, () -> {
            final long low = window.uint32LE(0);
            final long high = window.uint8(4);
            window.skip(5);
            callback.accept(high << 32 | low);
        });
    }

    @Override
    public void readUNumeric64LE(DoubleConsumer callback)
    {
        awaitData(8, () -> {
            final long low = window.uint32LE(0);
            final long high = window.uint32LE(4);
            window.skip(8);
            callback.accept(TWO_TO_32 * high + low);
        });
    }

    @Override
    public void readUNumeric96LE(DoubleConsumer callback)
    {
        awaitData(12, () -> {
            final long dword1 = window.uint32LE(0);
            final long dword2 = window.uint32LE(4);
            final long dword3 = window.uint32LE(8);
            window.skip(12);
            callback.accept(dword1 + TWO_TO_32 * dword2 + TWO_TO_32 * TWO_TO_32 * dword3);
        });
    }

    @Override
    public void readUNumeric128LE(DoubleConsumer callback)
    {
        awaitData(16, () -> {
            final long dword1 = window.uint32LE(0);
            final long dword2 = window.uint32LE(4);
            final long dword3 = window.uint32LE(8);
            final long dword4 = window.uint32LE(12);
            window.skip(16);
            callback.accept(dword1
                    + TWO_TO_32 * dword2
                    + TWO_TO_32 * TWO_TO_32 * dword3
                    + TWO_TO_32 * TWO_TO_32 * TWO_TO_32 * dword4);
        });
    }

    // ========================================================================
    // Variable-length data
    // ========================================================================

    @Override
    public void readBuffer(int length, Consumer<byte[]> callback)
    {
        if (length > options.maxFieldLength()) {
            throw new TdsDecodeException("Field length " + length
                    + " exceeds the configured maximum of " + options.maxFieldLength());
        }

        awaitData(length, () -> {
            final byte[] data = window.copy(0, length);
            window.skip(length);
            callback.accept(data);
        });
    }

    @Override
    public void readBVarByte(Consumer<byte[]> callback)
    {
        readUInt8(length -> readBuffer(length, callback));
    }

    @Override
    public void readUsVarByte(Consumer<byte[]> callback)
    {
        readUInt16LE(length -> readBuffer(length, callback));
    }

    @Override
    public void readBVarChar(Consumer<String> callback)
    {
        readUInt8(length ->
                readBuffer(length * 2, data -> callback.accept(new String(data, StandardCharsets.UTF_16LE))));
    }

    @Override
    public void readUsVarChar(Consumer<String> callback)
    {
        readUInt16LE(length ->
                readBuffer(length * 2, data -> callback.accept(new String(data, StandardCharsets.UTF_16LE))));
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static final class Builder
    {
        private TdsTokenDecoderRegistry registry = StandardTokenDecoders.registry();
        private TdsTokenParserOptions options = TdsTokenParserOptions.defaults();
        private TdsTokenStreamListener listener;
        private TdsObservabilitySink sink = NullObservabilitySink.INSTANCE;
        private WallClock clock = WallClock.system();
        private ColumnMetadataContext columns = ColumnMetadataContext.empty();

        private Builder() {}

        public Builder withRegistry(TdsTokenDecoderRegistry registry)
        {
            this.registry = registry;
            return this;
        }

        public Builder withOptions(TdsTokenParserOptions options)
        {
            this.options = options;
            return this;
        }

        public Builder withListener(TdsTokenStreamListener listener)
        {
            this.listener = listener;
            return this;
        }

        public Builder withObservabilitySink(TdsObservabilitySink sink)
        {
            this.sink = sink;
            return this;
        }

        public Builder withClock(WallClock clock)
        {
            this.clock = clock;
            return this;
        }

        /**
         * Seeds the column metadata, for a parser that picks up a stream whose
         * COLMETADATA token was decoded elsewhere.
         */
        public Builder withColumnMetadata(ColumnMetadataContext columns)
        {
            this.columns = columns;
            return this;
        }

        public DefaultTdsTokenStreamParser build()
        {
            return new DefaultTdsTokenStreamParser(this);
        }
    }
}
