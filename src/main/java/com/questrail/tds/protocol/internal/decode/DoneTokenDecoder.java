package com.questrail.tds.protocol.internal.decode;

import com.questrail.tds.protocol.codec.ColumnMetadataContext;
import com.questrail.tds.protocol.codec.TdsTokenDecoder;
import com.questrail.tds.protocol.codec.TdsTokenReader;
import com.questrail.tds.protocol.config.TdsTokenParserOptions;
import com.questrail.tds.protocol.model.DoneToken;
import com.questrail.tds.protocol.model.TdsToken;

import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.Consumer;
import java.util.function.LongConsumer;

/**
 * Decodes DONE, DONEPROC and DONEINPROC token bodies.
 *
 * <p>Layout: status (u16), current command (u16), row count (u32 before TDS
 * 7.2, u64 from 7.2 on). The row count is always on the wire but only
 * meaningful when the COUNT status bit is set.</p>
 */
public final class DoneTokenDecoder implements TdsTokenDecoder
{
    private final DoneToken.Kind kind;

    public DoneTokenDecoder(DoneToken.Kind kind)
    {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    @Override
    public void decode(TdsTokenReader reader,
                       ColumnMetadataContext columns,
                       TdsTokenParserOptions options,
                       Consumer<TdsToken> onComplete)
    {
        reader.readUInt16LE(status ->
                reader.readUInt16LE(currentCommand ->
                        readRowCount(reader, options, rowCount -> {
                            OptionalLong count = (status & DoneToken.STATUS_COUNT) != 0
                                    ? OptionalLong.of(rowCount)
                                    : OptionalLong.empty();
                            onComplete.accept(new DoneToken(kind, status, currentCommand, count));
                        })));
    }

    private static void readRowCount(TdsTokenReader reader, TdsTokenParserOptions options, LongConsumer callback)
    {
        if (options.tdsVersion().atLeast72()) {
            reader.readUInt64LE(value -> callback.accept((long) value));
        }
        else {
            reader.readUInt32LE(callback);
        }
    }
}
