package com.questrail.tds.protocol.internal.decode;

import com.questrail.tds.protocol.codec.ColumnMetadataContext;
import com.questrail.tds.protocol.codec.TdsTokenDecoder;
import com.questrail.tds.protocol.codec.TdsTokenReader;
import com.questrail.tds.protocol.config.TdsTokenParserOptions;
import com.questrail.tds.protocol.model.OrderToken;
import com.questrail.tds.protocol.model.TdsToken;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Decodes ORDER: a byte length (u16) followed by length / 2 column ordinals (u16).
 */
public final class OrderTokenDecoder implements TdsTokenDecoder
{
    @Override
    public void decode(TdsTokenReader reader,
                       ColumnMetadataContext columns,
                       TdsTokenParserOptions options,
                       Consumer<TdsToken> onComplete)
    {
        reader.readUInt16LE(length -> {
            final int count = length / 2;
            readOrdinals(reader, count, new ArrayList<>(count),
                    ordinals -> onComplete.accept(new OrderToken(ordinals)));
        });
    }

    private static void readOrdinals(TdsTokenReader reader,
                                     int remaining,
                                     List<Integer> ordinals,
                                     Consumer<List<Integer>> callback)
    {
        if (remaining == 0) {
            callback.accept(ordinals);
            return;
        }
        reader.readUInt16LE(ordinal -> {
            ordinals.add(ordinal);
            readOrdinals(reader, remaining - 1, ordinals, callback);
        });
    }
}
