package com.questrail.tds.protocol.internal.decode;

import com.questrail.tds.protocol.codec.ColumnMetadataContext;
import com.questrail.tds.protocol.codec.TdsTokenDecoder;
import com.questrail.tds.protocol.codec.TdsTokenReader;
import com.questrail.tds.protocol.config.TdsTokenParserOptions;
import com.questrail.tds.protocol.model.ColMetadataToken;
import com.questrail.tds.protocol.model.ColumnMetadata;
import com.questrail.tds.protocol.model.TdsToken;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Decodes COLMETADATA token bodies.
 *
 * <p>Layout: column count (u16), then one descriptor per column. A count of
 * {@code 0xFFFF} means "no metadata" and yields an empty column list.</p>
 */
public final class ColMetadataTokenDecoder implements TdsTokenDecoder
{
    static final int NO_METADATA = 0xFFFF;

    @Override
    public void decode(TdsTokenReader reader,
                       ColumnMetadataContext columns,
                       TdsTokenParserOptions options,
                       Consumer<TdsToken> onComplete)
    {
        reader.readUInt16LE(count -> {
            if (count == NO_METADATA) {
                onComplete.accept(new ColMetadataToken(List.of()));
                return;
            }
            readColumns(reader, options, count, new ArrayList<>(count),
                    descriptors -> onComplete.accept(new ColMetadataToken(descriptors)));
        });
    }

    private static void readColumns(TdsTokenReader reader,
                                    TdsTokenParserOptions options,
                                    int remaining,
                                    List<ColumnMetadata> descriptors,
                                    Consumer<List<ColumnMetadata>> callback)
    {
        if (remaining == 0) {
            callback.accept(descriptors);
            return;
        }
        TypeInfoReader.readColumnMetadata(reader, options, column -> {
            descriptors.add(column);
            readColumns(reader, options, remaining - 1, descriptors, callback);
        });
    }
}
