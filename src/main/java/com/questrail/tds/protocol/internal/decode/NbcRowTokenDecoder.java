package com.questrail.tds.protocol.internal.decode;

import com.questrail.tds.protocol.codec.ColumnMetadataContext;
import com.questrail.tds.protocol.codec.TdsTokenDecoder;
import com.questrail.tds.protocol.codec.TdsTokenReader;
import com.questrail.tds.protocol.config.TdsTokenParserOptions;
import com.questrail.tds.protocol.model.ColumnValue;
import com.questrail.tds.protocol.model.RowToken;
import com.questrail.tds.protocol.model.TdsToken;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Decodes NBCROW (null bitmap compressed row) token bodies.
 *
 * <p>A bitmap of {@code ceil(columns / 8)} bytes comes first; bit {@code i}
 * (least significant bit first) set means column {@code i} is NULL and has no
 * bytes on the wire. The remaining columns follow as in a ROW token.</p>
 */
public final class NbcRowTokenDecoder implements TdsTokenDecoder
{
    @Override
    public void decode(TdsTokenReader reader,
                       ColumnMetadataContext columns,
                       TdsTokenParserOptions options,
                       Consumer<TdsToken> onComplete)
    {
        final int bitmapLength = (columns.size() + 7) / 8;

        reader.readBuffer(bitmapLength, bitmap ->
                readValue(reader, columns, options, bitmap, 0, new ArrayList<>(columns.size()),
                        values -> onComplete.accept(new RowToken(values, true))));
    }

    private static void readValue(TdsTokenReader reader,
                                  ColumnMetadataContext columns,
                                  TdsTokenParserOptions options,
                                  byte[] bitmap,
                                  int index,
                                  List<ColumnValue> values,
                                  Consumer<List<ColumnValue>> callback)
    {
        int column = index;
        while (column < columns.size() && isNull(bitmap, column)) {
            values.add(new ColumnValue(columns.column(column), null));
            column++;
        }

        if (column == columns.size()) {
            callback.accept(values);
            return;
        }

        final int present = column;
        ValueReader.read(reader, columns.column(present).typeInfo(), options, value -> {
            values.add(new ColumnValue(columns.column(present), value));
            readValue(reader, columns, options, bitmap, present + 1, values, callback);
        });
    }

    static boolean isNull(byte[] bitmap, int index)
    {
        return (bitmap[index / 8] >> (index % 8) & 1) == 1;
    }
}
