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
 * Decodes ROW token bodies: one value per column of the current metadata,
 * in column order.
 */
public final class RowTokenDecoder implements TdsTokenDecoder
{
    @Override
    public void decode(TdsTokenReader reader,
                       ColumnMetadataContext columns,
                       TdsTokenParserOptions options,
                       Consumer<TdsToken> onComplete)
    {
        readValue(reader, columns, options, 0, new ArrayList<>(columns.size()),
                values -> onComplete.accept(new RowToken(values, false)));
    }

    private static void readValue(TdsTokenReader reader,
                                  ColumnMetadataContext columns,
                                  TdsTokenParserOptions options,
                                  int index,
                                  List<ColumnValue> values,
                                  Consumer<List<ColumnValue>> callback)
    {
        if (index == columns.size()) {
            callback.accept(values);
            return;
        }
        ValueReader.read(reader, columns.column(index).typeInfo(), options, value -> {
            values.add(new ColumnValue(columns.column(index), value));
            readValue(reader, columns, options, index + 1, values, callback);
        });
    }
}
