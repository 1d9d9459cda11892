package com.questrail.tds.protocol.internal.decode;

import com.questrail.tds.protocol.codec.ColumnMetadataContext;
import com.questrail.tds.protocol.codec.TdsTokenDecoder;
import com.questrail.tds.protocol.codec.TdsTokenReader;
import com.questrail.tds.protocol.config.TdsTokenParserOptions;
import com.questrail.tds.protocol.model.ReturnStatusToken;
import com.questrail.tds.protocol.model.TdsToken;

import java.util.function.Consumer;

/**
 * Decodes RETURNSTATUS: a single signed 32-bit value.
 */
public final class ReturnStatusTokenDecoder implements TdsTokenDecoder
{
    @Override
    public void decode(TdsTokenReader reader,
                       ColumnMetadataContext columns,
                       TdsTokenParserOptions options,
                       Consumer<TdsToken> onComplete)
    {
        reader.readInt32LE(value -> onComplete.accept(new ReturnStatusToken(value)));
    }
}
