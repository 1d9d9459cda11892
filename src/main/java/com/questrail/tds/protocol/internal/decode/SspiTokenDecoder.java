package com.questrail.tds.protocol.internal.decode;

import com.questrail.tds.protocol.codec.ColumnMetadataContext;
import com.questrail.tds.protocol.codec.TdsTokenDecoder;
import com.questrail.tds.protocol.codec.TdsTokenReader;
import com.questrail.tds.protocol.config.TdsTokenParserOptions;
import com.questrail.tds.protocol.model.SspiToken;
import com.questrail.tds.protocol.model.TdsToken;

import java.util.function.Consumer;

/**
 * Decodes SSPI: a US_VARBYTE challenge passed through unparsed.
 */
public final class SspiTokenDecoder implements TdsTokenDecoder
{
    @Override
    public void decode(TdsTokenReader reader,
                       ColumnMetadataContext columns,
                       TdsTokenParserOptions options,
                       Consumer<TdsToken> onComplete)
    {
        reader.readUsVarByte(challenge -> onComplete.accept(new SspiToken(challenge)));
    }
}
