package com.questrail.tds.protocol.internal.decode;

import com.questrail.tds.protocol.codec.ColumnMetadataContext;
import com.questrail.tds.protocol.codec.TdsTokenDecoder;
import com.questrail.tds.protocol.codec.TdsTokenReader;
import com.questrail.tds.protocol.config.TdsTokenParserOptions;
import com.questrail.tds.protocol.model.ReturnValueToken;
import com.questrail.tds.protocol.model.TdsToken;

import java.util.function.Consumer;

/**
 * Decodes RETURNVALUE token bodies.
 *
 * <p>Layout: parameter ordinal (u16), parameter name (B_VARCHAR), status (u8),
 * user type, flags (u16), TYPE_INFO, then the value. The value is decoded
 * against its own TYPE_INFO, not the current column metadata.</p>
 */
public final class ReturnValueTokenDecoder implements TdsTokenDecoder
{
    @Override
    public void decode(TdsTokenReader reader,
                       ColumnMetadataContext columns,
                       TdsTokenParserOptions options,
                       Consumer<TdsToken> onComplete)
    {
        reader.readUInt16LE(paramOrdinal ->
                reader.readBVarChar(rawName ->
                        reader.readUInt8(status ->
                                TypeInfoReader.readParameterMetadata(reader, options, stripAt(rawName), metadata ->
                                        ValueReader.read(reader, metadata.typeInfo(), options, value ->
                                                onComplete.accept(new ReturnValueToken(
                                                        paramOrdinal,
                                                        metadata.colName(),
                                                        status,
                                                        metadata,
                                                        value
                                                )))))));
    }

    static String stripAt(String paramName)
    {
        return paramName.startsWith("@") ? paramName.substring(1) : paramName;
    }
}
