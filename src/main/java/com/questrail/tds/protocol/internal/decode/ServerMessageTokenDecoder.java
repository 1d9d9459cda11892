package com.questrail.tds.protocol.internal.decode;

import com.questrail.tds.protocol.codec.ColumnMetadataContext;
import com.questrail.tds.protocol.codec.TdsTokenDecoder;
import com.questrail.tds.protocol.codec.TdsTokenReader;
import com.questrail.tds.protocol.config.TdsTokenParserOptions;
import com.questrail.tds.protocol.model.ServerMessageToken;
import com.questrail.tds.protocol.model.TdsToken;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.LongConsumer;

/**
 * Decodes INFO and ERROR token bodies.
 *
 * <p>Layout: length (u16), number (u32), state (u8), class (u8), message
 * (US_VARCHAR), server name (B_VARCHAR), procedure name (B_VARCHAR), line
 * number (u16 before TDS 7.2, u32 from 7.2 on).</p>
 */
public final class ServerMessageTokenDecoder implements TdsTokenDecoder
{
    private final ServerMessageToken.Kind kind;

    public ServerMessageTokenDecoder(ServerMessageToken.Kind kind)
    {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    @Override
    public void decode(TdsTokenReader reader,
                       ColumnMetadataContext columns,
                       TdsTokenParserOptions options,
                       Consumer<TdsToken> onComplete)
    {
        reader.readUInt16LE(length ->
                reader.readUInt32LE(number ->
                        reader.readUInt8(state ->
                                reader.readUInt8(messageClass ->
                                        reader.readUsVarChar(message ->
                                                reader.readBVarChar(serverName ->
                                                        reader.readBVarChar(procName ->
                                                                readLineNumber(reader, options, lineNumber ->
                                                                        onComplete.accept(new ServerMessageToken(
                                                                                kind,
                                                                                number,
                                                                                state,
                                                                                messageClass,
                                                                                message,
                                                                                serverName,
                                                                                procName,
                                                                                lineNumber
                                                                        ))))))))));
    }

    private static void readLineNumber(TdsTokenReader reader, TdsTokenParserOptions options, LongConsumer callback)
    {
        if (options.tdsVersion().atLeast72()) {
            reader.readUInt32LE(callback);
        }
        else {
            reader.readUInt16LE(callback::accept);
        }
    }
}
