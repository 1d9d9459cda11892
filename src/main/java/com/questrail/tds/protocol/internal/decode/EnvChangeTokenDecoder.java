package com.questrail.tds.protocol.internal.decode;

import com.questrail.tds.protocol.codec.ColumnMetadataContext;
import com.questrail.tds.protocol.codec.TdsDecodeException;
import com.questrail.tds.protocol.codec.TdsTokenDecoder;
import com.questrail.tds.protocol.codec.TdsTokenReader;
import com.questrail.tds.protocol.config.TdsTokenParserOptions;
import com.questrail.tds.protocol.model.EnvChangeToken;
import com.questrail.tds.protocol.model.EnvChangeType;
import com.questrail.tds.protocol.model.TdsToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Decodes ENVCHANGE token bodies.
 *
 * <p>
 * Layout: total length (u16), subtype (u8), then a new/old value pair whose
 * encoding depends on the subtype:
 * </p>
 * <ul>
 *   <li>text subtypes: two B_VARCHAR values</li>
 *   <li>PACKET_SIZE: two B_VARCHAR values holding decimal integers</li>
 *   <li>binary subtypes: two B_VARBYTE values</li>
 *   <li>ROUTING_CHANGE: a US_VARBYTE routing block, then an empty US_VARBYTE</li>
 * </ul>
 *
 * <p>
 * Subtypes this library does not model are skipped using the total length
 * and produce no token.
 * </p>
 */
public final class EnvChangeTokenDecoder implements TdsTokenDecoder
{
    private static final Logger log = LoggerFactory.getLogger(EnvChangeTokenDecoder.class);

    @Override
    public void decode(TdsTokenReader reader,
                       ColumnMetadataContext columns,
                       TdsTokenParserOptions options,
                       Consumer<TdsToken> onComplete)
    {
        reader.readUInt16LE(length ->
                reader.readUInt8(code -> {
                    Optional<EnvChangeType> type = EnvChangeType.fromCode(code);
                    if (type.isEmpty()) {
                        if (length < 1) {
                            throw new TdsDecodeException("ENVCHANGE length " + length
                                    + " is too short for unsupported type " + code);
                        }
                        log.warn("Skipping unsupported ENVCHANGE type {} ({} bytes)", code, length - 1);
                        reader.readBuffer(length - 1, ignored -> { });
                        return;
                    }
                    decodeValues(reader, type.get(), onComplete);
                }));
    }

    private static void decodeValues(TdsTokenReader reader, EnvChangeType type, Consumer<TdsToken> onComplete)
    {
        switch (type.shape()) {
            case TEXT -> reader.readBVarChar(newValue ->
                    reader.readBVarChar(oldValue ->
                            onComplete.accept(new EnvChangeToken.TextChange(type, oldValue, newValue))));

            case INTEGER -> reader.readBVarChar(newValue ->
                    reader.readBVarChar(oldValue ->
                            onComplete.accept(new EnvChangeToken.PacketSizeChange(
                                    parsePacketSize(oldValue), parsePacketSize(newValue)))));

            case BINARY -> reader.readBVarByte(newValue ->
                    reader.readBVarByte(oldValue ->
                            onComplete.accept(new EnvChangeToken.BinaryChange(type, oldValue, newValue))));

            case ROUTING -> reader.readUsVarByte(routing ->
                    reader.readUsVarByte(ignoredOldValue ->
                            onComplete.accept(parseRouting(routing))));
        }
    }

    private static int parsePacketSize(String value)
    {
        try {
            return Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e) {
            throw new TdsDecodeException("Invalid PACKET_SIZE value: '" + value + "'", e);
        }
    }

    /**
     * Routing block: protocol (u8), port (u16), server name as US_VARCHAR.
     */
    private static EnvChangeToken.RoutingChange parseRouting(byte[] routing)
    {
        if (routing.length < 5) {
            throw new TdsDecodeException("ROUTING_CHANGE value too short: " + routing.length + " bytes");
        }

        ByteBuffer buffer = ByteBuffer.wrap(routing).order(ByteOrder.LITTLE_ENDIAN);
        final int protocol = buffer.get(0) & 0xFF;
        final int port = buffer.getShort(1) & 0xFFFF;
        final int serverChars = buffer.getShort(3) & 0xFFFF;

        if (5 + serverChars * 2 > routing.length) {
            throw new TdsDecodeException("ROUTING_CHANGE server name overruns value ("
                    + serverChars + " chars in " + routing.length + " bytes)");
        }

        String server = new String(routing, 5, serverChars * 2, StandardCharsets.UTF_16LE);
        return new EnvChangeToken.RoutingChange(protocol, port, server);
    }
}
