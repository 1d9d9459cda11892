package com.questrail.tds.protocol.internal.decode;

import com.questrail.tds.protocol.codec.ColumnMetadataContext;
import com.questrail.tds.protocol.codec.TdsDecodeException;
import com.questrail.tds.protocol.codec.TdsTokenDecoder;
import com.questrail.tds.protocol.codec.TdsTokenReader;
import com.questrail.tds.protocol.config.TdsTokenParserOptions;
import com.questrail.tds.protocol.model.FedAuthInfoToken;
import com.questrail.tds.protocol.model.TdsToken;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Decodes FEDAUTHINFO token bodies.
 *
 * <p>
 * Layout: token length (u32), then a block starting with an info-id count
 * (u32) followed by that many nine-byte option headers: id (u8), data length
 * (u32), data offset (u32). Offsets are relative to the start of the block.
 * Option data is UTF-16LE text.
 * </p>
 */
public final class FedAuthInfoTokenDecoder implements TdsTokenDecoder
{
    private static final int OPTION_HEADER_LENGTH = 9;

    @Override
    public void decode(TdsTokenReader reader,
                       ColumnMetadataContext columns,
                       TdsTokenParserOptions options,
                       Consumer<TdsToken> onComplete)
    {
        reader.readUInt32LE(tokenLength ->
                reader.readBuffer(DecodeSupport.checkedLength(tokenLength, options, "FEDAUTHINFO"),
                        data -> onComplete.accept(parse(data))));
    }

    static FedAuthInfoToken parse(byte[] data)
    {
        if (data.length < 4) {
            throw new TdsDecodeException("FEDAUTHINFO too short: " + data.length + " bytes");
        }

        ByteBuffer buffer = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        final long count = buffer.getInt(0) & 0xFFFFFFFFL;
        if (4 + count * OPTION_HEADER_LENGTH > data.length) {
            throw new TdsDecodeException("FEDAUTHINFO declares " + count + " options in " + data.length + " bytes");
        }

        String stsUrl = null;
        String spn = null;

        for (int i = 0; i < count; i++) {
            final int header = 4 + i * OPTION_HEADER_LENGTH;
            final int id = buffer.get(header) & 0xFF;
            final long length = buffer.getInt(header + 1) & 0xFFFFFFFFL;
            final long offset = buffer.getInt(header + 5) & 0xFFFFFFFFL;

            if (offset + length > data.length) {
                throw new TdsDecodeException("FEDAUTHINFO option " + id + " overruns token data");
            }

            String value = new String(data, (int) offset, (int) length, StandardCharsets.UTF_16LE);
            switch (id) {
                case FedAuthInfoToken.INFO_ID_STSURL -> stsUrl = value;
                case FedAuthInfoToken.INFO_ID_SPN -> spn = value;
                default -> {
                    // unknown option ids are ignored
                }
            }
        }

        return new FedAuthInfoToken(Optional.ofNullable(stsUrl), Optional.ofNullable(spn));
    }
}
