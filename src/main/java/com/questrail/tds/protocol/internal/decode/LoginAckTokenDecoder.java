package com.questrail.tds.protocol.internal.decode;

import com.questrail.tds.protocol.codec.ColumnMetadataContext;
import com.questrail.tds.protocol.codec.TdsDecodeException;
import com.questrail.tds.protocol.codec.TdsTokenDecoder;
import com.questrail.tds.protocol.codec.TdsTokenReader;
import com.questrail.tds.protocol.config.TdsTokenParserOptions;
import com.questrail.tds.protocol.model.LoginAckToken;
import com.questrail.tds.protocol.model.TdsToken;
import com.questrail.tds.protocol.model.TdsVersion;

import java.util.function.Consumer;

/**
 * Decodes LOGINACK token bodies.
 *
 * <p>Layout: length (u16), interface (u8), TDS version (u32, big-endian),
 * program name (B_VARCHAR), then four single-byte program version parts.</p>
 */
public final class LoginAckTokenDecoder implements TdsTokenDecoder
{
    @Override
    public void decode(TdsTokenReader reader,
                       ColumnMetadataContext columns,
                       TdsTokenParserOptions options,
                       Consumer<TdsToken> onComplete)
    {
        reader.readUInt16LE(length ->
                reader.readUInt8(interfaceNumber -> {
                    final String interfaceName = interfaceName(interfaceNumber);
                    reader.readUInt32BE(versionNumber -> {
                        final TdsVersion version = TdsVersion.fromValue(versionNumber)
                                .orElseThrow(() -> new TdsDecodeException(
                                        "Unknown TDS version: 0x" + Long.toHexString(versionNumber)));
                        reader.readBVarChar(progName ->
                                reader.readUInt8(major ->
                                        reader.readUInt8(minor ->
                                                reader.readUInt8(buildNumHi ->
                                                        reader.readUInt8(buildNumLow ->
                                                                onComplete.accept(new LoginAckToken(
                                                                        interfaceName,
                                                                        version,
                                                                        progName,
                                                                        new LoginAckToken.ProgramVersion(
                                                                                major, minor, buildNumHi, buildNumLow)
                                                                )))))));
                    });
                }));
    }

    private static String interfaceName(int interfaceNumber)
    {
        return switch (interfaceNumber) {
            case 0 -> "SQL_DFLT";
            case 1 -> "SQL_TSQL";
            default -> throw new TdsDecodeException("Unknown LOGINACK interface: " + interfaceNumber);
        };
    }
}
