package com.questrail.tds.protocol.internal.decode;

import com.questrail.tds.protocol.model.DoneToken;
import com.questrail.tds.protocol.model.EnvChangeToken;
import com.questrail.tds.protocol.model.EnvChangeType;
import com.questrail.tds.protocol.model.TdsToken;
import com.questrail.tds.protocol.test.TdsBytes;
import com.questrail.tds.protocol.test.TokenStreams;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class EnvChangeTokenDecoderTest
{
    @Test
    void databaseChangeCarriesNewAndOldNames()
    {
        byte[] stream = envChange(1, TdsBytes.create().bvarchar("orders").bvarchar("master"));

        List<TdsToken> tokens = TokenStreams.decode(stream);

        assertEquals(List.of(new EnvChangeToken.TextChange(EnvChangeType.DATABASE, "master", "orders")), tokens);
    }

    @Test
    void packetSizeIsParsedAsInteger()
    {
        byte[] stream = envChange(4, TdsBytes.create().bvarchar("8000").bvarchar("4096"));

        assertEquals(List.of(new EnvChangeToken.PacketSizeChange(4096, 8000)), TokenStreams.decode(stream));
    }

    @Test
    void malformedPacketSizeIsADecodeError()
    {
        byte[] stream = envChange(4, TdsBytes.create().bvarchar("big").bvarchar("4096"));

        assertTrue(TokenStreams.decodeError(stream).getMessage().contains("PACKET_SIZE"));
    }

    @Test
    void transactionDescriptorIsBinary()
    {
        byte[] descriptor = { 1, 2, 3, 4, 5, 6, 7, 8 };
        byte[] stream = envChange(8, TdsBytes.create().bvarbyte(descriptor).bvarbyte(new byte[0]));

        EnvChangeToken.BinaryChange change = (EnvChangeToken.BinaryChange) TokenStreams.decode(stream).get(0);

        assertEquals(EnvChangeType.BEGIN_TXN, change.type());
        assertArrayEquals(descriptor, change.newValue());
        assertEquals(0, change.oldValue().length);
    }

    @Test
    void routingChangeNamesAlternateServer()
    {
        byte[] routing = TdsBytes.create().u8(0).u16le(1433).usvarchar("replica01").build();
        byte[] stream = envChange(20, TdsBytes.create().usvarbyte(routing).u16le(0));

        assertEquals(List.of(new EnvChangeToken.RoutingChange(0, 1433, "replica01")), TokenStreams.decode(stream));
    }

    @Test
    void truncatedRoutingBlockIsADecodeError()
    {
        byte[] routing = TdsBytes.create().u8(0).u16le(1433).u16le(20).utf16("x").build();
        byte[] stream = envChange(20, TdsBytes.create().usvarbyte(routing).u16le(0));

        assertNotNull(TokenStreams.decodeError(stream));
    }

    @Test
    void unknownSubtypeIsSkippedWithoutToken()
    {
        byte[] stream = TdsBytes.create()
                .bytes(envChange(17, TdsBytes.create().bytes(9, 9, 9, 9)))
                .u8(0xFD).u16le(0).u16le(0).u64le(0)
                .build();

        List<TdsToken> tokens = TokenStreams.decode(stream);

        assertEquals(1, tokens.size());
        assertInstanceOf(DoneToken.class, tokens.get(0));
    }

    @Test
    void unknownSubtypeWithZeroLengthIsADecodeError()
    {
        byte[] stream = TdsBytes.create().u8(0xE3).u16le(0).u8(17).build();

        assertTrue(TokenStreams.decodeError(stream).getMessage().contains("ENVCHANGE length 0"));
    }

    private static byte[] envChange(int code, TdsBytes values)
    {
        byte[] body = values.build();
        return TdsBytes.create().u8(0xE3).u16le(1 + body.length).u8(code).bytes(body).build();
    }
}
