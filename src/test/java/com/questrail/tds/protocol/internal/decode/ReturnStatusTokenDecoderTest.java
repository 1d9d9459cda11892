package com.questrail.tds.protocol.internal.decode;

import com.questrail.tds.protocol.model.OrderToken;
import com.questrail.tds.protocol.model.ReturnStatusToken;
import com.questrail.tds.protocol.model.SspiToken;
import com.questrail.tds.protocol.model.TdsToken;
import com.questrail.tds.protocol.test.TdsBytes;
import com.questrail.tds.protocol.test.TokenStreams;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RETURNSTATUS, ORDER and SSPI: the single-field tokens.
 */
final class ReturnStatusTokenDecoderTest
{
    @Test
    void returnStatusIsSigned()
    {
        List<TdsToken> tokens = TokenStreams.decode(TdsBytes.create().u8(0x79).u32le(-6).build());

        assertEquals(List.of(new ReturnStatusToken(-6)), tokens);
    }

    @Test
    void orderListsColumnOrdinals()
    {
        byte[] stream = TdsBytes.create().u8(0xA9).u16le(6).u16le(2).u16le(1).u16le(3).build();

        assertEquals(List.of(new OrderToken(List.of(2, 1, 3))), TokenStreams.decode(stream));
    }

    @Test
    void emptyOrder()
    {
        byte[] stream = TdsBytes.create().u8(0xA9).u16le(0).build();

        assertEquals(List.of(new OrderToken(List.of())), TokenStreams.decode(stream));
    }

    @Test
    void sspiCarriesRawChallenge()
    {
        byte[] challenge = { 'N', 'T', 'L', 'M', 0, 2 };
        byte[] stream = TdsBytes.create().u8(0xED).usvarbyte(challenge).build();

        SspiToken token = (SspiToken) TokenStreams.decode(stream).get(0);

        assertArrayEquals(challenge, token.challenge());
    }
}
