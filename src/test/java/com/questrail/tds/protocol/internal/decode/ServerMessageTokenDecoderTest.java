package com.questrail.tds.protocol.internal.decode;

import com.questrail.tds.protocol.config.TdsTokenParserOptions;
import com.questrail.tds.protocol.model.ServerMessageToken;
import com.questrail.tds.protocol.model.TdsVersion;
import com.questrail.tds.protocol.test.TdsBytes;
import com.questrail.tds.protocol.test.TokenStreams;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ServerMessageTokenDecoderTest
{
    @Test
    void errorTokenCarriesAllFields()
    {
        byte[] body = TdsBytes.create()
                .u32le(208).u8(1).u8(16)
                .usvarchar("Invalid object name 'missing'.")
                .bvarchar("db01")
                .bvarchar("")
                .u32le(70000)
                .build();
        byte[] stream = TdsBytes.create().u8(0xAA).u16le(body.length).bytes(body).build();

        assertEquals(List.of(new ServerMessageToken(ServerMessageToken.Kind.ERROR,
                208, 1, 16, "Invalid object name 'missing'.", "db01", "", 70000)), TokenStreams.decode(stream));
    }

    @Test
    void infoTokenBeforeSevenTwoHasShortLineNumber()
    {
        TdsTokenParserOptions options = TdsTokenParserOptions.builder().withTdsVersion(TdsVersion.V7_1).build();
        byte[] body = TdsBytes.create()
                .u32le(5701).u8(2).u8(0)
                .usvarchar("Changed database context to 'orders'.")
                .bvarchar("db01")
                .bvarchar("usp_switch")
                .u16le(12)
                .build();
        byte[] stream = TdsBytes.create().u8(0xAB).u16le(body.length).bytes(body).build();

        ServerMessageToken info = (ServerMessageToken) TokenStreams.decode(options, stream).get(0);

        assertEquals(ServerMessageToken.Kind.INFO, info.kind());
        assertEquals(5701, info.number());
        assertEquals("usp_switch", info.procName());
        assertEquals(12, info.lineNumber());
    }
}
