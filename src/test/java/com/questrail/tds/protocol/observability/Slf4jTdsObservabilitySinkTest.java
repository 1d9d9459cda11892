package com.questrail.tds.protocol.observability;

import com.questrail.tds.protocol.codec.TdsChunk;
import com.questrail.tds.protocol.codec.impl.DefaultTdsTokenStreamParser;
import com.questrail.tds.protocol.model.ReturnStatusToken;
import com.questrail.tds.protocol.test.RecordingTokenListener;
import com.questrail.tds.protocol.test.TdsBytes;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class Slf4jTdsObservabilitySinkTest
{
    @Test
    void loggingSinkDoesNotAlterParserOutput()
    {
        RecordingTokenListener listener = new RecordingTokenListener();
        DefaultTdsTokenStreamParser parser = DefaultTdsTokenStreamParser.builder()
                .withListener(listener)
                .withObservabilitySink(new Slf4jTdsObservabilitySink())
                .build();

        byte[] stream = TdsBytes.create().u8(0x79).u32le(11).u8(0x00).build();
        parser.write(TdsChunk.bytes(new byte[] { stream[0], stream[1] }));
        parser.write(TdsChunk.bytes(new byte[] { stream[2], stream[3], stream[4], stream[5] }));

        assertEquals(List.of(new ReturnStatusToken(11)), listener.tokens());
        assertEquals(1, listener.errors().size());
    }

    @Test
    void suspensionEventReportsShortfall()
    {
        TdsSuspensionEvent event = new TdsSuspensionEvent(Instant.EPOCH, 8, 3);

        assertEquals(5, event.missingBytes());
    }
}
