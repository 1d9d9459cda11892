package com.questrail.tds.protocol.internal.decode;

import com.questrail.tds.protocol.codec.TdsChunk;
import com.questrail.tds.protocol.codec.impl.DefaultTdsTokenStreamParser;
import com.questrail.tds.protocol.model.ColMetadataToken;
import com.questrail.tds.protocol.model.ColumnMetadata;
import com.questrail.tds.protocol.model.DoneToken;
import com.questrail.tds.protocol.model.EndOfMessageToken;
import com.questrail.tds.protocol.model.EnvChangeToken;
import com.questrail.tds.protocol.model.LoginAckToken;
import com.questrail.tds.protocol.model.ReturnStatusToken;
import com.questrail.tds.protocol.model.ReturnValueToken;
import com.questrail.tds.protocol.model.RowToken;
import com.questrail.tds.protocol.model.ServerMessageToken;
import com.questrail.tds.protocol.model.TdsToken;
import com.questrail.tds.protocol.test.RecordingTokenListener;
import com.questrail.tds.protocol.test.TdsBytes;
import com.questrail.tds.protocol.test.TokenFormatter;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalLong;
import java.util.Random;

import static com.questrail.tds.protocol.internal.decode.Columns.colMetadata;
import static com.questrail.tds.protocol.internal.decode.Columns.collatedColumn;
import static com.questrail.tds.protocol.internal.decode.Columns.column;
import static org.junit.jupiter.api.Assertions.*;

/**
 * A login response followed by a stored procedure result, decoded with the
 * standard registry under many chunkings. However the bytes are split, the
 * token sequence must be the one produced from a single chunk.
 */
final class StandardTokenStreamTest
{
    private static final byte[] STREAM = responseStream();

    @Test
    void singleChunkYieldsExpectedSequence()
    {
        List<TdsToken> tokens = decode(new int[0]);

        assertEquals(List.of(
                LoginAckToken.class,
                EnvChangeToken.PacketSizeChange.class,
                ServerMessageToken.class,
                DoneToken.class,
                ColMetadataToken.class,
                RowToken.class,
                RowToken.class,
                DoneToken.class,
                ReturnStatusToken.class,
                ReturnValueToken.class,
                DoneToken.class), tokens.stream().map(Object::getClass).toList());

        RowToken second = (RowToken) tokens.get(6);
        assertTrue(second.nullBitmapCompressed());
        assertNull(second.value("Name"));
        assertEquals(OptionalLong.of(2), ((DoneToken) tokens.get(7)).rowCount());
    }

    @Test
    void everyTwoWaySplitMatchesSingleChunk()
    {
        List<String> expected = TokenFormatter.format(decode(new int[0]));

        for (int split = 0; split <= STREAM.length; split++) {
            assertEquals(expected, TokenFormatter.format(decode(new int[] { split })), "split at " + split);
        }
    }

    @Test
    void randomChunkingsMatchSingleChunk()
    {
        List<String> expected = TokenFormatter.format(decode(new int[0]));
        Random random = new Random(0x7D5);

        for (int run = 0; run < 200; run++) {
            int[] cuts = random.ints(1 + random.nextInt(12), 0, STREAM.length + 1).sorted().toArray();
            assertEquals(expected, TokenFormatter.format(decode(cuts)), () -> "cuts " + Arrays.toString(cuts));
        }
    }

    @Test
    void endOfMessageMarkerArrivesInWriteOrder()
    {
        RecordingTokenListener listener = new RecordingTokenListener();
        DefaultTdsTokenStreamParser parser = new DefaultTdsTokenStreamParser(listener);

        int middle = STREAM.length / 2;
        parser.write(TdsChunk.bytes(Arrays.copyOfRange(STREAM, 0, middle)));
        int before = listener.tokens().size();
        parser.write(TdsChunk.endOfMessage());
        parser.write(TdsChunk.bytes(Arrays.copyOfRange(STREAM, middle, STREAM.length)));

        assertSame(EndOfMessageToken.INSTANCE, listener.tokens().get(before));
        assertEquals(12, listener.tokens().size());
    }

    private static List<TdsToken> decode(int[] cuts)
    {
        RecordingTokenListener listener = new RecordingTokenListener();
        DefaultTdsTokenStreamParser parser = new DefaultTdsTokenStreamParser(listener);

        int from = 0;
        for (int cut : cuts) {
            parser.write(TdsChunk.bytes(Arrays.copyOfRange(STREAM, from, cut)));
            from = cut;
        }
        parser.write(TdsChunk.bytes(Arrays.copyOfRange(STREAM, from, STREAM.length)));

        assertTrue(listener.errors().isEmpty(), () -> "errors: " + listener.errors());
        assertFalse(parser.isSuspended());
        return listener.tokens();
    }

    private static byte[] responseStream()
    {
        byte[] info = TdsBytes.create()
                .u32le(5701).u8(2).u8(0)
                .usvarchar("Changed database context to 'orders'.")
                .bvarchar("db01").bvarchar("").u32le(1)
                .build();
        byte[] loginAck = TdsBytes.create()
                .u8(1).u32be(0x74000004L).bvarchar("Microsoft SQL Server").bytes(16, 0, 0x10, 0x7F)
                .build();
        byte[] packetSize = TdsBytes.create().u8(4).bvarchar("8000").bvarchar("4096").build();

        return TdsBytes.create()
                .u8(0xAD).u16le(loginAck.length).bytes(loginAck)
                .u8(0xE3).u16le(packetSize.length).bytes(packetSize)
                .u8(0xAB).u16le(info.length).bytes(info)
                .u8(0xFD).u16le(0).u16le(0).u64le(0)
                .bytes(colMetadata(
                        column("Id", ColumnMetadata.FLAG_IDENTITY, 0x38),
                        collatedColumn("Name", 0xE7, 100),
                        column("Price", ColumnMetadata.FLAG_NULLABLE, 0x6A, 5, 9, 2),
                        column("Payload", ColumnMetadata.FLAG_NULLABLE, 0xA5, 0xFF, 0xFF)))
                .u8(0xD1)
                .u32le(1)
                .usvarbyte("widget".getBytes(StandardCharsets.UTF_16LE))
                .u8(5).u8(1).u32le(1999)
                .u64le(4).u32le(2).bytes(1, 2).u32le(2).bytes(3, 4).u32le(0)
                .u8(0xD2).u8(0b0110)
                .u32le(2)
                .u64le(-1)
                .u8(0xFF).u16le(DoneToken.STATUS_COUNT | DoneToken.STATUS_MORE).u16le(0xC1).u64le(2)
                .u8(0x79).u32le(0)
                .u8(0xAC).u16le(1).bvarchar("@count").u8(1)
                .u32le(0).u16le(ColumnMetadata.FLAG_NULLABLE).u8(0x26).u8(4)
                .u8(4).u32le(2)
                .u8(0xFE).u16le(0).u16le(0xE0).u64le(0)
                .build();
    }
}
