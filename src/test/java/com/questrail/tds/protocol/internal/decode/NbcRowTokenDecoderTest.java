package com.questrail.tds.protocol.internal.decode;

import com.questrail.tds.protocol.model.ColumnMetadata;
import com.questrail.tds.protocol.model.RowToken;
import com.questrail.tds.protocol.test.TdsBytes;
import com.questrail.tds.protocol.test.TokenStreams;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;

import static com.questrail.tds.protocol.internal.decode.Columns.colMetadata;
import static com.questrail.tds.protocol.internal.decode.Columns.column;
import static org.junit.jupiter.api.Assertions.*;

final class NbcRowTokenDecoderTest
{
    @Test
    void bitmapMarksNullColumnsThatHaveNoBytes()
    {
        byte[][] columns = new byte[10][];
        for (int i = 0; i < columns.length; i++) {
            columns[i] = column("c" + i, ColumnMetadata.FLAG_NULLABLE, 0x26, 4);
        }

        // columns 1, 3 and 9 are null
        TdsBytes stream = TdsBytes.create()
                .bytes(colMetadata(columns))
                .u8(0xD2)
                .u8(0b0000_1010).u8(0b0000_0010);
        for (int i = 0; i < columns.length; i++) {
            if (i != 1 && i != 3 && i != 9) {
                stream.u8(4).u32le(i * 10);
            }
        }

        RowToken row = (RowToken) TokenStreams.decode(stream.build()).get(1);

        assertTrue(row.nullBitmapCompressed());
        assertEquals(Arrays.asList(0, null, 20, null, 40, 50, 60, 70, 80, null),
                row.columns().stream().map(c -> c.value()).toList());
    }

    @Test
    void nullBitOverridesNonNullableTypes()
    {
        byte[] stream = TdsBytes.create()
                .bytes(colMetadata(column("id", 0, 0x38), column("n", 0, 0x30)))
                .u8(0xD2).u8(0b01).u8(7)
                .build();

        RowToken row = (RowToken) TokenStreams.decode(stream).get(1);

        assertNull(row.value("id"));
        assertEquals(7, row.value("n"));
    }

    @Test
    void bitOrderIsLeastSignificantFirst()
    {
        byte[] bitmap = { (byte) 0x81, 0x01 };

        assertEquals(List.of(true, false, false, false, false, false, false, true, true, false),
                IntStream.range(0, 10)
                        .mapToObj(i -> NbcRowTokenDecoder.isNull(bitmap, i))
                        .toList());
    }
}
