package com.questrail.tds.protocol.internal.decode;

import com.questrail.tds.protocol.config.TdsTokenParserOptions;
import com.questrail.tds.protocol.model.ColumnMetadata;
import com.questrail.tds.protocol.model.RowToken;
import com.questrail.tds.protocol.model.TdsToken;
import com.questrail.tds.protocol.test.TdsBytes;
import com.questrail.tds.protocol.test.TokenStreams;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static com.questrail.tds.protocol.internal.decode.Columns.colMetadata;
import static com.questrail.tds.protocol.internal.decode.Columns.collatedColumn;
import static com.questrail.tds.protocol.internal.decode.Columns.column;
import static org.junit.jupiter.api.Assertions.*;

final class RowTokenDecoderTest
{
    private static final int NULLABLE = ColumnMetadata.FLAG_NULLABLE;

    /** 2024-03-15, counted from 1900-01-01. */
    private static final int DAYS_SINCE_1900 = 45364;

    /** 2024-03-15, counted from 0001-01-01. */
    private static final int DAYS_SINCE_0001 = 738959;

    @Test
    void integerAndFloatingPointValues()
    {
        byte[] stream = TdsBytes.create()
                .bytes(colMetadata(
                        column("tiny", 0, 0x30),
                        column("small", 0, 0x34),
                        column("id", 0, 0x38),
                        column("big", 0, 0x7F),
                        column("ref", NULLABLE, 0x26, 8),
                        column("flag", 0, 0x32),
                        column("ratio", NULLABLE, 0x6D, 8),
                        column("weight", 0, 0x3B)))
                .u8(0xD1)
                .u8(200)
                .u16le(-3)
                .u32le(42)
                .u64le(Long.MAX_VALUE)
                .u8(8).u64le(-9_000_000_000L)
                .u8(1)
                .u8(8).u64le(Double.doubleToLongBits(0.5))
                .u32le(Float.floatToIntBits(2.5f))
                .build();

        RowToken row = (RowToken) TokenStreams.decode(stream).get(1);

        assertEquals(200, row.value("tiny"));
        assertEquals(-3, row.value("small"));
        assertEquals(42, row.value("id"));
        assertEquals(Long.MAX_VALUE, row.value("big"));
        assertEquals(-9_000_000_000L, row.value("ref"));
        assertEquals(Boolean.TRUE, row.value("flag"));
        assertEquals(0.5, row.value("ratio"));
        assertEquals(2.5f, row.value("weight"));
        assertFalse(row.nullBitmapCompressed());
    }

    @Test
    void characterAndGuidValues()
    {
        byte[] stream = TdsBytes.create()
                .bytes(colMetadata(
                        collatedColumn("name", 0xE7, 100),
                        collatedColumn("code", 0xA7, 50),
                        column("guid", NULLABLE, 0x24, 16)))
                .u8(0xD1)
                // NVARCHAR lengths count bytes, not characters
                .usvarbyte("Ünïcode".getBytes(StandardCharsets.UTF_16LE))
                .u16le(4).bytes('c', 'a', 'f', 0xE9)
                .u8(16).bytes(0xFF, 0x19, 0x96, 0x6F, 0x86, 0x8B, 0x11, 0xD0,
                        0xB4, 0x2D, 0x00, 0xC0, 0x4F, 0xC9, 0x64, 0xFF)
                .build();

        RowToken row = (RowToken) TokenStreams.decode(stream).get(1);

        assertEquals("Ünïcode", row.value("name"));
        assertEquals("café", row.value("code"));
        assertEquals("6F9619FF-8B86-D011-B42D-00C04FC964FF", row.value("guid"));
    }

    @Test
    void guidsCanBeLowerCase()
    {
        byte[] stream = TdsBytes.create()
                .bytes(colMetadata(column("guid", NULLABLE, 0x24, 16)))
                .u8(0xD1)
                .u8(16).bytes(0xFF, 0x19, 0x96, 0x6F, 0x86, 0x8B, 0x11, 0xD0,
                        0xB4, 0x2D, 0x00, 0xC0, 0x4F, 0xC9, 0x64, 0xFF)
                .build();
        TdsTokenParserOptions options = TdsTokenParserOptions.builder().withLowerCaseGuids(true).build();

        RowToken row = (RowToken) TokenStreams.decode(options, stream).get(1);

        assertEquals("6f9619ff-8b86-d011-b42d-00c04fc964ff", row.value(0));
    }

    @Test
    void decimalAndMoneyValues()
    {
        byte[] stream = TdsBytes.create()
                .bytes(colMetadata(
                        column("price", NULLABLE, 0x6A, 5, 9, 2),
                        column("loss", NULLABLE, 0x6C, 9, 18, 3),
                        column("wide", NULLABLE, 0x6A, 17, 38, 0),
                        column("amount", NULLABLE, 0x6E, 8),
                        column("fee", 0, 0x7A)))
                .u8(0xD1)
                .u8(5).u8(1).u32le(12345)
                .u8(9).u8(0).u64le(1_500)
                .u8(17).u8(1).u64le(0).u32le(1).u32le(0)
                .u8(8).u32le(0x2).u32le(0xDFDC1C35L)
                .u32le(-25_000)
                .build();

        RowToken row = (RowToken) TokenStreams.decode(stream).get(1);

        assertEquals(123.45, row.value("price"));
        assertEquals(-1.5, row.value("loss"));
        assertEquals(Math.pow(2, 64), row.value("wide"));
        assertEquals(new BigDecimal("1234567.8901"), row.value("amount"));
        assertEquals(new BigDecimal("-2.5000"), row.value("fee"));
    }

    @Test
    void dateAndTimeValues()
    {
        long scale7Units = 45_045L * 10_000_000L + 1_234_567L;

        byte[] stream = TdsBytes.create()
                .bytes(colMetadata(
                        column("created", NULLABLE, 0x6F, 8),
                        column("logged", 0, 0x3A),
                        column("updated", NULLABLE, 0x2A, 7),
                        column("day", NULLABLE, 0x28),
                        column("at", NULLABLE, 0x29, 3),
                        column("seen", NULLABLE, 0x2B, 0)))
                .u8(0xD1)
                // 12:30:45.500 as 1/300 s ticks
                .u8(8).u32le(DAYS_SINCE_1900).u32le(45_045L * 300 + 150)
                .u16le(DAYS_SINCE_1900).u16le(12 * 60 + 30)
                .u8(8).u32le(scale7Units).u8((int) (scale7Units >>> 32)).bytes(days0001())
                .u8(3).bytes(days0001())
                .u8(4).u32le(28_800_250)
                // 10:00:00 UTC shown at +02:00
                .u8(8).bytes(36_000 & 0xFF, 36_000 >> 8 & 0xFF, 0).bytes(days0001()).u16le(120)
                .build();

        RowToken row = (RowToken) TokenStreams.decode(stream).get(1);

        assertEquals(LocalDateTime.of(2024, 3, 15, 12, 30, 45, 500_000_000), row.value("created"));
        assertEquals(LocalDateTime.of(2024, 3, 15, 12, 30), row.value("logged"));
        assertEquals(LocalDateTime.of(2024, 3, 15, 12, 30, 45, 123_456_700), row.value("updated"));
        assertEquals(LocalDate.of(2024, 3, 15), row.value("day"));
        assertEquals(LocalTime.of(8, 0, 0, 250_000_000), row.value("at"));
        assertEquals(OffsetDateTime.of(2024, 3, 15, 12, 0, 0, 0, ZoneOffset.ofHours(2)), row.value("seen"));
    }

    @Test
    void nullsForEachLengthPrefix()
    {
        byte[] stream = TdsBytes.create()
                .bytes(colMetadata(
                        column("ref", NULLABLE, 0x26, 4),
                        column("price", NULLABLE, 0x6A, 5, 9, 2),
                        column("day", NULLABLE, 0x28),
                        column("updated", NULLABLE, 0x2A, 7),
                        collatedColumn("name", 0xE7, 100),
                        column("data", NULLABLE, 0xA5, 0x40, 0x00),
                        column("blob", NULLABLE, 0xA5, 0xFF, 0xFF),
                        column("none", 0, 0x1F)))
                .u8(0xD1)
                .u8(0)
                .u8(0)
                .u8(0)
                .u8(0)
                .u16le(0xFFFF)
                .u16le(0xFFFF)
                .u64le(-1)
                .build();

        RowToken row = (RowToken) TokenStreams.decode(stream).get(1);

        assertEquals(8, row.columns().size());
        assertTrue(row.columns().stream().allMatch(c -> c.isNull()));
    }

    @Test
    void partiallyLengthPrefixedValuesAreReassembledFromChunks()
    {
        byte[] text = "chunked text".getBytes(StandardCharsets.UTF_16LE);

        byte[] stream = TdsBytes.create()
                .bytes(colMetadata(
                        column("blob", NULLABLE, 0xA5, 0xFF, 0xFF),
                        collatedColumn("note", 0xE7, 0xFFFF),
                        column("empty", NULLABLE, 0xA5, 0xFF, 0xFF)))
                .u8(0xD1)
                .u64le(5).u32le(3).bytes(1, 2, 3).u32le(2).bytes(4, 5).u32le(0)
                // unknown total length
                .u64le(-2).u32le(10).bytes(Arrays.copyOfRange(text, 0, 10))
                .u32le(text.length - 10).bytes(Arrays.copyOfRange(text, 10, text.length)).u32le(0)
                .u64le(0).u32le(0)
                .build();

        RowToken row = (RowToken) TokenStreams.decode(stream).get(1);

        assertArrayEquals(new byte[] { 1, 2, 3, 4, 5 }, (byte[]) row.value("blob"));
        assertEquals("chunked text", row.value("note"));
        assertArrayEquals(new byte[0], (byte[]) row.value("empty"));
    }

    @Test
    void rowsAreReadAgainstLatestMetadata()
    {
        byte[] stream = TdsBytes.create()
                .bytes(colMetadata(column("a", 0, 0x30)))
                .u8(0xD1).u8(1)
                .u8(0xD1).u8(2)
                .bytes(colMetadata(column("b", 0, 0x34), column("c", 0, 0x30)))
                .u8(0xD1).u16le(300).u8(3)
                .build();

        List<TdsToken> tokens = TokenStreams.decode(stream);

        assertEquals(5, tokens.size());
        assertEquals(2, ((RowToken) tokens.get(2)).value("a"));
        RowToken last = (RowToken) tokens.get(4);
        assertEquals(300, last.value("b"));
        assertEquals(3, last.value("c"));
    }

    @Test
    void invalidNullableLengthIsADecodeError()
    {
        byte[] stream = TdsBytes.create()
                .bytes(colMetadata(column("ref", NULLABLE, 0x26, 4)))
                .u8(0xD1).u8(3).bytes(1, 2, 3)
                .build();

        assertTrue(TokenStreams.decodeError(stream).getMessage().contains("length 3"));
    }

    @Test
    void lookupByUnknownNameFails()
    {
        byte[] stream = TdsBytes.create()
                .bytes(colMetadata(column("a", 0, 0x30)))
                .u8(0xD1).u8(1)
                .build();

        RowToken row = (RowToken) TokenStreams.decode(stream).get(1);

        assertThrows(IllegalArgumentException.class, () -> row.value("b"));
    }

    private static byte[] days0001()
    {
        return new byte[] { (byte) DAYS_SINCE_0001, (byte) (DAYS_SINCE_0001 >> 8), (byte) (DAYS_SINCE_0001 >> 16) };
    }
}
