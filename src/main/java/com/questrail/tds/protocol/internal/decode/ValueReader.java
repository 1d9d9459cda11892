package com.questrail.tds.protocol.internal.decode;

import com.questrail.tds.protocol.codec.TdsDecodeException;
import com.questrail.tds.protocol.codec.TdsTokenReader;
import com.questrail.tds.protocol.config.TdsTokenParserOptions;
import com.questrail.tds.protocol.model.DataType;
import com.questrail.tds.protocol.model.TypeInfo;

import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HexFormat;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.LongConsumer;

/**
 * ValueReader
 * ============================================================================
 * Reads one column or parameter value according to its {@link TypeInfo}.
 *
 * <h2>Value encodings</h2>
 * <ul>
 *   <li>FIXED types: the value only, width implied by the type</li>
 *   <li>BYTE_LENGTH, DECIMAL, DATE and SCALED types: a length byte, 0 for NULL</li>
 *   <li>USHORT_LENGTH types: a 16-bit length, {@code 0xFFFF} for NULL</li>
 *   <li>{@code max} types: an 8-byte total length (all ones for NULL), then
 *       chunks of (u32 length, bytes) ending with a zero-length chunk</li>
 * </ul>
 *
 * <h2>Precision</h2>
 * <p>DECIMAL and NUMERIC magnitudes are assembled by the double-based
 * {@code readUNumeric*} readers and are exact only up to 2<sup>53</sup>.
 * MONEY values are exact.</p>
 */
final class ValueReader
{
    private static final int NULL_USHORT_LENGTH = 0xFFFF;
    private static final int MONEY_SCALE = 4;
    private static final int GUID_LENGTH = 16;

    private static final LocalDate DATE_EPOCH = LocalDate.of(1, 1, 1);
    private static final LocalDateTime DATETIME_EPOCH = LocalDateTime.of(1900, 1, 1, 0, 0);

    private static final long[] NANOS_PER_UNIT = {
            1_000_000_000L, 100_000_000L, 10_000_000L, 1_000_000L,
            100_000L, 10_000L, 1_000L, 100L
    };

    private ValueReader() {}

    static void read(TdsTokenReader reader,
                     TypeInfo typeInfo,
                     TdsTokenParserOptions options,
                     Consumer<Object> callback)
    {
        final DataType type = typeInfo.type();

        switch (type.shape()) {
            case FIXED -> readFixed(reader, type, options, callback);
            case BYTE_LENGTH -> readByteLength(reader, type, options, callback);
            case DECIMAL -> readDecimal(reader, typeInfo, callback);
            case DATE -> readDate(reader, callback);
            case SCALED -> readScaled(reader, typeInfo, callback);
            case USHORT_LENGTH -> {
                if (typeInfo.partiallyLengthPrefixed()) {
                    readPlp(reader, type, options, callback);
                }
                else {
                    readUShortLength(reader, type, options, callback);
                }
            }
        }
    }

    // ========================================================================
    // Fixed-width values
    // ========================================================================

    private static void readFixed(TdsTokenReader reader,
                                  DataType type,
                                  TdsTokenParserOptions options,
                                  Consumer<Object> callback)
    {
        switch (type) {
            case NULL -> callback.accept(null);
            case TINYINT -> reader.readUInt8(callback::accept);
            case BIT -> reader.readUInt8(value -> callback.accept(value != 0));
            case SMALLINT -> reader.readInt16LE(callback::accept);
            case INT -> reader.readInt32LE(callback::accept);
            case BIGINT -> reader.readLongLE(callback::accept);
            case REAL -> reader.readFloatLE(value -> callback.accept((float) value));
            case FLOAT -> reader.readDoubleLE(callback::accept);
            case SMALLMONEY -> reader.readInt32LE(value -> callback.accept(BigDecimal.valueOf(value, MONEY_SCALE)));
            case MONEY -> reader.readInt32LE(high ->
                    reader.readUInt32LE(low ->
                            callback.accept(BigDecimal.valueOf((long) high << 32 | low, MONEY_SCALE))));
            case DATETIME -> reader.readInt32LE(days ->
                    reader.readUInt32LE(threeHundredths ->
                            callback.accept(dateTime(days, threeHundredths))));
            case SMALLDATETIME -> reader.readUInt16LE(days ->
                    reader.readUInt16LE(minutes ->
                            callback.accept(DATETIME_EPOCH.plusDays(days).plusMinutes(minutes))));
            default -> throw new TdsDecodeException(type + " is not a fixed-length type");
        }
    }

    /**
     * DATETIME: days since 1900-01-01 and 1/300ths of a second since midnight.
     */
    private static LocalDateTime dateTime(int days, long threeHundredths)
    {
        final long millis = Math.round(threeHundredths * 10 / 3.0);
        return DATETIME_EPOCH.plusDays(days).plusNanos(millis * 1_000_000L);
    }

    // ========================================================================
    // Byte-length values
    // ========================================================================

    private static void readByteLength(TdsTokenReader reader,
                                       DataType type,
                                       TdsTokenParserOptions options,
                                       Consumer<Object> callback)
    {
        reader.readUInt8(length -> {
            if (length == 0) {
                callback.accept(null);
            }
            else if (type == DataType.UNIQUEIDENTIFIER) {
                if (length != GUID_LENGTH) {
                    throw new TdsDecodeException("Invalid UNIQUEIDENTIFIER length: " + length);
                }
                reader.readBuffer(GUID_LENGTH, bytes -> callback.accept(formatGuid(bytes, options.lowerCaseGuids())));
            }
            else {
                readFixed(reader, fixedTypeFor(type, length), options, callback);
            }
        });
    }

    /**
     * Maps a nullable variable-width type and its actual length to the fixed
     * type with the same value encoding.
     */
    static DataType fixedTypeFor(DataType type, int length)
    {
        final DataType fixed = switch (type) {
            case INTN -> switch (length) {
                case 1 -> DataType.TINYINT;
                case 2 -> DataType.SMALLINT;
                case 4 -> DataType.INT;
                case 8 -> DataType.BIGINT;
                default -> null;
            };
            case BITN -> length == 1 ? DataType.BIT : null;
            case FLOATN -> switch (length) {
                case 4 -> DataType.REAL;
                case 8 -> DataType.FLOAT;
                default -> null;
            };
            case MONEYN -> switch (length) {
                case 4 -> DataType.SMALLMONEY;
                case 8 -> DataType.MONEY;
                default -> null;
            };
            case DATETIMEN -> switch (length) {
                case 4 -> DataType.SMALLDATETIME;
                case 8 -> DataType.DATETIME;
                default -> null;
            };
            default -> null;
        };

        if (fixed == null) {
            throw new TdsDecodeException("Invalid value length " + length + " for " + type);
        }
        return fixed;
    }

    /**
     * The first three groups are stored little-endian, the last two as-is.
     */
    static String formatGuid(byte[] bytes, boolean lowerCase)
    {
        final byte[] ordered = {
                bytes[3], bytes[2], bytes[1], bytes[0],
                bytes[5], bytes[4],
                bytes[7], bytes[6],
                bytes[8], bytes[9],
                bytes[10], bytes[11], bytes[12], bytes[13], bytes[14], bytes[15]
        };

        final HexFormat hex = lowerCase ? HexFormat.of() : HexFormat.of().withUpperCase();
        final String digits = hex.formatHex(ordered);

        return digits.substring(0, 8) + '-'
                + digits.substring(8, 12) + '-'
                + digits.substring(12, 16) + '-'
                + digits.substring(16, 20) + '-'
                + digits.substring(20);
    }

    // ========================================================================
    // Decimal / numeric
    // ========================================================================

    private static void readDecimal(TdsTokenReader reader, TypeInfo typeInfo, Consumer<Object> callback)
    {
        reader.readUInt8(length -> {
            if (length == 0) {
                callback.accept(null);
                return;
            }
            reader.readUInt8(sign ->
                    readMagnitude(reader, length - 1, magnitude -> {
                        final double value = magnitude / Math.pow(10, typeInfo.scale());
                        callback.accept(sign == 1 ? value : -value);
                    }));
        });
    }

    private static void readMagnitude(TdsTokenReader reader, int byteCount, DoubleConsumer callback)
    {
        switch (byteCount) {
            case 4 -> reader.readUInt32LE(callback::accept);
            case 8 -> reader.readUNumeric64LE(callback);
            case 12 -> reader.readUNumeric96LE(callback);
            case 16 -> reader.readUNumeric128LE(callback);
            default -> throw new TdsDecodeException("Invalid DECIMAL magnitude length: " + byteCount);
        }
    }

    // ========================================================================
    // Date and time
    // ========================================================================

    private static void readDate(TdsTokenReader reader, Consumer<Object> callback)
    {
        reader.readUInt8(length -> {
            if (length == 0) {
                callback.accept(null);
                return;
            }
            if (length != 3) {
                throw new TdsDecodeException("Invalid DATE length: " + length);
            }
            reader.readUInt24LE(days -> callback.accept(DATE_EPOCH.plusDays(days)));
        });
    }

    private static void readScaled(TdsTokenReader reader, TypeInfo typeInfo, Consumer<Object> callback)
    {
        final int scale = typeInfo.scale();

        reader.readUInt8(length -> {
            if (length == 0) {
                callback.accept(null);
                return;
            }

            switch (typeInfo.type()) {
                case TIMEN -> readTime(reader, length, scale, nanos ->
                        callback.accept(LocalTime.ofNanoOfDay(nanos)));

                case DATETIME2N -> readTime(reader, length - 3, scale, nanos ->
                        reader.readUInt24LE(days ->
                                callback.accept(DATE_EPOCH.plusDays(days).atTime(LocalTime.ofNanoOfDay(nanos)))));

                case DATETIMEOFFSETN -> readTime(reader, length - 5, scale, nanos ->
                        reader.readUInt24LE(days ->
                                reader.readInt16LE(offsetMinutes -> {
                                    final LocalDateTime utc = DATE_EPOCH.plusDays(days).atTime(LocalTime.ofNanoOfDay(nanos));
                                    callback.accept(OffsetDateTime.of(utc, ZoneOffset.UTC)
                                            .withOffsetSameInstant(ZoneOffset.ofTotalSeconds(offsetMinutes * 60)));
                                })));

                default -> throw new TdsDecodeException(typeInfo.type() + " is not a scaled temporal type");
            }
        });
    }

    /**
     * Time of day in units of 10<sup>-scale</sup> seconds, 3 to 5 bytes wide.
     */
    private static void readTime(TdsTokenReader reader, int byteCount, int scale, LongConsumer nanosCallback)
    {
        final long nanosPerUnit = NANOS_PER_UNIT[scale];

        switch (byteCount) {
            case 3 -> reader.readUInt24LE(units -> nanosCallback.accept(units * nanosPerUnit));
            case 4 -> reader.readUInt32LE(units -> nanosCallback.accept(units * nanosPerUnit));
            case 5 -> reader.readUInt40LE(units -> nanosCallback.accept(units * nanosPerUnit));
            default -> throw new TdsDecodeException("Invalid time length: " + byteCount);
        }
    }

    // ========================================================================
    // Character and binary data
    // ========================================================================

    private static void readUShortLength(TdsTokenReader reader,
                                         DataType type,
                                         TdsTokenParserOptions options,
                                         Consumer<Object> callback)
    {
        reader.readUInt16LE(length -> {
            if (length == NULL_USHORT_LENGTH) {
                callback.accept(null);
                return;
            }
            reader.readBuffer(length, bytes -> callback.accept(convertBytes(type, bytes, options)));
        });
    }

    private static void readPlp(TdsTokenReader reader,
                                DataType type,
                                TdsTokenParserOptions options,
                                Consumer<Object> callback)
    {
        reader.readBuffer(8, totalLength -> {
            if (isPlpNull(totalLength)) {
                callback.accept(null);
                return;
            }
            readPlpChunk(reader, options, new ByteArrayOutputStream(), bytes ->
                    callback.accept(convertBytes(type, bytes, options)));
        });
    }

    private static void readPlpChunk(TdsTokenReader reader,
                                     TdsTokenParserOptions options,
                                     ByteArrayOutputStream collected,
                                     Consumer<byte[]> callback)
    {
        reader.readUInt32LE(chunkLength -> {
            if (chunkLength == 0) {
                callback.accept(collected.toByteArray());
                return;
            }
            final int length = DecodeSupport.checkedLength(collected.size() + chunkLength, options, "PLP value")
                    - collected.size();
            reader.readBuffer(length, chunk -> {
                collected.writeBytes(chunk);
                readPlpChunk(reader, options, collected, callback);
            });
        });
    }

    private static boolean isPlpNull(byte[] totalLength)
    {
        for (byte b : totalLength) {
            if (b != (byte) 0xFF) {
                return false;
            }
        }
        return true;
    }

    private static Object convertBytes(DataType type, byte[] bytes, TdsTokenParserOptions options)
    {
        if (type.unicode()) {
            return new String(bytes, StandardCharsets.UTF_16LE);
        }
        if (type.collated()) {
            return new String(bytes, options.varcharCharset());
        }
        return bytes;
    }
}
