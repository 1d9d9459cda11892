package com.questrail.tds.protocol.internal.decode;

import com.questrail.tds.protocol.codec.TdsDecodeException;
import com.questrail.tds.protocol.codec.TdsTokenReader;
import com.questrail.tds.protocol.config.TdsTokenParserOptions;
import com.questrail.tds.protocol.model.Collation;
import com.questrail.tds.protocol.model.ColumnMetadata;
import com.questrail.tds.protocol.model.DataType;
import com.questrail.tds.protocol.model.TypeInfo;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Reads column descriptors and TYPE_INFO blocks.
 *
 * <p>Shared by COLMETADATA (user type, flags, type info, column name) and
 * RETURNVALUE (user type, flags, type info; the name comes earlier in the
 * token).</p>
 */
final class TypeInfoReader
{
    static final int MAX_TIME_SCALE = 7;

    private TypeInfoReader() {}

    static void readColumnMetadata(TdsTokenReader reader,
                                   TdsTokenParserOptions options,
                                   Consumer<ColumnMetadata> callback)
    {
        DecodeSupport.readUserType(reader, options, userType ->
                reader.readUInt16LE(flags ->
                        readTypeInfo(reader, typeInfo ->
                                reader.readBVarChar(colName ->
                                        callback.accept(new ColumnMetadata(
                                                userType,
                                                flags,
                                                typeInfo,
                                                options.camelCaseColumns() ? camelCase(colName) : colName
                                        ))))));
    }

    static void readParameterMetadata(TdsTokenReader reader,
                                      TdsTokenParserOptions options,
                                      String paramName,
                                      Consumer<ColumnMetadata> callback)
    {
        DecodeSupport.readUserType(reader, options, userType ->
                reader.readUInt16LE(flags ->
                        readTypeInfo(reader, typeInfo ->
                                callback.accept(new ColumnMetadata(userType, flags, typeInfo, paramName)))));
    }

    static void readTypeInfo(TdsTokenReader reader, Consumer<TypeInfo> callback)
    {
        reader.readUInt8(id -> {
            final DataType type = DataType.fromId(id)
                    .orElseThrow(() -> new TdsDecodeException("Unsupported data type: 0x" + Integer.toHexString(id)));

            switch (type.shape()) {
                case FIXED, DATE -> callback.accept(TypeInfo.of(type));

                case BYTE_LENGTH -> reader.readUInt8(dataLength ->
                        callback.accept(new TypeInfo(type, dataLength, 0, 0, Optional.empty())));

                case DECIMAL -> reader.readUInt8(dataLength ->
                        reader.readUInt8(precision ->
                                reader.readUInt8(scale ->
                                        callback.accept(new TypeInfo(type, dataLength, precision, scale, Optional.empty())))));

                case SCALED -> reader.readUInt8(scale -> {
                    if (scale > MAX_TIME_SCALE) {
                        throw new TdsDecodeException("Invalid scale " + scale + " for " + type);
                    }
                    callback.accept(new TypeInfo(type, 0, 0, scale, Optional.empty()));
                });

                case USHORT_LENGTH -> reader.readUInt16LE(dataLength -> {
                    if (type.collated()) {
                        reader.readBuffer(Collation.LENGTH, raw ->
                                callback.accept(new TypeInfo(type, dataLength, 0, 0, Optional.of(Collation.fromBytes(raw)))));
                    }
                    else {
                        callback.accept(new TypeInfo(type, dataLength, 0, 0, Optional.empty()));
                    }
                });
            }
        });
    }

    static String camelCase(String colName)
    {
        if (colName.isEmpty() || !Character.isUpperCase(colName.charAt(0))) {
            return colName;
        }
        return Character.toLowerCase(colName.charAt(0)) + colName.substring(1);
    }
}
