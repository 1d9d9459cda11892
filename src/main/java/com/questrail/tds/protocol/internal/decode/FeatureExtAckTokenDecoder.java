package com.questrail.tds.protocol.internal.decode;

import com.questrail.tds.protocol.codec.ColumnMetadataContext;
import com.questrail.tds.protocol.codec.TdsTokenDecoder;
import com.questrail.tds.protocol.codec.TdsTokenReader;
import com.questrail.tds.protocol.config.TdsTokenParserOptions;
import com.questrail.tds.protocol.model.FeatureExtAckToken;
import com.questrail.tds.protocol.model.TdsToken;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Decodes FEATUREEXTACK token bodies.
 *
 * <p>A sequence of (feature id (u8), data length (u32), data) entries
 * terminated by feature id {@code 0xFF}.</p>
 */
public final class FeatureExtAckTokenDecoder implements TdsTokenDecoder
{
    static final int TERMINATOR = 0xFF;

    @Override
    public void decode(TdsTokenReader reader,
                       ColumnMetadataContext columns,
                       TdsTokenParserOptions options,
                       Consumer<TdsToken> onComplete)
    {
        readFeature(reader, options, new LinkedHashMap<>(), onComplete);
    }

    private static void readFeature(TdsTokenReader reader,
                                    TdsTokenParserOptions options,
                                    Map<Integer, byte[]> features,
                                    Consumer<TdsToken> onComplete)
    {
        reader.readUInt8(featureId -> {
            if (featureId == TERMINATOR) {
                onComplete.accept(new FeatureExtAckToken(features));
                return;
            }
            reader.readUInt32LE(length ->
                    reader.readBuffer(DecodeSupport.checkedLength(length, options, "FEATUREEXTACK"), data -> {
                        features.put(featureId, data);
                        readFeature(reader, options, features, onComplete);
                    }));
        });
    }
}
