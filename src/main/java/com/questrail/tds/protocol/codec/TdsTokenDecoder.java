package com.questrail.tds.protocol.codec;

import com.questrail.tds.protocol.config.TdsTokenParserOptions;
import com.questrail.tds.protocol.model.TdsToken;

import java.util.function.Consumer;

/**
 * Decodes the body of one token kind, after the dispatch loop has consumed
 * its tag byte.
 *
 * <p>Implementations read fields through {@code reader} in continuation-passing
 * style and call {@code onComplete} once with the finished token. A decoder
 * may finish without calling {@code onComplete} when the token carries nothing
 * worth emitting. If the stream ends part-way through, {@code onComplete} is
 * simply never called.</p>
 */
@FunctionalInterface
public interface TdsTokenDecoder
{
    void decode(TdsTokenReader reader,
                ColumnMetadataContext columns,
                TdsTokenParserOptions options,
                Consumer<TdsToken> onComplete);
}
