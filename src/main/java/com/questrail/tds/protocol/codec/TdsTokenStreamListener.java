package com.questrail.tds.protocol.codec;

import com.questrail.tds.protocol.model.TdsToken;

/**
 * TdsTokenStreamListener
 * -----------------------------------------------------------------------------
 * Callback sink for a {@link TdsTokenStreamParser}.
 *
 * <p>Callbacks are delivered on the thread that called
 * {@link TdsTokenStreamParser#write(TdsChunk)}, in stream order.</p>
 */
public interface TdsTokenStreamListener
{
    /**
     * Called once for each completed token, in the order its bytes appeared.
     */
    void onToken(TdsToken token);

    /**
     * Called at most once, when decoding fails fatally. No further tokens are
     * delivered afterwards.
     *
     * @param cause the decode failure, e.g. an {@link UnknownTokenTagException}
     */
    void onError(TdsDecodeException cause);
}
